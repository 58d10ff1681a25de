/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.pixelreader.format;

/**
 * Closed set of source pixel encodings a {@link io.tileverse.pixelreader.PixelSource} may report.
 * <p>
 * Byte-aligned formats name their channels in memory order ({@link #BGR_888} stores blue first). Packed
 * formats ({@link #RGB_565}, {@link #ARGB_1555}, {@link #RGBA_1010102}, ...) follow the naming of the bitmap
 * libraries they come from; {@link FormatResolver} holds their exact bit layout. Multi-byte pixels are
 * little-endian.
 * <p>
 * Not every constant is decodable: {@link #UNKNOWN}, the floating point formats and the sub-byte indexed
 * formats are enumerated so adapters can report them, and {@link FormatResolver#resolve} rejects them.
 */
public enum PixelFormat {
    /** Sentinel for a pixel layout the adapter could not identify. */
    UNKNOWN(0),

    GRAY_8(8),
    GRAY_16(16),
    ALPHA_8(8),
    ALPHA_16(16),
    GRAY_ALPHA_88(16),
    RG_88(16),
    RG_1616(32),

    INDEXED_1(1),
    INDEXED_2(2),
    INDEXED_4(4),
    INDEXED_8(8),

    RGB_888(24),
    BGR_888(24),
    RGBX_8888(32),
    BGRX_8888(32),
    RGBA_8888(32),
    BGRA_8888(32),
    ARGB_8888(32),
    ABGR_8888(32),

    RGB_565(16),
    RGB_555(16),
    ARGB_1555(16),
    ARGB_4444(16),

    RGBA_1010102(32),
    BGRA_1010102(32),
    RGB_101010X(32),
    BGR_101010X(32),

    RGB_161616(48),
    BGR_161616(48),
    RGBA_16161616(64),

    RGBA_F16(64),
    RGBA_F16_CLAMPED(64),
    RGBA_F32(128),
    RG_F16(32),
    ALPHA_F16(16);

    private final int bitsPerPixel;

    PixelFormat(int bitsPerPixel) {
        this.bitsPerPixel = bitsPerPixel;
    }

    /**
     * @return the storage size of one pixel in bits, {@code 0} for {@link #UNKNOWN}
     */
    public int bitsPerPixel() {
        return bitsPerPixel;
    }

    /**
     * Returns the storage size of one pixel in bytes.
     *
     * @return the number of bytes per pixel, or {@code 0} if pixels of this format are not byte addressable
     */
    public int bytesPerPixel() {
        return bitsPerPixel % 8 == 0 ? bitsPerPixel / 8 : 0;
    }
}
