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
package io.tileverse.pixelreader.raw;

import io.tileverse.pixelreader.format.AlphaMode;
import io.tileverse.pixelreader.format.PixelFormat;
import io.tileverse.pixelreader.format.UnsupportedFormatException;
import java.util.Objects;

/**
 * An image held as a plain byte array of interleaved pixels.
 * <p>
 * Row {@code y} starts at {@code y * scanlineStride}; each row holds {@code width} pixels of
 * {@code format.bytesPerPixel()} bytes, multi-byte pixel words in little-endian order, followed by any padding up
 * to the stride. The array is not copied.
 *
 * @param width the number of columns
 * @param height the number of rows
 * @param format the pixel encoding, must have a whole number of bytes per pixel
 * @param alphaMode how the alpha channel, if any, is to be interpreted
 * @param pixels the pixel bytes
 * @param scanlineStride the number of bytes between the starts of consecutive rows
 */
public record RawImage(
        int width, int height, PixelFormat format, AlphaMode alphaMode, byte[] pixels, int scanlineStride) {

    public RawImage {
        Objects.requireNonNull(format, "Pixel format cannot be null");
        Objects.requireNonNull(alphaMode, "Alpha mode cannot be null");
        Objects.requireNonNull(pixels, "Pixels cannot be null");
        if (width < 0) {
            throw new IllegalArgumentException("width can't be < 0: " + width);
        }
        if (height < 0) {
            throw new IllegalArgumentException("height can't be < 0: " + height);
        }
        final int bytesPerPixel = format.bytesPerPixel();
        if (bytesPerPixel == 0) {
            throw new UnsupportedFormatException(format, "raw images need a whole number of bytes per pixel");
        }
        final long rowLength = (long) width * bytesPerPixel;
        if (scanlineStride < rowLength) {
            throw new IllegalArgumentException(
                    "scanlineStride " + scanlineStride + " is smaller than the row length " + rowLength);
        }
        final long required = height == 0 ? 0 : (long) (height - 1) * scanlineStride + rowLength;
        if (pixels.length < required) {
            throw new IllegalArgumentException(
                    "Pixel array too small: " + pixels.length + " bytes, need at least " + required);
        }
    }

    /**
     * Creates a raw image whose rows are tightly packed.
     *
     * @param width the number of columns
     * @param height the number of rows
     * @param format the pixel encoding
     * @param alphaMode how the alpha channel, if any, is to be interpreted
     * @param pixels the pixel bytes
     * @return A new {@link RawImage} instance.
     */
    public static RawImage of(int width, int height, PixelFormat format, AlphaMode alphaMode, byte[] pixels) {
        Objects.requireNonNull(format, "Pixel format cannot be null");
        return new RawImage(width, height, format, alphaMode, pixels, width * format.bytesPerPixel());
    }

    public int rowLength() {
        return width * format.bytesPerPixel();
    }
}
