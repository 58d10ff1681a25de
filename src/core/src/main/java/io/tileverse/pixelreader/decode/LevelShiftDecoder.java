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
package io.tileverse.pixelreader.decode;

import io.tileverse.pixelreader.PixelSource;
import io.tileverse.pixelreader.Region;
import io.tileverse.pixelreader.format.FormatDescriptor;
import io.tileverse.pixelreader.io.ByteBufferPool;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Decodes the raw pixels of a region into one integer plane per component.
 * <p>
 * The region's pixels are read from the {@link PixelSource} into a scratch buffer borrowed from a
 * {@link ByteBufferPool}, then each component is extracted as described by the {@link FormatDescriptor} and
 * stored at the pixel's row-major index ({@code row * width + column}) of its plane. With level shifting, an
 * unsigned {@code b}-bit value {@code v} is stored as {@code v - 2^(b-1)}.
 * <p>
 * Layouts whose components are all whole bytes are decoded byte by byte; any other layout is decoded by
 * assembling the little-endian pixel word and masking each component's bit field out of it.
 * <p>
 * Instances hold no state besides the pool and are safe to share between threads.
 */
@Slf4j
public class LevelShiftDecoder {

    private final ByteBufferPool bufferPool;

    /**
     * Creates a decoder borrowing scratch buffers from the {@link ByteBufferPool#getDefault() default pool}.
     */
    public LevelShiftDecoder() {
        this(ByteBufferPool.getDefault());
    }

    public LevelShiftDecoder(ByteBufferPool bufferPool) {
        this.bufferPool = Objects.requireNonNull(bufferPool, "bufferPool");
    }

    /**
     * Decodes the region into level-shifted samples.
     *
     * @param source the pixel source to read from
     * @param region the region to decode, within the source's bounds
     * @param descriptor the layout of the source's pixels
     * @param planes one array per component, each holding at least {@code region.area()} samples
     * @throws IOException if the source fails or returns fewer bytes than the region holds
     */
    public void decode(
            @NonNull PixelSource source,
            @NonNull Region region,
            @NonNull FormatDescriptor descriptor,
            @NonNull int[][] planes)
            throws IOException {
        decode(source, region, descriptor, planes, true);
    }

    /**
     * Decodes the region into the components' raw unsigned values, without level shifting.
     *
     * @see #decode(PixelSource, Region, FormatDescriptor, int[][])
     */
    public void decodeUnshifted(
            @NonNull PixelSource source,
            @NonNull Region region,
            @NonNull FormatDescriptor descriptor,
            @NonNull int[][] planes)
            throws IOException {
        decode(source, region, descriptor, planes, false);
    }

    private void decode(
            PixelSource source, Region region, FormatDescriptor descriptor, int[][] planes, boolean levelShift)
            throws IOException {
        final int componentCount = descriptor.componentCount();
        final int pixelCount = region.area();
        if (planes.length < componentCount) {
            throw new IllegalArgumentException(
                    "Expected " + componentCount + " planes, got " + planes.length);
        }
        for (int c = 0; c < componentCount; c++) {
            if (planes[c] == null || planes[c].length < pixelCount) {
                throw new IllegalArgumentException("Plane " + c + " cannot hold " + pixelCount + " samples");
            }
        }

        final int bytesPerPixel = descriptor.bytesPerPixel();
        final int length = Math.multiplyExact(pixelCount, bytesPerPixel);
        ByteBuffer buffer = bufferPool.borrowHeap(length);
        try {
            final int read = source.readPixels(region, buffer);
            if (read != length) {
                throw new IOException("Short read from %s: expected %d bytes for %s, got %d"
                        .formatted(source.getSourceIdentifier(), length, region, read));
            }
            buffer.flip();
            final byte[] bytes = buffer.array();
            final int base = buffer.arrayOffset();
            if (descriptor.isByteAligned()) {
                decodeBytes(bytes, base, pixelCount, descriptor, planes, levelShift);
            } else {
                decodeWords(bytes, base, pixelCount, descriptor, planes, levelShift);
            }
            log.trace("Decoded {} pixels of {} from {}", pixelCount, region, source.getSourceIdentifier());
        } finally {
            bufferPool.returnBuffer(buffer);
        }
    }

    private static void decodeBytes(
            byte[] bytes, int base, int pixelCount, FormatDescriptor descriptor, int[][] planes, boolean levelShift) {
        final int bytesPerPixel = descriptor.bytesPerPixel();
        for (int c = 0; c < descriptor.componentCount(); c++) {
            final int[] plane = planes[c];
            final int shift = levelShift ? descriptor.levelShift(c) : 0;
            int index = base + descriptor.bitOffset(c) / 8;
            for (int i = 0; i < pixelCount; i++, index += bytesPerPixel) {
                plane[i] = (bytes[index] & 0xFF) - shift;
            }
        }
    }

    private static void decodeWords(
            byte[] bytes, int base, int pixelCount, FormatDescriptor descriptor, int[][] planes, boolean levelShift) {
        final int bytesPerPixel = descriptor.bytesPerPixel();
        final int componentCount = descriptor.componentCount();
        final int[] offsets = new int[componentCount];
        final long[] masks = new long[componentCount];
        final int[] shifts = new int[componentCount];
        for (int c = 0; c < componentCount; c++) {
            offsets[c] = descriptor.bitOffset(c);
            masks[c] = (1L << descriptor.bitsPerComponent(c)) - 1;
            shifts[c] = levelShift ? descriptor.levelShift(c) : 0;
        }
        int index = base;
        for (int i = 0; i < pixelCount; i++, index += bytesPerPixel) {
            long word = 0;
            for (int b = bytesPerPixel - 1; b >= 0; b--) {
                word = (word << 8) | (bytes[index + b] & 0xFFL);
            }
            for (int c = 0; c < componentCount; c++) {
                planes[c][i] = (int) ((word >>> offsets[c]) & masks[c]) - shifts[c];
            }
        }
    }
}
