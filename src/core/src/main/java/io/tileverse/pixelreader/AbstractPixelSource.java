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
package io.tileverse.pixelreader;

import io.tileverse.pixelreader.format.UnsupportedFormatException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;

/**
 * Abstract base class providing argument validation for {@link PixelSource} implementations.
 * <p>
 * {@link #readPixels(Region, ByteBuffer)} checks the region and the target buffer and delegates the copy to
 * {@link #readPixelsNoFlip(Region, ByteBuffer)}, so concrete sources only deal with their own pixel storage.
 */
public abstract class AbstractPixelSource implements PixelSource {

    protected AbstractPixelSource() {
        // Default constructor for subclasses
    }

    /**
     * Reads the pixels of a region into the target buffer.
     * <p>
     * <strong>Parameter Validation:</strong>
     * <ul>
     * <li>The region and target must not be null, and the target must be writable</li>
     * <li>The pixel format must have a whole number of bytes per pixel</li>
     * <li>The region must be non-empty and lie within the image</li>
     * <li>The target must have room for {@code region.area() * bytesPerPixel} bytes</li>
     * </ul>
     *
     * @throws IllegalArgumentException if the region or target is null or the target is too small
     * @throws ReadOnlyBufferException if the target buffer is read-only
     * @throws UnsupportedFormatException if the pixel format packs several pixels per byte
     * @throws InvalidRegionException if the region is empty or outside the image
     */
    @Override
    public final int readPixels(Region region, ByteBuffer target) throws IOException {
        if (region == null) {
            throw new IllegalArgumentException("Region cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("Target buffer cannot be null");
        }
        if (target.isReadOnly()) {
            throw new ReadOnlyBufferException();
        }
        final int bytesPerPixel = getPixelFormat().bytesPerPixel();
        if (bytesPerPixel == 0) {
            throw new UnsupportedFormatException(getPixelFormat(), "pixels are not byte addressable");
        }
        if (region.isEmpty() || !region.isWithin(getWidth(), getHeight())) {
            throw new InvalidRegionException(region, getWidth(), getHeight());
        }
        final int length = Math.multiplyExact(region.area(), bytesPerPixel);
        final int remaining = target.remaining();
        if (remaining < length) {
            throw new IllegalArgumentException(
                    "Target buffer has insufficient remaining capacity: " + remaining + " < " + length);
        }
        return readPixelsNoFlip(region, target);
    }

    /**
     * Copies the pixels of a region into the target buffer without flipping it.
     * <p>
     * <strong>Implementation Requirements:</strong>
     * <ul>
     * <li>Write the region's rows top to bottom, each {@code region.width() * bytesPerPixel} bytes long, with no
     * padding between rows</li>
     * <li>Write multi-byte pixel words in little-endian order</li>
     * <li>Advance the target's position by the number of bytes written and leave its limit unchanged</li>
     * </ul>
     * When called from {@link #readPixels(Region, ByteBuffer)} the region is non-empty and within the image, and
     * the target is writable with enough remaining space.
     *
     * @param region the region to copy
     * @param target the buffer to write into
     * @return the number of bytes written
     * @throws IOException if the pixels cannot be read
     */
    protected abstract int readPixelsNoFlip(Region region, ByteBuffer target) throws IOException;
}
