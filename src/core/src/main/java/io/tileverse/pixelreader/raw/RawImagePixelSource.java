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

import io.tileverse.pixelreader.AbstractPixelSource;
import io.tileverse.pixelreader.PixelSource;
import io.tileverse.pixelreader.Region;
import io.tileverse.pixelreader.format.AlphaMode;
import io.tileverse.pixelreader.format.PixelFormat;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.util.Objects;

/**
 * A {@link PixelSource} over a {@link RawImage}.
 * <p>
 * Regions are copied row by row out of the image's byte array, dropping the scanline padding. Closing the source
 * releases the reference to the image; reads after close fail with {@link ClosedChannelException}.
 */
public class RawImagePixelSource extends AbstractPixelSource implements PixelSource {

    private final String identifier;
    private final int width;
    private final int height;
    private final PixelFormat format;
    private final AlphaMode alphaMode;
    private volatile RawImage image;

    public RawImagePixelSource(RawImage image) {
        this(image, null);
    }

    /**
     * @param image the image to read from
     * @param name a name to identify the image in logs, or {@code null} to derive one from its properties
     */
    public RawImagePixelSource(RawImage image, String name) {
        this.image = Objects.requireNonNull(image, "Raw image cannot be null");
        this.width = image.width();
        this.height = image.height();
        this.format = image.format();
        this.alphaMode = image.alphaMode();
        this.identifier = "raw:" + (name == null ? "%dx%d-%s".formatted(width, height, format) : name);
    }

    public static RawImagePixelSource of(RawImage image) {
        return new RawImagePixelSource(image);
    }

    @Override
    protected int readPixelsNoFlip(Region region, ByteBuffer target) throws IOException {
        final RawImage current = image;
        if (current == null) {
            throw new ClosedChannelException();
        }
        final int bytesPerPixel = format.bytesPerPixel();
        final int rowBytes = region.width() * bytesPerPixel;
        final int stride = current.scanlineStride();
        final byte[] pixels = current.pixels();
        int offset = region.y() * stride + region.x() * bytesPerPixel;
        for (int row = 0; row < region.height(); row++, offset += stride) {
            target.put(pixels, offset, rowBytes);
        }
        return rowBytes * region.height();
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public PixelFormat getPixelFormat() {
        return format;
    }

    @Override
    public AlphaMode getAlphaMode() {
        return alphaMode;
    }

    @Override
    public String getSourceIdentifier() {
        return identifier;
    }

    public boolean isOpen() {
        return image != null;
    }

    @Override
    public void close() {
        image = null;
    }

    @Override
    public String toString() {
        return "RawImagePixelSource[" + identifier + "]";
    }
}
