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

import io.tileverse.pixelreader.cache.CacheStats;
import io.tileverse.pixelreader.cache.WindowedBlockCache;
import io.tileverse.pixelreader.decode.LevelShiftDecoder;
import io.tileverse.pixelreader.format.AlphaMode;
import io.tileverse.pixelreader.format.FormatDescriptor;
import io.tileverse.pixelreader.format.FormatResolver;
import io.tileverse.pixelreader.format.UnsupportedFormatException;
import io.tileverse.pixelreader.io.ByteBufferPool;
import java.io.IOException;
import java.util.Objects;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link BlockDataSource} over a {@link PixelSource}, delivering level-shifted component samples through a
 * {@link WindowedBlockCache}.
 * <p>
 * The pixel format is resolved when the reader is opened, so an undecodable source fails immediately; in that
 * case the source is closed before the exception propagates. The reader owns the source from then on and closes
 * it in {@link #close()}.
 * <p>
 * Every call checks, in this order, that the reader is open, that the component index is valid and that the
 * region is a non-empty region within the image, before the cache is consulted.
 *
 * <pre>{@code
 * try (PixelReader reader = PixelReader.open(source)) {
 *     for (int c = 0; c < reader.getComponentCount(); c++) {
 *         SampleBlock block = reader.getInternalCompData(c, Region.of(0, 0, 64, 64));
 *         // consume block before the next read...
 *     }
 * }
 * }</pre>
 * <p>
 * <strong>Thread Safety:</strong> instances are not thread-safe, a read may replace the cached window that blocks
 * returned earlier point into. Confine a reader to one thread or wrap it with
 * {@link BlockDataSources#synchronizedSource(BlockDataSource)}.
 */
@Slf4j
public class PixelReader implements BlockDataSource {

    private final PixelSource source;
    private final FormatDescriptor descriptor;
    private final WindowedBlockCache cache;
    private final int width;
    private final int height;
    private boolean closed;

    private PixelReader(PixelSource source, FormatDescriptor descriptor, LevelShiftDecoder decoder) {
        this.source = source;
        this.descriptor = descriptor;
        this.width = source.getWidth();
        this.height = source.getHeight();
        this.cache = new WindowedBlockCache(source, descriptor, decoder);
    }

    /**
     * Opens a reader over a pixel source with default settings.
     *
     * @param source the pixel source, owned by the returned reader
     * @return the open reader
     * @throws UnsupportedFormatException if the source's pixel format cannot be decoded; the source is closed
     * @throws IOException if the source fails
     */
    public static PixelReader open(@NonNull PixelSource source) throws IOException {
        return builder(source).build();
    }

    /**
     * @param source the pixel source, owned by the reader once built
     * @return a builder for a reader over {@code source}
     */
    public static Builder builder(@NonNull PixelSource source) {
        return new Builder(source);
    }

    private void ensureOpen() {
        if (closed) {
            throw new SourceClosedException(source.getSourceIdentifier());
        }
    }

    private void checkComponent(int component) {
        if (component < 0 || component >= descriptor.componentCount()) {
            throw new ComponentIndexOutOfRangeException(component, descriptor.componentCount());
        }
    }

    private void checkRegion(Region region) {
        Objects.requireNonNull(region, "region");
        if (region.isEmpty() || !region.isWithin(width, height)) {
            throw new InvalidRegionException(region, width, height);
        }
    }

    @Override
    public int getWidth() {
        ensureOpen();
        return width;
    }

    @Override
    public int getHeight() {
        ensureOpen();
        return height;
    }

    @Override
    public int getComponentCount() {
        ensureOpen();
        return descriptor.componentCount();
    }

    @Override
    public int getNominalRangeBits(int component) {
        ensureOpen();
        checkComponent(component);
        return descriptor.bitsPerComponent(component);
    }

    @Override
    public boolean isOriginalSigned(int component) {
        ensureOpen();
        checkComponent(component);
        return descriptor.signed(component);
    }

    @Override
    public int getFixedPoint(int component) {
        ensureOpen();
        checkComponent(component);
        return 0;
    }

    @Override
    public SampleBlock getInternalCompData(int component, Region region) throws IOException {
        ensureOpen();
        checkComponent(component);
        checkRegion(region);
        return cache.get(component, region);
    }

    @Override
    public SampleBlock getCompData(int component, Region region, int[] target) throws IOException {
        ensureOpen();
        checkComponent(component);
        checkRegion(region);
        return cache.getCopy(component, region, target);
    }

    /**
     * @return the resolved layout of the source's pixels
     */
    public FormatDescriptor getDescriptor() {
        ensureOpen();
        return descriptor;
    }

    public CacheStats getCacheStats() {
        return cache.getCacheStats();
    }

    public String getSourceIdentifier() {
        return source.getSourceIdentifier();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Discards the cached samples and closes the pixel source. Calling this method more than once has no effect.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        cache.invalidate();
        log.debug("Closing pixel reader over {}", source.getSourceIdentifier());
        source.close();
    }

    @Override
    public String toString() {
        return "PixelReader: WxH = %dx%d, Components = %d".formatted(width, height, descriptor.componentCount());
    }

    /**
     * Builder for {@link PixelReader}.
     */
    public static class Builder {

        private final PixelSource source;
        private boolean ignoreAlpha;
        private ByteBufferPool bufferPool;
        private LevelShiftDecoder decoder;

        private Builder(PixelSource source) {
            this.source = Objects.requireNonNull(source, "Pixel source cannot be null");
        }

        /**
         * Drops the alpha channel of translucent sources, decoding only their colour components.
         *
         * @param ignoreAlpha whether to treat the source as opaque
         * @return this builder
         */
        public Builder ignoreAlpha(boolean ignoreAlpha) {
            this.ignoreAlpha = ignoreAlpha;
            return this;
        }

        /**
         * Sets the pool scratch buffers are borrowed from, defaults to {@link ByteBufferPool#getDefault()}.
         * Ignored if a {@link #decoder(LevelShiftDecoder) decoder} is set.
         *
         * @param bufferPool the buffer pool
         * @return this builder
         */
        public Builder bufferPool(ByteBufferPool bufferPool) {
            this.bufferPool = Objects.requireNonNull(bufferPool, "Buffer pool cannot be null");
            return this;
        }

        public Builder decoder(LevelShiftDecoder decoder) {
            this.decoder = Objects.requireNonNull(decoder, "Decoder cannot be null");
            return this;
        }

        /**
         * Resolves the source's pixel format and opens the reader.
         *
         * @return the open reader
         * @throws UnsupportedFormatException if the pixel format cannot be decoded; the source is closed
         * @throws IOException if the source fails
         */
        public PixelReader build() throws IOException {
            final FormatDescriptor descriptor;
            try {
                AlphaMode alphaMode = ignoreAlpha ? AlphaMode.OPAQUE : source.getAlphaMode();
                descriptor = FormatResolver.resolve(source.getPixelFormat(), alphaMode);
            } catch (RuntimeException e) {
                closeSource(e);
                throw e;
            }
            LevelShiftDecoder effectiveDecoder = decoder;
            if (effectiveDecoder == null) {
                effectiveDecoder =
                        new LevelShiftDecoder(bufferPool == null ? ByteBufferPool.getDefault() : bufferPool);
            }
            PixelReader reader = new PixelReader(source, descriptor, effectiveDecoder);
            log.debug("Opened {} over {} ({})", reader, source.getSourceIdentifier(), descriptor);
            return reader;
        }

        private void closeSource(RuntimeException cause) {
            try {
                source.close();
            } catch (IOException e) {
                cause.addSuppressed(e);
            }
        }
    }
}
