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
package io.tileverse.pixelreader.cache;

import io.tileverse.pixelreader.PixelSource;
import io.tileverse.pixelreader.Region;
import io.tileverse.pixelreader.SampleBlock;
import io.tileverse.pixelreader.decode.LevelShiftDecoder;
import io.tileverse.pixelreader.format.FormatDescriptor;
import java.io.IOException;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-slot cache of decoded component samples.
 * <p>
 * The cache holds at most one window: the last region decoded, with the samples of <em>all</em> components. A
 * request is served from the window when the window covers every pixel of it, otherwise the requested region
 * becomes the new window and is decoded in full before any component is returned. Since consumers usually walk
 * an image tile by tile and read every component of a tile in turn, one window is enough to decode each tile
 * once.
 * <p>
 * The previous window is discarded before decoding, so a decode that fails leaves the cache empty rather than
 * holding a mix of old and new samples. Plane arrays are reused across windows when they are large enough.
 * <p>
 * Blocks returned by {@link #get(int, Region)} are views into the planes and are overwritten by the next refill.
 * <p>
 * This class is not thread-safe.
 */
@Slf4j
public class WindowedBlockCache {

    private final PixelSource source;
    private final FormatDescriptor descriptor;
    private final LevelShiftDecoder decoder;

    private CachedWindow window;
    private int[][] planes;

    private long hitCount;
    private long missCount;
    private long decodeCount;

    public WindowedBlockCache(PixelSource source, FormatDescriptor descriptor, LevelShiftDecoder decoder) {
        this.source = Objects.requireNonNull(source, "Pixel source cannot be null");
        this.descriptor = Objects.requireNonNull(descriptor, "Format descriptor cannot be null");
        this.decoder = Objects.requireNonNull(decoder, "Decoder cannot be null");
    }

    /**
     * Returns the samples of one component over a region as a view into the cached window, decoding a new window
     * if the current one does not contain the region.
     *
     * @param component the component index, within the descriptor's component count
     * @param region a non-empty region within the source's bounds
     * @return a view valid until the next refill or {@link #invalidate()}
     * @throws IOException if the region has to be decoded and the source fails
     */
    public SampleBlock get(int component, Region region) throws IOException {
        Objects.checkIndex(component, descriptor.componentCount());
        Objects.requireNonNull(region, "region");
        CachedWindow current = window;
        if (current != null && current.contains(region)) {
            hitCount++;
            log.trace("Cache hit: component {} of {} in window {}", component, region, current.region());
            return current.view(component, region);
        }
        missCount++;
        return refill(region).view(component, region);
    }

    /**
     * Returns a copy of the samples of one component over a region.
     *
     * @param component the component index, within the descriptor's component count
     * @param region a non-empty region within the source's bounds
     * @param target the array to copy into, or {@code null} to allocate a new one
     * @return a block with offset 0 and scan width equal to the region width
     * @throws IllegalArgumentException if {@code target} holds fewer than {@code region.area()} samples, or is
     *     the array of a block returned by {@link #get(int, Region)}
     * @throws IOException if the region has to be decoded and the source fails
     */
    public SampleBlock getCopy(int component, Region region, int[] target) throws IOException {
        Objects.requireNonNull(region, "region");
        final int area = region.area();
        if (target != null && target.length < area) {
            throw new IllegalArgumentException(
                    "Target array has insufficient capacity: " + target.length + " < " + area);
        }
        if (target != null && isPlane(target)) {
            throw new IllegalArgumentException("Target array is a cached sample plane, copy into an array you own");
        }
        SampleBlock view = get(component, region);
        int[] copy = target == null ? new int[area] : target;
        final int width = region.width();
        for (int row = 0; row < region.height(); row++) {
            System.arraycopy(view.data(), view.offset() + row * view.scanWidth(), copy, row * width, width);
        }
        return new SampleBlock(region, copy, 0, width);
    }

    private boolean isPlane(int[] array) {
        if (planes != null) {
            for (int[] plane : planes) {
                if (plane == array) {
                    return true;
                }
            }
        }
        return false;
    }

    private CachedWindow refill(Region region) throws IOException {
        window = null;
        final int area = region.area();
        final int componentCount = descriptor.componentCount();
        if (planes == null) {
            planes = new int[componentCount][];
        }
        for (int c = 0; c < componentCount; c++) {
            if (planes[c] == null || planes[c].length < area) {
                planes[c] = new int[area];
            }
        }
        decodeCount++;
        log.debug("Decoding window {} of {}", region, source.getSourceIdentifier());
        decoder.decode(source, region, descriptor, planes);
        window = new CachedWindow(region, planes, region.width());
        return window;
    }

    /**
     * Discards the cached window and releases the sample planes.
     */
    public void invalidate() {
        window = null;
        planes = null;
    }

    /**
     * @return the region of the cached window, or {@code null} if the cache is empty
     */
    public Region getWindowRegion() {
        CachedWindow current = window;
        return current == null ? null : current.region();
    }

    public CacheStats getCacheStats() {
        CachedWindow current = window;
        long planeBytes = 0;
        if (planes != null) {
            for (int[] plane : planes) {
                planeBytes += plane == null ? 0 : 4L * plane.length;
            }
        }
        long windowArea = current == null ? 0 : current.region().area();
        return new CacheStats(hitCount, missCount, decodeCount, windowArea, planeBytes);
    }
}
