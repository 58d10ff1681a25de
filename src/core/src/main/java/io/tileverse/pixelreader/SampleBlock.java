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

/**
 * Samples of one component over a region, addressed through an offset and a scan width into a flat array.
 * <p>
 * The sample at column {@code i} and row {@code j} of the region (relative to its upper left corner) is
 * {@code data[offset + j * scanWidth + i]}.
 * <p>
 * Blocks returned by {@link BlockDataSource#getInternalCompData(int, Region)} are borrowed views of the
 * reader's internal buffers: they are only valid until the next read that refills the cache, or until the
 * reader is closed, and must not be modified. Use {@link BlockDataSource#getCompData(int, Region, int[])} to
 * obtain samples the caller owns.
 *
 * @param region the region the samples cover
 * @param data the sample array, may be larger than the region
 * @param offset the index of the upper left sample in {@code data}
 * @param scanWidth the distance in {@code data} between vertically adjacent samples
 */
public record SampleBlock(Region region, int[] data, int offset, int scanWidth) {

    public SampleBlock {
        if (region == null) {
            throw new IllegalArgumentException("region cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset can't be < 0: " + offset);
        }
        if (scanWidth < region.width()) {
            throw new IllegalArgumentException(
                    "scanWidth " + scanWidth + " is smaller than the region width " + region.width());
        }
    }

    public int width() {
        return region.width();
    }

    public int height() {
        return region.height();
    }

    /**
     * Returns one sample.
     *
     * @param column the column relative to the region's left edge
     * @param row the row relative to the region's top edge
     * @return the sample value
     * @throws IndexOutOfBoundsException if the position is outside the region
     */
    public int get(int column, int row) {
        if (column < 0 || column >= region.width() || row < 0 || row >= region.height()) {
            throw new IndexOutOfBoundsException(
                    "(" + column + ", " + row + ") is outside a " + region.width() + "x" + region.height()
                            + " block");
        }
        return data[offset + row * scanWidth + column];
    }
}
