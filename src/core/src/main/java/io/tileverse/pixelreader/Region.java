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

import java.io.Serializable;

/**
 * Rectangular pixel region defined by its upper left corner and its size
 *
 * @param x the column of the upper left pixel
 * @param y the row of the upper left pixel
 * @param width the number of columns
 * @param height the number of rows
 */
public record Region(
        /** The column of the upper left pixel */
        int x,
        /** The row of the upper left pixel */
        int y,
        /** The number of columns */
        int width,
        /** The number of rows */
        int height)
        implements Serializable {

    /**
     * Compact constructor that validates the region size.
     *
     * @param x the column of the upper left pixel
     * @param y the row of the upper left pixel
     * @param width the number of columns (must be non-negative)
     * @param height the number of rows (must be non-negative)
     */
    public Region {
        if (width < 0) {
            throw new IllegalArgumentException("width can't be < 0: " + width);
        }
        if (height < 0) {
            throw new IllegalArgumentException("height can't be < 0: " + height);
        }
    }

    /**
     * @return the exclusive right edge, {@code x + width}
     */
    public long right() {
        return (long) x + width;
    }

    /**
     * @return the exclusive bottom edge, {@code y + height}
     */
    public long bottom() {
        return (long) y + height;
    }

    /**
     * @return the number of pixels in the region
     * @throws ArithmeticException if the pixel count does not fit in an {@code int}
     */
    public int area() {
        return Math.multiplyExact(width, height);
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * Checks whether this region covers every pixel of {@code other}.
     *
     * @param other the region to test
     * @return {@code true} if all four edges of {@code other} lie within this region
     */
    public boolean contains(Region other) {
        return other.x() >= x && other.y() >= y && other.right() <= right() && other.bottom() <= bottom();
    }

    /**
     * Checks whether this region lies inside an image of the given size.
     *
     * @param imageWidth the image width
     * @param imageHeight the image height
     * @return {@code true} if the region does not extend past any image edge
     */
    public boolean isWithin(int imageWidth, int imageHeight) {
        return x >= 0 && y >= 0 && right() <= imageWidth && bottom() <= imageHeight;
    }

    /**
     * Factory method to create a new {@link Region}.
     *
     * @param x the column of the upper left pixel
     * @param y the row of the upper left pixel
     * @param width the number of columns
     * @param height the number of rows
     * @return A new {@link Region} instance.
     */
    public static Region of(int x, int y, int width, int height) {
        return new Region(x, y, width, height);
    }
}
