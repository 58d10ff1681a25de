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

import java.io.Closeable;
import java.io.IOException;

/**
 * Component-oriented view of an image, delivering level-shifted integer samples one region at a time.
 * <p>
 * This is the contract downstream sample consumers (for example a wavelet encoder) are written against. All
 * samples are centered on zero: an unsigned {@code b}-bit value {@code v} is delivered as
 * {@code v - 2^(b-1)}.
 */
public interface BlockDataSource extends Closeable {

    int getWidth();

    int getHeight();

    int getComponentCount();

    /**
     * @param component the component index
     * @return the number of bits of the component's samples before level shifting
     * @throws ComponentIndexOutOfRangeException if the index is out of range
     */
    int getNominalRangeBits(int component);

    /**
     * @param component the component index
     * @return whether the component's samples were signed before level shifting, always {@code false} for
     *     pixel sources
     * @throws ComponentIndexOutOfRangeException if the index is out of range
     */
    boolean isOriginalSigned(int component);

    /**
     * @param component the component index
     * @return the number of fractional bits of the samples, always {@code 0} for pixel sources
     * @throws ComponentIndexOutOfRangeException if the index is out of range
     */
    int getFixedPoint(int component);

    /**
     * Returns the samples of one component over a region as a borrowed view.
     * <p>
     * The returned block may share its array with other components' windows and with later calls; it is only
     * valid until the next call that refills the internal window, or until {@link #close()}, and must not be
     * modified.
     *
     * @param component the component index
     * @param region the region to read
     * @return a view of the samples
     * @throws IOException if the pixels cannot be read from the source
     * @throws SourceClosedException if the source is closed
     * @throws ComponentIndexOutOfRangeException if the component index is out of range
     * @throws InvalidRegionException if the region is empty or outside the image
     */
    SampleBlock getInternalCompData(int component, Region region) throws IOException;

    /**
     * Returns a copy of the samples of one component over a region.
     *
     * @param component the component index
     * @param region the region to read
     * @param target the array to copy into, or {@code null} to allocate one; must hold at least
     *     {@code region.area()} samples
     * @return a block with offset 0 and scan width equal to the region width, backed by {@code target} if given
     * @throws IOException if the pixels cannot be read from the source
     * @throws SourceClosedException if the source is closed
     * @throws ComponentIndexOutOfRangeException if the component index is out of range
     * @throws InvalidRegionException if the region is empty or outside the image
     * @throws IllegalArgumentException if {@code target} is too small, or is the array of a block borrowed from
     *     {@link #getInternalCompData(int, Region)}
     */
    SampleBlock getCompData(int component, Region region, int[] target) throws IOException;
}
