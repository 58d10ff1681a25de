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

import io.tileverse.pixelreader.Region;
import io.tileverse.pixelreader.SampleBlock;

/**
 * The decoded samples of every component over one region.
 * <p>
 * Plane {@code c} holds component {@code c} in row-major order with {@code scanWidth} samples per row; planes may
 * be longer than the region's area when their storage is reused from a larger window.
 *
 * @param region the region the planes cover
 * @param planes one sample array per component
 * @param scanWidth the number of samples per row
 */
record CachedWindow(Region region, int[][] planes, int scanWidth) {

    boolean contains(Region request) {
        return region.contains(request);
    }

    /**
     * Returns a view of one component restricted to a region inside this window.
     *
     * @param component the component index
     * @param request a region contained in this window
     * @return a block addressing the request's upper left sample within the plane
     */
    SampleBlock view(int component, Region request) {
        int offset = (request.y() - region.y()) * scanWidth + (request.x() - region.x());
        return new SampleBlock(request, planes[component], offset, scanWidth);
    }
}
