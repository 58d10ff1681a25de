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

import java.util.Locale;

/**
 * Snapshot of the activity of a {@link WindowedBlockCache}.
 *
 * @param hitCount the number of requests served from the cached window
 * @param missCount the number of requests that required a new window
 * @param decodeCount the number of windows decoded from the pixel source, including failed attempts
 * @param windowArea the number of pixels in the current window, {@code 0} if there is none
 * @param planeBytes the memory held by the sample planes, in bytes
 */
public record CacheStats(long hitCount, long missCount, long decodeCount, long windowArea, long planeBytes) {

    /**
     * Returns the total number of cache requests (hits + misses).
     *
     * @return The total request count
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * @return the ratio of hits to requests, between 0.0 and 1.0; 1.0 when there were no requests
     */
    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 1.0 : (double) hitCount / requests;
    }

    /**
     * @return the ratio of misses to requests, between 0.0 and 1.0; 0.0 when there were no requests
     */
    public double missRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) missCount / requests;
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ROOT,
                "CacheStats{windowArea=%d, planeBytes=%d, hitRate=%.2f%%, hits=%d, misses=%d, decodes=%d}",
                windowArea, planeBytes, hitRate() * 100.0, hitCount, missCount, decodeCount);
    }
}
