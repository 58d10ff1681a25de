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

import java.io.IOException;
import java.util.Objects;

/**
 * Static utilities for {@link BlockDataSource}s.
 */
public final class BlockDataSources {

    private BlockDataSources() {
        // utility class
    }

    /**
     * Returns a source that serializes every call to {@code source} on a single lock.
     * <p>
     * The lock is held for the whole duration of each call, including any window decode. Blocks returned by
     * {@link BlockDataSource#getInternalCompData(int, Region)} are still borrowed views that the next read from
     * any thread may overwrite; threads sharing the wrapper should use
     * {@link BlockDataSource#getCompData(int, Region, int[])} or hold the returned source's monitor across the
     * read and the use of the block.
     *
     * @param source the source to wrap
     * @return a thread-safe view of {@code source}, using itself as the lock
     */
    public static BlockDataSource synchronizedSource(BlockDataSource source) {
        Objects.requireNonNull(source, "source");
        if (source instanceof SynchronizedBlockDataSource) {
            return source;
        }
        return new SynchronizedBlockDataSource(source);
    }

    private static final class SynchronizedBlockDataSource implements BlockDataSource {

        private final BlockDataSource delegate;

        SynchronizedBlockDataSource(BlockDataSource delegate) {
            this.delegate = delegate;
        }

        @Override
        public synchronized int getWidth() {
            return delegate.getWidth();
        }

        @Override
        public synchronized int getHeight() {
            return delegate.getHeight();
        }

        @Override
        public synchronized int getComponentCount() {
            return delegate.getComponentCount();
        }

        @Override
        public synchronized int getNominalRangeBits(int component) {
            return delegate.getNominalRangeBits(component);
        }

        @Override
        public synchronized boolean isOriginalSigned(int component) {
            return delegate.isOriginalSigned(component);
        }

        @Override
        public synchronized int getFixedPoint(int component) {
            return delegate.getFixedPoint(component);
        }

        @Override
        public synchronized SampleBlock getInternalCompData(int component, Region region) throws IOException {
            return delegate.getInternalCompData(component, region);
        }

        @Override
        public synchronized SampleBlock getCompData(int component, Region region, int[] target)
                throws IOException {
            return delegate.getCompData(component, region, target);
        }

        @Override
        public synchronized void close() throws IOException {
            delegate.close();
        }

        @Override
        public synchronized String toString() {
            return "Synchronized[" + delegate + "]";
        }
    }
}
