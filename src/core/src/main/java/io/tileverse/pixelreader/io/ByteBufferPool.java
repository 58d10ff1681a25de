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
package io.tileverse.pixelreader.io;

import java.nio.ByteBuffer;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread-safe pool of heap {@link ByteBuffer}s used as scratch space for raw pixel rows.
 * <p>
 * Decoding a window needs a byte buffer as large as the window's raw pixels. Consecutive windows usually have
 * similar sizes, so buffers are returned after each decode and handed out again to the next one instead of
 * being reallocated.
 * <p>
 * The pool holds at most {@code maxBuffers} buffers; buffers smaller than {@code minBufferSize} and buffers
 * returned to a full pool are discarded. Borrowed buffers are cleared, with their limit set to the requested
 * size.
 *
 * <pre>{@code
 * ByteBuffer buffer = pool.borrowHeap(length);
 * try {
 *     source.readPixels(region, buffer);
 *     buffer.flip();
 *     // decode...
 * } finally {
 *     pool.returnBuffer(buffer);
 * }
 * }</pre>
 */
public class ByteBufferPool {

    private static final Logger logger = LoggerFactory.getLogger(ByteBufferPool.class);

    /** Default maximum number of pooled buffers. */
    public static final int DEFAULT_MAX_BUFFERS = 16;

    /** Default minimum buffer size to pool (4KB). */
    public static final int DEFAULT_MIN_BUFFER_SIZE = 4096;

    private static final ByteBufferPool DEFAULT_INSTANCE = new ByteBufferPool();

    private final ConcurrentLinkedQueue<ByteBuffer> buffers = new ConcurrentLinkedQueue<>();

    private final AtomicInteger bufferCount = new AtomicInteger(0);

    private final int maxBuffers;

    private final int minBufferSize;

    private final AtomicLong buffersCreated = new AtomicLong(0);

    private final AtomicLong buffersReused = new AtomicLong(0);

    private final AtomicLong buffersReturned = new AtomicLong(0);

    private final AtomicLong buffersDiscarded = new AtomicLong(0);

    /**
     * Creates a new pool with default settings.
     */
    public ByteBufferPool() {
        this(DEFAULT_MAX_BUFFERS, DEFAULT_MIN_BUFFER_SIZE);
    }

    /**
     * Creates a new pool with custom settings.
     *
     * @param maxBuffers maximum number of buffers to pool
     * @param minBufferSize minimum buffer size to pool (bytes)
     * @throws IllegalArgumentException if any parameter is negative or zero
     */
    public ByteBufferPool(int maxBuffers, int minBufferSize) {
        if (maxBuffers <= 0) {
            throw new IllegalArgumentException("maxBuffers must be positive: " + maxBuffers);
        }
        if (minBufferSize <= 0) {
            throw new IllegalArgumentException("minBufferSize must be positive: " + minBufferSize);
        }
        this.maxBuffers = maxBuffers;
        this.minBufferSize = minBufferSize;
        logger.debug("Created ByteBufferPool: maxBuffers={}, minSize={}", maxBuffers, minBufferSize);
    }

    /**
     * @return the shared pool used when no pool is configured explicitly
     */
    public static ByteBufferPool getDefault() {
        return DEFAULT_INSTANCE;
    }

    /**
     * Borrows a heap buffer with at least the specified capacity.
     * <p>
     * New buffers are allocated with a capacity rounded up to a multiple of 8KB so they can serve slightly larger
     * requests later.
     *
     * @param size minimum required capacity in bytes
     * @return a cleared heap buffer whose limit is {@code size}
     * @throws IllegalArgumentException if size is negative
     */
    public ByteBuffer borrowHeap(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + size);
        }
        ByteBuffer buffer = findSuitableBuffer(size);
        if (buffer != null) {
            buffersReused.incrementAndGet();
            logger.trace("Reused heap buffer: capacity={}", buffer.capacity());
        } else {
            int alignedCapacity = roundUpTo8KB(size);
            buffer = ByteBuffer.allocate(alignedCapacity);
            buffersCreated.incrementAndGet();
            logger.trace("Created new heap buffer: requested={}, aligned={}", size, alignedCapacity);
        }
        return buffer.clear().limit(size);
    }

    /**
     * Returns a buffer to the pool for potential reuse. The caller must not use the buffer afterwards.
     *
     * @param buffer the buffer to return, may be null in which case this is a no-op
     */
    public void returnBuffer(ByteBuffer buffer) {
        if (buffer == null) {
            return;
        }
        buffer.clear();
        if (buffer.isDirect() || buffer.isReadOnly() || buffer.capacity() < minBufferSize) {
            buffersDiscarded.incrementAndGet();
            logger.trace("Discarded buffer: capacity={}, direct={}", buffer.capacity(), buffer.isDirect());
            return;
        }
        if (bufferCount.get() < maxBuffers) {
            buffers.offer(buffer);
            bufferCount.incrementAndGet();
            buffersReturned.incrementAndGet();
            logger.trace("Returned heap buffer to pool: capacity={}", buffer.capacity());
        } else {
            buffersDiscarded.incrementAndGet();
            logger.trace("Discarded heap buffer (pool full): capacity={}", buffer.capacity());
        }
    }

    /**
     * Releases all pooled buffers.
     */
    public void clear() {
        int cleared = 0;
        while (buffers.poll() != null) {
            cleared++;
        }
        bufferCount.set(0);
        logger.debug("Cleared pool: {} heap buffers", cleared);
    }

    /**
     * @return a snapshot of the pool usage counters
     */
    public PoolStatistics getStatistics() {
        return new PoolStatistics(
                bufferCount.get(),
                maxBuffers,
                buffersCreated.get(),
                buffersReused.get(),
                buffersReturned.get(),
                buffersDiscarded.get());
    }

    private static int roundUpTo8KB(int capacity) {
        final int alignment = 8192;
        long aligned = ((capacity + (long) alignment - 1) / alignment) * alignment;
        return (int) Math.min(aligned, Integer.MAX_VALUE - 8);
    }

    private ByteBuffer findSuitableBuffer(int minCapacity) {
        ByteBuffer buffer;
        while ((buffer = buffers.poll()) != null) {
            bufferCount.decrementAndGet();
            if (buffer.capacity() >= minCapacity) {
                return buffer;
            }
            buffersDiscarded.incrementAndGet();
            logger.trace(
                    "Discarded heap buffer (too small for request): capacity={}, required={}",
                    buffer.capacity(),
                    minCapacity);
        }
        return null;
    }

    @Override
    public String toString() {
        PoolStatistics stats = getStatistics();
        return String.format(
                "ByteBufferPool[heap=%d/%d, created=%d, reused=%d, returned=%d, discarded=%d]",
                stats.currentBuffers(),
                stats.maxBuffers(),
                stats.buffersCreated(),
                stats.buffersReused(),
                stats.buffersReturned(),
                stats.buffersDiscarded());
    }

    /**
     * Immutable statistics snapshot for a buffer pool.
     *
     * @param currentBuffers current number of pooled buffers
     * @param maxBuffers maximum number of buffers that can be pooled
     * @param buffersCreated total number of buffers created
     * @param buffersReused total number of buffers reused from the pool
     * @param buffersReturned total number of buffers returned to the pool
     * @param buffersDiscarded total number of buffers discarded (pool full or too small)
     */
    public record PoolStatistics(
            int currentBuffers,
            int maxBuffers,
            long buffersCreated,
            long buffersReused,
            long buffersReturned,
            long buffersDiscarded) {

        /**
         * @return percentage of borrow operations satisfied from the pool (0.0 to 100.0)
         */
        public double hitRate() {
            long totalBorrows = buffersCreated + buffersReused;
            return totalBorrows > 0 ? (buffersReused * 100.0) / totalBorrows : 0.0;
        }
    }
}
