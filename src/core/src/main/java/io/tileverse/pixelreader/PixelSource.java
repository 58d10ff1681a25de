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

import io.tileverse.pixelreader.format.AlphaMode;
import io.tileverse.pixelreader.format.PixelFormat;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Supplier of raw, interleaved pixel bytes for an image held by some external bitmap library.
 * <p>
 * Pixels are delivered tightly packed: row after row, each row holding {@code width * bytesPerPixel} bytes,
 * with multi-byte pixel words in little-endian order. Implementations do not interpret the pixels; decoding
 * them into components is the job of {@link PixelReader}.
 * <p>
 * Implementations are expected to extend {@link AbstractPixelSource}, which validates arguments before
 * delegating the actual copy.
 */
public interface PixelSource extends Closeable {

    int getWidth();

    int getHeight();

    /**
     * @return the encoding of the pixels returned by {@link #readPixels(Region, ByteBuffer)}
     */
    PixelFormat getPixelFormat();

    /**
     * @return how the alpha channel of {@link #getPixelFormat()}, if any, is to be interpreted
     */
    AlphaMode getAlphaMode();

    /**
     * Reads the pixels of a region into a new buffer.
     *
     * @param region the region to read
     * @return a buffer ready for reading, with position 0 and limit at the number of bytes read
     * @throws IOException if an I/O error occurs
     */
    default ByteBuffer readPixels(Region region) throws IOException {
        int length = Math.multiplyExact(region.area(), getPixelFormat().bytesPerPixel());
        ByteBuffer buffer = ByteBuffer.allocate(length);
        readPixels(region, buffer);
        return buffer.flip();
    }

    /**
     * Reads the pixels of a region into the target buffer.
     * <p>
     * Following NIO conventions, bytes are written starting at the buffer's position, which is advanced by the
     * number of bytes written. The caller flips the buffer before consuming it.
     *
     * @param region the region to read, must lie within the image
     * @param target the buffer to write into
     * @return the number of bytes written
     * @throws IOException if an I/O error occurs
     */
    int readPixels(Region region, ByteBuffer target) throws IOException;

    /**
     * @return a string identifying the pixel source, for logging and error messages
     */
    String getSourceIdentifier();
}
