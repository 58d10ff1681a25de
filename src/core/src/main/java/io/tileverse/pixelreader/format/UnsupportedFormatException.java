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
package io.tileverse.pixelreader.format;

/**
 * Thrown when a pixel format cannot be decoded into integer samples, either because it is unknown or because it
 * uses a representation (floating point, sub-byte packing) this library declines to decode.
 */
public class UnsupportedFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final PixelFormat format;

    /**
     * @param format the offending format
     * @param reason why the format is rejected
     */
    public UnsupportedFormatException(PixelFormat format, String reason) {
        super("Unsupported pixel format " + format + ": " + reason);
        this.format = format;
    }

    /**
     * @return the pixel format that was rejected
     */
    public PixelFormat getFormat() {
        return format;
    }
}
