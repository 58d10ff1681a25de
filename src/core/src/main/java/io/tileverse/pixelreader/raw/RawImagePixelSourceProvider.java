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
package io.tileverse.pixelreader.raw;

import io.tileverse.pixelreader.PixelSource;
import io.tileverse.pixelreader.spi.AbstractPixelReaderProvider;
import io.tileverse.pixelreader.spi.PixelReaderConfig;
import io.tileverse.pixelreader.spi.PixelReaderProvider;

/**
 * A {@link PixelReaderProvider} for {@link RawImage}s.
 */
public class RawImagePixelSourceProvider extends AbstractPixelReaderProvider {

    /**
     * Key used as environment variable name to disable this provider
     * <pre>
     * {@code export IO_TILEVERSE_PIXELREADER_RAW=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_PIXELREADER_RAW";

    /**
     * This provider's {@link #getId() unique identifier}
     */
    public static final String ID = "raw";

    public RawImagePixelSourceProvider() {
        super();
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public boolean isAvailable() {
        return PixelReaderProvider.isEnabled(ENABLED_KEY);
    }

    @Override
    public String getDescription() {
        return "Reads pixels from in-memory byte arrays.";
    }

    @Override
    public boolean canProcess(Object image) {
        return image instanceof RawImage;
    }

    @Override
    public PixelSource createSource(Object image, PixelReaderConfig config) {
        if (!(image instanceof RawImage raw)) {
            throw new IllegalArgumentException("Not a RawImage: " + image);
        }
        return new RawImagePixelSource(raw);
    }
}
