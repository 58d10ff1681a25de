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
package io.tileverse.pixelreader.awt;

import io.tileverse.pixelreader.PixelSource;
import io.tileverse.pixelreader.format.FormatResolver;
import io.tileverse.pixelreader.format.PixelFormat;
import io.tileverse.pixelreader.spi.AbstractPixelReaderProvider;
import io.tileverse.pixelreader.spi.PixelReaderConfig;
import io.tileverse.pixelreader.spi.PixelReaderParameter;
import io.tileverse.pixelreader.spi.PixelReaderProvider;
import java.awt.image.BufferedImage;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link PixelReaderProvider} for {@link BufferedImage}s.
 */
@Slf4j
public class BufferedImagePixelSourceProvider extends AbstractPixelReaderProvider {

    /**
     * Key used as environment variable name to disable this provider
     * <pre>
     * {@code export IO_TILEVERSE_PIXELREADER_AWT=false}
     * </pre>
     */
    public static final String ENABLED_KEY = "IO_TILEVERSE_PIXELREADER_AWT";

    /**
     * This provider's {@link #getId() unique identifier}
     */
    public static final String ID = "awt";

    /**
     * Convert images whose layout cannot be decoded to {@link BufferedImage#TYPE_INT_ARGB} before reading them.
     */
    public static final PixelReaderParameter<Boolean> CONVERT_UNSUPPORTED = PixelReaderParameter.flag(
            "io.tileverse.pixelreader.awt.convert",
            PixelReaderParameter.GROUP_DECODING,
            "Convert unsupported images",
            """
            Draw images of undecodable types (sub-byte indexed, floating point or custom rasters) \
            into an 8-bit ARGB image before reading them.

            When disabled, opening a reader over such an image fails.
            """,
            false);

    public BufferedImagePixelSourceProvider() {
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
        return "Reads pixels from java.awt.image.BufferedImage rasters.";
    }

    @Override
    protected List<PixelReaderParameter<?>> buildParameters() {
        return List.of(CONVERT_UNSUPPORTED);
    }

    @Override
    public boolean canProcess(Object image) {
        return image instanceof BufferedImage;
    }

    @Override
    public PixelSource createSource(Object image, PixelReaderConfig config) {
        if (!(image instanceof BufferedImage bufferedImage)) {
            throw new IllegalArgumentException("Not a BufferedImage: " + image);
        }
        boolean convert = config.get(CONVERT_UNSUPPORTED).orElse(false);
        PixelFormat format = BufferedImagePixelSource.pixelFormatOf(bufferedImage);
        if (convert && !FormatResolver.isSupported(format)) {
            log.debug("Converting {} image of type {} to TYPE_INT_ARGB", format, bufferedImage.getType());
            bufferedImage = BufferedImagePixelSource.toIntArgb(bufferedImage);
        }
        return new BufferedImagePixelSource(bufferedImage);
    }
}
