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
package io.tileverse.pixelreader.spi;

import io.tileverse.pixelreader.PixelReader;
import io.tileverse.pixelreader.PixelSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * An abstract base class for {@link PixelReaderProvider} implementations. Adds the parameters common to all
 * providers and opens the {@link PixelReader} over the source created by the concrete provider.
 */
public abstract class AbstractPixelReaderProvider implements PixelReaderProvider {

    /**
     * Decode translucent images as if they were opaque, leaving their alpha channel out of the components.
     */
    public static final PixelReaderParameter<Boolean> IGNORE_ALPHA = PixelReaderParameter.flag(
            "io.tileverse.pixelreader.alpha.ignore",
            PixelReaderParameter.GROUP_DECODING,
            "Ignore alpha channel",
            """
            Decode only the colour components of images with an alpha channel.

            When disabled, translucent images (premultiplied or not) deliver their alpha channel \
            as the last component.
            """,
            false);

    private final List<PixelReaderParameter<?>> params;

    protected AbstractPixelReaderProvider() {
        List<PixelReaderParameter<?>> all = new ArrayList<>();
        all.add(IGNORE_ALPHA);
        all.addAll(buildParameters());
        this.params = List.copyOf(all);
    }

    @Override
    public final List<PixelReaderParameter<?>> getParameters() {
        return params;
    }

    /**
     * Builds the list of parameters specific to the concrete provider.
     *
     * @return A list of provider-specific {@link PixelReaderParameter}s.
     */
    protected List<PixelReaderParameter<?>> buildParameters() {
        return List.of();
    }

    /**
     * Creates the pixel source for the image and opens a reader over it, applying {@link #IGNORE_ALPHA}.
     *
     * @throws IllegalArgumentException if this provider cannot process the image
     */
    @Override
    public final PixelReader create(Object image, PixelReaderConfig config) throws IOException {
        if (!canProcess(image)) {
            throw new IllegalArgumentException(
                    "Provider " + getId() + " cannot process " + (image == null ? null : image.getClass()));
        }
        PixelSource source = createSource(image, config);
        boolean ignoreAlpha = config.get(IGNORE_ALPHA).orElse(false);
        return PixelReader.builder(source).ignoreAlpha(ignoreAlpha).build();
    }
}
