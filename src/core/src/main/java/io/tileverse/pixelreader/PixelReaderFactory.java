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

import static java.util.Objects.requireNonNull;

import io.tileverse.pixelreader.spi.PixelReaderConfig;
import io.tileverse.pixelreader.spi.PixelReaderProvider;
import java.io.IOException;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A factory for opening {@link PixelReader}s over image objects of any supported bitmap library.
 * This factory uses the Java Service Provider Interface (SPI) to discover
 * available {@link PixelReaderProvider} implementations at runtime.
 */
public final class PixelReaderFactory {
    private static final Logger logger = LoggerFactory.getLogger(PixelReaderFactory.class);

    private PixelReaderFactory() {
        // Private constructor to prevent instantiation of this utility class.
    }

    /**
     * Opens a {@link PixelReader} over the image with default configuration.
     *
     * @param image the image object
     * @return an open reader
     * @throws IOException If the pixel source cannot be created
     * @throws IllegalArgumentException If no available provider can process the image
     * @throws IllegalStateException If several providers with the same priority can process the image
     */
    public static PixelReader create(Object image) throws IOException {
        return create(image, new PixelReaderConfig());
    }

    /**
     * Opens a {@link PixelReader} over the image, configured by properties.
     *
     * @param image the image object
     * @param config configuration properties, see {@link PixelReaderConfig#fromProperties(Properties)}
     * @return an open reader
     * @throws IOException If the pixel source cannot be created
     * @throws IllegalArgumentException If no available provider can process the image
     * @throws IllegalStateException If several providers with the same priority can process the image
     */
    public static PixelReader create(Object image, Properties config) throws IOException {
        return create(image, PixelReaderConfig.fromProperties(requireNonNull(config)));
    }

    /**
     * Opens a {@link PixelReader} over the image using the best available provider.
     *
     * @param image the image object
     * @param config the configuration
     * @return an open reader
     * @throws IOException If the pixel source cannot be created
     * @throws IllegalArgumentException If no available provider can process the image
     * @throws IllegalStateException If several providers with the same priority can process the image
     */
    public static PixelReader create(Object image, PixelReaderConfig config) throws IOException {
        requireNonNull(image, "image");
        requireNonNull(config, "config");
        PixelReaderProvider provider = findBestProvider(image, config);
        logger.debug("Opening {} with provider {}", image.getClass().getSimpleName(), provider.getId());
        return provider.create(image, config);
    }

    /**
     * Finds the best {@link PixelReaderProvider} for the image.
     * <ol>
     *   <li>If a provider ID is set in the config, that provider is used, provided it is available.</li>
     *   <li>Otherwise the available providers that {@link PixelReaderProvider#canProcess(Object) can process}
     *       the image are candidates, and the one with the lowest {@link PixelReaderProvider#getOrder() order}
     *       wins.</li>
     * </ol>
     *
     * @param image the image object
     * @param config the configuration
     * @return The selected {@link PixelReaderProvider}.
     * @throws IllegalArgumentException If no available provider can process the image
     * @throws IllegalStateException If the explicit provider is unknown or unavailable, or if several providers
     *     share the highest priority
     */
    public static PixelReaderProvider findBestProvider(Object image, PixelReaderConfig config) {
        requireNonNull(config, "config");
        if (config.providerId().isPresent()) {
            return PixelReaderProvider.getProvider(config.providerId().orElseThrow(), true);
        }
        return findBestProvider(image, PixelReaderProvider.getAvailableProviders());
    }

    static PixelReaderProvider findBestProvider(Object image, List<PixelReaderProvider> providers) {
        requireNonNull(image, "image");
        List<PixelReaderProvider> candidates =
                providers.stream().filter(p -> p.canProcess(image)).toList();
        return switch (candidates.size()) {
            case 0 -> throw new IllegalArgumentException(
                    "No suitable provider found for " + image.getClass().getName());
            case 1 -> candidates.get(0);
            default -> resolveByPriority(candidates);
        };
    }

    private static PixelReaderProvider resolveByPriority(List<PixelReaderProvider> candidates) {
        final int highestPriority = candidates.stream()
                .mapToInt(PixelReaderProvider::getOrder)
                .min()
                .orElseThrow(() -> new IllegalStateException("No candidates to resolve by priority."));
        List<PixelReaderProvider> bestCandidates = candidates.stream()
                .filter(p -> p.getOrder() == highestPriority)
                .toList();

        if (bestCandidates.size() > 1) {
            String conflictingIds =
                    bestCandidates.stream().map(PixelReaderProvider::getId).collect(Collectors.joining(", "));
            throw new IllegalStateException("Multiple providers matched with the same priority ("
                    + highestPriority + "): [" + conflictingIds + "]. "
                    + "Please specify a provider ID in the PixelReaderConfig to resolve this ambiguity.");
        }
        return bestCandidates.get(0);
    }
}
