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
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.ServiceLoader.Provider;
import java.util.stream.Stream;

/**
 * Service Provider Interface (SPI) adapting the image objects of a bitmap library to {@link PixelSource}s.
 * Implementations are discovered at runtime using {@link ServiceLoader}.
 */
public interface PixelReaderProvider {

    /**
     * @return the unique identifier of this provider
     */
    String getId();

    /**
     * @return a human-readable description of this provider
     */
    String getDescription();

    /**
     * Checks if this provider is available in the current environment, for example whether its bitmap library is
     * present or whether it was disabled with a configuration flag.
     *
     * @return {@code true} if available, {@code false} otherwise.
     */
    boolean isAvailable();

    /**
     * @return the configuration parameters supported by this provider
     */
    List<PixelReaderParameter<?>> getParameters();

    default PixelReaderConfig getDefaultConfig() {
        return PixelReaderConfig.defaultsOf(getParameters());
    }

    /**
     * Checks whether the image is an object of the bitmap library this provider adapts. Must not do any I/O.
     *
     * @param image the image object
     * @return {@code true} if {@link #createSource(Object, PixelReaderConfig)} accepts the image
     */
    boolean canProcess(Object image);

    /**
     * Gets the order value of this provider. Lower values have higher priority.
     * The default priority is 0.
     *
     * @return The order value.
     */
    default int getOrder() {
        return 0;
    }

    /**
     * Adapts the image to a {@link PixelSource}.
     *
     * @param image an image this provider {@link #canProcess(Object) can process}
     * @param config the configuration
     * @return a new pixel source, owned by the caller
     * @throws IllegalArgumentException if the image cannot be processed by this provider
     * @throws IOException if the source cannot be created
     */
    PixelSource createSource(Object image, PixelReaderConfig config) throws IOException;

    /**
     * Opens a {@link PixelReader} over the image using default configuration.
     *
     * @param image the image object
     * @return an open reader
     * @throws IOException if the source cannot be created
     */
    default PixelReader create(Object image) throws IOException {
        return create(image, getDefaultConfig());
    }

    /**
     * Opens a {@link PixelReader} over the image.
     *
     * @param image the image object
     * @param config the configuration
     * @return an open reader
     * @throws IOException if the source cannot be created
     */
    PixelReader create(Object image, PixelReaderConfig config) throws IOException;

    /**
     * Checks if a provider is enabled via a system property or environment variable.
     * The property is checked first, then the environment variable.
     * If neither is set, it defaults to {@code true}.
     *
     * @param key The key for the system property/environment variable.
     * @return {@code true} if enabled, {@code false} otherwise.
     */
    static boolean isEnabled(String key) {
        String enabled = System.getProperty(key);
        if (enabled == null) {
            enabled = System.getenv(key);
        }
        return enabled == null ? true : Boolean.parseBoolean(enabled);
    }

    static Stream<PixelReaderProvider> findProviders() {
        ServiceLoader<PixelReaderProvider> loader = ServiceLoader.load(PixelReaderProvider.class);
        return loader.stream().map(Provider::get);
    }

    static List<PixelReaderProvider> getProviders() {
        return findProviders().toList();
    }

    static List<PixelReaderProvider> getAvailableProviders() {
        return findProviders().filter(PixelReaderProvider::isAvailable).toList();
    }

    static Optional<PixelReaderProvider> findProvider(String providerId) {
        return findProviders()
                .filter(p -> p.getId().equalsIgnoreCase(providerId))
                .findFirst();
    }

    /**
     * Retrieves a specific {@link PixelReaderProvider} by its ID, with an option to check for availability.
     *
     * @param providerId The ID of the provider to retrieve.
     * @param available  If {@code true}, the method will throw an exception if the provider is not available.
     * @return The requested {@link PixelReaderProvider}.
     * @throws IllegalStateException if the provider is not found, or if {@code available} is true and the provider
     *     is not available.
     */
    static PixelReaderProvider getProvider(String providerId, boolean available) {
        PixelReaderProvider provider = findProvider(providerId)
                .orElseThrow(() ->
                        new IllegalStateException("The specified PixelReaderProvider is not found: " + providerId));
        if (available && !provider.isAvailable()) {
            throw new IllegalStateException("The specified PixelReaderProvider is not available: " + providerId);
        }
        return provider;
    }
}
