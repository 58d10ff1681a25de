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

import static java.util.Objects.requireNonNull;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Settings used to open a {@link io.tileverse.pixelreader.PixelReader} through a {@link PixelReaderProvider}: an
 * optional provider id, forcing the choice of provider, and raw values for {@link PixelReaderParameter}s.
 * <p>
 * Values are kept as given and converted when a provider {@link #get(PixelReaderParameter) asks} for them, so a
 * configuration read from {@link Properties} holds strings until then.
 */
public class PixelReaderConfig {

    /** Property key of the provider id. */
    public static final String PROVIDER_ID_KEY = "io.tileverse.pixelreader.provider";

    /**
     * Id of the provider to use instead of the ones that {@link PixelReaderProvider#canProcess(Object) can process}
     * the image. Setting it is the same as calling {@link #providerId(String)}.
     */
    public static final PixelReaderParameter<String> FORCE_PROVIDER_ID = PixelReaderParameter.text(
            PROVIDER_ID_KEY,
            PixelReaderParameter.GROUP_PROVIDER,
            "Pixel reader provider",
            "Identifier of the provider to use, overriding automatic selection");

    private final Map<String, Object> values = new TreeMap<>();

    public Optional<String> providerId() {
        return get(FORCE_PROVIDER_ID);
    }

    public PixelReaderConfig providerId(String providerId) {
        return set(PROVIDER_ID_KEY, providerId);
    }

    /**
     * Sets the raw value of a key, or removes it if {@code value} is {@code null}. Keys no provider knows are kept
     * and ignored.
     *
     * @param key the property key
     * @param value the value, converted on access
     * @return this configuration
     */
    public PixelReaderConfig set(String key, Object value) {
        requireNonNull(key, "key");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        return this;
    }

    public <T> PixelReaderConfig set(PixelReaderParameter<T> parameter, T value) {
        return set(parameter.key(), value);
    }

    /**
     * Returns the value of a parameter, or its default value if none is set.
     *
     * @param parameter the parameter
     * @return the converted value, empty if neither a value nor a default exists
     * @throws IllegalArgumentException if the value cannot be converted to the parameter's type
     */
    public <T> Optional<T> get(PixelReaderParameter<T> parameter) {
        Object value = values.get(parameter.key());
        if (value == null) {
            return Optional.ofNullable(parameter.defaultValue());
        }
        return Optional.of(parameter.parse(value));
    }

    /**
     * @param key the property key
     * @return the value exactly as it was set
     */
    public Optional<Object> getRaw(String key) {
        return Optional.ofNullable(values.get(requireNonNull(key, "key")));
    }

    public Properties toProperties() {
        Properties properties = new Properties();
        values.forEach((key, value) -> properties.setProperty(key, String.valueOf(value)));
        return properties;
    }

    public static PixelReaderConfig fromProperties(Properties properties) {
        requireNonNull(properties, "properties");
        PixelReaderConfig config = new PixelReaderConfig();
        properties.stringPropertyNames().forEach(key -> config.set(key, properties.getProperty(key)));
        return config;
    }

    /**
     * Creates a configuration holding the default value of each parameter that has one.
     *
     * @param parameters the parameters
     * @return a new configuration
     */
    public static PixelReaderConfig defaultsOf(Collection<PixelReaderParameter<?>> parameters) {
        PixelReaderConfig config = new PixelReaderConfig();
        parameters.forEach(parameter -> config.set(parameter.key(), parameter.defaultValue()));
        return config;
    }

    @Override
    public String toString() {
        return "PixelReaderConfig" + values;
    }
}
