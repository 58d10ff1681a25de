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

import java.util.Set;

/**
 * A named, typed setting understood by one or more {@link PixelReaderProvider}s.
 * <p>
 * Values arrive untyped, usually as strings from {@link java.util.Properties} or environment-style configuration;
 * {@link #parse(Object)} turns them into the parameter's type. Only {@code Boolean}, {@code Integer} and
 * {@code String} parameters exist.
 *
 * @param <T> the value type
 * @param key the property key
 * @param group the area the parameter belongs to, e.g. {@link #GROUP_DECODING}
 * @param title a short human-readable name
 * @param description what the parameter changes
 * @param type the value type
 * @param defaultValue the value used when none is configured, may be {@code null}
 */
public record PixelReaderParameter<T>(
        String key, String group, String title, String description, Class<T> type, T defaultValue) {

    /** Group of the parameters that change how pixels are decoded into components. */
    public static final String GROUP_DECODING = "decoding";

    /** Group of the parameters that change how a provider is selected. */
    public static final String GROUP_PROVIDER = "provider";

    private static final Set<Class<?>> VALUE_TYPES = Set.of(Boolean.class, Integer.class, String.class);

    public PixelReaderParameter {
        requireNonNull(key, "key");
        requireNonNull(group, "group");
        requireNonNull(title, "title");
        requireNonNull(description, "description");
        requireNonNull(type, "type");
        if (!VALUE_TYPES.contains(type)) {
            throw new IllegalArgumentException("Unsupported type for parameter " + key + ": " + type.getName());
        }
        if (defaultValue != null && !type.isInstance(defaultValue)) {
            throw new IllegalArgumentException(
                    "Default value of " + key + " is not a " + type.getSimpleName() + ": " + defaultValue);
        }
    }

    /**
     * Creates an on/off parameter.
     */
    public static PixelReaderParameter<Boolean> flag(
            String key, String group, String title, String description, boolean defaultValue) {
        return new PixelReaderParameter<>(key, group, title, description, Boolean.class, defaultValue);
    }

    /**
     * Creates an integer parameter.
     */
    public static PixelReaderParameter<Integer> integer(
            String key, String group, String title, String description, int defaultValue) {
        return new PixelReaderParameter<>(key, group, title, description, Integer.class, defaultValue);
    }

    /**
     * Creates a string parameter without default value.
     */
    public static PixelReaderParameter<String> text(String key, String group, String title, String description) {
        return new PixelReaderParameter<>(key, group, title, description, String.class, null);
    }

    /**
     * Converts a configured value to this parameter's type.
     * <p>
     * Values of the right type are returned as is; anything else is converted from its string form, trimmed for
     * flags and integers. A flag is {@code true} only for {@code "true"}, ignoring case.
     *
     * @param value the configured value, not {@code null}
     * @return the typed value
     * @throws IllegalArgumentException if an integer parameter gets a value that is not a number
     */
    public T parse(Object value) {
        requireNonNull(value, "value");
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        final String text = String.valueOf(value);
        if (type == String.class) {
            return type.cast(text);
        }
        if (type == Boolean.class) {
            return type.cast(Boolean.valueOf(text.trim()));
        }
        try {
            return type.cast(Integer.valueOf(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + key + " expects an integer, got '" + text + "'", e);
        }
    }
}
