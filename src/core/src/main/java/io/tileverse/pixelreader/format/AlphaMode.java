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
 * How a source interprets the alpha channel of its pixel format, if it has one.
 * <p>
 * Only {@link #PREMULTIPLIED} and {@link #UNPREMULTIPLIED} keep the alpha channel as a component; an
 * {@link #OPAQUE} or {@link #UNKNOWN} source is read as if the alpha channel were padding.
 */
public enum AlphaMode {
    UNKNOWN,
    OPAQUE,
    PREMULTIPLIED,
    UNPREMULTIPLIED;

    /**
     * @return {@code true} if alpha values carry information and must be exposed as a component
     */
    public boolean isTranslucent() {
        return this == PREMULTIPLIED || this == UNPREMULTIPLIED;
    }
}
