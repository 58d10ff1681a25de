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

import static io.tileverse.pixelreader.format.ChannelRole.ALPHA;
import static io.tileverse.pixelreader.format.ChannelRole.BLUE;
import static io.tileverse.pixelreader.format.ChannelRole.GRAY;
import static io.tileverse.pixelreader.format.ChannelRole.GREEN;
import static io.tileverse.pixelreader.format.ChannelRole.INDEX;
import static io.tileverse.pixelreader.format.ChannelRole.PADDING;
import static io.tileverse.pixelreader.format.ChannelRole.RED;

import java.util.List;

/**
 * Storage order of the channels inside a pixel word, from the least significant bits upwards.
 * <p>
 * For byte-aligned formats this is plain memory order. Decoders use it to map stored channels onto
 * logical components, which are always ordered red, green, blue (or gray, or index) and then alpha.
 */
public enum ChannelOrder {
    GRAY_ONLY(GRAY),
    INDEX_ONLY(INDEX),
    ALPHA_ONLY(ALPHA),
    GRAY_ALPHA(GRAY, ALPHA),
    RG(RED, GREEN),
    RGB(RED, GREEN, BLUE),
    BGR(BLUE, GREEN, RED),
    RGBX(RED, GREEN, BLUE, PADDING),
    BGRX(BLUE, GREEN, RED, PADDING),
    RGBA(RED, GREEN, BLUE, ALPHA),
    BGRA(BLUE, GREEN, RED, ALPHA),
    ARGB(ALPHA, RED, GREEN, BLUE),
    ABGR(ALPHA, BLUE, GREEN, RED);

    private final List<ChannelRole> roles;

    ChannelOrder(ChannelRole... roles) {
        this.roles = List.of(roles);
    }

    /**
     * @return the stored channels, least significant first
     */
    public List<ChannelRole> roles() {
        return roles;
    }

    public int channelCount() {
        return roles.size();
    }

    public boolean hasAlpha() {
        return roles.contains(ALPHA);
    }

    /**
     * @return {@code true} if the order holds nothing but an alpha channel
     */
    public boolean isAlphaOnly() {
        return this == ALPHA_ONLY;
    }
}
