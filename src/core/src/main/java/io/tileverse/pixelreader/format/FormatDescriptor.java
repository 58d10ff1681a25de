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

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable description of how the components of a {@link PixelFormat} are laid out and what range they have.
 * <p>
 * Components are indexed in logical order (red, green, blue or gray, then alpha). For each component the
 * descriptor records its nominal bit depth, its signedness (always unsigned for source pixels) and where its
 * bits live inside the little-endian pixel word, so a decoder never has to guess the layout from buffer sizes.
 * <p>
 * Instances are created by {@link FormatResolver}.
 */
public final class FormatDescriptor {

    private final PixelFormat format;
    private final ChannelOrder channelOrder;
    private final boolean alphaPresent;
    private final int[] bitsPerComponent;
    private final boolean[] signed;
    private final int[] storageChannel;
    private final int[] bitOffset;
    private final boolean byteAligned;

    FormatDescriptor(
            PixelFormat format,
            ChannelOrder channelOrder,
            boolean alphaPresent,
            int[] bitsPerComponent,
            int[] storageChannel,
            int[] bitOffset) {
        this.format = Objects.requireNonNull(format, "format");
        this.channelOrder = Objects.requireNonNull(channelOrder, "channelOrder");
        this.alphaPresent = alphaPresent;
        this.bitsPerComponent = bitsPerComponent.clone();
        this.storageChannel = storageChannel.clone();
        this.bitOffset = bitOffset.clone();
        this.signed = new boolean[bitsPerComponent.length];

        final int count = bitsPerComponent.length;
        if (count == 0) {
            throw new IllegalArgumentException("A pixel format must have at least one component: " + format);
        }
        if (storageChannel.length != count || bitOffset.length != count) {
            throw new IllegalArgumentException("Component layout arrays differ in length for " + format);
        }
        boolean aligned = true;
        for (int c = 0; c < count; c++) {
            aligned &= bitsPerComponent[c] == 8 && bitOffset[c] % 8 == 0;
        }
        this.byteAligned = aligned;
    }

    public PixelFormat format() {
        return format;
    }

    /**
     * @return the storage order of the channels this descriptor maps components from
     */
    public ChannelOrder channelOrder() {
        return channelOrder;
    }

    public int componentCount() {
        return bitsPerComponent.length;
    }

    public int bytesPerPixel() {
        return format.bytesPerPixel();
    }

    /**
     * @return {@code true} if the last component is an alpha channel carrying real values
     */
    public boolean alphaPresent() {
        return alphaPresent;
    }

    /**
     * Returns the nominal dynamic range of a component, in bits.
     *
     * @param component the component index
     * @return the number of bits of the unsigned sample values
     */
    public int bitsPerComponent(int component) {
        return bitsPerComponent[component];
    }

    /**
     * @return a copy of the per-component bit depths
     */
    public int[] bitsPerComponent() {
        return bitsPerComponent.clone();
    }

    public boolean signed(int component) {
        return signed[component];
    }

    /**
     * @param component the component index
     * @return the index, in {@link #channelOrder()}, of the stored channel the component is read from
     */
    public int storageChannel(int component) {
        return storageChannel[component];
    }

    /**
     * @param component the component index
     * @return the position of the component's least significant bit inside the little-endian pixel word
     */
    public int bitOffset(int component) {
        return bitOffset[component];
    }

    /**
     * @return {@code true} if every component is a full byte, allowing byte-indexed decoding
     */
    public boolean isByteAligned() {
        return byteAligned;
    }

    /**
     * @param component the component index
     * @return the amount subtracted from raw samples of the component to center them on zero
     */
    public int levelShift(int component) {
        return 1 << (bitsPerComponent[component] - 1);
    }

    @Override
    public String toString() {
        return "FormatDescriptor[format=%s, order=%s, components=%d, bits=%s, alpha=%s]"
                .formatted(
                        format, channelOrder, componentCount(), Arrays.toString(bitsPerComponent), alphaPresent);
    }
}
