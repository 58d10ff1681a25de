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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps a {@link PixelFormat} and {@link AlphaMode} to the {@link FormatDescriptor} decoders work from.
 * <p>
 * Resolution is a fixed per-format lookup: component counts and bit depths are never derived from the pixel
 * size, so packed formats such as {@link PixelFormat#RGB_565} report their unequal depths individually. The
 * lookup is an exhaustive {@code switch} without a default branch; a new {@link PixelFormat} constant does not
 * compile until it is handled here.
 * <p>
 * Channels that carry alpha are kept as the last component only when the alpha mode is
 * {@link AlphaMode#isTranslucent() translucent}; otherwise they are skipped like padding. Alpha-only formats
 * always keep their single channel.
 * <p>
 * Resolved descriptors are memoized; this class is thread-safe.
 */
public final class FormatResolver {

    private static final ConcurrentMap<Key, FormatDescriptor> RESOLVED = new ConcurrentHashMap<>();

    private FormatResolver() {
        // utility class
    }

    private record Key(PixelFormat format, AlphaMode alphaMode) {}

    /**
     * Resolves the layout of a pixel format.
     *
     * @param format the source pixel format
     * @param alphaMode how the source interprets its alpha channel, if any
     * @return the descriptor of the format's components
     * @throws UnsupportedFormatException if the format is unknown, floating point, or packs several pixels per byte
     * @throws NullPointerException if any argument is {@code null}
     */
    public static FormatDescriptor resolve(PixelFormat format, AlphaMode alphaMode) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(alphaMode, "alphaMode");
        return RESOLVED.computeIfAbsent(new Key(format, alphaMode), key -> compute(format, alphaMode));
    }

    /**
     * Checks whether a format can be decoded, without throwing.
     *
     * @param format the pixel format
     * @return {@code true} if {@link #resolve} succeeds for this format
     */
    public static boolean isSupported(PixelFormat format) {
        try {
            resolve(format, AlphaMode.UNPREMULTIPLIED);
            return true;
        } catch (UnsupportedFormatException e) {
            return false;
        }
    }

    private static FormatDescriptor compute(PixelFormat format, AlphaMode alphaMode) {
        return switch (format) {
            case GRAY_8 -> layout(format, alphaMode, ChannelOrder.GRAY_ONLY, 8);
            case GRAY_16 -> layout(format, alphaMode, ChannelOrder.GRAY_ONLY, 16);
            case ALPHA_8 -> layout(format, alphaMode, ChannelOrder.ALPHA_ONLY, 8);
            case ALPHA_16 -> layout(format, alphaMode, ChannelOrder.ALPHA_ONLY, 16);
            case INDEXED_8 -> layout(format, alphaMode, ChannelOrder.INDEX_ONLY, 8);
            case GRAY_ALPHA_88 -> layout(format, alphaMode, ChannelOrder.GRAY_ALPHA, 8, 8);
            case RG_88 -> layout(format, alphaMode, ChannelOrder.RG, 8, 8);
            case RG_1616 -> layout(format, alphaMode, ChannelOrder.RG, 16, 16);
            case RGB_888 -> layout(format, alphaMode, ChannelOrder.RGB, 8, 8, 8);
            case BGR_888 -> layout(format, alphaMode, ChannelOrder.BGR, 8, 8, 8);
            case RGBX_8888 -> layout(format, alphaMode, ChannelOrder.RGBX, 8, 8, 8, 8);
            case BGRX_8888 -> layout(format, alphaMode, ChannelOrder.BGRX, 8, 8, 8, 8);
            case RGBA_8888 -> layout(format, alphaMode, ChannelOrder.RGBA, 8, 8, 8, 8);
            case BGRA_8888 -> layout(format, alphaMode, ChannelOrder.BGRA, 8, 8, 8, 8);
            case ARGB_8888 -> layout(format, alphaMode, ChannelOrder.ARGB, 8, 8, 8, 8);
            case ABGR_8888 -> layout(format, alphaMode, ChannelOrder.ABGR, 8, 8, 8, 8);
            // red in the high bits: 0bRRRRRGGGGGGBBBBB
            case RGB_565 -> layout(format, alphaMode, ChannelOrder.BGR, 5, 6, 5);
            // 0bXRRRRRGGGGGBBBBB
            case RGB_555 -> layout(format, alphaMode, ChannelOrder.BGRX, 5, 5, 5, 1);
            // 0bARRRRRGGGGGBBBBB
            case ARGB_1555 -> layout(format, alphaMode, ChannelOrder.BGRA, 5, 5, 5, 1);
            // 0xARGB nibbles
            case ARGB_4444 -> layout(format, alphaMode, ChannelOrder.BGRA, 4, 4, 4, 4);
            case RGBA_1010102 -> layout(format, alphaMode, ChannelOrder.RGBA, 10, 10, 10, 2);
            case BGRA_1010102 -> layout(format, alphaMode, ChannelOrder.BGRA, 10, 10, 10, 2);
            case RGB_101010X -> layout(format, alphaMode, ChannelOrder.RGBX, 10, 10, 10, 2);
            case BGR_101010X -> layout(format, alphaMode, ChannelOrder.BGRX, 10, 10, 10, 2);
            case RGB_161616 -> layout(format, alphaMode, ChannelOrder.RGB, 16, 16, 16);
            case BGR_161616 -> layout(format, alphaMode, ChannelOrder.BGR, 16, 16, 16);
            case RGBA_16161616 -> layout(format, alphaMode, ChannelOrder.RGBA, 16, 16, 16, 16);
            case INDEXED_1, INDEXED_2, INDEXED_4 -> throw new UnsupportedFormatException(
                    format, "sub-byte packed pixels are not supported");
            case RGBA_F16, RGBA_F16_CLAMPED, RGBA_F32, RG_F16, ALPHA_F16 -> throw new UnsupportedFormatException(
                    format, "floating point channels are not supported");
            case UNKNOWN -> throw new UnsupportedFormatException(
                    format, "pixel layout is unknown, number of components cannot be determined");
        };
    }

    private static FormatDescriptor layout(
            PixelFormat format, AlphaMode alphaMode, ChannelOrder order, int... channelBits) {
        if (channelBits.length != order.channelCount()) {
            throw new IllegalStateException("Channel layout of " + format + " does not match " + order);
        }
        final boolean keepAlpha = order.isAlphaOnly() || alphaMode.isTranslucent();

        List<int[]> kept = new ArrayList<>(); // {storage channel, bit offset, bits}
        int offset = 0;
        for (int i = 0; i < channelBits.length; i++) {
            ChannelRole role = order.roles().get(i);
            boolean isComponent = role != ChannelRole.PADDING && (role != ChannelRole.ALPHA || keepAlpha);
            if (isComponent) {
                kept.add(new int[] {i, offset, channelBits[i]});
            }
            offset += channelBits[i];
        }
        if (offset > format.bitsPerPixel()) {
            throw new IllegalStateException("Channel layout of " + format + " exceeds its pixel size");
        }
        kept.sort(Comparator.comparingInt(
                channel -> order.roles().get(channel[0]).ordinal()));

        final int count = kept.size();
        int[] bits = new int[count];
        int[] storage = new int[count];
        int[] offsets = new int[count];
        boolean alphaPresent = false;
        for (int c = 0; c < count; c++) {
            int[] channel = kept.get(c);
            storage[c] = channel[0];
            offsets[c] = channel[1];
            bits[c] = channel[2];
            alphaPresent |= order.roles().get(channel[0]) == ChannelRole.ALPHA;
        }
        return new FormatDescriptor(format, order, alphaPresent, bits, storage, offsets);
    }
}
