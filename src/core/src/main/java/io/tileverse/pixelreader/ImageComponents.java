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

import io.tileverse.pixelreader.decode.LevelShiftDecoder;
import io.tileverse.pixelreader.format.AlphaMode;
import io.tileverse.pixelreader.format.FormatDescriptor;
import io.tileverse.pixelreader.format.FormatResolver;
import java.io.IOException;
import java.util.Objects;

/**
 * All components of an image, decoded in one pass into their raw unsigned values.
 * <p>
 * This is the whole-image counterpart of {@link PixelReader}, for callers that need every sample at once and no
 * level shift, for example to compute statistics or to hand the planes to an encoder that shifts them itself.
 *
 * @param width the image width
 * @param height the image height
 * @param descriptor the layout the components were decoded with
 * @param components one row-major {@code int[width * height]} array per component
 */
public record ImageComponents(int width, int height, FormatDescriptor descriptor, int[][] components) {

    public ImageComponents {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(components, "components");
        if (components.length != descriptor.componentCount()) {
            throw new IllegalArgumentException(
                    "Expected " + descriptor.componentCount() + " components, got " + components.length);
        }
    }

    public int componentCount() {
        return components.length;
    }

    /**
     * @param component the component index
     * @return the samples of the component, not copied
     */
    public int[] component(int component) {
        if (component < 0 || component >= components.length) {
            throw new ComponentIndexOutOfRangeException(component, components.length);
        }
        return components[component];
    }

    /**
     * Decodes every component of a pixel source, honouring its alpha mode. The source is not closed.
     *
     * @param source the pixel source
     * @return the decoded components
     * @throws io.tileverse.pixelreader.format.UnsupportedFormatException if the pixel format cannot be decoded
     * @throws IOException if the source fails
     */
    public static ImageComponents extract(PixelSource source) throws IOException {
        return extract(source, source.getAlphaMode());
    }

    /**
     * Decodes every component of a pixel source, interpreting its alpha channel as {@code alphaMode}. The source is
     * not closed.
     *
     * @param source the pixel source
     * @param alphaMode the alpha mode to resolve the format with
     * @return the decoded components
     * @throws io.tileverse.pixelreader.format.UnsupportedFormatException if the pixel format cannot be decoded
     * @throws IOException if the source fails
     */
    public static ImageComponents extract(PixelSource source, AlphaMode alphaMode) throws IOException {
        Objects.requireNonNull(source, "source");
        FormatDescriptor descriptor = FormatResolver.resolve(source.getPixelFormat(), alphaMode);
        final int width = source.getWidth();
        final int height = source.getHeight();
        final int area = Math.multiplyExact(width, height);
        int[][] planes = new int[descriptor.componentCount()][area];
        if (area > 0) {
            new LevelShiftDecoder().decodeUnshifted(source, Region.of(0, 0, width, height), descriptor, planes);
        }
        return new ImageComponents(width, height, descriptor, planes);
    }
}
