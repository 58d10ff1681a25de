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

import io.tileverse.pixelreader.format.AlphaMode;
import io.tileverse.pixelreader.format.PixelFormat;
import io.tileverse.pixelreader.raw.RawImage;
import io.tileverse.pixelreader.raw.RawImagePixelSource;

/**
 * Builders of small in-memory images for tests.
 */
public final class TestImages {

    private TestImages() {}

    /**
     * Creates an 8-bit RGB image with every pixel set to the same colour.
     */
    public static RawImagePixelSource solidRgb(int width, int height, int red, int green, int blue) {
        byte[] pixels = new byte[width * height * 3];
        for (int i = 0; i < width * height; i++) {
            pixels[i * 3] = (byte) red;
            pixels[i * 3 + 1] = (byte) green;
            pixels[i * 3 + 2] = (byte) blue;
        }
        return new RawImagePixelSource(RawImage.of(width, height, PixelFormat.RGB_888, AlphaMode.OPAQUE, pixels));
    }

    /**
     * Creates an 8-bit RGB image whose pixel at {@code (x, y)} is {@code (x, y, x + y * width)}, so every sample
     * identifies its position.
     */
    public static RawImagePixelSource coordinateRgb(int width, int height) {
        byte[] pixels = new byte[width * height * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = (y * width + x) * 3;
                pixels[i] = (byte) x;
                pixels[i + 1] = (byte) y;
                pixels[i + 2] = (byte) (x + y * width);
            }
        }
        return new RawImagePixelSource(RawImage.of(width, height, PixelFormat.RGB_888, AlphaMode.OPAQUE, pixels));
    }

    /**
     * Creates a gray image from unsigned sample values.
     */
    public static RawImagePixelSource gray(int width, int height, int... values) {
        byte[] pixels = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            pixels[i] = (byte) values[i];
        }
        return new RawImagePixelSource(RawImage.of(width, height, PixelFormat.GRAY_8, AlphaMode.OPAQUE, pixels));
    }

    /**
     * Creates an image from raw pixel bytes, given as ints for readability.
     */
    public static RawImagePixelSource raw(int width, int height, PixelFormat format, AlphaMode alphaMode, int... bytes) {
        byte[] pixels = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            pixels[i] = (byte) bytes[i];
        }
        return new RawImagePixelSource(RawImage.of(width, height, format, alphaMode, pixels));
    }
}
