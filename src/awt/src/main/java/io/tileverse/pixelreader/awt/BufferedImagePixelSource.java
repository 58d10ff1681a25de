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
package io.tileverse.pixelreader.awt;

import io.tileverse.pixelreader.AbstractPixelSource;
import io.tileverse.pixelreader.PixelSource;
import io.tileverse.pixelreader.Region;
import io.tileverse.pixelreader.format.AlphaMode;
import io.tileverse.pixelreader.format.PixelFormat;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentSampleModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.awt.image.DataBufferInt;
import java.awt.image.DataBufferUShort;
import java.awt.image.Raster;
import java.awt.image.SampleModel;
import java.awt.image.SinglePixelPackedSampleModel;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.util.Arrays;
import java.util.Objects;

/**
 * A {@link PixelSource} over a {@link BufferedImage}.
 * <p>
 * The pixel format is derived from the image type. Pixels are copied straight out of the raster's data buffer,
 * following the sample model's pixel and scanline strides and the raster's translation, so no colour conversion
 * takes place. Packed {@code short} and {@code int} pixels are written as little-endian words, which makes e.g.
 * {@link BufferedImage#TYPE_INT_ARGB} pixels ({@code 0xAARRGGBB}) come out as {@link PixelFormat#BGRA_8888}.
 * <p>
 * Images whose type has no decodable counterpart report {@link PixelFormat#UNKNOWN} or the closest undecodable
 * format; {@link #toIntArgb(BufferedImage)} converts them to a supported layout.
 */
public class BufferedImagePixelSource extends AbstractPixelSource implements PixelSource {

    private final String identifier;
    private final int width;
    private final int height;
    private final PixelFormat format;
    private final AlphaMode alphaMode;
    private volatile BufferedImage image;

    public BufferedImagePixelSource(BufferedImage image) {
        this.image = Objects.requireNonNull(image, "Image cannot be null");
        this.width = image.getWidth();
        this.height = image.getHeight();
        this.format = pixelFormatOf(image);
        this.alphaMode = alphaModeOf(image.getColorModel());
        this.identifier = "awt:%dx%d-type%d@%x"
                .formatted(width, height, image.getType(), System.identityHashCode(image));
    }

    /**
     * Maps the layout of an image's raster to a {@link PixelFormat}.
     *
     * @param image the image
     * @return the pixel format of the image's data buffer, {@link PixelFormat#UNKNOWN} if it has no counterpart
     */
    public static PixelFormat pixelFormatOf(BufferedImage image) {
        return switch (image.getType()) {
            case BufferedImage.TYPE_BYTE_GRAY -> PixelFormat.GRAY_8;
            case BufferedImage.TYPE_USHORT_GRAY -> PixelFormat.GRAY_16;
            case BufferedImage.TYPE_BYTE_INDEXED -> PixelFormat.INDEXED_8;
            case BufferedImage.TYPE_BYTE_BINARY -> switch (image.getColorModel().getPixelSize()) {
                case 1 -> PixelFormat.INDEXED_1;
                case 2 -> PixelFormat.INDEXED_2;
                case 4 -> PixelFormat.INDEXED_4;
                default -> PixelFormat.UNKNOWN;
            };
            case BufferedImage.TYPE_3BYTE_BGR -> PixelFormat.BGR_888;
            case BufferedImage.TYPE_4BYTE_ABGR, BufferedImage.TYPE_4BYTE_ABGR_PRE -> PixelFormat.ABGR_8888;
            case BufferedImage.TYPE_INT_RGB -> PixelFormat.BGRX_8888;
            case BufferedImage.TYPE_INT_BGR -> PixelFormat.RGBX_8888;
            case BufferedImage.TYPE_INT_ARGB, BufferedImage.TYPE_INT_ARGB_PRE -> PixelFormat.BGRA_8888;
            case BufferedImage.TYPE_USHORT_565_RGB -> PixelFormat.RGB_565;
            case BufferedImage.TYPE_USHORT_555_RGB -> PixelFormat.RGB_555;
            default -> customPixelFormat(image);
        };
    }

    private static PixelFormat customPixelFormat(BufferedImage image) {
        final Raster raster = image.getRaster();
        final SampleModel sampleModel = raster.getSampleModel();
        final int dataType = sampleModel.getDataType();
        if (dataType == DataBuffer.TYPE_FLOAT || dataType == DataBuffer.TYPE_DOUBLE) {
            return PixelFormat.RGBA_F32;
        }
        if (!(sampleModel instanceof ComponentSampleModel csm) || !isSingleBank(csm)) {
            return PixelFormat.UNKNOWN;
        }
        final int bands = csm.getNumBands();
        if (csm.getPixelStride() != bands) {
            return PixelFormat.UNKNOWN;
        }
        final boolean alpha = image.getColorModel().hasAlpha();
        final int[] offsets = csm.getBandOffsets();
        final boolean ascending = Arrays.equals(offsets, sequence(bands, false));
        final boolean descending = Arrays.equals(offsets, sequence(bands, true));
        if (dataType == DataBuffer.TYPE_BYTE) {
            if (bands == 3 && !alpha) {
                return ascending ? PixelFormat.RGB_888 : descending ? PixelFormat.BGR_888 : PixelFormat.UNKNOWN;
            }
            if (bands == 4 && alpha) {
                return ascending ? PixelFormat.RGBA_8888 : descending ? PixelFormat.ABGR_8888 : PixelFormat.UNKNOWN;
            }
        } else if (dataType == DataBuffer.TYPE_USHORT) {
            if (bands == 3 && !alpha) {
                return ascending
                        ? PixelFormat.RGB_161616
                        : descending ? PixelFormat.BGR_161616 : PixelFormat.UNKNOWN;
            }
            if (bands == 4 && alpha && ascending) {
                return PixelFormat.RGBA_16161616;
            }
        }
        return PixelFormat.UNKNOWN;
    }

    private static int[] sequence(int length, boolean descending) {
        int[] values = new int[length];
        for (int i = 0; i < length; i++) {
            values[i] = descending ? length - 1 - i : i;
        }
        return values;
    }

    private static boolean isSingleBank(ComponentSampleModel sampleModel) {
        return Arrays.stream(sampleModel.getBankIndices()).allMatch(bank -> bank == 0);
    }

    /**
     * @param colorModel the image's colour model
     * @return {@link AlphaMode#OPAQUE} without alpha, otherwise premultiplied or unpremultiplied as declared
     */
    public static AlphaMode alphaModeOf(ColorModel colorModel) {
        if (!colorModel.hasAlpha()) {
            return AlphaMode.OPAQUE;
        }
        return colorModel.isAlphaPremultiplied() ? AlphaMode.PREMULTIPLIED : AlphaMode.UNPREMULTIPLIED;
    }

    /**
     * Draws an image into a new {@link BufferedImage#TYPE_INT_ARGB} image.
     *
     * @param image the image to convert
     * @return a new image with the same size and content
     */
    public static BufferedImage toIntArgb(BufferedImage image) {
        BufferedImage converted = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = converted.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return converted;
    }

    @Override
    protected int readPixelsNoFlip(Region region, ByteBuffer target) throws IOException {
        final BufferedImage current = image;
        if (current == null) {
            throw new ClosedChannelException();
        }
        final Raster raster = current.getRaster();
        final SampleModel sampleModel = raster.getSampleModel();
        final DataBuffer dataBuffer = raster.getDataBuffer();

        final int pixelStride;
        final int scanlineStride;
        final int elements;
        final int firstElement;
        if (sampleModel instanceof ComponentSampleModel csm && isSingleBank(csm)) {
            pixelStride = csm.getPixelStride();
            scanlineStride = csm.getScanlineStride();
            elements = csm.getNumBands();
            firstElement = Arrays.stream(csm.getBandOffsets()).min().orElse(0);
        } else if (sampleModel instanceof SinglePixelPackedSampleModel sppsm) {
            pixelStride = 1;
            scanlineStride = sppsm.getScanlineStride();
            elements = 1;
            firstElement = 0;
        } else {
            throw new IOException("Unsupported sample model " + sampleModel.getClass().getSimpleName() + " in "
                    + identifier);
        }

        final int sampleX = raster.getMinX() - raster.getSampleModelTranslateX() + region.x();
        final int sampleY = raster.getMinY() - raster.getSampleModelTranslateY() + region.y();
        final int base = dataBuffer.getOffset() + firstElement + sampleX * pixelStride;
        final int start = target.position();
        for (int row = 0; row < region.height(); row++) {
            final int index = base + (sampleY + row) * scanlineStride;
            if (dataBuffer instanceof DataBufferByte bytes) {
                copyRow(bytes.getData(), index, region.width(), pixelStride, elements, target);
            } else if (dataBuffer instanceof DataBufferUShort shorts) {
                copyRow(shorts.getData(), index, region.width(), pixelStride, elements, target);
            } else if (dataBuffer instanceof DataBufferInt ints) {
                copyRow(ints.getData(), index, region.width(), pixelStride, elements, target);
            } else {
                throw new IOException("Unsupported data buffer " + dataBuffer.getClass().getSimpleName() + " in "
                        + identifier);
            }
        }
        return target.position() - start;
    }

    private static void copyRow(byte[] data, int index, int pixels, int pixelStride, int elements, ByteBuffer target) {
        if (pixelStride == elements) {
            target.put(data, index, pixels * elements);
            return;
        }
        for (int i = 0; i < pixels; i++, index += pixelStride) {
            target.put(data, index, elements);
        }
    }

    private static void copyRow(short[] data, int index, int pixels, int pixelStride, int elements, ByteBuffer target) {
        for (int i = 0; i < pixels; i++, index += pixelStride) {
            for (int e = 0; e < elements; e++) {
                short value = data[index + e];
                target.put((byte) value);
                target.put((byte) (value >>> 8));
            }
        }
    }

    private static void copyRow(int[] data, int index, int pixels, int pixelStride, int elements, ByteBuffer target) {
        for (int i = 0; i < pixels; i++, index += pixelStride) {
            for (int e = 0; e < elements; e++) {
                int value = data[index + e];
                target.put((byte) value);
                target.put((byte) (value >>> 8));
                target.put((byte) (value >>> 16));
                target.put((byte) (value >>> 24));
            }
        }
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public PixelFormat getPixelFormat() {
        return format;
    }

    @Override
    public AlphaMode getAlphaMode() {
        return alphaMode;
    }

    @Override
    public String getSourceIdentifier() {
        return identifier;
    }

    /**
     * Releases the reference to the image. The image itself is left untouched.
     */
    @Override
    public void close() {
        image = null;
    }

    @Override
    public String toString() {
        return "BufferedImagePixelSource[" + identifier + ", " + format + "]";
    }
}
