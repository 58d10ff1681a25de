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
package io.tileverse.pixelreader.decode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import io.tileverse.pixelreader.PixelSource;
import io.tileverse.pixelreader.Region;
import io.tileverse.pixelreader.TestImages;
import io.tileverse.pixelreader.format.AlphaMode;
import io.tileverse.pixelreader.format.FormatDescriptor;
import io.tileverse.pixelreader.format.FormatResolver;
import io.tileverse.pixelreader.format.PixelFormat;
import io.tileverse.pixelreader.io.ByteBufferPool;
import java.io.IOException;
import java.nio.ByteBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LevelShiftDecoderTest {

    @Mock
    private PixelSource failingSource;

    private ByteBufferPool pool;
    private LevelShiftDecoder decoder;

    @BeforeEach
    void setUp() {
        pool = new ByteBufferPool(2, 1024);
        decoder = new LevelShiftDecoder(pool);
    }

    private static FormatDescriptor descriptor(PixelSource source) {
        return FormatResolver.resolve(source.getPixelFormat(), source.getAlphaMode());
    }

    private static int[][] planes(FormatDescriptor descriptor, int area) {
        return new int[descriptor.componentCount()][area];
    }

    @Test
    void gray8IsShiftedBy128() throws IOException {
        PixelSource source = TestImages.gray(2, 2, 0, 128, 255, 10);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 4);

        decoder.decode(source, Region.of(0, 0, 2, 2), descriptor, planes);

        assertThat(planes[0]).containsExactly(-128, 0, 127, -118);
    }

    @Test
    void everyGray8ValueIsShiftedBy128() throws IOException {
        int[] values = new int[256];
        for (int raw = 0; raw < 256; raw++) {
            values[raw] = raw;
        }
        PixelSource source = TestImages.gray(16, 16, values);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 256);

        decoder.decode(source, Region.of(0, 0, 16, 16), descriptor, planes);

        for (int raw = 0; raw < 256; raw++) {
            assertThat(planes[0][raw]).as("raw %d", raw).isEqualTo(raw - 128);
        }
    }

    @Test
    void every565FieldValueIsShiftedByHalfItsRange() throws IOException {
        // pixel i holds red i % 32, green i, blue 31 - i % 32
        int[] bytes = new int[64 * 2];
        for (int i = 0; i < 64; i++) {
            int word = (i % 32) << 11 | i << 5 | (31 - i % 32);
            bytes[i * 2] = word & 0xFF;
            bytes[i * 2 + 1] = word >>> 8;
        }
        PixelSource source = TestImages.raw(64, 1, PixelFormat.RGB_565, AlphaMode.OPAQUE, bytes);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 64);

        decoder.decode(source, Region.of(0, 0, 64, 1), descriptor, planes);

        for (int i = 0; i < 64; i++) {
            assertThat(planes[0][i]).as("red %d", i % 32).isEqualTo(i % 32 - 16);
            assertThat(planes[1][i]).as("green %d", i).isEqualTo(i - 32);
            assertThat(planes[2][i]).as("blue %d", 31 - i % 32).isEqualTo(31 - i % 32 - 16);
        }
    }

    @Test
    void subRegionIsStoredRowMajorFromZero() throws IOException {
        PixelSource source = TestImages.gray(3, 3, 0, 1, 2, 3, 4, 5, 6, 7, 8);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 4);

        decoder.decode(source, Region.of(1, 1, 2, 2), descriptor, planes);

        assertThat(planes[0]).containsExactly(4 - 128, 5 - 128, 7 - 128, 8 - 128);
    }

    @Test
    void bgraComponentsAreInLogicalOrder() throws IOException {
        PixelSource source = TestImages.raw(1, 1, PixelFormat.BGRA_8888, AlphaMode.UNPREMULTIPLIED, 1, 2, 3, 4);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 1);

        decoder.decode(source, Region.of(0, 0, 1, 1), descriptor, planes);

        assertThat(planes[0]).containsExactly(3 - 128);
        assertThat(planes[1]).containsExactly(2 - 128);
        assertThat(planes[2]).containsExactly(1 - 128);
        assertThat(planes[3]).containsExactly(4 - 128);
    }

    @Test
    void rgb565BitFields() throws IOException {
        // pure red 0xF800 and pure green 0x07E0, little endian
        PixelSource source = TestImages.raw(2, 1, PixelFormat.RGB_565, AlphaMode.OPAQUE, 0x00, 0xF8, 0xE0, 0x07);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 2);

        decoder.decode(source, Region.of(0, 0, 2, 1), descriptor, planes);

        assertThat(planes[0]).containsExactly(31 - 16, 0 - 16);
        assertThat(planes[1]).containsExactly(0 - 32, 63 - 32);
        assertThat(planes[2]).containsExactly(0 - 16, 0 - 16);
    }

    @Test
    void gray16UsesLittleEndianWords() throws IOException {
        PixelSource source = TestImages.raw(1, 1, PixelFormat.GRAY_16, AlphaMode.OPAQUE, 0x34, 0x12);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 1);

        decoder.decode(source, Region.of(0, 0, 1, 1), descriptor, planes);

        assertThat(planes[0]).containsExactly(0x1234 - 32768);
    }

    @Test
    void tenBitChannelsWithTwoBitAlpha() throws IOException {
        // R=1023, G=0, B=512, A=3 -> 0xE00003FF
        PixelSource source =
                TestImages.raw(1, 1, PixelFormat.RGBA_1010102, AlphaMode.UNPREMULTIPLIED, 0xFF, 0x03, 0x00, 0xE0);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 1);

        decoder.decode(source, Region.of(0, 0, 1, 1), descriptor, planes);

        assertThat(planes[0]).containsExactly(511);
        assertThat(planes[1]).containsExactly(-512);
        assertThat(planes[2]).containsExactly(0);
        assertThat(planes[3]).containsExactly(1);
    }

    @Test
    void unshiftedDecodeKeepsRawValues() throws IOException {
        PixelSource source = TestImages.raw(1, 1, PixelFormat.BGR_888, AlphaMode.OPAQUE, 7, 8, 9);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 1);

        decoder.decodeUnshifted(source, Region.of(0, 0, 1, 1), descriptor, planes);

        assertThat(planes[0]).containsExactly(9);
        assertThat(planes[1]).containsExactly(8);
        assertThat(planes[2]).containsExactly(7);
    }

    @Test
    void shortReadFailsAndReturnsTheBuffer() throws IOException {
        when(failingSource.readPixels(any(Region.class), any(ByteBuffer.class))).thenReturn(2);
        when(failingSource.getSourceIdentifier()).thenReturn("short");
        FormatDescriptor descriptor = FormatResolver.resolve(PixelFormat.GRAY_8, AlphaMode.OPAQUE);

        assertThatThrownBy(() -> decoder.decode(failingSource, Region.of(0, 0, 2, 2), descriptor, planes(descriptor, 4)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Short read from short");

        assertThat(pool.getStatistics().currentBuffers()).isEqualTo(1);
    }

    @Test
    void sourceFailurePropagatesAndReturnsTheBuffer() throws IOException {
        when(failingSource.readPixels(any(Region.class), any(ByteBuffer.class)))
                .thenThrow(new IOException("device gone"));
        FormatDescriptor descriptor = FormatResolver.resolve(PixelFormat.GRAY_8, AlphaMode.OPAQUE);

        assertThatThrownBy(() -> decoder.decode(failingSource, Region.of(0, 0, 2, 2), descriptor, planes(descriptor, 4)))
                .isInstanceOf(IOException.class)
                .hasMessage("device gone");

        assertThat(pool.getStatistics().currentBuffers()).isEqualTo(1);
    }

    @Test
    void planesMustHoldTheRegion() {
        PixelSource source = TestImages.solidRgb(2, 2, 1, 2, 3);
        FormatDescriptor descriptor = descriptor(source);

        assertThatThrownBy(() -> decoder.decode(source, Region.of(0, 0, 2, 2), descriptor, new int[3][3]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> decoder.decode(source, Region.of(0, 0, 2, 2), descriptor, new int[2][4]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void planesMayBeLargerThanTheRegion() throws IOException {
        PixelSource source = TestImages.solidRgb(2, 2, 10, 20, 30);
        FormatDescriptor descriptor = descriptor(source);
        int[][] planes = planes(descriptor, 10);

        decoder.decode(source, Region.of(0, 0, 1, 2), descriptor, planes);

        assertThat(planes[1]).startsWith(-108, -108).endsWith(0, 0);
    }
}
