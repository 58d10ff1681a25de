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
package io.tileverse.pixelreader.raw;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tileverse.pixelreader.InvalidRegionException;
import io.tileverse.pixelreader.Region;
import io.tileverse.pixelreader.format.AlphaMode;
import io.tileverse.pixelreader.format.PixelFormat;
import io.tileverse.pixelreader.format.UnsupportedFormatException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import java.nio.channels.ClosedChannelException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RawImagePixelSourceTest {

    // 3x2 GRAY_16 image with two bytes of padding per row
    private static final byte[] PADDED = {
        1, 0, 2, 0, 3, 0, -1, -1,
        4, 0, 5, 0, 6, 0, -1, -1
    };

    private RawImagePixelSource source;

    @BeforeEach
    void setUp() {
        source = new RawImagePixelSource(new RawImage(3, 2, PixelFormat.GRAY_16, AlphaMode.OPAQUE, PADDED, 8));
    }

    @Test
    void readsTightlyPackedRows() throws IOException {
        ByteBuffer pixels = source.readPixels(Region.of(1, 0, 2, 2));

        assertThat(pixels.position()).isZero();
        assertThat(pixels.remaining()).isEqualTo(8);
        byte[] bytes = new byte[8];
        pixels.get(bytes);
        assertThat(bytes).containsExactly(2, 0, 3, 0, 5, 0, 6, 0);
    }

    @Test
    void writesAtTheTargetPosition() throws IOException {
        ByteBuffer target = ByteBuffer.allocate(10);
        target.position(2);

        int read = source.readPixels(Region.of(2, 1, 1, 1), target);

        assertThat(read).isEqualTo(2);
        assertThat(target.position()).isEqualTo(4);
        assertThat(target.get(2)).isEqualTo((byte) 6);
    }

    @Test
    void argumentsAreChecked() {
        assertThatThrownBy(() -> source.readPixels(null, ByteBuffer.allocate(8)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> source.readPixels(Region.of(0, 0, 1, 1), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> source.readPixels(
                        Region.of(0, 0, 1, 1), ByteBuffer.allocate(8).asReadOnlyBuffer()))
                .isInstanceOf(ReadOnlyBufferException.class);
        assertThatThrownBy(() -> source.readPixels(Region.of(2, 0, 2, 1), ByteBuffer.allocate(8)))
                .isInstanceOf(InvalidRegionException.class);
        assertThatThrownBy(() -> source.readPixels(Region.of(0, 0, 0, 1), ByteBuffer.allocate(8)))
                .isInstanceOf(InvalidRegionException.class);
        assertThatThrownBy(() -> source.readPixels(Region.of(0, 0, 3, 1), ByteBuffer.allocate(5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("insufficient");
    }

    @Test
    void readingAfterCloseFails() throws IOException {
        assertThat(source.isOpen()).isTrue();
        source.close();
        assertThat(source.isOpen()).isFalse();

        assertThatThrownBy(() -> source.readPixels(Region.of(0, 0, 1, 1)))
                .isInstanceOf(ClosedChannelException.class);
    }

    @Test
    void identifier() {
        assertThat(source.getSourceIdentifier()).isEqualTo("raw:3x2-GRAY_16");
        assertThat(new RawImagePixelSource(RawImage.of(1, 1, PixelFormat.GRAY_8, AlphaMode.OPAQUE, new byte[1]), "tile")
                        .getSourceIdentifier())
                .isEqualTo("raw:tile");
    }

    @Test
    void rawImageValidation() {
        assertThatThrownBy(() -> new RawImage(3, 2, PixelFormat.GRAY_16, AlphaMode.OPAQUE, new byte[16], 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scanlineStride");
        assertThatThrownBy(() -> new RawImage(3, 2, PixelFormat.GRAY_16, AlphaMode.OPAQUE, new byte[13], 8))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too small");
        assertThatThrownBy(() -> RawImage.of(8, 1, PixelFormat.INDEXED_1, AlphaMode.OPAQUE, new byte[1]))
                .isInstanceOf(UnsupportedFormatException.class);

        // the last row needs no padding
        assertThat(new RawImage(3, 2, PixelFormat.GRAY_16, AlphaMode.OPAQUE, new byte[14], 8).rowLength())
                .isEqualTo(6);
    }
}
