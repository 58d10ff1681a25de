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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.tileverse.pixelreader.PixelReader;
import io.tileverse.pixelreader.PixelReaderFactory;
import io.tileverse.pixelreader.Region;
import io.tileverse.pixelreader.format.UnsupportedFormatException;
import io.tileverse.pixelreader.spi.AbstractPixelReaderProvider;
import io.tileverse.pixelreader.spi.PixelReaderConfig;
import io.tileverse.pixelreader.spi.PixelReaderProvider;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class BufferedImagePixelSourceProviderTest {

    private final BufferedImagePixelSourceProvider provider = new BufferedImagePixelSourceProvider();

    @Test
    void testDiscoveredByServiceLoader() {
        assertThat(PixelReaderProvider.getProviders())
                .extracting(PixelReaderProvider::getId)
                .contains(BufferedImagePixelSourceProvider.ID, "raw");
        assertThat(PixelReaderProvider.findProvider("AWT")).isPresent();
    }

    @Test
    void testParameters() {
        assertThat(provider.getParameters())
                .containsExactly(
                        AbstractPixelReaderProvider.IGNORE_ALPHA, BufferedImagePixelSourceProvider.CONVERT_UNSUPPORTED);
        PixelReaderConfig defaults = provider.getDefaultConfig();
        assertThat(defaults.get(BufferedImagePixelSourceProvider.CONVERT_UNSUPPORTED))
                .contains(false);
        assertThat(defaults.get(AbstractPixelReaderProvider.IGNORE_ALPHA))
                .contains(false);
    }

    @Test
    void testCanProcess() {
        assertThat(provider.canProcess(new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB))).isTrue();
        assertThat(provider.canProcess("image.png")).isFalse();
        assertThat(provider.canProcess(null)).isFalse();
        assertThatThrownBy(() -> provider.create("image.png")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFactorySelectsAwtProvider() throws IOException {
        BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(2, 1, 0xFF204060);

        try (PixelReader reader = PixelReaderFactory.create(image)) {
            assertThat(reader.getSourceIdentifier()).startsWith("awt:3x2-");
            assertEquals(4, reader.getComponentCount());
            assertEquals(0x60 - 128, reader.getInternalCompData(2, Region.of(2, 1, 1, 1)).get(0, 0));
        }
    }

    @Test
    void testIgnoreAlpha() throws IOException {
        BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        Properties properties = new Properties();
        properties.setProperty("io.tileverse.pixelreader.alpha.ignore", "true");

        try (PixelReader reader = PixelReaderFactory.create(image, properties)) {
            assertEquals(3, reader.getComponentCount());
        }
    }

    @Test
    void testConvertUnsupported() throws IOException {
        BufferedImage binary = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_BINARY);
        binary.getRaster().setSample(1, 0, 0, 1);

        assertThatThrownBy(() -> provider.create(binary)).isInstanceOf(UnsupportedFormatException.class);

        PixelReaderConfig config = provider.getDefaultConfig();
        config.set(BufferedImagePixelSourceProvider.CONVERT_UNSUPPORTED, true);
        try (PixelReader reader = provider.create(binary, config)) {
            assertEquals(4, reader.getComponentCount());
            assertEquals(-128, reader.getInternalCompData(0, Region.of(0, 0, 1, 1)).get(0, 0));
            assertEquals(127, reader.getInternalCompData(0, Region.of(1, 0, 1, 1)).get(0, 0));
            assertEquals(127, reader.getInternalCompData(3, Region.of(0, 0, 1, 1)).get(0, 0));
        }
    }

    @Test
    void testSupportedImagesAreNotConverted() throws IOException {
        PixelReaderConfig config = new PixelReaderConfig()
                .set(BufferedImagePixelSourceProvider.CONVERT_UNSUPPORTED, true);
        BufferedImage gray = new BufferedImage(1, 1, BufferedImage.TYPE_BYTE_GRAY);

        try (PixelReader reader = provider.create(gray, config)) {
            assertEquals(1, reader.getComponentCount());
            assertThat(reader.getSourceIdentifier())
                    .startsWith("awt:1x1-type" + BufferedImage.TYPE_BYTE_GRAY + "@");
        }
    }
}
