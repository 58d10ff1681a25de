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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RegionTest {

    @Test
    void negativeSizesAreRejected() {
        assertThatThrownBy(() -> Region.of(0, 0, -1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("width");
        assertThatThrownBy(() -> Region.of(0, 0, 1, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("height");
    }

    @Test
    void edgesAndArea() {
        Region region = Region.of(2, 3, 4, 5);
        assertThat(region.right()).isEqualTo(6);
        assertThat(region.bottom()).isEqualTo(8);
        assertThat(region.area()).isEqualTo(20);
        assertThat(region.isEmpty()).isFalse();
        assertThat(Region.of(2, 3, 0, 5).isEmpty()).isTrue();
    }

    @Test
    void edgesDoNotOverflow() {
        Region region = Region.of(Integer.MAX_VALUE, 0, 10, 1);
        assertThat(region.right()).isEqualTo(Integer.MAX_VALUE + 10L);
        assertThat(region.isWithin(Integer.MAX_VALUE, 1)).isFalse();
        assertThatThrownBy(() -> Region.of(0, 0, 65536, 65536).area()).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void contains() {
        Region window = Region.of(4, 4, 8, 8);
        assertThat(window.contains(window)).isTrue();
        assertThat(window.contains(Region.of(4, 4, 1, 1))).isTrue();
        assertThat(window.contains(Region.of(11, 11, 1, 1))).isTrue();
        assertThat(window.contains(Region.of(11, 11, 2, 1))).isFalse();
        assertThat(window.contains(Region.of(3, 4, 2, 2))).isFalse();
        assertThat(window.contains(Region.of(4, 3, 2, 2))).isFalse();
    }

    @Test
    void isWithin() {
        assertThat(Region.of(0, 0, 4, 4).isWithin(4, 4)).isTrue();
        assertThat(Region.of(3, 3, 1, 1).isWithin(4, 4)).isTrue();
        assertThat(Region.of(3, 3, 2, 1).isWithin(4, 4)).isFalse();
        assertThat(Region.of(-1, 0, 1, 1).isWithin(4, 4)).isFalse();
        assertThat(Region.of(0, -1, 1, 1).isWithin(4, 4)).isFalse();
    }
}
