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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class BlockDataSourcesTest {

    @Test
    void wrappingIsIdempotent() {
        BlockDataSource source = mock(BlockDataSource.class);
        BlockDataSource wrapped = BlockDataSources.synchronizedSource(source);

        assertThat(wrapped).isNotSameAs(source);
        assertThat(BlockDataSources.synchronizedSource(wrapped)).isSameAs(wrapped);
    }

    @Test
    void delegates() throws IOException {
        BlockDataSource source = mock(BlockDataSource.class);
        BlockDataSource wrapped = BlockDataSources.synchronizedSource(source);

        wrapped.getNominalRangeBits(2);
        wrapped.getCompData(1, Region.of(0, 0, 1, 1), null);
        wrapped.close();

        verify(source).getNominalRangeBits(2);
        verify(source).getCompData(1, Region.of(0, 0, 1, 1), null);
        verify(source).close();
    }

    @Test
    void concurrentCopyReads() throws Exception {
        final int size = 32;
        BlockDataSource shared = BlockDataSources.synchronizedSource(PixelReader.open(TestImages.coordinateRgb(size, size)));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                final int tile = t;
                results.add(executor.submit(() -> {
                    boolean ok = true;
                    for (int i = 0; i < 50; i++) {
                        int x = (tile * 4 + i) % (size - 4);
                        int y = (tile * 3 + i * 7) % (size - 4);
                        SampleBlock block = shared.getCompData(0, Region.of(x, y, 4, 4), null);
                        for (int row = 0; row < 4; row++) {
                            for (int col = 0; col < 4; col++) {
                                ok &= block.get(col, row) == x + col - 128;
                            }
                        }
                    }
                    return ok;
                }));
            }
            for (Future<Boolean> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            executor.shutdown();
            shared.close();
        }
    }
}
