/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Parallax.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.parallax.engine;

import com.hellblazer.parallax.cache.BlockDevice;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@Timeout(value = 30, unit = TimeUnit.SECONDS)
public class MonochromaticDualTreeMainTest {

    @Test
    void testAccessorsBeforeRun() {
        var main = new MonochromaticDualTreeMain<>(new RangeCountGnp(), DualTreeConfig.defaultConfig());
        assertThrows(IllegalStateException.class, main::results);
        assertThrows(IllegalStateException.class, main::globalResult);
    }

    @Test
    void testRun() {
        var dataset = TestTree.uniform(31L, 250, 3);
        var config = DualTreeConfig.builder()
                                   .withThreads(3)
                                   .withLeafSize(6)
                                   .withBlockPoints(32)
                                   .withParameter(RangeCountGnp.RADIUS, 2.0)
                                   .build();
        var main = new MonochromaticDualTreeMain<>(new RangeCountGnp(), config);
        main.run(c -> dataset);

        assertEquals(BlockDevice.Mode.READ, main.results().mode());
        assertEquals(250, main.globalResult().queries());
        assertEquals(9, main.solver().grainsSolved());
        assertEquals(250, main.results().size());
        long pairs = 0;
        for (int i = 0; i < main.results().size(); i++) {
            try (var result = main.results().read(i); var point = main.points().read(i)) {
                assertEquals(point.get().index(), result.get().queryIndex(), "results follow the point order");
                assertEquals(RangeCountGnp.expected(dataset, result.get().queryIndex(), 2.0),
                             result.get().neighbors());
                pairs += result.get().neighbors();
            }
        }
        assertEquals(pairs, main.globalResult().pairs());
        assertEquals(List.of("read", "copy", "tree", "all_threads"), List.copyOf(main.timers().elapsed().keySet()));
    }
}
