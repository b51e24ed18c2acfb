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

import com.hellblazer.parallax.cache.CacheArray;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class DatasetTest {

    @Test
    void testCopyIntoAssignsIndices() {
        var dataset = Dataset.of(3.0, 1.0, 2.0);
        var points = new CacheArray<>(RangeCountGnp.Point.serializer(1));
        points.init(new RangeCountGnp.Point(1), dataset.size(), 2);

        dataset.copyInto(points);
        for (int i = 0; i < dataset.size(); i++) {
            try (var point = points.read(i)) {
                assertEquals(i, point.get().index());
                assertEquals(dataset.point(i)[0], point.get().vec().getElement(0));
            }
        }
    }

    @Test
    void testCopyIntoTooSmallArray() {
        var points = new CacheArray<>(RangeCountGnp.Point.serializer(1));
        points.init(new RangeCountGnp.Point(1), 1, 2);
        assertThrows(IllegalArgumentException.class, () -> Dataset.of(1.0, 2.0).copyInto(points));
    }

    @Test
    void testDefensiveCopies() {
        var source = new ArrayList<double[]>();
        source.add(new double[] { 1.0, 2.0 });
        var dataset = new Dataset(2, source);

        source.get(0)[0] = 99.0;
        dataset.point(0)[1] = 99.0;
        assertArrayEquals(new double[] { 1.0, 2.0 }, dataset.point(0));
    }

    @Test
    void testDimensionMismatch() {
        assertThrows(IllegalArgumentException.class, () -> new Dataset(2, List.of(new double[] { 1.0 })));
        assertThrows(IllegalArgumentException.class, () -> new Dataset(0, List.of()));
    }
}
