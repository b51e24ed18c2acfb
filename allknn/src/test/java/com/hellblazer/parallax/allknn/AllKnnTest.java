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
package com.hellblazer.parallax.allknn;

import com.hellblazer.parallax.cache.CacheArray;
import com.hellblazer.parallax.engine.Dataset;
import com.hellblazer.parallax.engine.DualTreeConfig;
import com.hellblazer.parallax.engine.MonochromaticDualTreeMain;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@Timeout(value = 60, unit = TimeUnit.SECONDS)
public class AllKnnTest {

    static final double[]  FIXTURE   = { 0.05, 0.35, 0.15, 1.25, 5.05, -0.20, -2.00, -1.30, 0.45, 0.90, 1.00 };
    static final int[][]   NEIGHBORS = { { 2, 5, 1, 8, 9, 10, 3, 7, 6, 4 },
                                         { 8, 2, 0, 9, 5, 10, 3, 7, 6, 4 },
                                         { 0, 1, 8, 5, 9, 10, 3, 7, 6, 4 },
                                         { 10, 9, 8, 1, 2, 0, 5, 7, 6, 4 },
                                         { 3, 10, 9, 8, 1, 2, 0, 5, 7, 6 },
                                         { 0, 2, 1, 8, 9, 7, 10, 3, 6, 4 },
                                         { 7, 5, 0, 2, 1, 8, 9, 10, 3, 4 },
                                         { 6, 5, 0, 2, 1, 8, 9, 10, 3, 4 },
                                         { 1, 2, 0, 9, 10, 5, 3, 7, 6, 4 },
                                         { 10, 3, 8, 1, 2, 0, 5, 7, 6, 4 },
                                         { 9, 3, 8, 1, 2, 0, 5, 7, 6, 4 } };

    static Dataset uniform(long seed, int count, int dimension) {
        var random = new Random(seed);
        var points = new ArrayList<double[]>(count);
        for (int i = 0; i < count; i++) {
            var point = new double[dimension];
            for (int d = 0; d < dimension; d++) {
                point[d] = random.nextInt(1000) / 10.0;
            }
            points.add(point);
        }
        return new Dataset(dimension, points);
    }

    /**
     * Results of an array, indexed by query point index
     */
    static KnnResult[] byQuery(CacheArray<KnnResult> results) {
        var byQuery = new KnnResult[results.size()];
        for (int i = 0; i < results.size(); i++) {
            try (var result = results.read(i)) {
                var query = result.get().queryIndex();
                assertNull(byQuery[query], "query " + query + " answered twice");
                byQuery[query] = result.get();
            }
        }
        return byQuery;
    }

    static void assertSameNeighbors(KnnResult[] expected, KnnResult[] actual) {
        assertEquals(expected.length, actual.length);
        for (int q = 0; q < expected.length; q++) {
            assertNotNull(actual[q], "query " + q + " not answered");
            assertArrayEquals(expected[q].neighbors(), actual[q].neighbors(), "neighbors of " + q);
            for (int i = 0; i < expected[q].k(); i++) {
                assertEquals(expected[q].distance(i), actual[q].distance(i), "distance " + i + " of " + q);
            }
        }
    }

    static DualTreeConfig config(int k, int threads, int leafSize) {
        return DualTreeConfig.builder()
                             .withThreads(threads)
                             .withLeafSize(leafSize)
                             .withBlockPoints(16)
                             .withBlockNodes(8)
                             .withParameter(AllKnnGnp.K, k)
                             .build();
    }

    @Test
    void testFixture() {
        for (var threads : new int[] { 1, 3 }) {
            var main = new MonochromaticDualTreeMain<>(new AllKnnGnp(), config(10, threads, 2));
            main.run(c -> Dataset.of(FIXTURE));

            var results = byQuery(main.results());
            for (int q = 0; q < FIXTURE.length; q++) {
                assertArrayEquals(NEIGHBORS[q], results[q].neighbors(), "neighbors of " + q);
                for (int i = 0; i < 10; i++) {
                    var delta = FIXTURE[q] - FIXTURE[NEIGHBORS[q][i]];
                    assertEquals(delta * delta, results[q].distance(i), "distance " + i + " of " + q);
                }
            }
            assertEquals(11, main.globalResult().nQueries());
        }
    }

    @Test
    void testFixtureDistances() {
        var main = new MonochromaticDualTreeMain<>(new AllKnnGnp(), config(10, 1, 20));
        main.run(c -> Dataset.of(FIXTURE));
        var first = byQuery(main.results())[0];

        assertEquals(0.10 * 0.10, first.distance(0), 1e-15);
        assertEquals(0.25 * 0.25, first.distance(1), 1e-15);
        assertEquals(5.00 * 5.00, first.kthDistance(), 1e-12);
    }

    @Test
    void testKTooLarge() {
        var main = new MonochromaticDualTreeMain<>(new AllKnnGnp(), config(11, 1, 2));
        assertThrows(IllegalArgumentException.class, () -> main.run(c -> Dataset.of(FIXTURE)));
    }

    @Test
    void testMatchesBruteForceOnAnyThreadCount() {
        var dataset = uniform(0xC0FFEEL, 700, 3);
        var expected = NaiveAllKnn.solve(dataset, 5);
        KnnGlobalResult global = null;
        for (var threads : new int[] { 1, 2, 8 }) {
            var main = new MonochromaticDualTreeMain<>(new AllKnnGnp(), config(5, threads, 6));
            main.run(c -> dataset);

            assertSameNeighbors(expected, byQuery(main.results()));
            if (global == null) {
                global = main.globalResult();
            } else {
                assertEquals(global, main.globalResult(), "global result on " + threads + " threads");
            }
        }
    }

    @Test
    void testTreeStatistics() {
        var dataset = uniform(77L, 200, 2);
        var main = new MonochromaticDualTreeMain<>(new AllKnnGnp(), config(1, 1, 4));
        main.run(c -> dataset);

        double sumX = 0.0;
        for (var p : dataset.points()) {
            sumX += p[0];
        }
        try (var root = main.nodes().read(0)) {
            assertEquals(200, root.get().stat().count());
            assertEquals(sumX / 200, root.get().stat().centroid(0), 1e-9);
        }
    }
}
