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
import com.hellblazer.parallax.engine.distributed.Phase;
import com.hellblazer.parallax.engine.distributed.PhaseListener;
import com.hellblazer.parallax.engine.distributed.RpcMonochromaticDualTreeRunner;
import com.hellblazer.parallax.engine.rpc.InProcessRankDirectory;
import com.hellblazer.parallax.engine.rpc.Rpc;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.hellblazer.parallax.allknn.AllKnnTest.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * All k-NN across ranks of one JVM, connected by the in-process transport
 *
 * @author hal.hildebrand
 */
@Timeout(value = 60, unit = TimeUnit.SECONDS)
public class AllKnnDistributedTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void testFixtureOnTwoRanks() throws Exception {
        var runners = run(2, config(10, 2, 2), Dataset.of(FIXTURE), (runner, phase) -> {
        });
        var results = byQuery(runners.get(0).results());
        for (int q = 0; q < FIXTURE.length; q++) {
            assertArrayEquals(NEIGHBORS[q], results[q].neighbors(), "neighbors of " + q);
        }
    }

    @Test
    void testMatchesBruteForceOnOneTwoAndFourRanks() throws Exception {
        var dataset = uniform(0xBEEFL, 500, 2);
        var expected = NaiveAllKnn.solve(dataset, 4);
        var expectedGlobal = new KnnGlobalResult();
        expectedGlobal.init(new KnnParam(4));
        for (var result : expected) {
            expectedGlobal.add(result);
        }

        for (var nRanks : new int[] { 1, 2, 4 }) {
            // workers check the shared result array once every rank has flushed its results
            var seen = new ConcurrentHashMap<Integer, Boolean>();
            PhaseListener check = (runner, phase) -> {
                if (phase == Phase.FLUSH_RESULTS) {
                    @SuppressWarnings("unchecked")
                    var results = (CacheArray<KnnResult>) runner.results();
                    assertSameNeighbors(expected, byQuery(results));
                    seen.put(runner.rank(), true);
                }
            };
            var runners = run(nRanks, config(4, 2, 5), dataset, check);
            assertEquals(nRanks, seen.size(), "every rank saw the complete results");

            var global = new KnnGlobalResult();
            global.init(new KnnParam(4));
            for (var runner : runners) {
                global.accumulate(null, runner.globalResult());
            }
            assertEquals(expectedGlobal, global, "global result on " + nRanks + " ranks");
        }
    }

    private List<RpcMonochromaticDualTreeRunner<KnnParam, KnnPoint, KnnStat, KnnResult, KnnGlobalResult>> run(
    int nRanks, DualTreeConfig config, Dataset dataset, PhaseListener listener) throws Exception {
        var directory = new InProcessRankDirectory("allknn-" + UUID.randomUUID(), nRanks);
        var runners = new ArrayList<RpcMonochromaticDualTreeRunner<KnnParam, KnnPoint, KnnStat, KnnResult, KnnGlobalResult>>();
        var futures = new ArrayList<Future<?>>();
        for (int rank = 0; rank < nRanks; rank++) {
            var runner = new RpcMonochromaticDualTreeRunner<>(new AllKnnGnp(), config, new Rpc(directory, rank, null),
                                                              c -> dataset, listener);
            runners.add(runner);
            futures.add(pool.submit(runner::run));
        }
        for (var future : futures) {
            future.get();
        }
        return runners;
    }
}
