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
import com.hellblazer.parallax.cache.CacheArray;
import com.hellblazer.parallax.engine.tree.KdTreeMidpointBuilder;
import com.hellblazer.parallax.engine.tree.NodeStatistic;
import com.hellblazer.parallax.engine.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Single process driver for monochromatic problems, where the query and reference sets are the same points: read the
 * data, build one tree over it and solve every point against it on the configured number of threads.
 *
 * @author hal.hildebrand
 */
public class MonochromaticDualTreeMain<P extends GnpParam<PT>, PT extends VectorPoint, S extends NodeStatistic<P, PT, S>, R, G extends GlobalResult<P, G>> {
    private static final Logger log = LoggerFactory.getLogger(MonochromaticDualTreeMain.class);

    private final DualTreeConfig                      config;
    private final Gnp<P, PT, S, R, G>                 gnp;
    private final Timers                              timers = new Timers();
    private       CacheArray<TreeNode<S>>             nodes;
    private       P                                   param;
    private       CacheArray<PT>                      points;
    private       CacheArray<R>                       results;
    private       ThreadedDualTreeSolver<P, PT, S, R, G> solver;

    public MonochromaticDualTreeMain(Gnp<P, PT, S, R, G> gnp, DualTreeConfig config) {
        this.gnp = Objects.requireNonNull(gnp, "Gnp cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    public G globalResult() {
        return solved().globalResult();
    }

    public CacheArray<TreeNode<S>> nodes() {
        solved();
        return nodes;
    }

    public P param() {
        solved();
        return param;
    }

    public CacheArray<PT> points() {
        solved();
        return points;
    }

    /**
     * One result per point, at the point's position in the (reordered) point array
     */
    public CacheArray<R> results() {
        solved();
        return results;
    }

    public void run() {
        run(new CsvDatasetLoader());
    }

    public void run(DataSource source) {
        Objects.requireNonNull(source, "Data source cannot be null");
        param = gnp.createParam(config);

        timers.start("read");
        var dataset = source.load(config);
        timers.stop("read");

        timers.start("copy");
        var defaultPoint = gnp.createPoint(dataset.dimension());
        param.bootstrapMonochromatic(defaultPoint, dataset.size());
        points = new CacheArray<>(gnp.pointSerializer(param));
        points.init(defaultPoint, dataset.size(), config.blockPoints());
        dataset.copyInto(points);
        timers.stop("copy");

        timers.start("tree");
        nodes = new CacheArray<>(gnp.nodeSerializer(param));
        nodes.init(gnp.createNode(dataset.dimension(), param), 0, config.blockNodes());
        KdTreeMidpointBuilder.build(config, param, points, nodes);
        timers.stop("tree");

        results = new CacheArray<>(gnp.resultSerializer(param));
        results.init(gnp.createResult(param), dataset.size(), points.blockElems());

        points.flushClear(BlockDevice.Mode.READ);
        nodes.flushClear(BlockDevice.Mode.READ);
        results.flushClear(BlockDevice.Mode.CREATE);

        timers.start("all_threads");
        solver = ThreadedDualTreeSolver.solve(gnp, config, param, points, nodes, points, nodes, results);
        timers.stop("all_threads");

        results.flushClear(BlockDevice.Mode.READ);
        log.info("{} over {} points: {} [{}]", gnp.name(), dataset.size(), solver.report(), timers);
    }

    public ThreadedDualTreeSolver<P, PT, S, R, G> solver() {
        return solved();
    }

    public Timers timers() {
        return timers;
    }

    private ThreadedDualTreeSolver<P, PT, S, R, G> solved() {
        if (solver == null) {
            throw new IllegalStateException("Not yet run");
        }
        return solver;
    }
}
