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
package com.hellblazer.parallax.engine.distributed;

import com.hellblazer.parallax.cache.BlockDevice;
import com.hellblazer.parallax.engine.*;
import com.hellblazer.parallax.engine.rpc.Channels;
import com.hellblazer.parallax.engine.rpc.DistributedCacheArray;
import com.hellblazer.parallax.engine.rpc.Rpc;
import com.hellblazer.parallax.engine.tree.KdTreeMidpointBuilder;
import com.hellblazer.parallax.engine.tree.NodeStatistic;
import com.hellblazer.parallax.engine.tree.TreeNode;
import com.hellblazer.parallax.engine.work.LockedWorkQueue;
import com.hellblazer.parallax.engine.work.RemoteWorkQueue;
import com.hellblazer.parallax.engine.work.SimpleWorkQueue;
import com.hellblazer.parallax.engine.work.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Runs a monochromatic problem across the ranks of an {@link Rpc} context, one runner per rank.
 *
 * <p>Rank {@value Rpc#MASTER_RANK} is the master: it reads the data, builds the tree and publishes the run
 * configuration, the parameters, a work queue and the point, node and result arrays on their {@link Channels}. Every
 * rank, the master included, then solves grains taken from the master's queue and writes its results into the
 * master's result array. Ranks synchronize only at the barrier ending each {@link Phase}.
 *
 * @author hal.hildebrand
 */
public class RpcMonochromaticDualTreeRunner<P extends GnpParam<PT>, PT extends VectorPoint, S extends NodeStatistic<P, PT, S>, R, G extends GlobalResult<P, G>> {
    private static final Logger log = LoggerFactory.getLogger(RpcMonochromaticDualTreeRunner.class);

    private final DualTreeConfig                          baseConfig;
    private final DataSource                              dataSource;
    private final Gnp<P, PT, S, R, G>                     gnp;
    private final PhaseListener                           listener;
    private final Rpc                                     rpc;
    private final Timers                                  timers         = new Timers();
    private       DualTreeConfig                          config;
    private       int                                     nGrainsActual  = -1;
    private       DistributedCacheArray<TreeNode<S>>      nodes;
    private       P                                       param;
    private volatile Phase                                phase          = Phase.PREINIT;
    private       DistributedCacheArray<PT>               points;
    private       DistributedCacheArray<R>                results;
    private       RunConfig                               runConfig;
    private       ThreadedDualTreeSolver<P, PT, S, R, G>  solver;
    private       WorkQueue                               workQueue;

    public RpcMonochromaticDualTreeRunner(Gnp<P, PT, S, R, G> gnp, DualTreeConfig config, Rpc rpc,
                                          DataSource dataSource) {
        this(gnp, config, rpc, dataSource, PhaseListener.NONE);
    }

    public RpcMonochromaticDualTreeRunner(Gnp<P, PT, S, R, G> gnp, DualTreeConfig config, Rpc rpc,
                                          DataSource dataSource, PhaseListener listener) {
        this.gnp = Objects.requireNonNull(gnp, "Gnp cannot be null");
        this.baseConfig = Objects.requireNonNull(config, "Config cannot be null");
        this.rpc = Objects.requireNonNull(rpc, "Rpc cannot be null");
        this.dataSource = Objects.requireNonNull(dataSource, "Data source cannot be null");
        this.listener = Objects.requireNonNull(listener, "Listener cannot be null");
    }

    /**
     * The configuration in effect on this rank, its {@code rank<N>} scope for ranks other than the master
     */
    public DualTreeConfig config() {
        return config == null ? baseConfig : config;
    }

    /**
     * This rank's share of the global result, available once the compute phase has completed
     */
    public G globalResult() {
        if (solver == null) {
            throw new IllegalStateException("Compute phase has not started, rank " + rpc.rank() + " is in " + phase);
        }
        return solver.globalResult();
    }

    /**
     * The number of grains the master cut the tree into, empty on other ranks
     */
    public OptionalInt nGrainsActual() {
        return nGrainsActual < 0 ? OptionalInt.empty() : OptionalInt.of(nGrainsActual);
    }

    public DistributedCacheArray<TreeNode<S>> nodes() {
        return nodes;
    }

    public P param() {
        return param;
    }

    /**
     * The phase this rank is in
     */
    public Phase phase() {
        return phase;
    }

    public DistributedCacheArray<PT> points() {
        return points;
    }

    public int rank() {
        return rpc.rank();
    }

    /**
     * One result per point, at the point's position in the master's point array
     */
    public DistributedCacheArray<R> results() {
        return results;
    }

    /**
     * Run every phase, returning when all ranks are done
     *
     * @throws DualTreeException if the run failed on this rank
     */
    public void run() {
        try {
            preinit();
            configure();
            flushData();
            compute();
            flushResults();
            phase = Phase.DONE;
            rpc.done();
            log.info("Rank {} finished: {}", rpc.rank(), timers);
        } catch (RuntimeException e) {
            log.error("Rank {} failed in {}", rpc.rank(), phase, e);
            rpc.close();
            throw e;
        }
    }

    public RunConfig runConfig() {
        return runConfig;
    }

    public Timers timers() {
        return timers;
    }

    private void complete(Phase completed) {
        rpc.barrier(Channels.BARRIER + completed.barrierOffset());
        listener.phaseCompleted(this, completed);
    }

    private void compute() {
        phase = Phase.COMPUTE;
        timers.start("all_machines");
        solver = new ThreadedDualTreeSolver<>(gnp);
        solver.initSolve(runConfig, workQueue, param, points, nodes, points, nodes, results);
        complete(Phase.COMPUTE);
        timers.stop("all_machines");
    }

    private void configure() {
        phase = Phase.CONFIGURE;
        timers.start("configure");
        if (rpc.isMaster()) {
            configureMaster();
        } else {
            configureWorker();
        }
        complete(Phase.CONFIGURE);
        timers.stop("configure");
    }

    private void configureMaster() {
        param = gnp.createParam(config);

        timers.start("read");
        var dataset = dataSource.load(config);
        timers.stop("read");

        timers.start("copy");
        var defaultPoint = gnp.createPoint(dataset.dimension());
        param.bootstrapMonochromatic(defaultPoint, dataset.size());
        points = new DistributedCacheArray<>(gnp.pointSerializer(param));
        points.configure(rpc, Channels.DATA_POINTS);
        points.initMaster(defaultPoint, dataset.size(), config.blockPoints());
        dataset.copyInto(points);
        timers.stop("copy");

        timers.start("tree");
        nodes = new DistributedCacheArray<>(gnp.nodeSerializer(param));
        nodes.configure(rpc, Channels.DATA_NODES);
        nodes.initMaster(gnp.createNode(dataset.dimension(), param), 0, config.blockNodes());
        KdTreeMidpointBuilder.build(config, param, points, nodes);
        timers.stop("tree");

        results = new DistributedCacheArray<>(gnp.resultSerializer(param));
        results.configure(rpc, Channels.Q_RESULTS);
        results.initMaster(gnp.createResult(param), dataset.size(), points.blockElems());

        runConfig = new RunConfig(config.threads());
        rpc.registerData(Channels.CONFIG, RunConfig.SERIALIZER, runConfig);
        rpc.registerData(Channels.PARAM, gnp.paramSerializer(), param);

        var queue = new SimpleWorkQueue();
        queue.init(nodes, config.effectiveGrains(runConfig.nThreads(), rpc.nRanks()));
        nGrainsActual = queue.nGrains();
        log.info("n_grains_actual: {}", nGrainsActual);
        workQueue = new LockedWorkQueue(queue);
        rpc.registerWork(Channels.WORK, workQueue);

        points.fixBoundaries();
        nodes.fixBoundaries();
        results.fixBoundaries();
        log.info("Master published {} points, {} nodes for {} ranks", points.size(), nodes.size(), rpc.nRanks());
    }

    private void configureWorker() {
        runConfig = rpc.getRemoteData(Channels.CONFIG, Rpc.MASTER_RANK, RunConfig.SERIALIZER);
        param = rpc.getRemoteData(Channels.PARAM, Rpc.MASTER_RANK, gnp.paramSerializer());

        points = new DistributedCacheArray<>(gnp.pointSerializer(param));
        points.configure(rpc, Channels.DATA_POINTS);
        points.initWorker();
        nodes = new DistributedCacheArray<>(gnp.nodeSerializer(param));
        nodes.configure(rpc, Channels.DATA_NODES);
        nodes.initWorker();
        results = new DistributedCacheArray<>(gnp.resultSerializer(param));
        results.configure(rpc, Channels.Q_RESULTS);
        results.initWorker();

        workQueue = new RemoteWorkQueue(rpc, Channels.WORK, Rpc.MASTER_RANK);
        log.info("Rank {} attached with {} threads", rpc.rank(), runConfig.nThreads());
    }

    private void flushData() {
        phase = Phase.FLUSH_DATA;
        timers.start("flush_data");
        points.flushClear(BlockDevice.Mode.READ);
        nodes.flushClear(BlockDevice.Mode.READ);
        results.flushClear(BlockDevice.Mode.CREATE);
        complete(Phase.FLUSH_DATA);
        timers.stop("flush_data");
    }

    private void flushResults() {
        phase = Phase.FLUSH_RESULTS;
        timers.start("flush_results");
        results.flushClear(BlockDevice.Mode.READ);
        complete(Phase.FLUSH_RESULTS);
        timers.stop("flush_results");
    }

    private void preinit() {
        phase = Phase.PREINIT;
        config = rpc.isMaster() ? baseConfig : baseConfig.scoped("rank" + rpc.rank());
        try {
            rpc.start();
        } catch (IOException e) {
            throw new DualTreeException("Unable to start RPC on rank " + rpc.rank(), e);
        }
    }
}
