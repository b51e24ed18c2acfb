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
import com.hellblazer.parallax.engine.tree.NodeStatistic;
import com.hellblazer.parallax.engine.tree.TreeNode;
import com.hellblazer.parallax.engine.work.SimpleWorkQueue;
import com.hellblazer.parallax.engine.work.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Solves the grains of a work queue on a pool of worker threads.
 *
 * <p>Each worker takes grains from the queue until it comes back empty, solving every grain with a fresh
 * {@link GrainSolver} and folding the grain's partial result into the global result. One lock guards both the queue
 * and the global result. The per grain solvers share the cache arrays, which are read only during the solve except
 * for the query results, written only at the positions of the grain's own points.
 *
 * <p>A failed grain is fatal: the remaining workers stop taking grains and, once every worker has stopped, the
 * failure is thrown as a {@link DualTreeException}.
 *
 * @author hal.hildebrand
 */
public class ThreadedDualTreeSolver<P extends GnpParam<PT>, PT extends VectorPoint, S extends NodeStatistic<P, PT, S>, R, G extends GlobalResult<P, G>> {
    private static final Logger log = LoggerFactory.getLogger(ThreadedDualTreeSolver.class);

    private final Gnp<P, PT, S, R, G> gnp;
    private final ReentrantLock       lock = new ReentrantLock();
    private       DualTreeException   failure;
    private volatile boolean          failed;
    private       G                   globalResult;
    private       int                 grainsSolved;
    private       Map<String, Object> report;

    public ThreadedDualTreeSolver(Gnp<P, PT, S, R, G> gnp) {
        this.gnp = Objects.requireNonNull(gnp, "Gnp cannot be null");
    }

    /**
     * Solve a monochromatic problem in this process: cut the query tree into the configured number of grains and
     * solve them on the configured number of threads.
     */
    public static <P extends GnpParam<PT>, PT extends VectorPoint, S extends NodeStatistic<P, PT, S>, R, G extends GlobalResult<P, G>> ThreadedDualTreeSolver<P, PT, S, R, G> solve(
    Gnp<P, PT, S, R, G> gnp, DualTreeConfig config, P param, CacheArray<PT> qPoints, CacheArray<TreeNode<S>> qNodes,
    CacheArray<PT> rPoints, CacheArray<TreeNode<S>> rNodes, CacheArray<R> qResults) {
        var threads = config.threads();
        var queue = new SimpleWorkQueue();
        queue.init(qNodes, config.effectiveGrains(threads, 1));
        log.info("n_grains_actual: {}", queue.nGrains());

        var solver = new ThreadedDualTreeSolver<>(gnp);
        solver.initSolve(new RunConfig(threads), queue, param, qPoints, qNodes, rPoints, rNodes, qResults);
        return solver;
    }

    /**
     * @return the accumulated result, available once {@link #initSolve} has returned
     */
    public G globalResult() {
        if (report == null) {
            throw new IllegalStateException("Solve has not completed");
        }
        return globalResult;
    }

    public int grainsSolved() {
        return grainsSolved;
    }

    /**
     * Run {@code runConfig.nThreads()} workers over the queue and return once all of them have finished. Every grain
     * solver is handed the same run config.
     *
     * @throws DualTreeException if any grain failed
     */
    public void initSolve(RunConfig runConfig, WorkQueue workQueue, P param, CacheArray<PT> qPoints,
                          CacheArray<TreeNode<S>> qNodes, CacheArray<PT> rPoints, CacheArray<TreeNode<S>> rNodes,
                          CacheArray<R> qResults) {
        Objects.requireNonNull(runConfig, "Run config cannot be null");
        Objects.requireNonNull(workQueue, "Work queue cannot be null");
        var nThreads = runConfig.nThreads();
        globalResult = gnp.createGlobalResult(param);
        grainsSolved = 0;
        failed = false;
        failure = null;
        report = null;

        var started = System.nanoTime();
        var threadIds = new AtomicInteger();
        var pool = Executors.newFixedThreadPool(nThreads, r -> new Thread(r, gnp.name() + "-worker-"
                                                                             + threadIds.incrementAndGet()));
        var workers = new ArrayList<Future<?>>(nThreads);
        try {
            for (int i = 0; i < nThreads; i++) {
                workers.add(pool.submit(
                () -> work(runConfig, workQueue, param, qPoints, qNodes, rPoints, rNodes, qResults)));
            }
            join(workers);
        } finally {
            pool.shutdown();
        }

        if (failure != null) {
            throw failure;
        }
        report = globalResult.report(param);
        log.info("Solved {} grains on {} threads in {}ms: {}", grainsSolved, nThreads,
                 (System.nanoTime() - started) / 1_000_000, report);
    }

    /**
     * The report of the global result, produced once when the solve completed
     */
    public Map<String, Object> report() {
        if (report == null) {
            throw new IllegalStateException("Solve has not completed");
        }
        return report;
    }

    private void fail(String context, Throwable cause) {
        lock.lock();
        try {
            failed = true;
            if (failure == null) {
                failure = new DualTreeException(context, cause);
            } else {
                failure.addSuppressed(cause);
            }
        } finally {
            lock.unlock();
        }
        log.error("{}: {}", context, cause.toString());
    }

    private void join(List<Future<?>> workers) {
        for (var worker : workers) {
            try {
                worker.get();
            } catch (ExecutionException e) {
                fail("Worker failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for workers", e);
                workers.forEach(w -> w.cancel(true));
                return;
            }
        }
    }

    private List<Integer> nextGrains(WorkQueue workQueue) {
        lock.lock();
        try {
            return workQueue.getWork();
        } finally {
            lock.unlock();
        }
    }

    private void work(RunConfig runConfig, WorkQueue workQueue, P param, CacheArray<PT> qPoints, CacheArray<TreeNode<S>> qNodes,
                      CacheArray<PT> rPoints, CacheArray<TreeNode<S>> rNodes, CacheArray<R> qResults) {
        while (!failed) {
            List<Integer> grains;
            try {
                grains = nextGrains(workQueue);
            } catch (RuntimeException e) {
                fail("Unable to take work", e);
                return;
            }
            if (grains.isEmpty()) {
                return;
            }
            for (var grain : grains) {
                if (failed) {
                    return;
                }
                var solver = gnp.createSolver();
                try {
                    solver.initSolve(runConfig, param, grain, qPoints, qNodes, rPoints, rNodes, qResults);
                } catch (RuntimeException e) {
                    fail("Grain " + grain + " failed", e);
                    return;
                }
                log.debug("Solved grain {}", grain);

                lock.lock();
                try {
                    globalResult.accumulate(param, solver.globalResult());
                    grainsSolved++;
                } finally {
                    lock.unlock();
                }
            }
        }
    }
}
