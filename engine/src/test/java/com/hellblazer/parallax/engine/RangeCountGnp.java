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
import com.hellblazer.parallax.cache.RecordSerializer;
import com.hellblazer.parallax.engine.tree.NodeStatistic;
import com.hellblazer.parallax.engine.tree.TreeNode;
import com.hellblazer.parallax.geometry.HRect;

import javax.vecmath.GVector;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;

/**
 * Test problem: for every point, count the other points within {@code radius}. Grains are solved by brute force,
 * which keeps the drivers under test independent of any pruning logic.
 *
 * @author hal.hildebrand
 */
public class RangeCountGnp implements Gnp<RangeCountGnp.Param, RangeCountGnp.Point, RangeCountGnp.Stat, RangeCountGnp.Result, RangeCountGnp.Total> {
    public static final String RADIUS = "radius";

    private final IntPredicate   failOn;
    private final Set<RunConfig> runConfigs    = ConcurrentHashMap.newKeySet();
    private final Set<String>    solverThreads = ConcurrentHashMap.newKeySet();

    public RangeCountGnp() {
        this(grain -> false);
    }

    /**
     * @param failOn grains whose solve throws
     */
    public RangeCountGnp(IntPredicate failOn) {
        this.failOn = failOn;
    }

    /**
     * Brute force count for one point of a data set
     */
    public static int expected(Dataset dataset, int index, double radius) {
        var count = 0;
        var p = dataset.point(index);
        for (int j = 0; j < dataset.size(); j++) {
            if (j != index && distanceSq(p, dataset.point(j)) <= radius * radius) {
                count++;
            }
        }
        return count;
    }

    private static double distanceSq(double[] a, double[] b) {
        double sum = 0.0;
        for (int d = 0; d < a.length; d++) {
            var delta = a[d] - b[d];
            sum += delta * delta;
        }
        return sum;
    }

    @Override
    public Param createParam(DualTreeConfig config) {
        return new Param(config.doubleParameter(RADIUS, 1.0));
    }

    @Override
    public Point createPoint(int dimension) {
        return new Point(dimension);
    }

    @Override
    public Result createResult(Param param) {
        return new Result(-1, -1);
    }

    @Override
    public GrainSolver<Param, Point, Stat, Result, Total> createSolver() {
        return new Solver();
    }

    @Override
    public Stat createStat(Param param) {
        return new Stat(param.dimension());
    }

    @Override
    public String name() {
        return "rangecount";
    }

    @Override
    public Total newGlobalResult() {
        return new Total();
    }

    @Override
    public RecordSerializer<Param> paramSerializer() {
        return Param.SERIALIZER;
    }

    @Override
    public RecordSerializer<Point> pointSerializer(Param param) {
        return Point.serializer(param.dimension());
    }

    @Override
    public RecordSerializer<Result> resultSerializer(Param param) {
        return Result.SERIALIZER;
    }

    /**
     * The run configs the grain solvers were handed
     */
    public Set<RunConfig> runConfigs() {
        return runConfigs;
    }

    /**
     * Names of the threads that solved at least one grain
     */
    public Set<String> solverThreads() {
        return solverThreads;
    }

    @Override
    public RecordSerializer<Stat> statSerializer(Param param) {
        return Stat.serializer(param.dimension());
    }

    public static final class Param implements GnpParam<Point> {
        static final RecordSerializer<Param> SERIALIZER = new RecordSerializer<>() {
            @Override
            public Param deserialize(ByteBuffer buffer) {
                var param = new Param(buffer.getDouble());
                param.dimension = buffer.getInt();
                param.count = buffer.getInt();
                return param;
            }

            @Override
            public int recordSize() {
                return Double.BYTES + 2 * Integer.BYTES;
            }

            @Override
            public void serialize(Param record, ByteBuffer buffer) {
                buffer.putDouble(record.radius).putInt(record.dimension).putInt(record.count);
            }
        };

        private final double radius;
        private       int    count;
        private       int    dimension;

        public Param(double radius) {
            this.radius = radius;
        }

        @Override
        public void bootstrapMonochromatic(Point defaultPoint, int count) {
            this.dimension = defaultPoint.vec().getSize();
            this.count = count;
        }

        public int count() {
            return count;
        }

        @Override
        public int dimension() {
            return dimension;
        }

        public double radius() {
            return radius;
        }
    }

    public static final class Point implements VectorPoint {
        private final GVector vec;
        private       int     index = -1;

        public Point(int dimension) {
            vec = new GVector(dimension);
        }

        static RecordSerializer<Point> serializer(int dimension) {
            return new RecordSerializer<>() {
                @Override
                public Point deserialize(ByteBuffer buffer) {
                    var point = new Point(dimension);
                    point.index = buffer.getInt();
                    for (int d = 0; d < dimension; d++) {
                        point.vec.setElement(d, buffer.getDouble());
                    }
                    return point;
                }

                @Override
                public int recordSize() {
                    return Integer.BYTES + dimension * Double.BYTES;
                }

                @Override
                public void serialize(Point record, ByteBuffer buffer) {
                    buffer.putInt(record.index);
                    for (int d = 0; d < dimension; d++) {
                        buffer.putDouble(record.vec.getElement(d));
                    }
                }
            };
        }

        @Override
        public int index() {
            return index;
        }

        @Override
        public void setIndex(int index) {
            this.index = index;
        }

        @Override
        public GVector vec() {
            return vec;
        }
    }

    /**
     * Population, coordinate sums and the number of postprocess calls since the last reset
     */
    public static final class Stat implements NodeStatistic<Param, Point, Stat> {
        private final double[] sum;
        private       int      count;
        private       int      postprocessed;

        public Stat(int dimension) {
            sum = new double[dimension];
        }

        static RecordSerializer<Stat> serializer(int dimension) {
            return new RecordSerializer<>() {
                @Override
                public Stat deserialize(ByteBuffer buffer) {
                    var stat = new Stat(dimension);
                    stat.count = buffer.getInt();
                    stat.postprocessed = buffer.getInt();
                    for (int d = 0; d < dimension; d++) {
                        stat.sum[d] = buffer.getDouble();
                    }
                    return stat;
                }

                @Override
                public int recordSize() {
                    return 2 * Integer.BYTES + dimension * Double.BYTES;
                }

                @Override
                public void serialize(Stat record, ByteBuffer buffer) {
                    buffer.putInt(record.count).putInt(record.postprocessed);
                    for (var s : record.sum) {
                        buffer.putDouble(s);
                    }
                }
            };
        }

        @Override
        public void accumulate(Param param, Point point) {
            for (int d = 0; d < sum.length; d++) {
                sum[d] += point.vec().getElement(d);
            }
            count++;
        }

        @Override
        public void accumulate(Param param, Stat child, HRect childBound, int childCount) {
            for (int d = 0; d < sum.length; d++) {
                sum[d] += child.sum[d];
            }
            count += child.count;
        }

        public int count() {
            return count;
        }

        @Override
        public void postprocess(Param param, HRect bound, int count) {
            postprocessed++;
        }

        public int postprocessed() {
            return postprocessed;
        }

        @Override
        public void reset(Param param) {
            Arrays.fill(sum, 0.0);
            count = 0;
            postprocessed = 0;
        }

        public double sum(int dimension) {
            return sum[dimension];
        }
    }

    public record Result(int queryIndex, int neighbors) {
        static final RecordSerializer<Result> SERIALIZER = new RecordSerializer<>() {
            @Override
            public Result deserialize(ByteBuffer buffer) {
                return new Result(buffer.getInt(), buffer.getInt());
            }

            @Override
            public int recordSize() {
                return 2 * Integer.BYTES;
            }

            @Override
            public void serialize(Result record, ByteBuffer buffer) {
                buffer.putInt(record.queryIndex).putInt(record.neighbors);
            }
        };
    }

    public static final class Total implements GlobalResult<Param, Total> {
        private long pairs;
        private int  queries;

        @Override
        public void accumulate(Param param, Total other) {
            pairs += other.pairs;
            queries += other.queries;
        }

        @Override
        public void init(Param param) {
            pairs = 0;
            queries = 0;
        }

        public long pairs() {
            return pairs;
        }

        public int queries() {
            return queries;
        }

        @Override
        public Map<String, Object> report(Param param) {
            var report = new LinkedHashMap<String, Object>();
            report.put("queries", queries);
            report.put("pairs", pairs);
            return report;
        }
    }

    private class Solver implements GrainSolver<Param, Point, Stat, Result, Total> {
        private final Total total = new Total();

        @Override
        public Total globalResult() {
            return total;
        }

        @Override
        public void initSolve(RunConfig runConfig, Param param, int queryRoot, CacheArray<Point> qPoints,
                              CacheArray<TreeNode<Stat>> qNodes, CacheArray<Point> rPoints,
                              CacheArray<TreeNode<Stat>> rNodes, CacheArray<Result> qResults) {
            runConfigs.add(runConfig);
            solverThreads.add(Thread.currentThread().getName());
            if (failOn.test(queryRoot)) {
                throw new IllegalStateException("Grain " + queryRoot + " is poisoned");
            }
            int begin;
            int end;
            try (var root = qNodes.read(queryRoot)) {
                begin = root.get().begin();
                end = root.get().end();
            }
            var limit = param.radius() * param.radius();
            for (int q = begin; q < end; q++) {
                var neighbors = 0;
                int queryIndex;
                try (var query = qPoints.read(q)) {
                    queryIndex = query.get().index();
                    for (int r = 0; r < rPoints.size(); r++) {
                        try (var reference = rPoints.read(r)) {
                            if (reference.get().index() != queryIndex && distanceSq(query.get(), reference.get())
                                                                         <= limit) {
                                neighbors++;
                            }
                        }
                    }
                }
                try (var result = qResults.write(q)) {
                    result.set(new Result(queryIndex, neighbors));
                }
                total.pairs += neighbors;
                total.queries++;
            }
        }

        private double distanceSq(Point a, Point b) {
            double sum = 0.0;
            for (int d = 0; d < a.vec().getSize(); d++) {
                var delta = a.vec().getElement(d) - b.vec().getElement(d);
                sum += delta * delta;
            }
            return sum;
        }
    }
}
