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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Configuration of a dual-tree run: threading, work granularity, cache paging, tree shape and the parameters of the
 * problem being solved.
 *
 * <p>Named scopes hold complete configurations that override this one for a particular participant, e.g. the scope
 * {@code rank2} for the process running as rank 2.
 *
 * @author hal.hildebrand
 */
public final class DualTreeConfig {

    public static final int DEFAULT_BLOCK_NODES  = 128;
    public static final int DEFAULT_BLOCK_POINTS = 1024;
    public static final int DEFAULT_LEAF_SIZE    = 20;
    public static final int DEFAULT_THREADS      = 1;

    private final int                         blockNodes;
    private final int                         blockPoints;
    private final Path                        dataPath;
    private final Integer                     grains;
    private final int                         leafSize;
    private final Map<String, String>         parameters;
    private final Duration                    rpcDeadline;
    private final Map<String, DualTreeConfig> scopes;
    private final int                         threads;

    private DualTreeConfig(Builder builder) {
        this.threads = builder.threads;
        this.grains = builder.grains;
        this.blockPoints = builder.blockPoints;
        this.blockNodes = builder.blockNodes;
        this.leafSize = builder.leafSize;
        this.dataPath = builder.dataPath;
        this.rpcDeadline = builder.rpcDeadline;
        this.parameters = Collections.unmodifiableMap(new HashMap<>(builder.parameters));
        this.scopes = Collections.unmodifiableMap(new HashMap<>(builder.scopes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DualTreeConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Records per block of node arrays ({@code n_block_nodes})
     */
    public int blockNodes() {
        return blockNodes;
    }

    /**
     * Records per block of point and result arrays ({@code n_block_points})
     */
    public int blockPoints() {
        return blockPoints;
    }

    public Optional<Path> dataPath() {
        return Optional.ofNullable(dataPath);
    }

    /**
     * The grain count for a queue feeding {@code ranks} participants of {@code threads} threads each: the configured
     * {@code n_grains}, else 1 per rank for single threaded ranks, else {@code 3 * threads} per rank.
     */
    public int effectiveGrains(int threads, int ranks) {
        if (grains != null) {
            return grains;
        }
        return (threads == 1 ? 1 : 3 * threads) * ranks;
    }

    public double doubleParameter(String name, double defaultValue) {
        var value = parameters.get(name);
        return value == null ? defaultValue : Double.parseDouble(value);
    }

    /**
     * Explicitly configured grain count ({@code n_grains})
     */
    public OptionalInt grains() {
        return grains == null ? OptionalInt.empty() : OptionalInt.of(grains);
    }

    public int intParameter(String name, int defaultValue) {
        var value = parameters.get(name);
        return value == null ? defaultValue : Integer.parseInt(value);
    }

    /**
     * Largest number of points in a leaf of trees built under this configuration ({@code leaf_size})
     */
    public int leafSize() {
        return leafSize;
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    /**
     * @return the deadline applied to every remote call, empty when calls wait indefinitely
     */
    public Optional<Duration> rpcDeadline() {
        return Optional.ofNullable(rpcDeadline);
    }

    /**
     * @return the configuration of the named scope, or this configuration when no such scope exists
     */
    public DualTreeConfig scoped(String scope) {
        return scopes.getOrDefault(scope, this);
    }

    public Map<String, DualTreeConfig> scopes() {
        return scopes;
    }

    public Optional<String> stringParameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    /**
     * Worker threads per process ({@code n_threads})
     */
    public int threads() {
        return threads;
    }

    public Builder toBuilder() {
        var builder = new Builder();
        builder.threads = threads;
        builder.grains = grains;
        builder.blockPoints = blockPoints;
        builder.blockNodes = blockNodes;
        builder.leafSize = leafSize;
        builder.dataPath = dataPath;
        builder.rpcDeadline = rpcDeadline;
        builder.parameters.putAll(parameters);
        return builder;
    }

    @Override
    public String toString() {
        return String.format(
        "DualTreeConfig[threads=%d, grains=%s, blockPoints=%d, blockNodes=%d, leafSize=%d, data=%s, scopes=%s]",
        threads, grains == null ? "default" : grains, blockPoints, blockNodes, leafSize, dataPath,
        scopes.keySet());
    }

    public static class Builder {
        private final Map<String, String>         parameters  = new HashMap<>();
        private final Map<String, DualTreeConfig> scopes      = new HashMap<>();
        private       int                         blockNodes  = DEFAULT_BLOCK_NODES;
        private       int                         blockPoints = DEFAULT_BLOCK_POINTS;
        private       Path                        dataPath;
        private       Integer                     grains;
        private       int                         leafSize    = DEFAULT_LEAF_SIZE;
        private       Duration                    rpcDeadline;
        private       int                         threads     = DEFAULT_THREADS;

        private Builder() {
        }

        public DualTreeConfig build() {
            return new DualTreeConfig(this);
        }

        public Builder withBlockNodes(int blockNodes) {
            this.blockNodes = positive("n_block_nodes", blockNodes);
            return this;
        }

        public Builder withBlockPoints(int blockPoints) {
            this.blockPoints = positive("n_block_points", blockPoints);
            return this;
        }

        public Builder withDataPath(Path dataPath) {
            this.dataPath = dataPath;
            return this;
        }

        public Builder withGrains(int grains) {
            this.grains = positive("n_grains", grains);
            return this;
        }

        public Builder withLeafSize(int leafSize) {
            this.leafSize = positive("leaf_size", leafSize);
            return this;
        }

        public Builder withParameter(String name, Object value) {
            if (name == null || value == null) {
                throw new IllegalArgumentException("Parameter name and value cannot be null");
            }
            parameters.put(name, value.toString());
            return this;
        }

        public Builder withRpcDeadline(Duration deadline) {
            if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
                throw new IllegalArgumentException("RPC deadline must be positive: " + deadline);
            }
            this.rpcDeadline = deadline;
            return this;
        }

        public Builder withScope(String scope, DualTreeConfig config) {
            if (scope == null || config == null) {
                throw new IllegalArgumentException("Scope name and configuration cannot be null");
            }
            scopes.put(scope, config);
            return this;
        }

        public Builder withThreads(int threads) {
            this.threads = positive("n_threads", threads);
            return this;
        }

        private int positive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
