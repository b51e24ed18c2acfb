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
package com.hellblazer.parallax.engine.rpc;

import io.grpc.ManagedChannel;
import io.grpc.ServerBuilder;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;

import java.util.Objects;

/**
 * Ranks running in one JVM, connected by the gRPC in-process transport. Each directory name identifies one run.
 *
 * @author hal.hildebrand
 */
public class InProcessRankDirectory implements RankDirectory {
    private final String name;
    private final int    size;

    public InProcessRankDirectory(String name, int size) {
        this.name = Objects.requireNonNull(name, "Name cannot be null");
        if (size < 1) {
            throw new IllegalArgumentException("A run needs at least one rank: " + size);
        }
        this.size = size;
    }

    @Override
    public ManagedChannel channelTo(int rank) {
        return InProcessChannelBuilder.forName(serverName(Objects.checkIndex(rank, size))).build();
    }

    @Override
    public ServerBuilder<?> serverFor(int rank) {
        return InProcessServerBuilder.forName(serverName(Objects.checkIndex(rank, size)));
    }

    @Override
    public int size() {
        return size;
    }

    private String serverName(int rank) {
        return name + "-rank-" + rank;
    }
}
