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

/**
 * Where the ranks of a run listen, and how to reach them
 *
 * @author hal.hildebrand
 */
public interface RankDirectory {

    /**
     * A channel to the rank's server. The caller owns and shuts down the channel.
     */
    ManagedChannel channelTo(int rank);

    /**
     * A builder for the server the rank listens on
     */
    ServerBuilder<?> serverFor(int rank);

    /**
     * The number of ranks in the run
     */
    int size();
}
