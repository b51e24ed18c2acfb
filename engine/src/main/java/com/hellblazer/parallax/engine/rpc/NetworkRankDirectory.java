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
import io.grpc.ManagedChannelBuilder;
import io.grpc.ServerBuilder;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ranks listening on TCP endpoints, rank {@code i} at the {@code i}th address. Connections are plaintext.
 *
 * @author hal.hildebrand
 */
public class NetworkRankDirectory implements RankDirectory {
    private final List<InetSocketAddress> endpoints;

    public NetworkRankDirectory(List<InetSocketAddress> endpoints) {
        Objects.requireNonNull(endpoints, "Endpoints cannot be null");
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("A run needs at least one rank");
        }
        this.endpoints = List.copyOf(endpoints);
    }

    /**
     * Parse a comma separated list of {@code host:port} endpoints
     */
    public static NetworkRankDirectory parse(String endpoints) {
        var parsed = new ArrayList<InetSocketAddress>();
        for (var endpoint : endpoints.split(",")) {
            var trimmed = endpoint.trim();
            var colon = trimmed.lastIndexOf(':');
            if (colon <= 0 || colon == trimmed.length() - 1) {
                throw new IllegalArgumentException("Endpoint must be host:port, got \"" + trimmed + "\"");
            }
            int port;
            try {
                port = Integer.parseInt(trimmed.substring(colon + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port in endpoint \"" + trimmed + "\"", e);
            }
            parsed.add(InetSocketAddress.createUnresolved(trimmed.substring(0, colon), port));
        }
        return new NetworkRankDirectory(parsed);
    }

    @Override
    public ManagedChannel channelTo(int rank) {
        var endpoint = endpoints.get(rank);
        return ManagedChannelBuilder.forAddress(endpoint.getHostString(), endpoint.getPort()).usePlaintext().build();
    }

    @Override
    public ServerBuilder<?> serverFor(int rank) {
        return ServerBuilder.forPort(endpoints.get(rank).getPort());
    }

    @Override
    public int size() {
        return endpoints.size();
    }
}
