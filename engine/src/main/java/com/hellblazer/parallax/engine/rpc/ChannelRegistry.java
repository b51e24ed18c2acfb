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

import com.hellblazer.parallax.cache.BlockDevice;
import com.hellblazer.parallax.engine.work.RemoteWorkQueueBackend;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The objects a rank publishes, by channel. A lookup returns a future that completes when the channel is registered,
 * so requests arriving before the owner has published are held rather than refused.
 *
 * @author hal.hildebrand
 */
final class ChannelRegistry {
    private final Slots<BlockDevice>            arrays = new Slots<>("array");
    private final Slots<DataGetterBackend<?>>   data   = new Slots<>("data");
    private final Slots<RemoteWorkQueueBackend> work   = new Slots<>("work queue");

    CompletableFuture<BlockDevice> array(int channel) {
        return arrays.lookup(channel);
    }

    CompletableFuture<DataGetterBackend<?>> data(int channel) {
        return data.lookup(channel);
    }

    void registerArray(int channel, BlockDevice device) {
        arrays.register(channel, device);
    }

    void registerData(int channel, DataGetterBackend<?> backend) {
        data.register(channel, backend);
    }

    void registerWork(int channel, RemoteWorkQueueBackend backend) {
        work.register(channel, backend);
    }

    CompletableFuture<RemoteWorkQueueBackend> work(int channel) {
        return work.lookup(channel);
    }

    private static final class Slots<B> {
        private final String                                           kind;
        private final ConcurrentHashMap<Integer, CompletableFuture<B>> slots = new ConcurrentHashMap<>();

        private Slots(String kind) {
            this.kind = kind;
        }

        CompletableFuture<B> lookup(int channel) {
            return slots.computeIfAbsent(channel, c -> new CompletableFuture<>());
        }

        void register(int channel, B backend) {
            if (backend == null) {
                throw new IllegalArgumentException("Cannot register a null " + kind + " on channel " + channel);
            }
            if (!lookup(channel).complete(backend)) {
                throw new IllegalStateException("A " + kind + " is already registered on channel " + channel);
            }
        }
    }
}
