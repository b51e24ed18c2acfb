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
package com.hellblazer.parallax.engine.work;

import com.hellblazer.parallax.engine.rpc.Rpc;

import java.util.List;
import java.util.Objects;

/**
 * Client of a work queue published by another rank. Once the owner reports the queue exhausted no further requests
 * are sent.
 *
 * @author hal.hildebrand
 */
public class RemoteWorkQueue implements WorkQueue {
    private final int      channel;
    private final int      owner;
    private final Rpc      rpc;
    private volatile boolean exhausted;

    public RemoteWorkQueue(Rpc rpc, int channel, int owner) {
        this.rpc = Objects.requireNonNull(rpc, "Rpc cannot be null");
        this.channel = channel;
        this.owner = owner;
    }

    @Override
    public List<Integer> getWork() {
        if (exhausted) {
            return List.of();
        }
        var work = rpc.getRemoteWork(channel, owner);
        if (work.isEmpty()) {
            exhausted = true;
        }
        return work;
    }
}
