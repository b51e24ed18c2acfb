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
import com.hellblazer.parallax.cache.CacheArray;
import com.hellblazer.parallax.cache.MemoryBlockDevice;
import com.hellblazer.parallax.cache.RecordSerializer;

import java.util.Objects;

/**
 * A cache array shared by every rank of a run. The master owns the storage and publishes it on the array's channel,
 * the other ranks reach it through a {@link RemoteBlockDevice}.
 *
 * @author hal.hildebrand
 */
public class DistributedCacheArray<T> extends CacheArray<T> {
    private int channel = -1;
    private Rpc rpc;

    public DistributedCacheArray(RecordSerializer<T> serializer) {
        super(serializer);
    }

    public int channel() {
        return channel;
    }

    public void configure(Rpc rpc, int channel) {
        this.rpc = Objects.requireNonNull(rpc, "Rpc cannot be null");
        this.channel = channel;
    }

    /**
     * Create the storage of {@code count} default records, writable, and publish it
     */
    public void initMaster(T defaultRecord, int count, int blockElems) {
        checkConfigured();
        Objects.requireNonNull(defaultRecord, "Default record cannot be null");
        var device = new MemoryBlockDevice(serializer().toBytes(defaultRecord), blockElems);
        init(device, BlockDevice.Mode.MODIFY);
        if (count > 0) {
            alloc(count);
        }
        rpc.registerArray(channel, device);
    }

    /**
     * Attach to the master's storage. The array's shape is learned when it is first needed, normally on the first
     * {@link #flushClear(BlockDevice.Mode)} after the master has fixed its boundaries.
     */
    public void initWorker() {
        checkConfigured();
        init(new RemoteBlockDevice(rpc, channel, Rpc.MASTER_RANK), BlockDevice.Mode.READ);
    }

    private void checkConfigured() {
        if (rpc == null) {
            throw new IllegalStateException("Distributed cache array is not configured with a channel");
        }
    }
}
