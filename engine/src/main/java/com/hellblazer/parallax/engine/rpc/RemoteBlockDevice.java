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
import com.hellblazer.parallax.cache.CacheException;
import com.hellblazer.parallax.engine.DualTreeException;
import com.hellblazer.parallax.engine.rpc.proto.ArrayDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A block device owned by another rank, reached through {@link Rpc}. The shape of the array is fetched from the owner
 * on first use and again on every {@link #refresh()}. Remote arrays cannot grow.
 *
 * @author hal.hildebrand
 */
public class RemoteBlockDevice implements BlockDevice {
    private static final Logger log = LoggerFactory.getLogger(RemoteBlockDevice.class);

    private final int                       channel;
    private final int                       owner;
    private final Rpc                       rpc;
    private volatile ArrayDescription       description;

    public RemoteBlockDevice(Rpc rpc, int channel, int owner) {
        this.rpc = Objects.requireNonNull(rpc, "Rpc cannot be null");
        this.channel = channel;
        this.owner = owner;
    }

    @Override
    public int allocRecords(int count) {
        throw new UnsupportedOperationException("Cannot allocate records of the array on channel " + channel);
    }

    @Override
    public int blockElems() {
        return description().getBlockElems();
    }

    @Override
    public byte[] defaultRecord() {
        return description().getDefaultRecord().toByteArray();
    }

    @Override
    public void fixBoundaries() {
        throw new UnsupportedOperationException("Boundaries of the array on channel " + channel
                                                + " are fixed by its owner, rank " + owner);
    }

    @Override
    public boolean isFixed() {
        return description().getFixed();
    }

    @Override
    public byte[] readBlock(int blockId) {
        Objects.checkIndex(blockId, nBlocks());
        var records = remote(() -> rpc.readBlock(channel, owner, blockId));
        if (records.length != blockBytes()) {
            throw new CacheException(
            "Block " + blockId + " on channel " + channel + " has " + records.length + " bytes, expected "
            + blockBytes());
        }
        return records;
    }

    @Override
    public int recordSize() {
        return description().getRecordSize();
    }

    @Override
    public void refresh() {
        description = remote(() -> rpc.describeArray(channel, owner));
        log.debug("Array on channel {} at rank {}: {} records in blocks of {}", channel, owner,
                  description.getSize(), description.getBlockElems());
    }

    @Override
    public int size() {
        return description().getSize();
    }

    @Override
    public void writeRecords(int blockId, int begin, int end, byte[] records) {
        remote(() -> {
            rpc.writeRecords(channel, owner, blockId, begin, end, records);
            return null;
        });
    }

    private ArrayDescription description() {
        var current = description;
        if (current == null) {
            refresh();
            current = description;
        }
        return current;
    }

    private <T> T remote(Supplier<T> call) {
        try {
            return call.get();
        } catch (DualTreeException e) {
            throw new CacheException(e.getMessage(), e);
        }
    }
}
