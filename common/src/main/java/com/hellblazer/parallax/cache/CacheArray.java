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
package com.hellblazer.parallax.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.BitSet;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Paged, index addressed array of records over a {@link BlockDevice}.
 *
 * <p>Records are reached only through scoped leases: {@link #read(int)} and {@link #write(int)} return handles that
 * must be closed, typically with try-with-resources. Blocks are decoded into record objects the first time one of
 * their records is leased and stay cached until {@link #flushClear(BlockDevice.Mode)}. Written records are tracked
 * individually, so a flush sends only the records this array modified and two arrays writing disjoint records of the
 * same block, on the same or on different ranks, do not overwrite each other.
 *
 * <p><b>Thread Safety</b>: leases may be acquired concurrently. A block is loaded once, by the first thread that
 * needs it, and outside of any map lock, so a slow or remote load stalls only the threads waiting on that block.
 * Callers are responsible for not writing the same record from two threads.
 *
 * @param <T> the record type
 * @author hal.hildebrand
 */
public class CacheArray<T> {
    private static final Logger log = LoggerFactory.getLogger(CacheArray.class);

    private final ConcurrentHashMap<Integer, CompletableFuture<Block>> blocks      = new ConcurrentHashMap<>();
    private final AtomicInteger                                        outstanding = new AtomicInteger();
    private final RecordSerializer<T>                                  serializer;
    private volatile BlockDevice                                       device;
    private volatile BlockDevice.Mode                                  mode;

    public CacheArray(RecordSerializer<T> serializer) {
        this.serializer = Objects.requireNonNull(serializer, "Serializer cannot be null");
    }

    /**
     * Append records initialized to the default record
     *
     * @return the index of the first new record
     */
    public int alloc(int count) {
        checkInitialized();
        if (mode == BlockDevice.Mode.READ) {
            throw new IllegalStateException("Cannot allocate records in READ mode");
        }
        return device.allocRecords(count);
    }

    public int blockElems() {
        checkInitialized();
        return device.blockElems();
    }

    /**
     * The device backing this array, for sharing with components that open their own arrays over it
     */
    public BlockDevice device() {
        checkInitialized();
        return device;
    }

    /**
     * Pad the trailing block and freeze the size of the array. Dirty records are flushed first.
     */
    public void fixBoundaries() {
        checkInitialized();
        flush();
        device.fixBoundaries();
    }

    /**
     * Write every dirty record back to the device. Cached blocks stay cached.
     */
    public void flush() {
        checkInitialized();
        int written = 0;
        for (var loaded : blocks.values()) {
            if (loaded.isDone() && !loaded.isCompletedExceptionally()) {
                written += loaded.join().flush();
            }
        }
        if (written > 0) {
            log.trace("Flushed {} records", written);
        }
    }

    /**
     * Flush, drop every cached block and continue in the given mode.
     *
     * @throws IllegalStateException if any lease is still held
     */
    public void flushClear(BlockDevice.Mode newMode) {
        Objects.requireNonNull(newMode, "Mode cannot be null");
        checkInitialized();
        var held = outstanding.get();
        if (held != 0) {
            throw new IllegalStateException("Cannot clear cache array, " + held + " handles still held");
        }
        flush();
        blocks.clear();
        device.refresh();
        mode = newMode;
    }

    /**
     * Initialize a memory backed array of {@code count} default records, writable in {@link BlockDevice.Mode#MODIFY}
     */
    public void init(T defaultRecord, int count, int blockElems) {
        Objects.requireNonNull(defaultRecord, "Default record cannot be null");
        init(new MemoryBlockDevice(serializer.toBytes(defaultRecord), blockElems), BlockDevice.Mode.MODIFY);
        alloc(count);
    }

    /**
     * Initialize the array over an existing device
     */
    public void init(BlockDevice device, BlockDevice.Mode mode) {
        this.device = Objects.requireNonNull(device, "Device cannot be null");
        this.mode = Objects.requireNonNull(mode, "Mode cannot be null");
        blocks.clear();
    }

    public boolean isInitialized() {
        return device != null;
    }

    public BlockDevice.Mode mode() {
        return mode;
    }

    /**
     * @return the number of handles currently leased
     */
    public int outstanding() {
        return outstanding.get();
    }

    /**
     * Lease a record for reading
     *
     * @throws IndexOutOfBoundsException if the index is outside the array
     */
    public CacheRead<T> read(int index) {
        var block = blockFor(index);
        outstanding.incrementAndGet();
        return new CacheRead<>(this, index, block.get(offset(index)));
    }

    public RecordSerializer<T> serializer() {
        return serializer;
    }

    public int size() {
        checkInitialized();
        return device.size();
    }

    /**
     * Lease a record for modification. The record is flushed back on the next flush.
     *
     * @throws IllegalStateException     in {@link BlockDevice.Mode#READ}
     * @throws IndexOutOfBoundsException if the index is outside the array
     */
    public CacheWrite<T> write(int index) {
        if (mode == BlockDevice.Mode.READ) {
            throw new IllegalStateException("Cannot write record " + index + " in READ mode");
        }
        var block = blockFor(index);
        var offset = offset(index);
        block.markDirty(offset);
        outstanding.incrementAndGet();
        return new CacheWrite<>(this, index, block.get(offset));
    }

    void release() {
        outstanding.decrementAndGet();
    }

    void store(int index, T record) {
        var block = blockFor(index);
        var offset = offset(index);
        block.set(offset, record);
        block.markDirty(offset);
    }

    private Block blockFor(int index) {
        checkInitialized();
        Objects.checkIndex(index, device.size());
        var blockId = index / device.blockElems();
        var pending = blocks.get(blockId);
        if (pending == null) {
            var loading = new CompletableFuture<Block>();
            pending = blocks.putIfAbsent(blockId, loading);
            if (pending == null) {
                try {
                    loading.complete(load(blockId));
                } catch (RuntimeException e) {
                    blocks.remove(blockId, loading);
                    loading.completeExceptionally(e);
                    throw e;
                }
                return loading.join();
            }
        }
        try {
            return pending.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new CacheException("Unable to load block " + blockId, e.getCause());
        }
    }

    private void checkInitialized() {
        if (device == null) {
            throw new IllegalStateException("Cache array is not initialized");
        }
    }

    private Block load(int blockId) {
        var elems = device.blockElems();
        var records = new Object[elems];
        if (mode == BlockDevice.Mode.CREATE) {
            var template = device.defaultRecord();
            for (int i = 0; i < elems; i++) {
                records[i] = serializer.fromBytes(template);
            }
        } else {
            var buffer = ByteBuffer.wrap(device.readBlock(blockId));
            for (int i = 0; i < elems; i++) {
                records[i] = serializer.deserialize(buffer);
            }
        }
        log.trace("Loaded block {} in {} mode", blockId, mode);
        return new Block(blockId, records);
    }

    private int offset(int index) {
        return index % device.blockElems();
    }

    private final class Block {
        private final int      blockId;
        private final BitSet   dirty = new BitSet();
        private final Object[] records;

        private Block(int blockId, Object[] records) {
            this.blockId = blockId;
            this.records = records;
        }

        synchronized int flush() {
            var count = 0;
            var begin = dirty.nextSetBit(0);
            while (begin >= 0) {
                var end = dirty.nextClearBit(begin);
                var buffer = ByteBuffer.allocate((end - begin) * serializer.recordSize());
                for (int i = begin; i < end; i++) {
                    serializer.serialize(get(i), buffer);
                }
                device.writeRecords(blockId, begin, end, buffer.array());
                count += end - begin;
                begin = dirty.nextSetBit(end);
            }
            dirty.clear();
            return count;
        }

        @SuppressWarnings("unchecked")
        synchronized T get(int offset) {
            return (T) records[offset];
        }

        synchronized void markDirty(int offset) {
            dirty.set(offset);
        }

        synchronized void set(int offset, T record) {
            records[offset] = record;
        }
    }
}
