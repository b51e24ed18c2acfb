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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Block device held in memory. Blocks are materialized whole, so the trailing block is always padded with default
 * records and {@link #fixBoundaries()} only freezes the size.
 *
 * @author hal.hildebrand
 */
public class MemoryBlockDevice implements BlockDevice {

    private final int          blockElems;
    private final List<byte[]> blocks = new ArrayList<>();
    private final byte[]       defaultRecord;
    private       boolean      fixed;
    private       int          size;

    public MemoryBlockDevice(byte[] defaultRecord, int blockElems) {
        Objects.requireNonNull(defaultRecord, "Default record cannot be null");
        if (blockElems <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + blockElems);
        }
        if (defaultRecord.length == 0) {
            throw new IllegalArgumentException("Records must occupy at least one byte");
        }
        this.defaultRecord = defaultRecord.clone();
        this.blockElems = blockElems;
    }

    @Override
    public synchronized int allocRecords(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Cannot allocate a negative record count: " + count);
        }
        if (fixed) {
            throw new IllegalStateException("Boundaries are fixed, cannot allocate " + count + " records");
        }
        var begin = size;
        size += count;
        while (blocks.size() * blockElems < size) {
            blocks.add(newBlock());
        }
        return begin;
    }

    @Override
    public int blockElems() {
        return blockElems;
    }

    @Override
    public byte[] defaultRecord() {
        return defaultRecord.clone();
    }

    @Override
    public synchronized void fixBoundaries() {
        fixed = true;
    }

    @Override
    public synchronized boolean isFixed() {
        return fixed;
    }

    @Override
    public synchronized byte[] readBlock(int blockId) {
        Objects.checkIndex(blockId, blocks.size());
        return blocks.get(blockId).clone();
    }

    @Override
    public int recordSize() {
        return defaultRecord.length;
    }

    @Override
    public synchronized int size() {
        return size;
    }

    @Override
    public synchronized void writeRecords(int blockId, int begin, int end, byte[] records) {
        Objects.checkIndex(blockId, blocks.size());
        Objects.checkFromToIndex(begin, end, blockElems);
        var length = (end - begin) * recordSize();
        if (records.length != length) {
            throw new IllegalArgumentException(
            "Expected " + length + " bytes for records [" + begin + ", " + end + "), got " + records.length);
        }
        System.arraycopy(records, 0, blocks.get(blockId), begin * recordSize(), length);
    }

    private byte[] newBlock() {
        var block = new byte[blockBytes()];
        for (int i = 0; i < blockElems; i++) {
            System.arraycopy(defaultRecord, 0, block, i * defaultRecord.length, defaultRecord.length);
        }
        return block;
    }
}
