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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Block device stored in a file, one block after another with no header. Records that were never written read back
 * as the default record.
 *
 * <p>The engine's drivers keep their arrays in memory and never select this device. It is for callers that build
 * their own arrays, through {@link CacheArray#init(BlockDevice, BlockDevice.Mode)}, over data too large for the heap.
 *
 * @author hal.hildebrand
 */
public class FileBlockDevice implements BlockDevice, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FileBlockDevice.class);

    private final int         blockElems;
    private final FileChannel channel;
    private final byte[]      defaultRecord;
    private final Path        path;
    private       boolean     fixed;
    private       int         size;

    /**
     * Create an empty device, truncating the file if it exists
     */
    public FileBlockDevice(Path path, byte[] defaultRecord, int blockElems) {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(defaultRecord, "Default record cannot be null");
        if (blockElems <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + blockElems);
        }
        if (defaultRecord.length == 0) {
            throw new IllegalArgumentException("Records must occupy at least one byte");
        }
        this.path = path;
        this.defaultRecord = defaultRecord.clone();
        this.blockElems = blockElems;
        try {
            this.channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.READ,
                                            StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new CacheException("Unable to open block file " + path, e);
        }
        log.debug("Opened block file {} ({} records of {} bytes per block)", path, blockElems,
                  defaultRecord.length);
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
        writeDefaults(begin, begin + count);
        size += count;
        return begin;
    }

    @Override
    public int blockElems() {
        return blockElems;
    }

    @Override
    public synchronized void close() {
        try {
            channel.close();
        } catch (IOException e) {
            throw new CacheException("Unable to close block file " + path, e);
        }
    }

    @Override
    public byte[] defaultRecord() {
        return defaultRecord.clone();
    }

    @Override
    public synchronized void fixBoundaries() {
        if (fixed) {
            return;
        }
        var padded = nBlocks() * blockElems;
        writeDefaults(size, padded);
        fixed = true;
        log.debug("Fixed boundaries of {}: {} records padded to {}", path, size, padded);
    }

    @Override
    public synchronized boolean isFixed() {
        return fixed;
    }

    @Override
    public synchronized byte[] readBlock(int blockId) {
        Objects.checkIndex(blockId, nBlocks());
        var block = new byte[blockBytes()];
        var buffer = ByteBuffer.wrap(block);
        long position = (long) blockId * blockBytes();
        try {
            while (buffer.hasRemaining()) {
                var read = channel.read(buffer, position + buffer.position());
                if (read < 0) {
                    break;
                }
            }
        } catch (IOException e) {
            throw new CacheException("Unable to read block " + blockId + " of " + path, e);
        }
        // Past the end of the file: never written, so default
        for (int offset = buffer.position(); offset < block.length; offset++) {
            block[offset] = defaultRecord[offset % defaultRecord.length];
        }
        return block;
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
        Objects.checkIndex(blockId, nBlocks());
        Objects.checkFromToIndex(begin, end, blockElems);
        var length = (end - begin) * recordSize();
        if (records.length != length) {
            throw new IllegalArgumentException(
            "Expected " + length + " bytes for records [" + begin + ", " + end + "), got " + records.length);
        }
        long position = ((long) blockId * blockElems + begin) * recordSize();
        write(ByteBuffer.wrap(records), position);
    }

    private void write(ByteBuffer buffer, long position) {
        try {
            while (buffer.hasRemaining()) {
                channel.write(buffer, position + buffer.position());
            }
        } catch (IOException e) {
            throw new CacheException("Unable to write " + path + " at " + position, e);
        }
    }

    private void writeDefaults(int from, int to) {
        if (to <= from) {
            return;
        }
        var buffer = ByteBuffer.allocate((to - from) * defaultRecord.length);
        for (int i = from; i < to; i++) {
            buffer.put(defaultRecord);
        }
        buffer.flip();
        write(buffer, (long) from * defaultRecord.length);
    }
}
