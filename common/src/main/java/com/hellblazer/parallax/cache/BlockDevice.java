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

/**
 * Backing storage of a {@link CacheArray}: a sequence of blocks, each holding {@link #blockElems()} serialized records
 * of {@link #recordSize()} bytes.
 *
 * <p>Implementations must be safe for concurrent use, since a device may be shared by several arrays and served to
 * remote ranks at the same time.
 *
 * @author hal.hildebrand
 */
public interface BlockDevice {

    /**
     * How a cache array uses its device between two flushes
     */
    enum Mode {
        /**
         * Blocks are fetched on demand and cannot be written
         */
        READ,
        /**
         * Blocks are fetched on demand, written records are flushed back
         */
        MODIFY,
        /**
         * Blocks start as copies of the default record and are never fetched, written records are flushed back
         */
        CREATE
    }

    /**
     * Append records initialized to the default record.
     *
     * @param count the number of records to add
     * @return the index of the first new record
     * @throws IllegalStateException if the boundaries are fixed
     */
    int allocRecords(int count);

    int blockElems();

    /**
     * The serialized default record, used to pad blocks and to seed blocks in {@link Mode#CREATE}
     */
    byte[] defaultRecord();

    /**
     * Pad the trailing partial block with default records and freeze the size of the device
     */
    void fixBoundaries();

    boolean isFixed();

    default int nBlocks() {
        return (size() + blockElems() - 1) / blockElems();
    }

    /**
     * @return the full contents of the block, {@code blockElems() * recordSize()} bytes
     */
    byte[] readBlock(int blockId);

    int recordSize();

    /**
     * Re-read any metadata cached from an owner. Local devices have nothing to refresh.
     */
    default void refresh() {
    }

    /**
     * The number of committed records
     */
    int size();

    /**
     * Overwrite records {@code [begin, end)} of the block, offsets relative to the block's first record.
     */
    void writeRecords(int blockId, int begin, int end, byte[] records);

    /**
     * The byte length of one block
     */
    default int blockBytes() {
        return blockElems() * recordSize();
    }
}
