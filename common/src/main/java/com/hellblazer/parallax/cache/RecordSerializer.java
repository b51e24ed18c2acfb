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

import java.nio.ByteBuffer;

/**
 * Converts records to and from their fixed size binary form. Every record of an array occupies exactly
 * {@link #recordSize()} bytes on a {@link BlockDevice}.
 *
 * @param <T> the record type
 * @author hal.hildebrand
 */
public interface RecordSerializer<T> {

    /**
     * Decode one record from the buffer's current position, advancing it by {@link #recordSize()}
     */
    T deserialize(ByteBuffer buffer);

    default T fromBytes(byte[] bytes) {
        if (bytes.length != recordSize()) {
            throw new IllegalArgumentException(
            "Expected " + recordSize() + " bytes for a record, got " + bytes.length);
        }
        return deserialize(ByteBuffer.wrap(bytes));
    }

    int recordSize();

    /**
     * Encode the record at the buffer's current position, advancing it by {@link #recordSize()}
     */
    void serialize(T record, ByteBuffer buffer);

    default byte[] toBytes(T record) {
        var buffer = ByteBuffer.allocate(recordSize());
        serialize(record, buffer);
        return buffer.array();
    }
}
