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
package com.hellblazer.parallax.engine;

import com.hellblazer.parallax.cache.RecordSerializer;

import java.nio.ByteBuffer;

/**
 * The run settings the master publishes to every rank
 *
 * @param nThreads solver threads per rank
 * @author hal.hildebrand
 */
public record RunConfig(int nThreads) {

    public static final RecordSerializer<RunConfig> SERIALIZER = new RecordSerializer<>() {
        @Override
        public RunConfig deserialize(ByteBuffer buffer) {
            return new RunConfig(buffer.getInt());
        }

        @Override
        public int recordSize() {
            return Integer.BYTES;
        }

        @Override
        public void serialize(RunConfig record, ByteBuffer buffer) {
            buffer.putInt(record.nThreads);
        }
    };

    public RunConfig {
        if (nThreads < 1) {
            throw new IllegalArgumentException("nThreads must be positive: " + nThreads);
        }
    }
}
