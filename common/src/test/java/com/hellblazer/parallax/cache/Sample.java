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
 * Mutable test record: an id and a value
 *
 * @author hal.hildebrand
 */
class Sample {
    static final RecordSerializer<Sample> SERIALIZER = new RecordSerializer<>() {
        @Override
        public Sample deserialize(ByteBuffer buffer) {
            return new Sample(buffer.getInt(), buffer.getDouble());
        }

        @Override
        public int recordSize() {
            return Integer.BYTES + Double.BYTES;
        }

        @Override
        public void serialize(Sample record, ByteBuffer buffer) {
            buffer.putInt(record.id);
            buffer.putDouble(record.value);
        }
    };

    int    id;
    double value;

    Sample(int id, double value) {
        this.id = id;
        this.value = value;
    }
}
