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
package com.hellblazer.parallax.allknn;

import com.hellblazer.parallax.cache.RecordSerializer;
import com.hellblazer.parallax.engine.GnpParam;

import java.nio.ByteBuffer;

/**
 * Parameters of an all k nearest neighbors problem
 *
 * @author hal.hildebrand
 */
public final class KnnParam implements GnpParam<KnnPoint> {
    public static final RecordSerializer<KnnParam> SERIALIZER = new RecordSerializer<>() {
        @Override
        public KnnParam deserialize(ByteBuffer buffer) {
            var param = new KnnParam(buffer.getInt());
            param.dimension = buffer.getInt();
            param.count = buffer.getInt();
            return param;
        }

        @Override
        public int recordSize() {
            return 3 * Integer.BYTES;
        }

        @Override
        public void serialize(KnnParam record, ByteBuffer buffer) {
            buffer.putInt(record.k).putInt(record.dimension).putInt(record.count);
        }
    };

    private final int k;
    private       int count;
    private       int dimension;

    public KnnParam(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        this.k = k;
    }

    @Override
    public void bootstrapMonochromatic(KnnPoint defaultPoint, int count) {
        if (k >= count) {
            throw new IllegalArgumentException(
            "k = " + k + " neighbors requested, but only " + (count - 1) + " other points exist");
        }
        this.dimension = defaultPoint.vec().getSize();
        this.count = count;
    }

    public int count() {
        return count;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    public int k() {
        return k;
    }

    @Override
    public String toString() {
        return String.format("KnnParam[k=%d, dimension=%d, count=%d]", k, dimension, count);
    }
}
