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
import com.hellblazer.parallax.engine.VectorPoint;

import javax.vecmath.GVector;
import java.nio.ByteBuffer;

/**
 * @author hal.hildebrand
 */
public final class KnnPoint implements VectorPoint {
    private final GVector vec;
    private       int     index = -1;

    public KnnPoint(int dimension) {
        this.vec = new GVector(dimension);
    }

    public static RecordSerializer<KnnPoint> serializer(int dimension) {
        return new RecordSerializer<>() {
            @Override
            public KnnPoint deserialize(ByteBuffer buffer) {
                var point = new KnnPoint(dimension);
                point.index = buffer.getInt();
                for (int d = 0; d < dimension; d++) {
                    point.vec.setElement(d, buffer.getDouble());
                }
                return point;
            }

            @Override
            public int recordSize() {
                return Integer.BYTES + dimension * Double.BYTES;
            }

            @Override
            public void serialize(KnnPoint record, ByteBuffer buffer) {
                buffer.putInt(record.index);
                for (int d = 0; d < dimension; d++) {
                    buffer.putDouble(record.vec.getElement(d));
                }
            }
        };
    }

    public KnnPoint copy() {
        var copy = new KnnPoint(vec.getSize());
        copy.vec.set(vec);
        copy.index = index;
        return copy;
    }

    /**
     * Squared Euclidean distance
     */
    public double distanceSq(KnnPoint other) {
        double sum = 0.0;
        for (int d = 0; d < vec.getSize(); d++) {
            var delta = vec.getElement(d) - other.vec.getElement(d);
            sum += delta * delta;
        }
        return sum;
    }

    @Override
    public int index() {
        return index;
    }

    @Override
    public void setIndex(int index) {
        this.index = index;
    }

    @Override
    public String toString() {
        return "KnnPoint[" + index + "]" + vec;
    }

    @Override
    public GVector vec() {
        return vec;
    }
}
