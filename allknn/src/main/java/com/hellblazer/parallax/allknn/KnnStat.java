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
import com.hellblazer.parallax.engine.tree.NodeStatistic;
import com.hellblazer.parallax.geometry.HRect;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Centroid and population of the points below a node
 *
 * @author hal.hildebrand
 */
public final class KnnStat implements NodeStatistic<KnnParam, KnnPoint, KnnStat> {
    private final double[] centroid;
    private       int      count;

    public KnnStat(int dimension) {
        centroid = new double[dimension];
    }

    public static RecordSerializer<KnnStat> serializer(int dimension) {
        return new RecordSerializer<>() {
            @Override
            public KnnStat deserialize(ByteBuffer buffer) {
                var stat = new KnnStat(dimension);
                stat.count = buffer.getInt();
                for (int d = 0; d < dimension; d++) {
                    stat.centroid[d] = buffer.getDouble();
                }
                return stat;
            }

            @Override
            public int recordSize() {
                return Integer.BYTES + dimension * Double.BYTES;
            }

            @Override
            public void serialize(KnnStat record, ByteBuffer buffer) {
                buffer.putInt(record.count);
                for (var c : record.centroid) {
                    buffer.putDouble(c);
                }
            }
        };
    }

    @Override
    public void accumulate(KnnParam param, KnnPoint point) {
        for (int d = 0; d < centroid.length; d++) {
            centroid[d] += point.vec().getElement(d);
        }
        count++;
    }

    @Override
    public void accumulate(KnnParam param, KnnStat child, HRect childBound, int childCount) {
        for (int d = 0; d < centroid.length; d++) {
            centroid[d] += child.centroid[d] * child.count;
        }
        count += child.count;
    }

    public double centroid(int dimension) {
        return centroid[dimension];
    }

    public int count() {
        return count;
    }

    @Override
    public void postprocess(KnnParam param, HRect bound, int count) {
        if (this.count != count) {
            throw new IllegalStateException("Statistic covers " + this.count + " points, node holds " + count);
        }
        if (count > 0) {
            for (int d = 0; d < centroid.length; d++) {
                centroid[d] /= count;
            }
        }
    }

    @Override
    public void reset(KnnParam param) {
        Arrays.fill(centroid, 0.0);
        count = 0;
    }
}
