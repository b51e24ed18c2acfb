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

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * The k nearest neighbors of one query point, nearest first. Neighbors at equal distance are ordered by decreasing
 * point index.
 *
 * @author hal.hildebrand
 */
public final class KnnResult {
    public static final int NO_NEIGHBOR = -1;

    private final double[] distances;
    private final int[]    neighbors;
    private       int      queryIndex = -1;

    public KnnResult(int k) {
        neighbors = new int[k];
        distances = new double[k];
        Arrays.fill(neighbors, NO_NEIGHBOR);
        Arrays.fill(distances, Double.POSITIVE_INFINITY);
    }

    public static RecordSerializer<KnnResult> serializer(int k) {
        return new RecordSerializer<>() {
            @Override
            public KnnResult deserialize(ByteBuffer buffer) {
                var result = new KnnResult(k);
                result.queryIndex = buffer.getInt();
                for (int i = 0; i < k; i++) {
                    result.neighbors[i] = buffer.getInt();
                }
                for (int i = 0; i < k; i++) {
                    result.distances[i] = buffer.getDouble();
                }
                return result;
            }

            @Override
            public int recordSize() {
                return Integer.BYTES + k * (Integer.BYTES + Double.BYTES);
            }

            @Override
            public void serialize(KnnResult record, ByteBuffer buffer) {
                buffer.putInt(record.queryIndex);
                for (var n : record.neighbors) {
                    buffer.putInt(n);
                }
                for (var d : record.distances) {
                    buffer.putDouble(d);
                }
            }
        };
    }

    /**
     * Offer a candidate neighbor
     *
     * @return true if the candidate is now among the k nearest
     */
    public boolean consider(int neighbor, double distanceSq) {
        var k = neighbors.length;
        if (!precedes(distanceSq, neighbor, distances[k - 1], neighbors[k - 1])) {
            return false;
        }
        int i = k - 1;
        while (i > 0 && precedes(distanceSq, neighbor, distances[i - 1], neighbors[i - 1])) {
            distances[i] = distances[i - 1];
            neighbors[i] = neighbors[i - 1];
            i--;
        }
        distances[i] = distanceSq;
        neighbors[i] = neighbor;
        return true;
    }

    /**
     * Squared distance to the {@code i}th nearest neighbor
     */
    public double distance(int i) {
        return distances[i];
    }

    public int k() {
        return neighbors.length;
    }

    /**
     * Squared distance to the farthest of the current k neighbors, infinite until k have been found
     */
    public double kthDistance() {
        return distances[distances.length - 1];
    }

    public int neighbor(int i) {
        return neighbors[i];
    }

    public int[] neighbors() {
        return neighbors.clone();
    }

    public int queryIndex() {
        return queryIndex;
    }

    public void setQueryIndex(int queryIndex) {
        this.queryIndex = queryIndex;
    }

    @Override
    public String toString() {
        return "KnnResult[" + queryIndex + " -> " + Arrays.toString(neighbors) + "]";
    }

    private static boolean precedes(double distance, int neighbor, double otherDistance, int otherNeighbor) {
        if (distance != otherDistance) {
            return distance < otherDistance;
        }
        return neighbor > otherNeighbor;
    }
}
