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

import com.hellblazer.parallax.engine.GlobalResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Order independent summary of the neighbors found: how many queries were answered, the range of their kth neighbor
 * distances and a checksum of every (query, rank, neighbor) triple.
 *
 * @author hal.hildebrand
 */
public final class KnnGlobalResult implements GlobalResult<KnnParam, KnnGlobalResult> {
    private double maxKthDistance;
    private double minKthDistance;
    private long   neighborChecksum;
    private long   nQueries;

    @Override
    public void accumulate(KnnParam param, KnnGlobalResult other) {
        nQueries += other.nQueries;
        neighborChecksum += other.neighborChecksum;
        maxKthDistance = Math.max(maxKthDistance, other.maxKthDistance);
        minKthDistance = Math.min(minKthDistance, other.minKthDistance);
    }

    /**
     * Fold one answered query into the summary
     */
    public void add(KnnResult result) {
        nQueries++;
        var query = result.queryIndex() + 1L;
        for (int i = 0; i < result.k(); i++) {
            neighborChecksum += query * 1_000_003L * (i + 1) + result.neighbor(i) + 1L;
        }
        maxKthDistance = Math.max(maxKthDistance, result.kthDistance());
        minKthDistance = Math.min(minKthDistance, result.kthDistance());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KnnGlobalResult that)) {
            return false;
        }
        return nQueries == that.nQueries && neighborChecksum == that.neighborChecksum
        && Double.compare(maxKthDistance, that.maxKthDistance) == 0
        && Double.compare(minKthDistance, that.minKthDistance) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nQueries, neighborChecksum, maxKthDistance, minKthDistance);
    }

    @Override
    public void init(KnnParam param) {
        nQueries = 0;
        neighborChecksum = 0;
        maxKthDistance = Double.NEGATIVE_INFINITY;
        minKthDistance = Double.POSITIVE_INFINITY;
    }

    public double maxKthDistance() {
        return maxKthDistance;
    }

    public double minKthDistance() {
        return minKthDistance;
    }

    public long neighborChecksum() {
        return neighborChecksum;
    }

    public long nQueries() {
        return nQueries;
    }

    @Override
    public Map<String, Object> report(KnnParam param) {
        var report = new LinkedHashMap<String, Object>();
        report.put("k", param.k());
        report.put("n_queries", nQueries);
        report.put("min_kth_distance", minKthDistance);
        report.put("max_kth_distance", maxKthDistance);
        report.put("neighbor_checksum", neighborChecksum);
        return report;
    }

    @Override
    public String toString() {
        return "KnnGlobalResult[queries=" + nQueries + ", kth in [" + minKthDistance + ", " + maxKthDistance
        + "], checksum=" + neighborChecksum + "]";
    }
}
