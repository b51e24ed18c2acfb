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

import com.hellblazer.parallax.engine.Dataset;

/**
 * Brute force all k nearest neighbors, the baseline the dual-tree results are checked against
 *
 * @author hal.hildebrand
 */
public final class NaiveAllKnn {

    private NaiveAllKnn() {
    }

    /**
     * @return the neighbors of every point, indexed by point index
     */
    public static KnnResult[] solve(Dataset dataset, int k) {
        var points = new KnnPoint[dataset.size()];
        for (int i = 0; i < points.length; i++) {
            points[i] = new KnnPoint(dataset.dimension());
            points[i].vec().set(dataset.point(i));
            points[i].setIndex(i);
        }
        var results = new KnnResult[points.length];
        for (int q = 0; q < points.length; q++) {
            results[q] = new KnnResult(k);
            results[q].setQueryIndex(q);
            for (int r = 0; r < points.length; r++) {
                if (r != q) {
                    results[q].consider(r, points[q].distanceSq(points[r]));
                }
            }
        }
        return results;
    }
}
