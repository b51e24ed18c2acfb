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

import com.hellblazer.parallax.cache.CacheArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Points read from an input source, all of one dimension. Point {@code i} keeps index {@code i} for the whole run.
 *
 * @author hal.hildebrand
 */
public record Dataset(int dimension, List<double[]> points) {

    public Dataset {
        if (dimension < 1) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        var copy = new ArrayList<double[]>(points.size());
        for (int i = 0; i < points.size(); i++) {
            var point = points.get(i);
            if (point.length != dimension) {
                throw new IllegalArgumentException(
                "Point " + i + " has dimension " + point.length + ", expected " + dimension);
            }
            copy.add(point.clone());
        }
        points = Collections.unmodifiableList(copy);
    }

    /**
     * One dimensional data set
     */
    public static Dataset of(double... values) {
        var points = new ArrayList<double[]>(values.length);
        for (var value : values) {
            points.add(new double[] { value });
        }
        return new Dataset(1, points);
    }

    /**
     * Write the coordinates and index of every point into the first {@link #size()} records of the array
     */
    public <PT extends VectorPoint> void copyInto(CacheArray<PT> array) {
        if (array.size() < size()) {
            throw new IllegalArgumentException("Array of " + array.size() + " records cannot hold " + size() + " points");
        }
        for (int i = 0; i < size(); i++) {
            try (var handle = array.write(i)) {
                var point = handle.get();
                point.vec().set(points.get(i));
                point.setIndex(i);
            }
        }
    }

    public double[] point(int index) {
        return points.get(index).clone();
    }

    public int size() {
        return points.size();
    }
}
