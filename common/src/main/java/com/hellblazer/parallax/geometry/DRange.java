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
package com.hellblazer.parallax.geometry;

/**
 * A closed interval of doubles, one axis of an {@link HRect}. An empty range has {@code lo > hi}.
 *
 * @author hal.hildebrand
 */
public final class DRange {
    private double lo;
    private double hi;

    public DRange() {
        reset();
    }

    public DRange(double lo, double hi) {
        this.lo = lo;
        this.hi = hi;
    }

    public boolean contains(double value) {
        return value >= lo && value <= hi;
    }

    public double hi() {
        return hi;
    }

    public void include(double value) {
        if (value < lo) {
            lo = value;
        }
        if (value > hi) {
            hi = value;
        }
    }

    public void include(DRange other) {
        if (other.isEmpty()) {
            return;
        }
        include(other.lo);
        include(other.hi);
    }

    public boolean isEmpty() {
        return lo > hi;
    }

    public double lo() {
        return lo;
    }

    /**
     * Distance from the value to the nearest end of this range, 0 when contained
     */
    public double distance(double value) {
        if (value < lo) {
            return lo - value;
        }
        if (value > hi) {
            return value - hi;
        }
        return 0.0;
    }

    /**
     * Gap between this range and the other, 0 when they overlap
     */
    public double gap(DRange other) {
        if (other.lo > hi) {
            return other.lo - hi;
        }
        if (lo > other.hi) {
            return lo - other.hi;
        }
        return 0.0;
    }

    /**
     * Largest distance between any value in this range and any value in the other
     */
    public double span(DRange other) {
        return Math.max(other.hi - lo, hi - other.lo);
    }

    public double mid() {
        return (lo + hi) / 2.0;
    }

    public void reset() {
        lo = Double.POSITIVE_INFINITY;
        hi = Double.NEGATIVE_INFINITY;
    }

    public void set(double lo, double hi) {
        this.lo = lo;
        this.hi = hi;
    }

    public double width() {
        return isEmpty() ? 0.0 : hi - lo;
    }

    @Override
    public String toString() {
        return "[" + lo + ", " + hi + "]";
    }
}
