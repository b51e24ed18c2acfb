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

import javax.vecmath.GVector;
import java.nio.ByteBuffer;

/**
 * Axis aligned hyper-rectangle used as the bounding region of a tree node.
 *
 * <p>All distances are squared Euclidean distances, the form the dual-tree problems compare against.
 *
 * @author hal.hildebrand
 */
public final class HRect {
    private final DRange[] ranges;

    public HRect(int dimension) {
        if (dimension < 0) {
            throw new IllegalArgumentException("Dimension must be non-negative: " + dimension);
        }
        ranges = new DRange[dimension];
        for (int d = 0; d < dimension; d++) {
            ranges[d] = new DRange();
        }
    }

    /**
     * Number of bytes {@link #writeTo(ByteBuffer)} produces for the given dimension
     */
    public static int serializedSize(int dimension) {
        return dimension * 2 * Double.BYTES;
    }

    public boolean contains(GVector point) {
        for (int d = 0; d < ranges.length; d++) {
            if (!ranges[d].contains(point.getElement(d))) {
                return false;
            }
        }
        return true;
    }

    public void copyFrom(HRect other) {
        checkDimension(other);
        for (int d = 0; d < ranges.length; d++) {
            ranges[d].set(other.ranges[d].lo(), other.ranges[d].hi());
        }
    }

    public int dimension() {
        return ranges.length;
    }

    public DRange get(int dimension) {
        return ranges[dimension];
    }

    public void include(GVector point) {
        for (int d = 0; d < ranges.length; d++) {
            ranges[d].include(point.getElement(d));
        }
    }

    public void include(HRect other) {
        checkDimension(other);
        for (int d = 0; d < ranges.length; d++) {
            ranges[d].include(other.ranges[d]);
        }
    }

    public boolean isEmpty() {
        for (var range : ranges) {
            if (range.isEmpty()) {
                return true;
            }
        }
        return ranges.length == 0;
    }

    public double maxDistanceSq(HRect other) {
        checkDimension(other);
        double sum = 0.0;
        for (int d = 0; d < ranges.length; d++) {
            var span = ranges[d].span(other.ranges[d]);
            sum += span * span;
        }
        return sum;
    }

    public double minDistanceSq(GVector point) {
        double sum = 0.0;
        for (int d = 0; d < ranges.length; d++) {
            var delta = ranges[d].distance(point.getElement(d));
            sum += delta * delta;
        }
        return sum;
    }

    public double minDistanceSq(HRect other) {
        checkDimension(other);
        double sum = 0.0;
        for (int d = 0; d < ranges.length; d++) {
            var gap = ranges[d].gap(other.ranges[d]);
            sum += gap * gap;
        }
        return sum;
    }

    public void readFrom(ByteBuffer buffer) {
        for (var range : ranges) {
            range.set(buffer.getDouble(), buffer.getDouble());
        }
    }

    public void reset() {
        for (var range : ranges) {
            range.reset();
        }
    }

    /**
     * @return the dimension with the widest extent, 0 for an empty rectangle
     */
    public int widestDimension() {
        int widest = 0;
        double width = -1.0;
        for (int d = 0; d < ranges.length; d++) {
            var w = ranges[d].width();
            if (w > width) {
                width = w;
                widest = d;
            }
        }
        return widest;
    }

    public void writeTo(ByteBuffer buffer) {
        for (var range : ranges) {
            buffer.putDouble(range.lo());
            buffer.putDouble(range.hi());
        }
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("HRect{");
        for (int d = 0; d < ranges.length; d++) {
            if (d > 0) {
                sb.append(" x ");
            }
            sb.append(ranges[d]);
        }
        return sb.append('}').toString();
    }

    private void checkDimension(HRect other) {
        if (other.ranges.length != ranges.length) {
            throw new IllegalArgumentException(
            "Dimension mismatch: " + ranges.length + " != " + other.ranges.length);
        }
    }
}
