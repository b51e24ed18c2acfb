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
package com.hellblazer.parallax.engine.tree;

import com.hellblazer.parallax.cache.BlockDevice;
import com.hellblazer.parallax.cache.CacheArray;
import com.hellblazer.parallax.engine.DualTreeConfig;
import com.hellblazer.parallax.engine.StatFixer;
import com.hellblazer.parallax.engine.VectorPoint;
import com.hellblazer.parallax.geometry.HRect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a kd-tree over a point cache array by splitting each node's bounding box at the midpoint of its widest
 * dimension, until nodes hold at most {@link DualTreeConfig#leafSize()} points.
 *
 * <p>Points are reordered in place so every node owns a contiguous range of the point array. Nodes are appended to
 * the (initially empty) node array in preorder: a node's subtree occupies the contiguous index range starting at the
 * node itself. Statistics are fixed once the shape is complete.
 *
 * @author hal.hildebrand
 */
public final class KdTreeMidpointBuilder<P, PT extends VectorPoint, S extends NodeStatistic<P, PT, S>> {
    private static final Logger log = LoggerFactory.getLogger(KdTreeMidpointBuilder.class);

    private final int                     dimension;
    private final int                     leafSize;
    private final CacheArray<TreeNode<S>> nodes;
    private final CacheArray<PT>          points;
    private       int                     leaves;

    private KdTreeMidpointBuilder(int dimension, int leafSize, CacheArray<PT> points, CacheArray<TreeNode<S>> nodes) {
        this.dimension = dimension;
        this.leafSize = leafSize;
        this.points = points;
        this.nodes = nodes;
    }

    /**
     * Build the tree and fix its statistics.
     *
     * @param points the points, in a writable mode
     * @param nodes  an empty node array whose default record has the points' dimension
     */
    public static <P, PT extends VectorPoint, S extends NodeStatistic<P, PT, S>> void build(DualTreeConfig config,
                                                                                           P param,
                                                                                           CacheArray<PT> points,
                                                                                           CacheArray<TreeNode<S>> nodes) {
        if (points.mode() == BlockDevice.Mode.READ || nodes.mode() == BlockDevice.Mode.READ) {
            throw new IllegalStateException("Tree construction requires writable point and node arrays");
        }
        if (nodes.size() != 0) {
            throw new IllegalArgumentException("Node array must be empty, holds " + nodes.size() + " nodes");
        }
        int dimension;
        try (var first = points.read(0)) {
            dimension = first.get().vec().getSize();
        } catch (IndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Cannot build a tree over an empty point array", e);
        }

        var builder = new KdTreeMidpointBuilder<>(dimension, config.leafSize(), points, nodes);
        builder.split(0, points.size());
        log.debug("Built kd-tree of {} nodes, {} leaves over {} points (leaf size {})", nodes.size(), builder.leaves,
                  points.size(), config.leafSize());

        StatFixer.fix(param, points, nodes);
    }

    private HRect boundOf(int begin, int end) {
        var bound = new HRect(dimension);
        for (int i = begin; i < end; i++) {
            try (var point = points.read(i)) {
                bound.include(point.get().vec());
            }
        }
        return bound;
    }

    private double coordinate(int index, int d) {
        try (var point = points.read(index)) {
            return point.get().vec().getElement(d);
        }
    }

    /**
     * @return the index of the first point at or above the split value
     */
    private int partition(int begin, int end, int d, double split) {
        int left = begin;
        int right = end - 1;
        while (left <= right) {
            if (coordinate(left, d) < split) {
                left++;
            } else {
                swap(left, right);
                right--;
            }
        }
        return left;
    }

    private int split(int begin, int count) {
        var nodeIndex = nodes.alloc(1);
        var bound = boundOf(begin, begin + count);
        var left = -1;
        var right = -1;

        if (count > leafSize) {
            var d = bound.widestDimension();
            var range = bound.get(d);
            var middle = partition(begin, begin + count, d, range.mid());
            var leftCount = middle - begin;
            // identical points cannot be separated
            if (leftCount > 0 && leftCount < count) {
                left = split(begin, leftCount);
                right = split(middle, count - leftCount);
            }
        }

        try (var handle = nodes.write(nodeIndex)) {
            var node = handle.get();
            node.bound().copyFrom(bound);
            node.setRange(begin, count);
            if (left < 0) {
                node.setLeaf();
                leaves++;
            } else {
                node.setChildren(left, right);
            }
        }
        return nodeIndex;
    }

    private void swap(int i, int j) {
        if (i == j) {
            return;
        }
        try (var a = points.write(i); var b = points.write(j)) {
            var first = a.get();
            var second = b.get();
            a.set(second);
            b.set(first);
        }
    }
}
