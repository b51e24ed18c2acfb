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

import com.hellblazer.parallax.cache.BlockDevice;
import com.hellblazer.parallax.cache.CacheArray;
import com.hellblazer.parallax.engine.tree.NodeStatistic;
import com.hellblazer.parallax.engine.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes the statistic of every node of a tree, children before parents, starting from the root at index 0.
 *
 * <p>The fixer works through its own READ view of the points and MODIFY view of the nodes, opened over the devices
 * of the given arrays. The given arrays are flushed before the fix and their caches dropped after it, so they observe
 * the fixed statistics. Neither array may have leases outstanding.
 *
 * @author hal.hildebrand
 */
public final class StatFixer<P, PT, S extends NodeStatistic<P, PT, S>> {
    private static final Logger log = LoggerFactory.getLogger(StatFixer.class);

    private final CacheArray<TreeNode<S>> nodes;
    private final P                       param;
    private final CacheArray<PT>          points;
    private       int                     visited;

    private StatFixer(P param, CacheArray<PT> points, CacheArray<TreeNode<S>> nodes) {
        this.param = param;
        this.points = points;
        this.nodes = nodes;
    }

    public static <P, PT, S extends NodeStatistic<P, PT, S>> void fix(P param, CacheArray<PT> points,
                                                                     CacheArray<TreeNode<S>> nodes) {
        points.flush();
        nodes.flush();
        if (nodes.size() == 0) {
            return;
        }

        var pointView = new CacheArray<>(points.serializer());
        pointView.init(points.device(), BlockDevice.Mode.READ);
        var nodeView = new CacheArray<>(nodes.serializer());
        nodeView.init(nodes.device(), BlockDevice.Mode.MODIFY);

        var fixer = new StatFixer<>(param, pointView, nodeView);
        fixer.fixRecursively(0);
        nodeView.flush();
        log.debug("Fixed statistics of {} nodes", fixer.visited);

        nodes.flushClear(nodes.mode());
    }

    private void fixRecursively(int nodeIndex) {
        try (var handle = nodes.write(nodeIndex)) {
            var node = handle.get();
            var stat = node.stat();
            stat.reset(param);

            if (node.isLeaf()) {
                for (int i = node.begin(); i < node.end(); i++) {
                    try (var point = points.read(i)) {
                        stat.accumulate(param, point.get());
                    }
                }
            } else {
                for (int k = 0; k < node.childCount(); k++) {
                    var childIndex = node.child(k);
                    fixRecursively(childIndex);
                    try (var child = nodes.read(childIndex)) {
                        stat.accumulate(param, child.get().stat(), child.get().bound(), child.get().count());
                    }
                }
            }
            stat.postprocess(param, node.bound(), node.count());
            visited++;
        }
    }
}
