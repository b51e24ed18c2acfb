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
package com.hellblazer.parallax.engine.work;

import com.hellblazer.parallax.cache.CacheArray;
import com.hellblazer.parallax.engine.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static work queue over a preorder laid out tree. The tree is cut into grains by repeatedly splitting the frontier
 * subtree holding the most points until the requested number of grains exists or only leaves remain on the frontier.
 * Grains are handed out one per call in node index order.
 *
 * <p>Every point lies under exactly one grain, and the grains' subtrees are disjoint node index ranges. Not thread
 * safe, see {@link LockedWorkQueue}.
 *
 * @author hal.hildebrand
 */
public class SimpleWorkQueue implements WorkQueue {
    private static final Logger log = LoggerFactory.getLogger(SimpleWorkQueue.class);

    private List<Integer> grains = List.of();
    private int           next;

    /**
     * @param nodes     the tree, root at index 0
     * @param requested the number of grains wanted, at least 1
     */
    public void init(CacheArray<? extends TreeNode<?>> nodes, int requested) {
        if (requested < 1) {
            throw new IllegalArgumentException("At least one grain is required: " + requested);
        }
        next = 0;
        if (nodes.size() == 0) {
            grains = List.of();
            return;
        }

        var frontier = new ArrayList<Frontier>();
        frontier.add(frontier(nodes, 0));
        while (frontier.size() < requested) {
            Frontier largest = null;
            for (var candidate : frontier) {
                if (!candidate.leaf && (largest == null || candidate.count > largest.count)) {
                    largest = candidate;
                }
            }
            if (largest == null) {
                break;
            }
            frontier.remove(largest);
            frontier.add(frontier(nodes, largest.left));
            frontier.add(frontier(nodes, largest.right));
        }

        var roots = new ArrayList<Integer>(frontier.size());
        for (var f : frontier) {
            roots.add(f.index);
        }
        Collections.sort(roots);
        grains = Collections.unmodifiableList(roots);
        log.debug("Cut {} grains of {} requested from {} nodes", grains.size(), requested, nodes.size());
    }

    @Override
    public List<Integer> getWork() {
        if (next >= grains.size()) {
            return List.of();
        }
        return List.of(grains.get(next++));
    }

    /**
     * Every grain of the queue in delivery order, including those already delivered
     */
    public List<Integer> grains() {
        return grains;
    }

    public int nGrains() {
        return grains.size();
    }

    private Frontier frontier(CacheArray<? extends TreeNode<?>> nodes, int index) {
        try (var handle = nodes.read(index)) {
            var node = handle.get();
            if (node.isLeaf()) {
                return new Frontier(index, node.count(), true, -1, -1);
            }
            return new Frontier(index, node.count(), false, node.child(0), node.child(1));
        }
    }

    private record Frontier(int index, int count, boolean leaf, int left, int right) {
    }
}
