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

import com.hellblazer.parallax.cache.CacheArray;
import com.hellblazer.parallax.engine.GrainSolver;
import com.hellblazer.parallax.engine.RunConfig;
import com.hellblazer.parallax.engine.tree.TreeNode;
import com.hellblazer.parallax.geometry.HRect;

import java.util.HashMap;
import java.util.Map;

/**
 * Dual-tree all k nearest neighbors for one grain.
 *
 * <p>Query and reference nodes are visited in pairs. A pair is pruned when the reference node cannot hold a point
 * closer than the current kth neighbor of every query point below the query node. Pairs at exactly that distance are
 * still visited, since an equally distant point with a higher index displaces the current kth neighbor.
 *
 * @author hal.hildebrand
 */
public class KnnSolver implements GrainSolver<KnnParam, KnnPoint, KnnStat, KnnResult, KnnGlobalResult> {

    private final Map<Integer, Double>     bounds       = new HashMap<>();
    private final KnnGlobalResult          globalResult = new KnnGlobalResult();
    private final Map<Integer, KnnPoint[]> leafPoints   = new HashMap<>();
    private       int                      queryBegin;
    private       CacheArray<KnnPoint>     queryPoints;
    private       KnnResult[]              queryResults;
    private       CacheArray<KnnPoint>     referencePoints;

    @Override
    public KnnGlobalResult globalResult() {
        return globalResult;
    }

    @Override
    public void initSolve(RunConfig runConfig, KnnParam param, int queryRoot, CacheArray<KnnPoint> qPoints,
                          CacheArray<TreeNode<KnnStat>> qNodes, CacheArray<KnnPoint> rPoints,
                          CacheArray<TreeNode<KnnStat>> rNodes, CacheArray<KnnResult> qResults) {
        globalResult.init(param);
        queryPoints = qPoints;
        referencePoints = rPoints;

        var queryViews = new ViewSource(qNodes, new HashMap<>());
        var referenceViews = rNodes == qNodes ? queryViews : new ViewSource(rNodes, new HashMap<>());
        var root = queryViews.view(queryRoot);
        queryBegin = root.begin;
        queryResults = new KnnResult[root.count];
        for (int i = 0; i < root.count; i++) {
            queryResults[i] = new KnnResult(param.k());
            try (var point = qPoints.read(root.begin + i)) {
                queryResults[i].setQueryIndex(point.get().index());
            }
        }

        solve(queryViews, queryRoot, referenceViews, 0);

        for (int i = 0; i < root.count; i++) {
            try (var result = qResults.write(root.begin + i)) {
                result.set(queryResults[i]);
            }
            globalResult.add(queryResults[i]);
        }
    }

    private void baseCase(NodeView query, NodeView reference, int referenceIndex) {
        var references = leafPoints.computeIfAbsent(referenceIndex, i -> load(reference));
        var bound = Double.NEGATIVE_INFINITY;
        for (int q = query.begin; q < query.begin + query.count; q++) {
            var result = queryResults[q - queryBegin];
            KnnPoint point;
            try (var handle = queryPoints.read(q)) {
                point = handle.get();
                for (var candidate : references) {
                    if (candidate.index() != point.index()) {
                        result.consider(candidate.index(), point.distanceSq(candidate));
                    }
                }
            }
            bound = Math.max(bound, result.kthDistance());
        }
        bounds.put(query.index, bound);
    }

    private double bound(int queryIndex) {
        return bounds.getOrDefault(queryIndex, Double.POSITIVE_INFINITY);
    }

    private KnnPoint[] load(NodeView leaf) {
        var points = new KnnPoint[leaf.count];
        for (int i = 0; i < leaf.count; i++) {
            try (var handle = referencePoints.read(leaf.begin + i)) {
                points[i] = handle.get().copy();
            }
        }
        return points;
    }

    private void solve(ViewSource queries, int queryIndex, ViewSource references, int referenceIndex) {
        var query = queries.view(queryIndex);
        var reference = references.view(referenceIndex);
        if (query.bound.minDistanceSq(reference.bound) > bound(queryIndex)) {
            return;
        }

        if (query.isLeaf() && reference.isLeaf()) {
            baseCase(query, reference, referenceIndex);
        } else if (query.isLeaf()) {
            solveReferenceChildren(queries, query, references, reference);
        } else if (reference.isLeaf()) {
            solve(queries, query.left, references, referenceIndex);
            solve(queries, query.right, references, referenceIndex);
            bounds.put(queryIndex, Math.max(bound(query.left), bound(query.right)));
        } else {
            var left = queries.view(query.left);
            var right = queries.view(query.right);
            solveReferenceChildren(queries, left, references, reference);
            solveReferenceChildren(queries, right, references, reference);
            bounds.put(queryIndex, Math.max(bound(query.left), bound(query.right)));
        }
    }

    /**
     * Visit the reference node's children, nearer child first
     */
    private void solveReferenceChildren(ViewSource queries, NodeView query, ViewSource references,
                                        NodeView reference) {
        var left = references.view(reference.left);
        var right = references.view(reference.right);
        if (query.bound.minDistanceSq(left.bound) <= query.bound.minDistanceSq(right.bound)) {
            solve(queries, query.index, references, reference.left);
            solve(queries, query.index, references, reference.right);
        } else {
            solve(queries, query.index, references, reference.right);
            solve(queries, query.index, references, reference.left);
        }
    }

    /**
     * The shape of a node, copied out of the node array
     */
    private record NodeView(int index, HRect bound, int begin, int count, int left, int right) {

        static NodeView of(CacheArray<TreeNode<KnnStat>> nodes, int index) {
            try (var handle = nodes.read(index)) {
                var node = handle.get();
                var bound = new HRect(node.bound().dimension());
                bound.copyFrom(node.bound());
                if (node.isLeaf()) {
                    return new NodeView(index, bound, node.begin(), node.count(), -1, -1);
                }
                return new NodeView(index, bound, node.begin(), node.count(), node.child(0), node.child(1));
            }
        }

        boolean isLeaf() {
            return left < 0;
        }
    }

    private record ViewSource(CacheArray<TreeNode<KnnStat>> nodes, Map<Integer, NodeView> views) {

        NodeView view(int index) {
            return views.computeIfAbsent(index, i -> NodeView.of(nodes, i));
        }
    }
}
