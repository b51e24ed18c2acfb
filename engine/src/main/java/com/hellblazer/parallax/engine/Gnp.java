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

import com.hellblazer.parallax.cache.RecordSerializer;
import com.hellblazer.parallax.engine.tree.NodeStatistic;
import com.hellblazer.parallax.engine.tree.TreeNode;

/**
 * A generalized N-body problem: the bundle of types and factories the dual-tree drivers need to solve it.
 *
 * @param <P>  parameters
 * @param <PT> points
 * @param <S>  node statistics
 * @param <R>  per query point results
 * @param <G>  global result
 * @author hal.hildebrand
 */
public interface Gnp<P extends GnpParam<PT>, PT extends VectorPoint, S extends NodeStatistic<P, PT, S>, R, G extends GlobalResult<P, G>> {

    default TreeNode<S> createNode(int dimension, P param) {
        return new TreeNode<>(dimension, createStat(param));
    }

    /**
     * @return an initialized, empty global result
     */
    default G createGlobalResult(P param) {
        var result = newGlobalResult();
        result.init(param);
        return result;
    }

    /**
     * Parameters initialized from the configuration, not yet bootstrapped
     */
    P createParam(DualTreeConfig config);

    PT createPoint(int dimension);

    /**
     * The default result record, the value of every result before its query point is solved
     */
    R createResult(P param);

    GrainSolver<P, PT, S, R, G> createSolver();

    S createStat(P param);

    String name();

    G newGlobalResult();

    default RecordSerializer<TreeNode<S>> nodeSerializer(P param) {
        return TreeNode.serializer(param.dimension(), statSerializer(param));
    }

    RecordSerializer<P> paramSerializer();

    RecordSerializer<PT> pointSerializer(P param);

    RecordSerializer<R> resultSerializer(P param);

    RecordSerializer<S> statSerializer(P param);
}
