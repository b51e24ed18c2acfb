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
import com.hellblazer.parallax.engine.tree.TreeNode;

/**
 * Solves one grain: the query subtree rooted at a node, against the whole reference tree. A fresh solver is created
 * for every grain.
 *
 * @author hal.hildebrand
 */
public interface GrainSolver<P, PT extends VectorPoint, S, R, G extends GlobalResult<P, G>> {

    /**
     * The contribution of the solved grain, valid after {@link #initSolve}
     */
    G globalResult();

    /**
     * Solve the query subtree rooted at {@code queryRoot}, writing one result per query point into {@code qResults}
     * at the point's position.
     *
     * @param runConfig the settings of the run this grain belongs to
     */
    void initSolve(RunConfig runConfig, P param, int queryRoot, CacheArray<PT> qPoints,
                   CacheArray<TreeNode<S>> qNodes, CacheArray<PT> rPoints, CacheArray<TreeNode<S>> rNodes,
                   CacheArray<R> qResults);
}
