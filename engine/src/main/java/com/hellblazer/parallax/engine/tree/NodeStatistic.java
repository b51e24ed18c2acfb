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

import com.hellblazer.parallax.geometry.HRect;

/**
 * Summary of the points below a tree node, maintained bottom up by the statistic fixer.
 *
 * <p>A fix visits a node once: {@link #reset}, then either one point {@code accumulate} per point of a leaf or one
 * child {@code accumulate} per child of an internal node, then a single {@link #postprocess}.
 *
 * @param <P>  the parameter type
 * @param <PT> the point type
 * @param <S>  the concrete statistic type
 * @author hal.hildebrand
 */
public interface NodeStatistic<P, PT, S extends NodeStatistic<P, PT, S>> {

    void accumulate(P param, PT point);

    void accumulate(P param, S child, HRect childBound, int childCount);

    void postprocess(P param, HRect bound, int count);

    void reset(P param);
}
