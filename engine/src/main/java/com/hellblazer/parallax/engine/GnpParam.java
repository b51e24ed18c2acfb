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

/**
 * Problem wide parameters of a generalized N-body problem. Immutable once published to the solvers.
 *
 * @param <PT> the point type
 * @author hal.hildebrand
 */
public interface GnpParam<PT extends VectorPoint> {

    /**
     * Complete initialization for a problem whose query and reference sets are the same {@code count} points.
     *
     * @param defaultPoint a point of the data set's dimension, used as the default record of the point array
     * @param count        the number of points
     */
    void bootstrapMonochromatic(PT defaultPoint, int count);

    /**
     * The dimension of the points, known once bootstrapped
     */
    int dimension();
}
