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

import java.util.List;

/**
 * Source of grains, the query subtree roots handed to solver threads.
 *
 * <p>A grain is delivered at most once. Once a queue returns an empty list it returns an empty list forever.
 *
 * @author hal.hildebrand
 */
public interface WorkQueue {

    /**
     * @return the next grains, empty when the queue is exhausted
     */
    List<Integer> getWork();
}
