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

import java.util.Map;

/**
 * Aggregate of the per grain results of a run. Accumulation must not depend on the order in which grains finish.
 *
 * @param <P> the parameter type
 * @param <G> the concrete global result type
 * @author hal.hildebrand
 */
public interface GlobalResult<P, G extends GlobalResult<P, G>> {

    void accumulate(P param, G other);

    void init(P param);

    /**
     * @return named summary values, in a stable order
     */
    Map<String, Object> report(P param);
}
