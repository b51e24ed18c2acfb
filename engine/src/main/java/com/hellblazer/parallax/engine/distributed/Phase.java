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
package com.hellblazer.parallax.engine.distributed;

/**
 * Phases of a distributed monochromatic run, in order. Every rank crosses a barrier at the end of each phase from
 * {@link #CONFIGURE} through {@link #FLUSH_RESULTS}.
 *
 * @author hal.hildebrand
 */
public enum Phase {
    /**
     * Select the rank's configuration scope and start RPC
     */
    PREINIT(-1),
    /**
     * Master loads data, builds the tree and publishes it; workers attach to the published objects
     */
    CONFIGURE(0),
    /**
     * Flush data to a consistent read state, and open results for creation
     */
    FLUSH_DATA(1),
    COMPUTE(2),
    /**
     * Write every rank's results back to the master
     */
    FLUSH_RESULTS(3),
    DONE(-1);

    private final int barrierOffset;

    Phase(int barrierOffset) {
        this.barrierOffset = barrierOffset;
    }

    /**
     * @return the offset of the barrier ending this phase from the first barrier channel, -1 for phases not ended by
     * a barrier
     */
    public int barrierOffset() {
        return barrierOffset;
    }
}
