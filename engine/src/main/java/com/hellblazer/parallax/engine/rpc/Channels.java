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
package com.hellblazer.parallax.engine.rpc;

/**
 * Channel numbers shared by every rank of a distributed run
 *
 * @author hal.hildebrand
 */
public final class Channels {
    /**
     * First of the barrier channels. Phase transitions use {@code BARRIER + 0} through {@code BARRIER + 3}.
     */
    public static final int BARRIER          = 100;
    public static final int CONFIG           = 121;
    public static final int DATA_NODES       = 111;
    public static final int DATA_POINTS      = 110;
    public static final int PARAM            = 120;
    public static final int Q_RESULTS        = 112;
    /**
     * Barrier crossed by every rank before its RPC services shut down
     */
    public static final int SHUTDOWN_BARRIER = BARRIER + 4;
    public static final int WORK             = 122;

    private Channels() {
    }
}
