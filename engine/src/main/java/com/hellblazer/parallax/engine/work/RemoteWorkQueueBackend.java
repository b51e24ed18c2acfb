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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Serves a work queue to remote ranks. Requests from different ranks and from the owner's own threads are
 * serialized, so a grain is delivered to exactly one caller.
 *
 * @author hal.hildebrand
 */
public class RemoteWorkQueueBackend {
    private static final Logger log = LoggerFactory.getLogger(RemoteWorkQueueBackend.class);

    private final WorkQueue queue;

    public RemoteWorkQueueBackend(WorkQueue queue) {
        Objects.requireNonNull(queue, "Queue cannot be null");
        this.queue = queue instanceof LockedWorkQueue ? queue : new LockedWorkQueue(queue);
    }

    public List<Integer> getWork(int requester) {
        var work = queue.getWork();
        log.debug("Rank {} took grains {}", requester, work);
        return work;
    }
}
