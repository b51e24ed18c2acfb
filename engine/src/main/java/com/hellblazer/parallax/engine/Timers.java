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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named phase timings, reported in the order the phases started
 *
 * @author hal.hildebrand
 */
public class Timers {
    private final Map<String, Duration> elapsed = new LinkedHashMap<>();
    private final Map<String, Long>     running = new LinkedHashMap<>();

    public synchronized Map<String, Duration> elapsed() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(elapsed));
    }

    public synchronized void start(String name) {
        if (running.putIfAbsent(name, System.nanoTime()) != null) {
            throw new IllegalStateException("Timer " + name + " already running");
        }
        elapsed.putIfAbsent(name, Duration.ZERO);
    }

    public synchronized Duration stop(String name) {
        var started = running.remove(name);
        if (started == null) {
            throw new IllegalStateException("Timer " + name + " is not running");
        }
        var total = elapsed.get(name).plusNanos(System.nanoTime() - started);
        elapsed.put(name, total);
        return total;
    }

    @Override
    public synchronized String toString() {
        var sb = new StringBuilder();
        elapsed.forEach((name, duration) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(name).append('=').append(duration.toMillis()).append("ms");
        });
        return sb.toString();
    }
}
