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
package com.hellblazer.parallax.cache;

/**
 * A scoped lease on one record of a {@link CacheArray}. The lease must be closed before the array is cleared, and a
 * closed lease cannot be used again.
 *
 * @param <T> the record type
 * @author hal.hildebrand
 */
public abstract sealed class CacheHandle<T> implements AutoCloseable permits CacheRead, CacheWrite {

    protected final CacheArray<T> array;
    protected final int           index;
    private         boolean       released;
    private         T             record;

    CacheHandle(CacheArray<T> array, int index, T record) {
        this.array = array;
        this.index = index;
        this.record = record;
    }

    @Override
    public void close() {
        if (released) {
            throw new IllegalStateException("Handle on record " + index + " already released");
        }
        released = true;
        record = null;
        array.release();
    }

    /**
     * @return the leased record
     * @throws IllegalStateException if the handle has been released
     */
    public T get() {
        checkLive();
        return record;
    }

    public int index() {
        return index;
    }

    public boolean isReleased() {
        return released;
    }

    protected void checkLive() {
        if (released) {
            throw new IllegalStateException("Handle on record " + index + " used after release");
        }
    }

    void replace(T replacement) {
        record = replacement;
    }
}
