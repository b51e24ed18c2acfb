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

import java.util.Objects;

/**
 * Modify lease on a record. The record is marked dirty when the lease is acquired, so changes made through
 * {@link #get()} are written back on the next flush.
 *
 * @author hal.hildebrand
 */
public final class CacheWrite<T> extends CacheHandle<T> {

    CacheWrite(CacheArray<T> array, int index, T record) {
        super(array, index, record);
    }

    /**
     * Store a different record object in the leased slot. The array takes ownership of the record.
     */
    public void set(T record) {
        checkLive();
        Objects.requireNonNull(record, "Record cannot be null");
        array.store(index, record);
        replace(record);
    }

    @Override
    public String toString() {
        return "CacheWrite[" + index + (isReleased() ? ", released]" : "]");
    }
}
