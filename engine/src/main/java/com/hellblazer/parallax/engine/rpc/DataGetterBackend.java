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

import com.hellblazer.parallax.cache.RecordSerializer;

import java.util.Objects;

/**
 * Serves a published object to remote readers. The object is serialized when published; later changes to it are
 * not visible remotely.
 *
 * @param <T> the published type
 * @author hal.hildebrand
 */
public final class DataGetterBackend<T> {
    private final byte[] payload;

    public DataGetterBackend(RecordSerializer<T> serializer, T value) {
        Objects.requireNonNull(serializer, "Serializer cannot be null");
        Objects.requireNonNull(value, "Published value cannot be null");
        this.payload = serializer.toBytes(value);
    }

    public byte[] payload() {
        return payload.clone();
    }
}
