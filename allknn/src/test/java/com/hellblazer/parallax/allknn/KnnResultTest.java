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
package com.hellblazer.parallax.allknn;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class KnnResultTest {

    @Test
    void testEqualDistancesPreferHigherIndex() {
        var result = new KnnResult(3);
        result.consider(2, 1.0);
        result.consider(7, 1.0);
        result.consider(4, 1.0);
        assertArrayEquals(new int[] { 7, 4, 2 }, result.neighbors());

        assertFalse(result.consider(1, 1.0), "lower index at the kth distance does not displace");
        assertTrue(result.consider(9, 1.0));
        assertArrayEquals(new int[] { 9, 7, 4 }, result.neighbors());
    }

    @Test
    void testKeepsNearestInOrder() {
        var result = new KnnResult(2);
        assertEquals(Double.POSITIVE_INFINITY, result.kthDistance());
        assertEquals(KnnResult.NO_NEIGHBOR, result.neighbor(0));

        assertTrue(result.consider(5, 4.0));
        assertTrue(result.consider(3, 9.0));
        assertTrue(result.consider(8, 1.0));
        assertFalse(result.consider(6, 16.0));

        assertArrayEquals(new int[] { 8, 5 }, result.neighbors());
        assertEquals(1.0, result.distance(0));
        assertEquals(4.0, result.kthDistance());
    }

    @Test
    void testSerializedForm() {
        var serializer = KnnResult.serializer(2);
        var result = new KnnResult(2);
        result.setQueryIndex(12);
        result.consider(4, 0.5);

        var buffer = ByteBuffer.allocate(serializer.recordSize());
        serializer.serialize(result, buffer);
        assertFalse(buffer.hasRemaining());

        var copy = serializer.fromBytes(buffer.array());
        assertEquals(12, copy.queryIndex());
        assertArrayEquals(new int[] { 4, KnnResult.NO_NEIGHBOR }, copy.neighbors());
        assertEquals(Double.POSITIVE_INFINITY, copy.kthDistance());
    }
}
