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
package com.hellblazer.parallax.engine.tree;

import com.hellblazer.parallax.cache.RecordSerializer;
import com.hellblazer.parallax.geometry.HRect;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * A node of a binary space partitioning tree stored as a record of a node cache array. Nodes refer to their children
 * by index and own the contiguous range {@code [begin, begin + count)} of the point array.
 *
 * @param <S> the statistic type
 * @author hal.hildebrand
 */
public final class TreeNode<S> {
    public static final int NO_CHILD = -1;

    private final HRect bound;
    private final S     stat;
    private       int   begin;
    private       int   count;
    private       int   left  = NO_CHILD;
    private       int   right = NO_CHILD;

    public TreeNode(int dimension, S stat) {
        this(new HRect(dimension), stat);
    }

    private TreeNode(HRect bound, S stat) {
        this.bound = bound;
        this.stat = Objects.requireNonNull(stat, "Statistic cannot be null");
    }

    /**
     * Serializer for nodes of the given dimension carrying statistics serialized by {@code statSerializer}
     */
    public static <S> RecordSerializer<TreeNode<S>> serializer(int dimension, RecordSerializer<S> statSerializer) {
        return new Serializer<>(dimension, statSerializer);
    }

    public int begin() {
        return begin;
    }

    public HRect bound() {
        return bound;
    }

    public int child(int k) {
        return switch (k) {
            case 0 -> left;
            case 1 -> right;
            default -> throw new IndexOutOfBoundsException("Child " + k + " of a binary node");
        };
    }

    /**
     * @return 0 for a leaf, 2 otherwise
     */
    public int childCount() {
        return left == NO_CHILD ? 0 : 2;
    }

    public int count() {
        return count;
    }

    public int end() {
        return begin + count;
    }

    public boolean isLeaf() {
        return left == NO_CHILD;
    }

    public void setChildren(int left, int right) {
        if (left < 0 || right < 0) {
            throw new IllegalArgumentException("Invalid children: " + left + ", " + right);
        }
        this.left = left;
        this.right = right;
    }

    public void setLeaf() {
        left = NO_CHILD;
        right = NO_CHILD;
    }

    public void setRange(int begin, int count) {
        if (begin < 0 || count < 0) {
            throw new IllegalArgumentException("Invalid point range: " + begin + " + " + count);
        }
        this.begin = begin;
        this.count = count;
    }

    public S stat() {
        return stat;
    }

    @Override
    public String toString() {
        var children = isLeaf() ? "leaf" : left + "," + right;
        return "TreeNode{begin=" + begin + ", count=" + count + ", children=" + children + ", " + bound + '}';
    }

    private record Serializer<S>(int dimension, RecordSerializer<S> statSerializer)
    implements RecordSerializer<TreeNode<S>> {

        @Override
        public TreeNode<S> deserialize(ByteBuffer buffer) {
            var bound = new HRect(dimension);
            bound.readFrom(buffer);
            var begin = buffer.getInt();
            var count = buffer.getInt();
            var left = buffer.getInt();
            var right = buffer.getInt();
            var node = new TreeNode<>(bound, statSerializer.deserialize(buffer));
            node.begin = begin;
            node.count = count;
            node.left = left;
            node.right = right;
            return node;
        }

        @Override
        public int recordSize() {
            return HRect.serializedSize(dimension) + 4 * Integer.BYTES + statSerializer.recordSize();
        }

        @Override
        public void serialize(TreeNode<S> node, ByteBuffer buffer) {
            node.bound.writeTo(buffer);
            buffer.putInt(node.begin);
            buffer.putInt(node.count);
            buffer.putInt(node.left);
            buffer.putInt(node.right);
            statSerializer.serialize(node.stat, buffer);
        }
    }
}
