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

import com.hellblazer.parallax.cache.BlockDevice;
import com.hellblazer.parallax.cache.CacheArray;
import com.hellblazer.parallax.engine.Dataset;
import com.hellblazer.parallax.engine.DualTreeConfig;
import com.hellblazer.parallax.engine.RangeCountGnp;
import com.hellblazer.parallax.engine.TestTree;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class KdTreeMidpointBuilderTest {

    @Test
    void testEmptyPointsRejected() {
        var gnp = new RangeCountGnp();
        var param = gnp.createParam(DualTreeConfig.defaultConfig());
        param.bootstrapMonochromatic(gnp.createPoint(2), 0);
        var points = new CacheArray<>(gnp.pointSerializer(param));
        points.init(gnp.createPoint(2), 0, 4);
        var nodes = new CacheArray<>(gnp.nodeSerializer(param));
        nodes.init(gnp.createNode(2, param), 0, 4);

        assertThrows(IllegalArgumentException.class,
                     () -> KdTreeMidpointBuilder.build(DualTreeConfig.defaultConfig(), param, points, nodes));
    }

    @Test
    void testIdenticalPointsFormOneLeaf() {
        var tree = TestTree.build(new RangeCountGnp(), Dataset.of(2.0, 2.0, 2.0, 2.0, 2.0),
                                  DualTreeConfig.builder().withLeafSize(1).build());
        assertEquals(1, tree.nodes().size());
        assertTrue(tree.node(0).isLeaf());
        assertEquals(5, tree.node(0).count());
    }

    @Test
    void testPreorderLayoutAndRanges() {
        var dataset = TestTree.uniform(0x1234L, 500, 3);
        var config = DualTreeConfig.builder().withLeafSize(7).withBlockPoints(32).withBlockNodes(8).build();
        var tree = TestTree.build(new RangeCountGnp(), dataset, config);

        var root = tree.node(0);
        assertEquals(0, root.begin());
        assertEquals(500, root.count());
        assertEquals(tree.nodes().size(), verify(tree, 0, config.leafSize()));
    }

    @Test
    void testPointsArePermutedNotLost() {
        var dataset = TestTree.uniform(42L, 200, 2);
        var tree = TestTree.build(new RangeCountGnp(), dataset, DualTreeConfig.builder().withLeafSize(3).build());

        var seen = new HashSet<Integer>();
        for (int i = 0; i < tree.points().size(); i++) {
            try (var point = tree.points().read(i)) {
                var index = point.get().index();
                assertTrue(seen.add(index), "duplicate point " + index);
                var expected = dataset.point(index);
                for (int d = 0; d < expected.length; d++) {
                    assertEquals(expected[d], point.get().vec().getElement(d));
                }
            }
        }
        assertEquals(200, seen.size());
    }

    @Test
    void testReadOnlyArraysRejected() {
        var tree = TestTree.build(new RangeCountGnp(), Dataset.of(1.0, 2.0), DualTreeConfig.defaultConfig());
        tree.points().flushClear(BlockDevice.Mode.READ);
        var gnp = new RangeCountGnp();
        var nodes = new CacheArray<>(gnp.nodeSerializer(tree.param()));
        nodes.init(gnp.createNode(1, tree.param()), 0, 4);

        assertThrows(IllegalStateException.class,
                     () -> KdTreeMidpointBuilder.build(DualTreeConfig.defaultConfig(), tree.param(), tree.points(),
                                                       nodes));
    }

    @Test
    void testStatisticsFixed() {
        var dataset = TestTree.uniform(7L, 300, 2);
        var tree = TestTree.build(new RangeCountGnp(), dataset, DualTreeConfig.builder().withLeafSize(4).build());

        var expectedSum = Arrays.stream(dataset.points().toArray(new double[0][])).mapToDouble(p -> p[1]).sum();
        var rootStat = tree.node(0).stat();
        assertEquals(300, rootStat.count());
        assertEquals(expectedSum, rootStat.sum(1), 1e-9);
        for (int i = 0; i < tree.nodes().size(); i++) {
            var node = tree.node(i);
            assertEquals(node.count(), node.stat().count(), "statistic population of node " + i);
            assertEquals(1, node.stat().postprocessed(), "postprocess calls of node " + i);
        }
    }

    /**
     * Check the subtree at {@code index} and return the index one past its last node
     */
    private int verify(TestTree tree, int index, int leafSize) {
        var node = tree.node(index);
        for (int i = node.begin(); i < node.end(); i++) {
            try (var point = tree.points().read(i)) {
                assertTrue(node.bound().contains(point.get().vec()), "point " + i + " outside node " + index);
            }
        }
        if (node.isLeaf()) {
            assertTrue(node.count() <= leafSize, "leaf " + index + " holds " + node.count());
            return index + 1;
        }
        var left = tree.node(node.child(0));
        var right = tree.node(node.child(1));
        assertEquals(index + 1, node.child(0), "left child follows its parent");
        assertEquals(node.begin(), left.begin());
        assertEquals(left.end(), right.begin());
        assertEquals(node.end(), right.end());
        assertTrue(left.count() > 0 && right.count() > 0);

        var afterLeft = verify(tree, node.child(0), leafSize);
        assertEquals(afterLeft, node.child(1), "right child follows the left subtree");
        return verify(tree, node.child(1), leafSize);
    }
}
