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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CsvDatasetLoaderTest {

    private final CsvDatasetLoader loader = new CsvDatasetLoader();

    @TempDir
    Path tempDir;

    @Test
    void testBadInputRejected() {
        assertThrows(IllegalArgumentException.class, () -> read("1,2\n3\n"));
        assertThrows(IllegalArgumentException.class, () -> read("1,two\n"));
        assertThrows(IllegalArgumentException.class, () -> read("# nothing here\n\n"));
    }

    @Test
    void testLoadFromConfiguredPath() throws IOException {
        var file = tempDir.resolve("points.csv");
        Files.writeString(file, "0.5\n1.5\n2.5\n");

        var dataset = loader.load(DualTreeConfig.builder().withDataPath(file).build());
        assertEquals(3, dataset.size());
        assertArrayEquals(new double[] { 1.5 }, dataset.point(1));
    }

    @Test
    void testMissingDataPath() {
        assertThrows(IllegalArgumentException.class, () -> loader.load(DualTreeConfig.defaultConfig()));
    }

    @Test
    void testSeparatorsAndComments() throws IOException {
        var dataset = read("""
                           # x, y, z
                           % another comment
                           1.0, 2.0, 3.0

                           4 5\t6
                           -7.5,8e-1 ,9
                           """);
        assertEquals(3, dataset.dimension());
        assertEquals(3, dataset.size());
        assertArrayEquals(new double[] { 4, 5, 6 }, dataset.point(1));
        assertArrayEquals(new double[] { -7.5, 0.8, 9 }, dataset.point(2));
    }

    private Dataset read(String text) throws IOException {
        return loader.read(new StringReader(text), "test");
    }
}
