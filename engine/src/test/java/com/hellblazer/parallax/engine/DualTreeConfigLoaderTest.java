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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class DualTreeConfigLoaderTest {

    private final DualTreeConfigLoader loader = new DualTreeConfigLoader();

    @TempDir
    Path tempDir;

    @Test
    void testBadValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> load("{\"n_threads\": \"four\"}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"n_threads\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"leaf_size\": 2.5}"));
        assertThrows(IllegalArgumentException.class, () -> load("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"rank1\": 4}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"parameters\": 4}"));
        assertThrows(UncheckedIOException.class, () -> load("{\"n_threads\": "));
    }

    @Test
    void testDataPathResolvesAgainstConfigDirectory() throws IOException {
        var file = tempDir.resolve("run.json");
        Files.writeString(file, "{\"data\": \"points.csv\"}");

        var config = loader.load(file);
        assertEquals(tempDir.toAbsolutePath().resolve("points.csv"), config.dataPath().orElseThrow());
    }

    @Test
    void testLoad() {
        var config = load("""
                          {
                            "n_threads": 4,
                            "n_grains": 12,
                            "n_block_points": 64,
                            "n_block_nodes": 16,
                            "leaf_size": 8,
                            "rpc_deadline_ms": 2500,
                            "parameters": { "k": 10, "name": "test" }
                          }
                          """);
        assertEquals(4, config.threads());
        assertEquals(12, config.grains().orElseThrow());
        assertEquals(64, config.blockPoints());
        assertEquals(16, config.blockNodes());
        assertEquals(8, config.leafSize());
        assertEquals(Duration.ofMillis(2500), config.rpcDeadline().orElseThrow());
        assertEquals(10, config.intParameter("k", 1));
        assertEquals("test", config.stringParameter("name").orElseThrow());
    }

    @Test
    void testMissingFile() {
        assertThrows(UncheckedIOException.class, () -> loader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void testRankScopesOverlayTopLevel() {
        var config = load("""
                          {
                            "n_threads": 2,
                            "leaf_size": 5,
                            "parameters": { "k": 3 },
                            "rank1": { "n_threads": 6, "parameters": { "k": 4 } },
                            "unrelated": { "n_threads": 9 }
                          }
                          """);
        var rank1 = config.scoped("rank1");
        assertEquals(6, rank1.threads());
        assertEquals(5, rank1.leafSize());
        assertEquals(4, rank1.intParameter("k", 1));
        assertEquals(2, config.threads());
        assertEquals(3, config.intParameter("k", 1));
        assertEquals(1, config.scopes().size());
    }

    @Test
    void testZeroDeadlineMeansNone() {
        assertTrue(load("{\"rpc_deadline_ms\": 0}").rpcDeadline().isEmpty());
    }

    private DualTreeConfig load(String json) {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), null);
    }
}
