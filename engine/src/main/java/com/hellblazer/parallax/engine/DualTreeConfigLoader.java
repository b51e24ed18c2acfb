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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Loads a {@link DualTreeConfig} from JSON:
 *
 * <pre>
 * {
 *   "n_threads": 4,
 *   "n_grains": 12,
 *   "n_block_points": 1024,
 *   "n_block_nodes": 128,
 *   "leaf_size": 20,
 *   "data": "points.csv",
 *   "rpc_deadline_ms": 60000,
 *   "parameters": { "k": 10 },
 *   "rank1": { "n_threads": 8 }
 * }
 * </pre>
 *
 * <p>Objects keyed {@code rank<N>} are scopes: they are layered over the top level values and recorded as named
 * scopes of the result. A relative {@code data} path resolves against the directory of the configuration file.
 *
 * @author hal.hildebrand
 */
public class DualTreeConfigLoader {
    private static final Logger  log   = LoggerFactory.getLogger(DualTreeConfigLoader.class);
    private static final Pattern SCOPE = Pattern.compile("rank\\d+");

    private final ObjectMapper objectMapper;

    public DualTreeConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    public DualTreeConfig load(InputStream json, Path baseDirectory) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to parse dual-tree configuration", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Dual-tree configuration must be a JSON object");
        }
        var base = apply(DualTreeConfig.builder(), (ObjectNode) root, baseDirectory);
        var builder = apply(DualTreeConfig.builder(), (ObjectNode) root, baseDirectory);
        root.fields().forEachRemaining(entry -> {
            if (SCOPE.matcher(entry.getKey()).matches()) {
                if (!entry.getValue().isObject()) {
                    throw new IllegalArgumentException("Scope " + entry.getKey() + " must be a JSON object");
                }
                var scoped = apply(base.build().toBuilder(), (ObjectNode) entry.getValue(), baseDirectory);
                builder.withScope(entry.getKey(), scoped.build());
                log.debug("Loaded configuration scope {}", entry.getKey());
            }
        });
        var config = builder.build();
        log.info("Loaded {}", config);
        return config;
    }

    public DualTreeConfig load(Path file) {
        try (var in = Files.newInputStream(file)) {
            return load(in, file.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read dual-tree configuration " + file, e);
        }
    }

    private DualTreeConfig.Builder apply(DualTreeConfig.Builder builder, ObjectNode node, Path baseDirectory) {
        if (node.has("n_threads")) {
            builder.withThreads(requireInt(node, "n_threads"));
        }
        if (node.has("n_grains")) {
            builder.withGrains(requireInt(node, "n_grains"));
        }
        if (node.has("n_block_points")) {
            builder.withBlockPoints(requireInt(node, "n_block_points"));
        }
        if (node.has("n_block_nodes")) {
            builder.withBlockNodes(requireInt(node, "n_block_nodes"));
        }
        if (node.has("leaf_size")) {
            builder.withLeafSize(requireInt(node, "leaf_size"));
        }
        if (node.has("data")) {
            var data = Path.of(node.get("data").asText());
            builder.withDataPath(data.isAbsolute() || baseDirectory == null ? data : baseDirectory.resolve(data));
        }
        if (node.has("rpc_deadline_ms")) {
            var millis = requireInt(node, "rpc_deadline_ms");
            builder.withRpcDeadline(millis == 0 ? null : Duration.ofMillis(millis));
        }
        var parameters = node.get("parameters");
        if (parameters != null) {
            if (!parameters.isObject()) {
                throw new IllegalArgumentException("\"parameters\" must be a JSON object");
            }
            parameters.fields().forEachRemaining(p -> builder.withParameter(p.getKey(), p.getValue().asText()));
        }
        return builder;
    }

    private int requireInt(ObjectNode node, String field) {
        var value = node.get(field);
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException("\"" + field + "\" must be an integer, got " + value);
        }
        return value.intValue();
    }
}
