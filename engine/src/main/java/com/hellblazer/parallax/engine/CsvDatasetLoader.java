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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * Reads points from delimited text, one point per line, coordinates separated by commas and/or whitespace. Blank
 * lines and lines starting with {@code #} or {@code %} are skipped.
 *
 * @author hal.hildebrand
 */
public class CsvDatasetLoader implements DataSource {
    private static final Logger  log       = LoggerFactory.getLogger(CsvDatasetLoader.class);
    private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");

    public Dataset load(Path file) {
        try (var reader = Files.newBufferedReader(file)) {
            var dataset = read(reader, file.toString());
            log.info("Read {} points of dimension {} from {}", dataset.size(), dataset.dimension(), file);
            return dataset;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read data set " + file, e);
        }
    }

    /**
     * Load the file named by the configuration's {@code data} path
     */
    @Override
    public Dataset load(DualTreeConfig config) {
        var path = config.dataPath()
                         .orElseThrow(() -> new IllegalArgumentException("No data set configured (\"data\")"));
        return load(path);
    }

    public Dataset read(Reader source, String name) throws IOException {
        var reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        var points = new ArrayList<double[]>();
        int dimension = -1;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("%")) {
                continue;
            }
            var fields = SEPARATOR.split(trimmed);
            if (dimension < 0) {
                dimension = fields.length;
            } else if (fields.length != dimension) {
                throw new IllegalArgumentException(
                String.format("%s:%d has %d values, expected %d", name, lineNumber, fields.length, dimension));
            }
            var point = new double[dimension];
            for (int d = 0; d < dimension; d++) {
                try {
                    point[d] = Double.parseDouble(fields[d]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(
                    String.format("%s:%d: \"%s\" is not a number", name, lineNumber, fields[d]), e);
                }
            }
            points.add(point);
        }
        if (points.isEmpty()) {
            throw new IllegalArgumentException(name + " holds no points");
        }
        return new Dataset(dimension, points);
    }
}
