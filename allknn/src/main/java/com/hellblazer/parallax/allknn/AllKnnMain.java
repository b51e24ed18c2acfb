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

import com.hellblazer.parallax.cache.CacheArray;
import com.hellblazer.parallax.engine.CsvDatasetLoader;
import com.hellblazer.parallax.engine.DualTreeConfigLoader;
import com.hellblazer.parallax.engine.MonochromaticDualTreeMain;
import com.hellblazer.parallax.engine.distributed.RpcMonochromaticDualTreeRunner;
import com.hellblazer.parallax.engine.rpc.NetworkRankDirectory;
import com.hellblazer.parallax.engine.rpc.Rpc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.TreeMap;

/**
 * Command line entry point.
 *
 * <pre>
 * AllKnnMain config.json [--output neighbors.csv] [--rank N --endpoints host:port,host:port,...]
 * </pre>
 * <p>
 * Without endpoints the problem is solved in this process. With endpoints this process runs as rank {@code N} of a
 * distributed run, rank 0 being the master, which alone writes the output.
 *
 * @author hal.hildebrand
 */
public class AllKnnMain {
    private static final Logger log = LoggerFactory.getLogger(AllKnnMain.class);

    public static void main(String[] args) {
        try {
            System.exit(run(args));
        } catch (RuntimeException e) {
            log.error("All k-NN failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static int run(String[] args) {
        if (args.length < 1) {
            usage();
            return 2;
        }
        var configFile = Path.of(args[0]);
        Path output = null;
        String endpoints = null;
        var rank = 0;
        var rankGiven = false;
        for (int i = 1; i < args.length; i++) {
            var value = i + 1 < args.length ? args[i + 1] : null;
            switch (args[i]) {
                case "--output" -> output = Path.of(required(args[i], value));
                case "--endpoints" -> endpoints = required(args[i], value);
                case "--rank" -> {
                    rank = Integer.parseInt(required(args[i], value));
                    rankGiven = true;
                }
                default -> {
                    log.error("Unknown option {}", args[i]);
                    usage();
                    return 2;
                }
            }
            i++;
        }

        if (endpoints == null && rankGiven) {
            log.error("--rank requires --endpoints");
            usage();
            return 2;
        }

        var config = new DualTreeConfigLoader().load(configFile);
        var gnp = new AllKnnGnp();
        if (endpoints == null) {
            var main = new MonochromaticDualTreeMain<>(gnp, config);
            main.run(new CsvDatasetLoader());
            if (output != null) {
                write(main.results(), output);
            }
            return 0;
        }

        var directory = NetworkRankDirectory.parse(endpoints);
        var rpc = new Rpc(directory, rank, config.rpcDeadline().orElse(null));
        var runner = new RpcMonochromaticDualTreeRunner<>(gnp, config, rpc, new CsvDatasetLoader());
        runner.run();
        if (output != null && rpc.isMaster()) {
            // the master's result array is local, readable after RPC shutdown
            write(runner.results(), output);
        }
        return 0;
    }

    private static String required(String option, String value) {
        if (value == null) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return value;
    }

    private static void usage() {
        log.error("Usage: AllKnnMain config.json [--output neighbors.csv] [--rank N --endpoints host:port,...]");
    }

    /**
     * One line per point in input order: the point's index, its k neighbors nearest first, then the k squared
     * distances in the same order
     */
    static void write(CacheArray<KnnResult> results, Path output) {
        var byQuery = new TreeMap<Integer, KnnResult>();
        for (int i = 0; i < results.size(); i++) {
            try (var result = results.read(i)) {
                byQuery.put(result.get().queryIndex(), result.get());
            }
        }
        try (var writer = new PrintWriter(Files.newBufferedWriter(output))) {
            byQuery.forEach((query, result) -> {
                writer.print(query);
                for (int i = 0; i < result.k(); i++) {
                    writer.print(',');
                    writer.print(result.neighbor(i));
                }
                for (int i = 0; i < result.k(); i++) {
                    writer.print(',');
                    writer.print(result.distance(i));
                }
                writer.println();
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write neighbors to " + output, e);
        }
        log.info("Wrote neighbors of {} points to {}", byQuery.size(), output);
    }
}
