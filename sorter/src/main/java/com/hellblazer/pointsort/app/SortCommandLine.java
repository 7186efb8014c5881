/*
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.pointsort.app;

import com.hellblazer.pointsort.SortConfiguration;
import com.hellblazer.pointsort.Sorter;
import com.hellblazer.pointsort.codec.PointCloudReader;
import com.hellblazer.pointsort.grid.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point for sorting a point cloud file.
 *
 * <pre>
 * pointsort [options] &lt;input&gt; [output]
 * </pre>
 *
 * @author hal.hildebrand
 */
public class SortCommandLine {
    private static final Logger log = LoggerFactory.getLogger(SortCommandLine.class);

    /**
     * Configuration holder for all command-line options.
     */
    public static class Config {
        public String  inputFile;
        public String  outputFile;
        public double  cellSize            = SortConfiguration.AUTO_CELL_SIZE;
        public double  thinFraction        = 0.0;
        public String  workingDirectory    = SortConfiguration.DEFAULT_WORKING_DIRECTORY;
        public int     batchSize           = Grid.DEFAULT_BATCH_SIZE;
        public long    targetPointsPerCell = SortConfiguration.DEFAULT_TARGET_POINTS_PER_CELL;
        public Long    seed;
        public boolean info                = false;
        public boolean help                = false;

        final List<String> parseErrors = new ArrayList<>();

        public List<String> getValidationErrors() {
            var errors = new ArrayList<>(parseErrors);

            if (inputFile == null) {
                errors.add("Input file is required");
            } else if (!Files.exists(Path.of(inputFile))) {
                errors.add("Input file does not exist: " + inputFile);
            }
            if (cellSize < 0 || Double.isNaN(cellSize) || Double.isInfinite(cellSize)) {
                errors.add("Cell size must be positive");
            }
            if (!(thinFraction >= 0.0 && thinFraction < 1.0)) {
                errors.add("Thin fraction must be at least 0 and less than 1");
            }
            if (batchSize <= 0) {
                errors.add("Batch size must be positive");
            }
            if (targetPointsPerCell <= 0) {
                errors.add("Target points per cell must be positive");
            }
            return errors;
        }

        public Path getOutputPath() {
            return outputFile != null ? Path.of(outputFile) : Sorter.defaultOutputPath(Path.of(inputFile));
        }

        public SortConfiguration toSortConfiguration() {
            var builder = SortConfiguration.builder()
                                           .withCellSize(cellSize)
                                           .withThinFraction(thinFraction)
                                           .withWorkingDirectory(Path.of(workingDirectory))
                                           .withBatchSize(batchSize)
                                           .withTargetPointsPerCell(targetPointsPerCell);
            if (seed != null) {
                builder.withSeed(seed);
            }
            return builder.build();
        }

        @Override
        public String toString() {
            return String.format("Config{input=%s, output=%s, size=%s, thin=%s, workDir=%s}", inputFile, outputFile,
                                 cellSize == SortConfiguration.AUTO_CELL_SIZE ? "auto" : String.valueOf(cellSize),
                                 thinFraction, workingDirectory);
        }
    }

    /**
     * Parse command-line arguments into configuration.
     */
    public static Config parse(String[] args) {
        var config = new Config();

        for (int i = 0; i < args.length; i++) {
            var arg = args[i];

            switch (arg) {
                case "-s", "--size" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        config.cellSize = parseDouble(value, arg, config);
                    }
                }
                case "-t", "--thin" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        config.thinFraction = parseDouble(value, arg, config);
                    }
                }
                case "-w", "--work-dir" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        config.workingDirectory = value;
                    }
                }
                case "-b", "--batch" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        long batch = parseLong(value, arg, config);
                        if (batch > Integer.MAX_VALUE) {
                            config.parseErrors.add("Batch size too large: " + value);
                        } else {
                            config.batchSize = (int) batch;
                        }
                    }
                }
                case "--target" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        config.targetPointsPerCell = parseLong(value, arg, config);
                    }
                }
                case "--seed" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        config.seed = parseLong(value, arg, config);
                    }
                }
                case "--info" -> config.info = true;
                case "-h", "--help" -> config.help = true;
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        config.parseErrors.add("Unknown option: " + arg);
                    } else if (config.inputFile == null) {
                        config.inputFile = arg;
                    } else if (config.outputFile == null) {
                        config.outputFile = arg;
                    } else {
                        config.parseErrors.add("Unexpected argument: " + arg);
                    }
                }
            }
        }

        return config;
    }

    private static String value(String[] args, int index, String option, Config config) {
        if (index < args.length) {
            return args[index];
        }
        config.parseErrors.add("Option " + option + " requires a value");
        return null;
    }

    private static double parseDouble(String value, String option, Config config) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            config.parseErrors.add("Invalid number for " + option + ": " + value);
            return 0.0;
        }
    }

    private static long parseLong(String value, String option, Config config) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            config.parseErrors.add("Invalid integer for " + option + ": " + value);
            return 0L;
        }
    }

    /**
     * Print usage information.
     */
    public static void printUsage(PrintStream out) {
        out.println("pointsort - Spatially sort point clouds larger than memory");
        out.println();
        out.println("Usage: pointsort [options] <input> [output]");
        out.println();
        out.println("Output defaults to <input-stem>-sorted.<input-ext>; a .pcz output is compressed.");
        out.println();
        out.println("Options:");
        out.println("  -s, --size <f>         Cell edge length (default: estimated from point density)");
        out.println("  -t, --thin <f>         Fraction of points to drop, 0 <= f < 1 (default: 0)");
        out.println("  -w, --work-dir <dir>   Scratch directory (default: " + SortConfiguration.DEFAULT_WORKING_DIRECTORY
                    + ")");
        out.println("  -b, --batch <n>        Points read between bucket flushes (default: " + Grid.DEFAULT_BATCH_SIZE
                    + ")");
        out.println("  --target <n>           Points per cell aimed at when estimating the cell size (default: "
                    + SortConfiguration.DEFAULT_TARGET_POINTS_PER_CELL + ")");
        out.println("  --seed <n>             Seed for thinning, for reproducible output");
        out.println("  --info                 Print the input's header and exit");
        out.println("  -h, --help             Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  pointsort survey.pcb");
        out.println("  pointsort -s 50 -t 0.5 survey.pcb thinned.pcz");
    }

    /**
     * Validate configuration and print any errors.
     */
    public static boolean validate(Config config, PrintStream err) {
        var errors = config.getValidationErrors();
        if (!errors.isEmpty()) {
            err.println("Configuration errors:");
            for (var error : errors) {
                err.println("  - " + error);
            }
            err.println();
            err.println("Use 'pointsort --help' for usage information.");
            return false;
        }
        return true;
    }

    /**
     * Run the command line, answering the process exit code.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        var config = parse(args);

        // a missing input is answered with usage, as an explicit help request is
        if (config.help || (config.inputFile == null && config.parseErrors.isEmpty())) {
            printUsage(out);
            return 0;
        }

        if (!validate(config, err)) {
            return 1;
        }

        var input = Path.of(config.inputFile);
        try {
            if (config.info) {
                printInfo(input, out);
                return 0;
            }

            var output = config.getOutputPath();
            var result = new Sorter(config.toSortConfiguration()).sort(input, output);
            out.printf("Sorted %s -> %s: %d of %d points, cell size %s, %d buckets%n", input, output,
                       result.writtenPoints(), result.sourcePoints(), result.cellSize(),
                       result.statistics().bucketCount());
            return 0;
        } catch (IOException | RuntimeException e) {
            err.println("Sort of " + input + " failed: " + e.getMessage());
            log.error("Sort of {} failed", input, e);
            return 1;
        }
    }

    /**
     * Print the header of a point cloud file.
     */
    public static void printInfo(Path input, PrintStream out) throws IOException {
        try (var reader = PointCloudReader.open(input)) {
            var header = reader.getHeader();
            var bounds = header.bounds();
            out.println("File: " + input);
            out.println("Points count: " + header.pointCount());
            out.println("Compressed: " + header.compressed());
            out.printf("Bounds: (%.3f, %.3f, %.3f) - (%.3f, %.3f, %.3f)%n", bounds.minX(), bounds.minY(),
                       bounds.minZ(), bounds.maxX(), bounds.maxY(), bounds.maxZ());
            if (!header.systemIdentifier().isEmpty()) {
                out.println("System identifier: " + header.systemIdentifier());
            }
            out.println();
        }
    }

    /**
     * Main entry point for CLI.
     */
    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
