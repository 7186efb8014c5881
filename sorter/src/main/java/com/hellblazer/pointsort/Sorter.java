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
package com.hellblazer.pointsort;

import com.hellblazer.pointsort.codec.Bounds;
import com.hellblazer.pointsort.codec.PointCloudFormat;
import com.hellblazer.pointsort.codec.PointCloudHeader;
import com.hellblazer.pointsort.codec.PointCloudReader;
import com.hellblazer.pointsort.codec.PointCloudWriter;
import com.hellblazer.pointsort.grid.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Repartitions a point cloud file into spatial order.
 *
 * <p>A run has two strictly sequential phases. The bucketing phase reads the entire source into a disk-backed
 * {@link Grid}; only then is the number of accepted points known, and it must be in the output header before the first
 * point is written. The merge phase then streams the buckets, in ascending {@link CellKey} order, into the output.
 *
 * <p>Output is compressed when its path has the compressed extension, regardless of the source's compression. A failed
 * or cancelled run deletes the partial output and every temporary segment. So does a run whose cleanup fails after the
 * output was complete.
 *
 * <p>A sorter may be reused for several files, one at a time.
 *
 * @author hal.hildebrand
 */
public class Sorter {
    private static final Logger log = LoggerFactory.getLogger(Sorter.class);

    private final    SortConfiguration config;
    private volatile Grid              active;
    private volatile boolean           cancelled = false;

    public Sorter() {
        this(SortConfiguration.defaultConfig());
    }

    public Sorter(SortConfiguration config) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
    }

    /**
     * The output path used when none is given: {@code <input-stem>-sorted.<input-ext>}
     */
    public static Path defaultOutputPath(Path input) {
        var name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        var sorted = dot > 0 ? name.substring(0, dot) + "-sorted" + name.substring(dot) : name + "-sorted";
        return input.resolveSibling(sorted);
    }

    /**
     * Sort the input into the output.
     *
     * @param input  the source point cloud
     * @param output the destination, replaced if it exists
     * @return the run's summary
     * @throws IOException           if any file cannot be read or written, or the source is malformed
     * @throws CancellationException if {@link #cancel()} was called during the run
     */
    public SortResult sort(Path input, Path output) throws IOException {
        Objects.requireNonNull(input, "Input cannot be null");
        Objects.requireNonNull(output, "Output cannot be null");
        if (Files.isDirectory(output)) {
            throw new IllegalArgumentException("Output is a directory: " + output);
        }
        if (Files.exists(output) && Files.isSameFile(input, output)) {
            throw new IllegalArgumentException("Output would overwrite input: " + output);
        }
        cancelled = false;
        long start = System.nanoTime();

        try (var reader = PointCloudReader.open(input)) {
            var header = reader.getHeader();
            boolean compressed = PointCloudFormat.isCompressedPath(output);
            double cellSize = resolveCellSize(header.bounds(), header.pointCount());

            log.info("Sorting {} -> {}: {} points, cell size {}{}", input, output, header.pointCount(), cellSize,
                     compressed ? ", compressed" : "");

            SortResult result;
            try (var grid = createGrid(cellSize, header)) {
                active = grid;
                if (cancelled) {
                    grid.cancel();
                }
                grid.read(reader, config.getThinFraction());

                var outputHeader = header.withPointCount(grid.getAcceptedCount()).withCompressed(compressed);
                long written;
                try (var writer = new PointCloudWriter(output, outputHeader)) {
                    written = grid.write(writer);
                }

                long elapsed = (System.nanoTime() - start) / 1_000_000;
                result = new SortResult(input, output, header.pointCount(), grid.getAcceptedCount(), written,
                                        cellSize, compressed, grid.getStatistics(), elapsed);
            } catch (IOException | RuntimeException e) {
                // includes a failed teardown of the grid, after which the output is not trusted
                discard(output, e);
                throw e;
            } finally {
                active = null;
            }
            report(result);
            return result;
        }
    }

    /**
     * Ask a running sort to stop. It fails with a {@link CancellationException}, cleaning up as for any failure.
     */
    public void cancel() {
        cancelled = true;
        var grid = active;
        if (grid != null) {
            grid.cancel();
        }
    }

    public SortConfiguration getConfiguration() {
        return config;
    }

    Grid createGrid(double cellSize, PointCloudHeader header) throws IOException {
        return new Grid(config.getWorkingDirectory(), cellSize, header, config.getRandom(), config.getBatchSize(),
                        config.getProgressListener());
    }

    double resolveCellSize(Bounds bounds, long pointCount) {
        if (!config.isAutoCellSize()) {
            return config.getCellSize();
        }
        double estimated = CellSizeEstimator.estimate(bounds, pointCount, config.getThinFraction(),
                                                      config.getTargetPointsPerCell());
        log.info("Estimated cell size {} for {} points targeting {} per cell", estimated, pointCount,
                 config.getTargetPointsPerCell());
        return estimated;
    }

    private void discard(Path output, Exception cause) {
        try {
            if (Files.deleteIfExists(output)) {
                log.debug("Deleted partial output {}", output);
            }
        } catch (IOException e) {
            log.warn("Unable to delete partial output {}", output, e);
            cause.addSuppressed(e);
        }
    }

    private void report(SortResult result) {
        var statistics = result.statistics();
        log.info("Sorted {} of {} points into {} in {} ms", result.writtenPoints(), result.sourcePoints(),
                 result.output(), result.elapsedMillis());
        log.info("Buckets: {}, average points per bucket: {}, average bucket size: {} KB", statistics.bucketCount(),
                 String.format("%.1f", statistics.averagePointsPerBucket()),
                 String.format("%.1f", statistics.averageFileSize() / 1024.0));
    }
}
