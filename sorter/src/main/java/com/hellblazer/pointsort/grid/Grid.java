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
package com.hellblazer.pointsort.grid;

import com.hellblazer.pointsort.CellKey;
import com.hellblazer.pointsort.codec.PointCloudHeader;
import com.hellblazer.pointsort.codec.PointCloudReader;
import com.hellblazer.pointsort.codec.PointRecord;
import com.hellblazer.pointsort.codec.PointSink;
import com.hellblazer.pointsort.resource.WorkingDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;

/**
 * Spatial router over disk-backed {@link Bucket}s.
 *
 * <p>The grid drives the two passes of an out-of-core spatial sort:
 * <ol>
 *   <li>{@link #read(PointCloudReader, double)} routes every source point to the bucket of its {@link CellKey},
 *   optionally thinning, and flushes all buckets every {@code batchSize} source points so that memory stays bounded
 *   by the batch size</li>
 *   <li>{@link #write(PointSink)} merges the buckets into a sink in ascending key order, deleting each bucket's
 *   segments as soon as it has been merged</li>
 * </ol>
 *
 * <p>The grid owns its buckets and its working directory. Closing it deletes every remaining segment and removes the
 * working directory if the grid created it. Single threaded, apart from {@link #cancel()}.
 *
 * @author hal.hildebrand
 */
public class Grid implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Grid.class);

    public static final int DEFAULT_BATCH_SIZE = 1_000_000;

    private final NavigableMap<CellKey, Bucket> buckets = new TreeMap<>();
    private final WorkingDirectory              workingDirectory;
    private final double                        cellSize;
    private final PointCloudHeader              sourceHeader;
    private final Random                        random;
    private final int                           batchSize;
    private final ProgressListener              progress;

    private          long    consumed;
    private          long    accepted;
    private          long    written;
    private          int     bucketsCreated;
    private          long    mergedBytes;
    private volatile boolean cancelled = false;
    private          boolean closed    = false;

    /**
     * Create a grid with an unseeded random source, the default batch size and logged progress
     */
    public Grid(Path workingDirectory, double cellSize, PointCloudHeader sourceHeader) throws IOException {
        this(workingDirectory, cellSize, sourceHeader, new Random(), DEFAULT_BATCH_SIZE, ProgressListener.LOGGING);
    }

    /**
     * Create a grid, opening (and creating if necessary) its working directory.
     *
     * @param workingDirectory directory for segment files
     * @param cellSize         edge length of a grid cell
     * @param sourceHeader     header of the cloud being sorted; segment files reuse its coordinate encoding
     * @param random           random source for thinning
     * @param batchSize        source points consumed between flushes, and points between progress reports
     * @param progress         progress listener
     * @throws IOException if the working directory cannot be opened
     */
    public Grid(Path workingDirectory, double cellSize, PointCloudHeader sourceHeader, Random random, int batchSize,
                ProgressListener progress) throws IOException {
        if (!(cellSize > 0) || Double.isInfinite(cellSize)) {
            throw new IllegalArgumentException("Cell size must be positive and finite: " + cellSize);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.cellSize = cellSize;
        this.sourceHeader = Objects.requireNonNull(sourceHeader, "Source header cannot be null");
        this.random = Objects.requireNonNull(random, "Random cannot be null");
        this.progress = Objects.requireNonNull(progress, "Progress listener cannot be null");
        this.batchSize = batchSize;
        this.workingDirectory = WorkingDirectory.open(workingDirectory);

        log.debug("Grid created: cell size {}, batch size {}, {}", cellSize, batchSize, this.workingDirectory);
    }

    /**
     * Route a point to the bucket of its cell, creating the bucket on first use, and count it as accepted
     */
    public void add(PointRecord point) {
        ensureNotClosed();

        var key = CellKey.of(point, cellSize);
        var bucket = buckets.get(key);
        if (bucket == null) {
            bucket = new Bucket(key, workingDirectory, sourceHeader);
            buckets.put(key, bucket);
            bucketsCreated++;
        }
        bucket.add(point);
        accepted++;
    }

    /**
     * Bucket every point of the source.
     *
     * <p>When {@code thinFraction} is positive each point is kept only if a uniform draw from [0, 1) is at least
     * {@code thinFraction}, so that fraction of the input is dropped on average. A zero fraction keeps every point and
     * consumes no randomness.
     *
     * @param reader       the source
     * @param thinFraction expected fraction of points to drop, in [0, 1)
     * @return the number of points accepted by this pass
     * @throws IOException if reading the source or writing a segment fails
     */
    public long read(PointCloudReader reader, double thinFraction) throws IOException {
        ensureNotClosed();
        if (!(thinFraction >= 0.0 && thinFraction < 1.0)) {
            throw new IllegalArgumentException("Thin fraction must be in [0, 1): " + thinFraction);
        }

        long total = reader.getHeader().pointCount();
        long acceptedBefore = accepted;
        log.info("Bucketing {} points, cell size {}{}", total, cellSize,
                 thinFraction > 0 ? ", thinning " + thinFraction : "");

        PointRecord point;
        while ((point = reader.readNext()) != null) {
            checkCancelled();
            consumed++;
            if (thinFraction == 0.0 || random.nextDouble() >= thinFraction) {
                add(point);
            }
            if (consumed % batchSize == 0) {
                flush();
                progress.progress(ProgressListener.Phase.READ, consumed, total);
            }
        }
        flush();

        long acceptedNow = accepted - acceptedBefore;
        log.info("Bucketed {} of {} points into {} buckets", acceptedNow, consumed, buckets.size());
        return acceptedNow;
    }

    /**
     * Flush every bucket's buffered points to disk
     */
    public void flush() throws IOException {
        ensureNotClosed();
        for (var bucket : buckets.values()) {
            bucket.flush();
        }
    }

    /**
     * Merge every bucket into the sink in ascending cell order, removing each bucket once merged.
     *
     * @param sink the destination
     * @return the number of points written
     * @throws IOException if a segment cannot be read or the sink fails
     */
    public long write(PointSink sink) throws IOException {
        ensureNotClosed();

        long total = accepted;
        long writtenBefore = written;
        log.info("Merging {} buckets ({} points)", buckets.size(), total);

        PointSink counting = point -> {
            checkCancelled();
            sink.write(point);
            written++;
            if (written % batchSize == 0) {
                progress.progress(ProgressListener.Phase.WRITE, written, total);
            }
        };

        var iterator = buckets.entrySet().iterator();
        while (iterator.hasNext()) {
            var bucket = iterator.next().getValue();
            bucket.flush();
            mergedBytes += bucket.fileSize();
            long count = bucket.write(counting);
            log.debug("Merged {}: {} points", bucket.getKey(), count);
            bucket.remove();
            iterator.remove();
        }

        long writtenNow = written - writtenBefore;
        log.info("Merged {} points", writtenNow);
        return writtenNow;
    }

    /**
     * Request that the pass in progress stop. The pass fails with a {@link CancellationException} at the next point.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private void checkCancelled() {
        if (cancelled) {
            throw new CancellationException("Grid processing cancelled");
        }
    }

    public long getAcceptedCount() {
        return accepted;
    }

    public long getConsumedCount() {
        return consumed;
    }

    public long getWrittenCount() {
        return written;
    }

    public double getCellSize() {
        return cellSize;
    }

    /**
     * Number of buckets currently held, i.e. created and not yet merged
     */
    public int getBucketCount() {
        return buckets.size();
    }

    /**
     * Buckets currently held, in merge order
     */
    public NavigableMap<CellKey, Bucket> getBuckets() {
        return Collections.unmodifiableNavigableMap(buckets);
    }

    public WorkingDirectory getWorkingDirectory() {
        return workingDirectory;
    }

    /**
     * Snapshot of the grid's diagnostics, counting merged buckets as well as held ones
     */
    public GridStatistics getStatistics() {
        long bytes = mergedBytes;
        for (var bucket : buckets.values()) {
            bytes += bucket.fileSize();
        }
        double averagePoints = bucketsCreated == 0 ? 0.0 : (double) accepted / bucketsCreated;
        double averageSize = bucketsCreated == 0 ? 0.0 : (double) bytes / bucketsCreated;
        return new GridStatistics(bucketsCreated, consumed, accepted, averagePoints, averageSize);
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Grid is closed");
        }
    }

    /**
     * Tear down: flush what is still buffered, delete every bucket's segments, then remove the working directory if
     * this grid created it. Every step is attempted even if an earlier one fails, whatever the failure.
     *
     * @throws IOException the first cleanup failure, with later ones suppressed. A first failure that is a runtime
     *                     exception is rethrown unwrapped.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }

        Exception failure = null;
        try {
            flush();
        } catch (IOException | RuntimeException e) {
            log.warn("Final flush failed during teardown", e);
            failure = e;
        } finally {
            closed = true;
        }

        for (var bucket : buckets.values()) {
            try {
                bucket.remove();
            } catch (IOException | RuntimeException e) {
                failure = accumulate(failure, e);
            }
        }
        buckets.clear();

        try {
            workingDirectory.close();
        } catch (IOException | RuntimeException e) {
            log.warn("Unable to remove working directory {}", workingDirectory.getPath(), e);
            failure = accumulate(failure, e);
        }

        log.debug("Grid closed: {}", getStatistics());
        if (failure instanceof IOException) {
            throw (IOException) failure;
        }
        if (failure != null) {
            throw (RuntimeException) failure;
        }
    }

    private static Exception accumulate(Exception failure, Exception e) {
        if (failure == null) {
            return e;
        }
        failure.addSuppressed(e);
        return failure;
    }
}
