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
import com.hellblazer.pointsort.codec.PointCloudWriter;
import com.hellblazer.pointsort.codec.PointRecord;
import com.hellblazer.pointsort.codec.PointSink;
import com.hellblazer.pointsort.resource.WorkingDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Disk-backed accumulator for the points of one grid cell.
 *
 * <p>Points are buffered in memory until {@link #flush()} persists them as a new immutable segment file in the
 * working directory. {@link #write(PointSink)} replays the segments in creation order, so a cell's points come back in
 * insertion order. The bucket owns its segment files and deletes them on {@link #remove()}.
 *
 * <p>Not thread safe.
 *
 * @author hal.hildebrand
 */
public class Bucket implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Bucket.class);

    private final CellKey           key;
    private final WorkingDirectory  directory;
    private final PointCloudHeader  scratchHeader;
    private final List<Path>        segments = new ArrayList<>();
    private       List<PointRecord> pending  = new ArrayList<>();
    private       long              count;
    private       long              fileSize;

    /**
     * @param key           the cell this bucket accumulates
     * @param directory     where segment files are created
     * @param sourceHeader  header of the source cloud; segments share its coordinate encoding but are never compressed
     */
    public Bucket(CellKey key, WorkingDirectory directory, PointCloudHeader sourceHeader) {
        this.key = key;
        this.directory = directory;
        this.scratchHeader = sourceHeader.withCompressed(false);
    }

    /**
     * Buffer a point. The point is counted immediately, whether or not it has been flushed yet.
     */
    public void add(PointRecord point) {
        pending.add(point);
        count++;
    }

    /**
     * Persist the buffered points as a new segment, then release the buffer. Does nothing when nothing is buffered.
     *
     * <p>If the segment cannot be written it is deleted and the points stay buffered, so the segments never hold a
     * point twice.
     *
     * @throws IOException if the segment cannot be written
     */
    public void flush() throws IOException {
        if (pending.isEmpty()) {
            return;
        }

        var segment = directory.newSegmentFile(segmentPrefix(), ".pcb");
        try {
            try (var writer = new PointCloudWriter(segment, scratchHeader.withPointCount(pending.size()))) {
                for (var point : pending) {
                    writer.write(point);
                }
            }
        } catch (IOException | RuntimeException e) {
            discard(segment, e);
            throw e;
        }
        segments.add(segment);
        fileSize += Files.size(segment);

        log.debug("{} flushed {} points to {}", key, pending.size(), segment.getFileName());
        // a cleared list keeps its capacity; a fresh one returns it
        pending = new ArrayList<>();
    }

    private void discard(Path segment, Exception cause) {
        try {
            Files.deleteIfExists(segment);
        } catch (IOException e) {
            log.warn("Unable to delete failed segment {} of {}", segment, key, e);
            cause.addSuppressed(e);
        }
    }

    /**
     * Stream every point of this bucket into the sink: segments in creation order, each in file order. Anything still
     * buffered is flushed first.
     *
     * @param sink the destination
     * @return the number of points written
     * @throws IOException if a segment cannot be read or the sink fails
     */
    public long write(PointSink sink) throws IOException {
        flush();

        long written = 0;
        for (var segment : segments) {
            try (var reader = PointCloudReader.open(segment)) {
                PointRecord point;
                while ((point = reader.readNext()) != null) {
                    sink.write(point);
                    written++;
                }
            }
        }
        return written;
    }

    /**
     * Delete all segment files and discard anything buffered. Safe to call repeatedly.
     *
     * @throws IOException if a segment could not be deleted; deletion of the remaining segments is still attempted
     */
    public void remove() throws IOException {
        pending = new ArrayList<>();

        IOException failure = null;
        for (var segment : segments) {
            try {
                Files.deleteIfExists(segment);
            } catch (IOException e) {
                log.warn("Unable to delete segment {} of {}", segment, key, e);
                if (failure == null) {
                    failure = new IOException("Unable to delete segments of " + key);
                }
                failure.addSuppressed(e);
            }
        }
        segments.clear();
        fileSize = 0;

        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() throws IOException {
        remove();
    }

    /**
     * Total number of points ever added, across all segments and the pending buffer
     */
    public long count() {
        return count;
    }

    /**
     * Sum of the on-disk sizes of this bucket's segments, in bytes
     */
    public long fileSize() {
        return fileSize;
    }

    public CellKey getKey() {
        return key;
    }

    public int getPendingCount() {
        return pending.size();
    }

    List<PointRecord> getPendingBuffer() {
        return pending;
    }

    public List<Path> getSegments() {
        return List.copyOf(segments);
    }

    private String segmentPrefix() {
        return "cell-" + key.getI() + "_" + key.getJ() + "_" + key.getK() + "-";
    }

    @Override
    public String toString() {
        return "Bucket[" + key + ", count=" + count + ", segments=" + segments.size() + "]";
    }
}
