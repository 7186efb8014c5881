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
package com.hellblazer.pointsort.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

/**
 * Streaming reader for point cloud files.
 *
 * <p>Provides an iterator-style interface for reading point clouds far larger than memory, one point at a time.
 *
 * @author hal.hildebrand
 * @see PointCloudWriter
 */
public class PointCloudReader implements AutoCloseable, Iterable<PointRecord> {
    private static final Logger log = LoggerFactory.getLogger(PointCloudReader.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path             inputFile;
    private final FileChannel      channel;
    private final PointCloudHeader header;
    private final InputStream      points;
    private final byte[]           record = new byte[PointCloudFormat.POINT_SIZE];
    private final ByteBuffer       recordBuffer;
    private       long             pointsRead;
    private       boolean          closed = false;

    /**
     * Create a streaming reader for a point cloud file.
     *
     * @param inputFile Path to the point cloud file
     * @throws IOException if the file cannot be opened or has invalid format
     */
    public PointCloudReader(Path inputFile) throws IOException {
        this.inputFile = inputFile;
        this.channel = FileChannel.open(inputFile, StandardOpenOption.READ);
        try {
            this.header = PointCloudFormat.readHeader(channel);
            InputStream body = new BufferedInputStream(Channels.newInputStream(channel), BUFFER_SIZE);
            this.points = header.compressed() ? new GZIPInputStream(body, BUFFER_SIZE) : body;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        this.recordBuffer = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);

        log.debug("PointCloudReader opened {}: {} points{}", inputFile, header.pointCount(),
                  header.compressed() ? " (compressed)" : "");
    }

    public static PointCloudReader open(Path inputFile) throws IOException {
        return new PointCloudReader(inputFile);
    }

    /**
     * Get the file header information.
     */
    public PointCloudHeader getHeader() {
        return header;
    }

    /**
     * Check if there are more points to read.
     */
    public boolean hasNext() {
        return pointsRead < header.pointCount();
    }

    /**
     * Read the next point.
     *
     * @return The next point, or null if no more points
     * @throws IOException if reading fails or the file ends before the declared point count
     */
    public PointRecord readNext() throws IOException {
        ensureNotClosed();

        if (!hasNext()) {
            return null;
        }

        int read = points.readNBytes(record, 0, record.length);
        if (read < record.length) {
            throw new EOFException(
            inputFile + " ended after " + pointsRead + " of " + header.pointCount() + " declared points");
        }
        recordBuffer.clear();
        pointsRead++;
        return PointCloudFormat.decodePoint(recordBuffer, header);
    }

    /**
     * Get the number of points read so far.
     */
    public long getPointsRead() {
        return pointsRead;
    }

    @Override
    public Iterator<PointRecord> iterator() {
        return new PointIterator();
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("PointCloudReader has been closed");
        }
    }

    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            points.close();
            log.debug("PointCloudReader closed {} after reading {} points", inputFile, pointsRead);
        }
    }

    private class PointIterator implements Iterator<PointRecord> {
        @Override
        public boolean hasNext() {
            return PointCloudReader.this.hasNext();
        }

        @Override
        public PointRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            try {
                return readNext();
            } catch (IOException e) {
                throw new RuntimeException("Failed to read point", e);
            }
        }
    }
}
