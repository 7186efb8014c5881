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

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.GZIPOutputStream;

/**
 * Streaming writer for point cloud files.
 *
 * <p>Points are appended one at a time without holding them in memory. The header is written up front and its point
 * count is rewritten with the number of points actually written when the writer is closed. When the header is marked
 * compressed the point data is GZIP deflated; the header never is.
 *
 * @author hal.hildebrand
 * @see PointCloudReader
 */
public class PointCloudWriter implements PointSink, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PointCloudWriter.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path             outputFile;
    private final FileChannel      channel;
    private final PointCloudHeader header;
    private final OutputStream     points;
    private final GZIPOutputStream deflater;
    private final ByteBuffer       recordBuffer;
    private       long             pointsWritten;
    private       boolean          closed = false;

    /**
     * Create a streaming writer for a point cloud file.
     *
     * @param outputFile Path to the output file, truncated if it exists
     * @param header     the header to write; its point count is the declared count
     * @throws IOException if the file cannot be created
     */
    public PointCloudWriter(Path outputFile, PointCloudHeader header) throws IOException {
        this.outputFile = outputFile;
        this.header = header;
        this.channel = FileChannel.open(outputFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                                        StandardOpenOption.TRUNCATE_EXISTING);
        try {
            writeHeader(header.pointCount());
            channel.position(PointCloudFormat.HEADER_SIZE);
            var body = new BufferedOutputStream(Channels.newOutputStream(channel), BUFFER_SIZE);
            if (header.compressed()) {
                this.deflater = new GZIPOutputStream(body, BUFFER_SIZE);
                this.points = deflater;
            } else {
                this.deflater = null;
                this.points = body;
            }
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        this.recordBuffer = ByteBuffer.allocate(PointCloudFormat.POINT_SIZE).order(ByteOrder.LITTLE_ENDIAN);

        log.debug("PointCloudWriter created for {}: {} declared points{}", outputFile, header.pointCount(),
                  header.compressed() ? " (compressed)" : "");
    }

    /**
     * Write a single point.
     *
     * @param point The point to write
     * @throws IOException if writing fails
     */
    @Override
    public void write(PointRecord point) throws IOException {
        ensureNotClosed();

        recordBuffer.clear();
        PointCloudFormat.encodePoint(point, header, recordBuffer);
        points.write(recordBuffer.array(), 0, PointCloudFormat.POINT_SIZE);
        pointsWritten++;
    }

    /**
     * Get the number of points written so far.
     */
    public long getPointsWritten() {
        return pointsWritten;
    }

    public PointCloudHeader getHeader() {
        return header;
    }

    private void writeHeader(long pointCount) throws IOException {
        var buffer = PointCloudFormat.encodeHeader(header.withPointCount(pointCount));
        long position = 0;
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("PointCloudWriter has been closed");
        }
    }

    /**
     * Close the writer, flushing point data and updating the header with the final count.
     */
    @Override
    public void close() throws IOException {
        if (!closed) {
            closed = true;
            try {
                if (deflater != null) {
                    deflater.finish();
                }
                points.flush();

                if (pointsWritten != header.pointCount()) {
                    log.warn("{} declared {} points but {} were written, rewriting header", outputFile,
                             header.pointCount(), pointsWritten);
                }
                writeHeader(pointsWritten);
            } finally {
                points.close();
            }

            log.debug("PointCloudWriter closed {}: {} points", outputFile, pointsWritten);
        }
    }
}
