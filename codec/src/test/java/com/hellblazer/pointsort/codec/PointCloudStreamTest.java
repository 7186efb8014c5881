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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.EOFException;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for point cloud streaming I/O.
 *
 * @author hal.hildebrand
 */
public class PointCloudStreamTest {

    @TempDir
    Path tempDir;

    private List<PointRecord> points;
    private PointCloudHeader  header;

    @BeforeEach
    void setUp() {
        var random = new Random(0x5EED);
        points = new ArrayList<>();
        var bounds = Bounds.empty();
        for (int i = 0; i < 1000; i++) {
            // positions on the default millimetre grid decode to identical doubles
            var point = new PointRecord(random.nextInt(100_000) * 0.001, random.nextInt(100_000) * 0.001,
                                        (random.nextInt(5_000) - 2_500) * 0.001, random.nextInt(65536), i % 32,
                                        1 + i % 4, i * 0.25);
            points.add(point);
            bounds = bounds.union(point);
        }
        header = PointCloudHeader.create(points.size(), bounds).withSystemIdentifier("unit-test");
    }

    @Test
    void testPlainRoundTrip() throws IOException {
        var file = tempDir.resolve("cloud.pcb");
        write(file, header);

        assertTrue(PointCloudFormat.isValidFile(file));
        assertEquals(PointCloudFormat.HEADER_SIZE + (long) points.size() * PointCloudFormat.POINT_SIZE,
                     Files.size(file));

        try (var reader = PointCloudReader.open(file)) {
            assertEquals(header, reader.getHeader());
            var loaded = new ArrayList<PointRecord>();
            reader.forEach(loaded::add);
            assertEquals(points, loaded);
            assertEquals(points.size(), reader.getPointsRead());
            assertFalse(reader.hasNext());
            assertNull(reader.readNext());
        }
    }

    @Test
    void testCompressedRoundTrip() throws IOException {
        var plain = tempDir.resolve("cloud.pcb");
        var compressed = tempDir.resolve("cloud.pcz");
        write(plain, header);
        write(compressed, header.withCompressed(true));

        assertTrue(Files.size(compressed) < Files.size(plain));

        try (var reader = PointCloudReader.open(compressed)) {
            assertTrue(reader.getHeader().compressed());
            assertEquals(points.size(), reader.getHeader().pointCount());
            for (var expected : points) {
                assertEquals(expected, reader.readNext());
            }
            assertFalse(reader.hasNext());
        }
    }

    @Test
    void testHeaderCountRewrittenOnClose() throws IOException {
        var file = tempDir.resolve("undeclared.pcz");
        try (var writer = new PointCloudWriter(file, header.withPointCount(0).withCompressed(true))) {
            for (int i = 0; i < 10; i++) {
                writer.write(points.get(i));
            }
            assertEquals(10, writer.getPointsWritten());
        }

        try (var reader = PointCloudReader.open(file)) {
            assertEquals(10, reader.getHeader().pointCount());
            int count = 0;
            while (reader.readNext() != null) {
                count++;
            }
            assertEquals(10, count);
        }
    }

    @Test
    void testEmptyCloud() throws IOException {
        var file = tempDir.resolve("empty.pcz");
        try (var writer = new PointCloudWriter(file, PointCloudHeader.create(0, Bounds.empty()).withCompressed(true))) {
            assertEquals(0, writer.getPointsWritten());
        }
        try (var reader = PointCloudReader.open(file)) {
            assertEquals(0, reader.getHeader().pointCount());
            assertTrue(reader.getHeader().bounds().isEmpty());
            assertNull(reader.readNext());
        }
    }

    @Test
    void testTruncatedPointData() throws IOException {
        var file = tempDir.resolve("truncated.pcb");
        write(file, header);
        try (var channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            channel.truncate(PointCloudFormat.HEADER_SIZE + 10L * PointCloudFormat.POINT_SIZE + 5);
        }

        try (var reader = PointCloudReader.open(file)) {
            for (int i = 0; i < 10; i++) {
                assertNotNull(reader.readNext());
            }
            assertThrows(EOFException.class, reader::readNext);
        }
    }

    @Test
    void testBadMagicRejected() throws IOException {
        var file = tempDir.resolve("bogus.pcb");
        Files.write(file, new byte[PointCloudFormat.HEADER_SIZE]);

        assertFalse(PointCloudFormat.isValidFile(file));
        var e = assertThrows(PointCloudFormatException.class, () -> PointCloudReader.open(file));
        assertTrue(e.getMessage().contains("magic"));
    }

    @Test
    void testTruncatedHeaderRejected() throws IOException {
        var file = tempDir.resolve("short.pcb");
        Files.write(file, new byte[] { 'P', 'C', 'B', '1' });

        assertThrows(PointCloudFormatException.class, () -> PointCloudReader.open(file));
    }

    @Test
    void testClosedWriterRejectsPoints() throws IOException {
        var file = tempDir.resolve("closed.pcb");
        var writer = new PointCloudWriter(file, header.withPointCount(0));
        writer.close();
        writer.close();

        assertThrows(IllegalStateException.class, () -> writer.write(points.get(0)));
    }

    @Test
    void testUnrepresentableCoordinate() throws IOException {
        var file = tempDir.resolve("overflow.pcb");
        try (var writer = new PointCloudWriter(file, header.withPointCount(1))) {
            assertThrows(IllegalArgumentException.class, () -> writer.write(PointRecord.at(1e12, 0, 0)));
        }
    }

    private void write(Path file, PointCloudHeader h) throws IOException {
        try (var writer = new PointCloudWriter(file, h)) {
            for (var point : points) {
                writer.write(point);
            }
        }
    }
}
