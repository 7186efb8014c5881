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
import com.hellblazer.pointsort.TestClouds;
import com.hellblazer.pointsort.codec.PointCloudReader;
import com.hellblazer.pointsort.codec.PointRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for Grid routing, the bucketing and merge passes, thinning and teardown.
 *
 * @author hal.hildebrand
 */
public class GridTest {

    private static final ProgressListener QUIET = (phase, processed, total) -> {
    };

    @TempDir
    Path tempDir;

    @Test
    void testAddRoutesToCells() throws IOException {
        var points = List.of(PointRecord.at(0.1, 0.1, 0.1), PointRecord.at(0.9, 0.1, 0.1),
                             PointRecord.at(0.2, 0.3, 0.4), PointRecord.at(-0.1, 0.1, 0.1));
        try (var grid = grid(tempDir.resolve("work"), 0.5, points, new Random(), 10)) {
            points.forEach(grid::add);

            assertEquals(3, grid.getBucketCount());
            assertEquals(4, grid.getAcceptedCount());
            assertEquals(2, grid.getBuckets().get(new CellKey(0, 0, 0)).count());
            assertEquals(1, grid.getBuckets().get(new CellKey(1, 0, 0)).count());
            assertEquals(1, grid.getBuckets().get(new CellKey(-1, 0, 0)).count());
            assertEquals(new CellKey(-1, 0, 0), grid.getBuckets().firstKey());
        }
    }

    @Test
    @DisplayName("Uniform points in the unit cube with cell size 0.5 fill exactly eight cells")
    void testUnitCubeEightCells() throws IOException {
        int n = 40_000;
        var points = TestClouds.uniform(new Random(8), n, 1.0);
        var source = TestClouds.write(tempDir.resolve("cube.pcb"), points);

        try (var reader = PointCloudReader.open(source);
             var grid = grid(tempDir.resolve("work"), 0.5, points, new Random(), 7_000)) {
            assertEquals(n, grid.read(reader, 0.0));

            assertEquals(8, grid.getBucketCount());
            long sum = 0;
            for (var bucket : grid.getBuckets().values()) {
                assertEquals(n / 8.0, bucket.count(), n / 8.0 * 0.1);
                assertEquals(0, bucket.getPendingCount());
                sum += bucket.count();
            }
            assertEquals(grid.getAcceptedCount(), sum);
            assertEquals(n, grid.getConsumedCount());
        }
    }

    @Test
    void testBatchBoundariesFlushAndReport() throws IOException {
        var points = TestClouds.uniform(new Random(5), 1_050, 1.0);
        var source = TestClouds.write(tempDir.resolve("batches.pcb"), points);
        var listener = mock(ProgressListener.class);

        try (var reader = PointCloudReader.open(source);
             var grid = new Grid(tempDir.resolve("work"), 0.5, TestClouds.header(points), new Random(), 100,
                                 listener)) {
            grid.read(reader, 0.0);

            // one segment per batch boundary, plus one for the remainder if the cell received any of it
            for (var bucket : grid.getBuckets().values()) {
                int segments = bucket.getSegments().size();
                assertTrue(segments == 10 || segments == 11, bucket + ": " + segments);
            }
            verify(listener, times(10)).progress(eq(ProgressListener.Phase.READ), anyLong(), eq(1_050L));
            verify(listener).progress(ProgressListener.Phase.READ, 500, 1_050);

            grid.write(point -> {
            });
            verify(listener, times(10)).progress(eq(ProgressListener.Phase.WRITE), anyLong(), eq(1_050L));
            verify(listener).progress(ProgressListener.Phase.WRITE, 1_000, 1_050);
        }
    }

    @Test
    void testWriteMergesInKeyOrderAndReclaims() throws IOException {
        var points = TestClouds.uniform(new Random(21), 5_000, 2.0);
        var source = TestClouds.write(tempDir.resolve("merge.pcb"), points);
        var work = tempDir.resolve("work");

        try (var reader = PointCloudReader.open(source);
             var grid = grid(work, 0.5, points, new Random(), 1_000)) {
            grid.read(reader, 0.0);
            assertEquals(64, grid.getBucketCount());
            var expected = TestClouds.sortedByCell(points, 0.5);

            var merged = new ArrayList<PointRecord>();
            var bucketsSeen = new ArrayList<Integer>();
            long written = grid.write(point -> {
                merged.add(point);
                bucketsSeen.add(grid.getBucketCount());
            });

            assertEquals(points.size(), written);
            assertEquals(grid.getAcceptedCount(), grid.getWrittenCount());
            assertEquals(expected, merged);
            // buckets are discarded one at a time as they are merged
            assertEquals(64, (int) bucketsSeen.get(0));
            assertEquals(1, (int) bucketsSeen.get(bucketsSeen.size() - 1));
            assertEquals(0, grid.getBucketCount());
            assertTrue(grid.getWorkingDirectory().listFiles().isEmpty());

            var statistics = grid.getStatistics();
            assertEquals(64, statistics.bucketCount());
            assertEquals(points.size() / 64.0, statistics.averagePointsPerBucket(), 1e-9);
            assertTrue(statistics.averageFileSize() > 0);
        }
        assertFalse(Files.exists(work));
    }

    @Test
    void testThinningConvergesToKeptFraction() throws IOException {
        int n = 20_000;
        var points = TestClouds.uniform(new Random(99), n, 1.0);
        var source = TestClouds.write(tempDir.resolve("thin.pcb"), points);

        for (double p : new double[] { 0.1, 0.5, 0.9 }) {
            try (var reader = PointCloudReader.open(source);
                 var grid = grid(tempDir.resolve("work"), 0.25, points, new Random(1234), 5_000)) {
                long accepted = grid.read(reader, p);

                // five standard deviations of a binomial proportion
                double tolerance = 5 * Math.sqrt(p * (1 - p) / n);
                assertEquals(1 - p, (double) accepted / n, tolerance, "thin fraction " + p);
                assertEquals(n, grid.getConsumedCount());

                long sum = grid.getBuckets().values().stream().mapToLong(Bucket::count).sum();
                assertEquals(accepted, sum);
            }
        }
    }

    @Test
    void testThinningIsReproducibleWithSeed() throws IOException {
        var points = TestClouds.uniform(new Random(4), 3_000, 1.0);
        var source = TestClouds.write(tempDir.resolve("seeded.pcb"), points);

        var first = thinAndMerge(source, points, new Random(77));
        var second = thinAndMerge(source, points, new Random(77));
        assertEquals(first, second);
        assertTrue(first.size() < points.size());
    }

    @Test
    @DisplayName("Without thinning no random values are drawn")
    void testNoThinningConsumesNoRandomness() throws IOException {
        var points = TestClouds.uniform(new Random(6), 500, 1.0);
        var source = TestClouds.write(tempDir.resolve("plain.pcb"), points);
        var random = new Random() {
            @Override
            public double nextDouble() {
                throw new AssertionError("random drawn without thinning");
            }
        };

        try (var reader = PointCloudReader.open(source);
             var grid = grid(tempDir.resolve("work"), 0.5, points, random, 100)) {
            assertEquals(points.size(), grid.read(reader, 0.0));
        }
    }

    @Test
    void testEmptyInput() throws IOException {
        var source = TestClouds.write(tempDir.resolve("empty.pcb"), List.of());
        var work = tempDir.resolve("work");

        try (var reader = PointCloudReader.open(source); var grid = grid(work, 1.0, List.of(), new Random(), 10)) {
            assertEquals(0, grid.read(reader, 0.0));
            assertEquals(0, grid.getBucketCount());
            assertEquals(0, grid.write(point -> fail("nothing to write")));
            assertTrue(grid.getWorkingDirectory().listFiles().isEmpty());

            var statistics = grid.getStatistics();
            assertEquals(0, statistics.bucketCount());
            assertEquals(0.0, statistics.averagePointsPerBucket());
        }
        assertFalse(Files.exists(work));
    }

    @Test
    @DisplayName("A failure part way through the merge leaves no segments behind")
    void testFailureMidWriteCleansUp() throws IOException {
        var points = TestClouds.uniform(new Random(13), 2_000, 1.0);
        var source = TestClouds.write(tempDir.resolve("fail.pcb"), points);
        var work = tempDir.resolve("work");

        var grid = grid(work, 0.25, points, new Random(), 300);
        try (var reader = PointCloudReader.open(source)) {
            grid.read(reader, 0.0);
        }
        assertFalse(grid.getWorkingDirectory().listFiles().isEmpty());

        var thrown = assertThrows(IOException.class, () -> grid.write(point -> {
            if (grid.getWrittenCount() == 700) {
                throw new IOException("simulated write failure");
            }
        }));
        assertEquals("simulated write failure", thrown.getMessage());
        assertTrue(grid.getBucketCount() > 0);

        grid.close();
        assertFalse(Files.exists(work));
        assertThrows(IllegalStateException.class, () -> grid.add(points.get(0)));
        grid.close();
    }

    @Test
    @DisplayName("Teardown completes when a bucket cannot encode its points")
    void testTeardownAfterUnencodablePoint() throws IOException {
        var work = tempDir.resolve("work");
        var good = PointRecord.at(0.5, 0.5, 0.5);
        // a valid record outside the range of the default millimetre quantization
        var far = PointRecord.at(1e7, 0.5, 0.5);
        var grid = grid(work, 1.0, List.of(good), new Random(), 10);
        grid.add(good);
        grid.add(far);

        assertThrows(IllegalArgumentException.class, grid::flush);
        assertEquals(1, grid.getWorkingDirectory().listFiles().size());
        assertEquals(1, grid.getBuckets().get(CellKey.of(far, 1.0)).getPendingCount());

        var thrown = assertThrows(IllegalArgumentException.class, grid::close);
        assertTrue(thrown.getMessage().contains("not representable"), thrown.getMessage());
        assertFalse(Files.exists(work));
        assertEquals(0, grid.getBucketCount());
        assertThrows(IllegalStateException.class, () -> grid.add(good));
        grid.close();
    }

    @Test
    void testPreExistingWorkingDirectorySurvives() throws IOException {
        var work = Files.createDirectory(tempDir.resolve("shared"));
        var unrelated = Files.writeString(work.resolve("notes.txt"), "keep me");
        var points = TestClouds.uniform(new Random(2), 1_000, 1.0);
        var source = TestClouds.write(tempDir.resolve("shared.pcb"), points);

        try (var reader = PointCloudReader.open(source); var grid = grid(work, 0.5, points, new Random(), 100)) {
            assertFalse(grid.getWorkingDirectory().isCreated());
            grid.read(reader, 0.0);
        }

        assertTrue(Files.isDirectory(work));
        try (var remaining = Files.list(work)) {
            assertEquals(List.of(unrelated), remaining.toList());
        }
    }

    @Test
    void testCancellationDuringRead() throws IOException {
        var points = TestClouds.uniform(new Random(31), 1_000, 1.0);
        var source = TestClouds.write(tempDir.resolve("cancel.pcb"), points);
        var work = tempDir.resolve("work");
        var holder = new Grid[1];

        try (var reader = PointCloudReader.open(source);
             var grid = new Grid(work, 0.5, TestClouds.header(points), new Random(), 100,
                                 (phase, processed, total) -> {
                                     if (processed == 300) {
                                         holder[0].cancel();
                                     }
                                 })) {
            holder[0] = grid;
            assertThrows(CancellationException.class, () -> grid.read(reader, 0.0));
            assertTrue(grid.isCancelled());
            assertEquals(300, grid.getConsumedCount());
            assertFalse(grid.getWorkingDirectory().listFiles().isEmpty());
        }
        assertFalse(Files.exists(work));
    }

    @Test
    void testCancellationBeforeWrite() throws IOException {
        var points = TestClouds.uniform(new Random(32), 200, 1.0);
        var source = TestClouds.write(tempDir.resolve("cancel-write.pcb"), points);

        try (var reader = PointCloudReader.open(source);
             var grid = grid(tempDir.resolve("work"), 0.5, points, new Random(), 50)) {
            grid.read(reader, 0.0);
            grid.cancel();
            assertThrows(CancellationException.class, () -> grid.write(point -> fail("cancelled merge wrote")));
            assertEquals(0, grid.getWrittenCount());
        }
    }

    @Test
    void testInvalidArguments() throws IOException {
        var header = TestClouds.header(List.of());
        assertThrows(IllegalArgumentException.class, () -> new Grid(tempDir.resolve("a"), 0, header));
        assertThrows(IllegalArgumentException.class,
                     () -> new Grid(tempDir.resolve("b"), 1, header, new Random(), 0, QUIET));
        assertFalse(Files.exists(tempDir.resolve("a")));

        var source = TestClouds.write(tempDir.resolve("args.pcb"), List.of());
        try (var reader = PointCloudReader.open(source); var grid = new Grid(tempDir.resolve("c"), 1, header)) {
            assertThrows(IllegalArgumentException.class, () -> grid.read(reader, 1.0));
            assertThrows(IllegalArgumentException.class, () -> grid.read(reader, -0.1));
        }
    }

    private Grid grid(Path work, double cellSize, List<PointRecord> points, Random random, int batchSize)
    throws IOException {
        return new Grid(work, cellSize, TestClouds.header(points), random, batchSize, QUIET);
    }

    private List<PointRecord> thinAndMerge(Path source, List<PointRecord> points, Random random) throws IOException {
        var merged = new ArrayList<PointRecord>();
        try (var reader = PointCloudReader.open(source);
             var grid = grid(tempDir.resolve("work"), 0.5, points, random, 500)) {
            grid.read(reader, 0.3);
            grid.write(merged::add);
        }
        return merged;
    }
}
