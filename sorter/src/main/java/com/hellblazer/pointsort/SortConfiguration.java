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

import com.hellblazer.pointsort.grid.Grid;
import com.hellblazer.pointsort.grid.ProgressListener;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Random;

/**
 * Settings for a {@link Sorter} run.
 *
 * @author hal.hildebrand
 */
public class SortConfiguration {

    /**
     * Cell size sentinel asking for the size to be estimated from the source's point density
     */
    public static final double AUTO_CELL_SIZE = 0.0;

    public static final String DEFAULT_WORKING_DIRECTORY      = "pointsort-tmp";
    public static final long   DEFAULT_TARGET_POINTS_PER_CELL = 2_000_000L;

    private final double           cellSize;
    private final double           thinFraction;
    private final Path             workingDirectory;
    private final int              batchSize;
    private final long             targetPointsPerCell;
    private final Random           random;
    private final ProgressListener progressListener;

    private SortConfiguration(Builder builder) {
        this.cellSize = builder.cellSize;
        this.thinFraction = builder.thinFraction;
        this.workingDirectory = builder.workingDirectory;
        this.batchSize = builder.batchSize;
        this.targetPointsPerCell = builder.targetPointsPerCell;
        this.random = builder.random != null ? builder.random : new Random();
        this.progressListener = builder.progressListener;
    }

    public static SortConfiguration defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getCellSize() {
        return cellSize;
    }

    public boolean isAutoCellSize() {
        return cellSize == AUTO_CELL_SIZE;
    }

    public double getThinFraction() {
        return thinFraction;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public long getTargetPointsPerCell() {
        return targetPointsPerCell;
    }

    public Random getRandom() {
        return random;
    }

    public ProgressListener getProgressListener() {
        return progressListener;
    }

    @Override
    public String toString() {
        return String.format("SortConfiguration{cellSize=%s, thin=%s, workDir=%s, batch=%d, target=%d}",
                             isAutoCellSize() ? "auto" : String.valueOf(cellSize), thinFraction, workingDirectory,
                             batchSize, targetPointsPerCell);
    }

    public static class Builder {
        private double           cellSize            = AUTO_CELL_SIZE;
        private double           thinFraction        = 0.0;
        private Path             workingDirectory    = Path.of(DEFAULT_WORKING_DIRECTORY);
        private int              batchSize           = Grid.DEFAULT_BATCH_SIZE;
        private long             targetPointsPerCell = DEFAULT_TARGET_POINTS_PER_CELL;
        private Random           random;
        private ProgressListener progressListener    = ProgressListener.LOGGING;

        public Builder withCellSize(double cellSize) {
            this.cellSize = cellSize;
            return this;
        }

        public Builder withThinFraction(double thinFraction) {
            this.thinFraction = thinFraction;
            return this;
        }

        public Builder withWorkingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder withBatchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder withTargetPointsPerCell(long targetPointsPerCell) {
            this.targetPointsPerCell = targetPointsPerCell;
            return this;
        }

        public Builder withRandom(Random random) {
            this.random = random;
            return this;
        }

        public Builder withSeed(long seed) {
            this.random = new Random(seed);
            return this;
        }

        public Builder withProgressListener(ProgressListener progressListener) {
            this.progressListener = progressListener;
            return this;
        }

        public SortConfiguration build() {
            if (!(cellSize == AUTO_CELL_SIZE || cellSize > 0) || Double.isNaN(cellSize) || Double.isInfinite(
            cellSize)) {
                throw new IllegalArgumentException("Cell size must be positive, or AUTO_CELL_SIZE: " + cellSize);
            }
            if (!(thinFraction >= 0.0 && thinFraction < 1.0)) {
                throw new IllegalArgumentException("Thin fraction must be in [0, 1): " + thinFraction);
            }
            Objects.requireNonNull(workingDirectory, "Working directory cannot be null");
            Objects.requireNonNull(progressListener, "Progress listener cannot be null");
            if (batchSize <= 0) {
                throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
            }
            if (targetPointsPerCell <= 0) {
                throw new IllegalArgumentException("Target points per cell must be positive: " + targetPointsPerCell);
            }
            return new SortConfiguration(this);
        }
    }
}
