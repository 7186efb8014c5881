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

/**
 * Chooses a cell edge length from the source's bounding box and point count, aiming for a fixed population per cell.
 *
 * <p>The estimate assumes uniform density over the bounding box. Clustered data yields cells far fuller or emptier
 * than the target.
 *
 * @author hal.hildebrand
 */
public final class CellSizeEstimator {

    /**
     * Returned when the data gives no extent to divide
     */
    public static final double FALLBACK_CELL_SIZE = 1.0;

    private CellSizeEstimator() {
    }

    /**
     * Estimate the cell edge length.
     *
     * <p>With {@code expected = pointCount * (1 - thinFraction)} and {@code cells = expected / targetPointsPerCell},
     * the cell size is the cube root of {@code volume / cells}. Degenerate boxes fall back to fewer dimensions: a flat
     * box uses the square root of its area per cell, a line its length per cell. When there are no points, or the box
     * is a single point or empty, the whole box is one cell.
     *
     * @param bounds              bounding box of the source
     * @param pointCount          declared number of source points
     * @param thinFraction        expected fraction of points dropped, in [0, 1)
     * @param targetPointsPerCell desired points per cell
     * @return a positive, finite cell size
     * @throws IllegalArgumentException if the bounds are not finite or an argument is out of range
     */
    public static double estimate(Bounds bounds, long pointCount, double thinFraction, long targetPointsPerCell) {
        if (pointCount < 0) {
            throw new IllegalArgumentException("Point count must be non-negative: " + pointCount);
        }
        if (!(thinFraction >= 0.0 && thinFraction < 1.0)) {
            throw new IllegalArgumentException("Thin fraction must be in [0, 1): " + thinFraction);
        }
        if (targetPointsPerCell <= 0) {
            throw new IllegalArgumentException("Target points per cell must be positive: " + targetPointsPerCell);
        }
        if (bounds.isEmpty()) {
            return FALLBACK_CELL_SIZE;
        }
        if (!bounds.isFinite()) {
            throw new IllegalArgumentException("Bounds must be finite: " + bounds);
        }

        double expected = pointCount * (1.0 - thinFraction);
        if (expected <= 0) {
            return Math.max(bounds.maxExtent(), FALLBACK_CELL_SIZE);
        }
        double cells = expected / targetPointsPerCell;

        double measure = 1.0;
        int dimensions = 0;
        for (double extent : new double[] { bounds.width(), bounds.height(), bounds.depth() }) {
            if (extent > 0) {
                measure *= extent;
                dimensions++;
            }
        }

        double size = switch (dimensions) {
            case 3 -> Math.cbrt(measure / cells);
            case 2 -> Math.sqrt(measure / cells);
            case 1 -> measure / cells;
            default -> FALLBACK_CELL_SIZE;
        };
        if (!(size > 0) || Double.isInfinite(size)) {
            return FALLBACK_CELL_SIZE;
        }
        return size;
    }
}
