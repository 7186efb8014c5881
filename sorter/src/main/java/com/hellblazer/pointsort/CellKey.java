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
import com.hellblazer.pointsort.codec.PointRecord;

import javax.vecmath.Tuple3d;
import java.util.Objects;

/**
 * Spatial key of a cubic grid cell: the integer triple {@code (i, j, k)} obtained by dividing each coordinate by the
 * cell edge length and rounding down.
 *
 * <p>Rounding is floor, not truncation toward zero, so every cell is the half-open cube
 * {@code [i * size, (i + 1) * size)} on each axis, including the cells straddling the origin. Keys order
 * lexicographically by {@code i}, then {@code j}, then {@code k}, which visits cells in raster order.
 *
 * @author hal.hildebrand
 */
public final class CellKey implements SpatialKey<CellKey> {

    private final int i;
    private final int j;
    private final int k;

    public CellKey(int i, int j, int k) {
        this.i = i;
        this.j = j;
        this.k = k;
    }

    /**
     * Compute the key of the cell containing a position.
     *
     * @param x        the x coordinate
     * @param y        the y coordinate
     * @param z        the z coordinate
     * @param cellSize the cell edge length, positive
     * @return the key of the containing cell
     * @throws IllegalArgumentException if the cell size is not positive, or a cell index does not fit in an int
     */
    public static CellKey of(double x, double y, double z, double cellSize) {
        if (!(cellSize > 0) || Double.isInfinite(cellSize)) {
            throw new IllegalArgumentException("Cell size must be positive and finite: " + cellSize);
        }
        return new CellKey(index(x, cellSize), index(y, cellSize), index(z, cellSize));
    }

    public static CellKey of(Tuple3d position, double cellSize) {
        return of(position.x, position.y, position.z, cellSize);
    }

    public static CellKey of(PointRecord point, double cellSize) {
        return of(point.x(), point.y(), point.z(), cellSize);
    }

    private static int index(double coordinate, double cellSize) {
        double cell = Math.floor(coordinate / cellSize);
        if (Double.isNaN(cell) || cell < Integer.MIN_VALUE || cell > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
            "Coordinate " + coordinate + " has no cell index at cell size " + cellSize);
        }
        return (int) cell;
    }

    @Override
    public Bounds bounds(double cellSize) {
        return new Bounds(i * cellSize, j * cellSize, k * cellSize, (i + 1L) * cellSize, (j + 1L) * cellSize,
                          (k + 1L) * cellSize);
    }

    @Override
    public int compareTo(CellKey other) {
        Objects.requireNonNull(other, "Cannot compare to null CellKey");
        int result = Integer.compare(i, other.i);
        if (result != 0) {
            return result;
        }
        result = Integer.compare(j, other.j);
        if (result != 0) {
            return result;
        }
        return Integer.compare(k, other.k);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof final CellKey other)) {
            return false;
        }
        return i == other.i && j == other.j && k == other.k;
    }

    public int getI() {
        return i;
    }

    public int getJ() {
        return j;
    }

    public int getK() {
        return k;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * i + j) + k;
    }

    @Override
    public String toString() {
        return "CellKey[" + i + "," + j + "," + k + "]";
    }
}
