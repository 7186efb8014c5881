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

/**
 * Axis-aligned bounding box of a point cloud, in world units.
 *
 * @author hal.hildebrand
 */
public record Bounds(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {

    private static final Bounds EMPTY = new Bounds(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY,
                                                   Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY,
                                                   Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY);

    /**
     * The empty box, the identity for {@link #union(double, double, double)}
     */
    public static Bounds empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return minX > maxX || minY > maxY || minZ > maxZ;
    }

    public boolean isFinite() {
        return Double.isFinite(minX) && Double.isFinite(minY) && Double.isFinite(minZ) && Double.isFinite(maxX)
        && Double.isFinite(maxY) && Double.isFinite(maxZ);
    }

    /**
     * Get the width (X extent) of the bounds
     */
    public double width() {
        return isEmpty() ? 0.0 : maxX - minX;
    }

    /**
     * Get the height (Y extent) of the bounds
     */
    public double height() {
        return isEmpty() ? 0.0 : maxY - minY;
    }

    /**
     * Get the depth (Z extent) of the bounds
     */
    public double depth() {
        return isEmpty() ? 0.0 : maxZ - minZ;
    }

    /**
     * Get the maximum extent across all dimensions
     */
    public double maxExtent() {
        return Math.max(Math.max(width(), height()), depth());
    }

    public double volume() {
        return width() * height() * depth();
    }

    /**
     * Check if a point is contained within these bounds
     */
    public boolean contains(double x, double y, double z) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY && z >= minZ && z <= maxZ;
    }

    /**
     * Answer the smallest box containing this box and the given position
     */
    public Bounds union(double x, double y, double z) {
        return new Bounds(Math.min(minX, x), Math.min(minY, y), Math.min(minZ, z), Math.max(maxX, x),
                          Math.max(maxY, y), Math.max(maxZ, z));
    }

    public Bounds union(PointRecord point) {
        return union(point.x(), point.y(), point.z());
    }
}
