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

import javax.vecmath.Point3d;

/**
 * A single point of a point cloud. Only the position matters for spatial ordering; the remaining attributes are
 * carried through unchanged.
 *
 * @param x              world X coordinate
 * @param y              world Y coordinate
 * @param z              world Z coordinate
 * @param intensity      return intensity, 0..65535
 * @param classification classification code, 0..255
 * @param returnNumber   return number, 0..255
 * @param gpsTime        acquisition time stamp
 * @author hal.hildebrand
 */
public record PointRecord(double x, double y, double z, int intensity, int classification, int returnNumber,
                          double gpsTime) {

    public PointRecord {
        if (Double.isNaN(x) || Double.isNaN(y) || Double.isNaN(z)) {
            throw new IllegalArgumentException("Point position cannot be NaN");
        }
        if (intensity < 0 || intensity > 0xFFFF) {
            throw new IllegalArgumentException("Intensity out of range: " + intensity);
        }
        if (classification < 0 || classification > 0xFF) {
            throw new IllegalArgumentException("Classification out of range: " + classification);
        }
        if (returnNumber < 0 || returnNumber > 0xFF) {
            throw new IllegalArgumentException("Return number out of range: " + returnNumber);
        }
    }

    /**
     * A point with the given position and zeroed attributes
     */
    public static PointRecord at(double x, double y, double z) {
        return new PointRecord(x, y, z, 0, 0, 0, 0.0);
    }

    public Point3d position() {
        return new Point3d(x, y, z);
    }
}
