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

import javax.vecmath.Vector3d;
import java.util.Objects;

/**
 * Metadata header of a point cloud file: declared point count, coordinate encoding, bounding box and compression.
 *
 * <p>Positions are stored quantized: {@code raw = round((value - offset) / scale)} per axis.
 *
 * @author hal.hildebrand
 */
public record PointCloudHeader(int version, boolean compressed, long pointCount, Vector3d scale, Vector3d offset,
                               Bounds bounds, String systemIdentifier) {

    public static final Vector3d DEFAULT_SCALE  = new Vector3d(0.001, 0.001, 0.001);
    public static final Vector3d DEFAULT_OFFSET = new Vector3d(0, 0, 0);

    public PointCloudHeader {
        Objects.requireNonNull(scale, "Scale cannot be null");
        Objects.requireNonNull(offset, "Offset cannot be null");
        Objects.requireNonNull(bounds, "Bounds cannot be null");
        if (pointCount < 0) {
            throw new IllegalArgumentException("Point count must be non-negative: " + pointCount);
        }
        if (!(scale.x > 0 && scale.y > 0 && scale.z > 0) || !Double.isFinite(scale.x) || !Double.isFinite(scale.y)
        || !Double.isFinite(scale.z)) {
            throw new IllegalArgumentException("Scale must be positive and finite: " + scale);
        }
        systemIdentifier = systemIdentifier == null ? "" : systemIdentifier;
        if (systemIdentifier.length() > PointCloudFormat.SYSTEM_IDENTIFIER_SIZE) {
            throw new IllegalArgumentException(
            "System identifier longer than " + PointCloudFormat.SYSTEM_IDENTIFIER_SIZE + " characters");
        }
        scale = new Vector3d(scale);
        offset = new Vector3d(offset);
    }

    /**
     * Create a header for the current format version with the default coordinate encoding
     */
    public static PointCloudHeader create(long pointCount, Bounds bounds) {
        return new PointCloudHeader(PointCloudFormat.CURRENT_VERSION, false, pointCount, DEFAULT_SCALE,
                                    DEFAULT_OFFSET, bounds, "");
    }

    @Override
    public Vector3d scale() {
        return new Vector3d(scale);
    }

    @Override
    public Vector3d offset() {
        return new Vector3d(offset);
    }

    public PointCloudHeader withPointCount(long count) {
        return new PointCloudHeader(version, compressed, count, scale, offset, bounds, systemIdentifier);
    }

    public PointCloudHeader withCompressed(boolean compress) {
        return new PointCloudHeader(version, compress, pointCount, scale, offset, bounds, systemIdentifier);
    }

    public PointCloudHeader withBounds(Bounds newBounds) {
        return new PointCloudHeader(version, compressed, pointCount, scale, offset, newBounds, systemIdentifier);
    }

    public PointCloudHeader withSystemIdentifier(String identifier) {
        return new PointCloudHeader(version, compressed, pointCount, scale, offset, bounds, identifier);
    }
}
