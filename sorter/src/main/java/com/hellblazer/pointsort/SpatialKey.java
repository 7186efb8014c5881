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
 * Base interface for spatial bucketing keys.
 *
 * Keys must be immutable and implement proper equals/hashCode semantics. The Comparable ordering is the order in which
 * cells are merged into the output, so it must be a strict total order.
 *
 * @param <K> The concrete key type (self-referential for type safety)
 * @author hal.hildebrand
 */
public interface SpatialKey<K extends SpatialKey<K>> extends Comparable<K> {

    /**
     * The region of space covered by this key's cell
     *
     * @param cellSize the edge length of a cell
     * @return the cell's bounds in world coordinates
     */
    Bounds bounds(double cellSize);

    /**
     * Get a human-readable string representation of this key.
     *
     * @return string representation of this key
     */
    @Override
    String toString();
}
