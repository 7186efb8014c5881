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

import com.hellblazer.pointsort.grid.GridStatistics;

import java.nio.file.Path;

/**
 * Outcome of a successful {@link Sorter} run.
 *
 * @param input           the source file
 * @param output          the sorted file
 * @param sourcePoints    points declared by the source header
 * @param acceptedPoints  points surviving thinning, as declared in the output header
 * @param writtenPoints   points streamed to the output
 * @param cellSize        the cell size used
 * @param compressed      whether the output is compressed
 * @param statistics      bucket diagnostics
 * @param elapsedMillis   wall clock time of the run
 * @author hal.hildebrand
 */
public record SortResult(Path input, Path output, long sourcePoints, long acceptedPoints, long writtenPoints,
                         double cellSize, boolean compressed, GridStatistics statistics, long elapsedMillis) {
}
