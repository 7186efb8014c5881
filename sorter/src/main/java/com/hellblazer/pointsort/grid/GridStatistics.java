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

/**
 * Diagnostic summary of a {@link Grid}. Informational only.
 *
 * @param bucketCount            number of buckets created
 * @param consumedCount          points read from the source, before thinning
 * @param acceptedCount          points accepted into buckets
 * @param averagePointsPerBucket accepted points per bucket
 * @param averageFileSize        segment bytes per bucket
 * @author hal.hildebrand
 */
public record GridStatistics(int bucketCount, long consumedCount, long acceptedCount, double averagePointsPerBucket,
                             double averageFileSize) {

    @Override
    public String toString() {
        return String.format("buckets=%d, consumed=%d, accepted=%d, avg points/bucket=%.1f, avg bucket size=%.1f KB",
                             bucketCount, consumedCount, acceptedCount, averagePointsPerBucket,
                             averageFileSize / 1024.0);
    }
}
