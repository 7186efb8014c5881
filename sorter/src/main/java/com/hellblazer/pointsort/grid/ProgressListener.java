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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives progress reports from the two passes of a {@link Grid}.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * The pass being reported
     */
    enum Phase {
        READ("Bucketing"), WRITE("Merging");

        private final String description;

        Phase(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    /**
     * Logs each report as a percentage at info level
     */
    ProgressListener LOGGING = new ProgressListener() {
        private final Logger log = LoggerFactory.getLogger(ProgressListener.class);

        @Override
        public void progress(Phase phase, long processed, long total) {
            log.info("{}: {}% ({} of {} points)", phase.getDescription(), percent(processed, total), processed,
                     total);
        }
    };

    /**
     * @param phase     the pass in progress
     * @param processed points processed so far in this pass
     * @param total     points expected in this pass
     */
    void progress(Phase phase, long processed, long total);

    static int percent(long processed, long total) {
        if (total <= 0) {
            return 100;
        }
        return (int) Math.min(100, processed * 100 / total);
    }
}
