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
package com.hellblazer.pointsort.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scratch directory for temporary segment files.
 *
 * <p>Ownership aware: the directory is created on open if it does not exist, and on close it is removed only when this
 * instance created it. Missing parents created on open are removed too, unless something else has since been put in
 * them. A directory that existed beforehand is left in place, whatever it contains.
 *
 * @author hal.hildebrand
 */
public class WorkingDirectory implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkingDirectory.class);

    private final    Path       path;
    private final    boolean    created;
    private final    List<Path> createdParents;
    private volatile boolean    closed = false;

    private WorkingDirectory(Path path, boolean created, List<Path> createdParents) {
        this.path = path;
        this.created = created;
        this.createdParents = createdParents;
    }

    /**
     * Open a working directory, creating it (and any missing parents) if it does not exist.
     *
     * @param path the directory
     * @return the working directory
     * @throws IOException if the path exists but is not a directory, or cannot be created
     */
    public static WorkingDirectory open(Path path) throws IOException {
        Objects.requireNonNull(path, "Working directory cannot be null");
        var directory = path.toAbsolutePath().normalize();
        if (Files.isDirectory(directory)) {
            log.debug("Using existing working directory {}", directory);
            return new WorkingDirectory(directory, false, List.of());
        }
        if (Files.exists(directory)) {
            throw new IOException("Working directory path is not a directory: " + directory);
        }
        // missing ancestors, innermost first
        var parents = new ArrayList<Path>();
        for (var parent = directory.getParent(); parent != null && Files.notExists(parent);
             parent = parent.getParent()) {
            parents.add(parent);
        }
        Files.createDirectories(directory);
        log.debug("Created working directory {}{}", directory,
                  parents.isEmpty() ? "" : " and " + parents.size() + " parent directories");
        return new WorkingDirectory(directory, true, List.copyOf(parents));
    }

    /**
     * Create a new, empty, uniquely named file in this directory
     *
     * @param prefix file name prefix
     * @param suffix file name suffix
     * @return the path of the new file
     * @throws IOException if the file cannot be created
     */
    public Path newSegmentFile(String prefix, String suffix) throws IOException {
        ensureNotClosed();
        return Files.createTempFile(path, prefix, suffix);
    }

    public Path getPath() {
        return path;
    }

    /**
     * Answer true if this instance created the directory, and so owns its removal
     */
    public boolean isCreated() {
        return created;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * List the regular files currently in the directory
     */
    public List<Path> listFiles() throws IOException {
        if (!Files.isDirectory(path)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(path)) {
            return entries.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("Working directory is closed: " + path);
        }
    }

    /**
     * Release the directory. An owned directory is deleted together with anything left inside it; a pre-existing one
     * is untouched.
     *
     * @throws IOException if an owned directory cannot be deleted
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        if (!created) {
            log.debug("Leaving pre-existing working directory {}", path);
            return;
        }
        if (!Files.exists(path)) {
            log.warn("Working directory {} was removed externally", path);
            removeCreatedParents();
            return;
        }

        var leftovers = new ArrayList<Path>();
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(entry -> {
                if (!entry.equals(path)) {
                    leftovers.add(entry);
                }
                try {
                    Files.delete(entry);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        if (!leftovers.isEmpty()) {
            log.warn("Deleted {} leftover entries in working directory {}", leftovers.size(), path);
        }
        log.debug("Removed working directory {}", path);
        removeCreatedParents();
    }

    /**
     * Parent directories created along with the working directory, innermost first
     */
    public List<Path> getCreatedParents() {
        return createdParents;
    }

    private void removeCreatedParents() throws IOException {
        for (var parent : createdParents) {
            try {
                Files.deleteIfExists(parent);
            } catch (DirectoryNotEmptyException e) {
                log.debug("Keeping parent directory {}, it holds other entries", parent);
                return;
            }
        }
    }

    @Override
    public String toString() {
        return "WorkingDirectory[" + path + (created ? ", owned" : "") + "]";
    }
}
