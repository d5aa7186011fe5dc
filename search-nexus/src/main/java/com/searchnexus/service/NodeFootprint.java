package com.searchnexus.service;

import lombok.Value;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What one materializer call put on disk. A rollback removes exactly this and
 * nothing the operator or another node owns.
 */
public final class NodeFootprint {

    /** A directory this call created, and the topmost ancestor it had to create along with it. */
    @Value
    static class CreatedDirectory {
        Path directory;
        Path topmost;
    }

    private final List<CreatedDirectory> created = new ArrayList<>();
    private final List<Path> reused = new ArrayList<>();

    void recordCreated(Path directory, Path topmost) {
        created.add(new CreatedDirectory(directory, topmost));
    }

    /** An existing empty directory this call wrote into. */
    void recordReused(Path directory) {
        reused.add(directory);
    }

    boolean covers(Path directory) {
        return created.stream().anyMatch(entry -> entry.getDirectory().equals(directory))
                || reused.contains(directory);
    }

    List<CreatedDirectory> created() {
        return Collections.unmodifiableList(created);
    }

    List<Path> reused() {
        return Collections.unmodifiableList(reused);
    }

    static Path topmostMissing(Path directory) {
        Path topmost = directory;
        Path parent = directory.getParent();
        while (parent != null && !Files.exists(parent)) {
            topmost = parent;
            parent = parent.getParent();
        }
        return topmost;
    }
}
