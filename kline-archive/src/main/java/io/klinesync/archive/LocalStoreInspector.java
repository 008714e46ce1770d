package io.klinesync.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Answers whether an identifier's artifact is already on disk. Only complete artifacts can be seen here
 * because transfers land in part files and are moved into place in one step.
 */
public class LocalStoreInspector {
    private final ArchiveLayout layout;

    public LocalStoreInspector(ArchiveLayout layout) {
        this.layout = layout;
    }

    /** True when the artifact is a regular, non-empty file. Unreadable paths count as absent. */
    public boolean exists(ResourceIdentifier id) {
        Path path = layout.localPath(id);
        if (!Files.isRegularFile(path)) return false;
        try {
            return Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }
}
