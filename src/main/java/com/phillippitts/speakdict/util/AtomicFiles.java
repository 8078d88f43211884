package com.phillippitts.speakdict.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * File replacement helpers shared by the store and the compilation pipeline.
 *
 * <p>Readers of a replaced file either see the old content or the new content, never a
 * partially written file, as long as source and target live on the same file system.
 */
public final class AtomicFiles {

    private static final Logger LOG = LogManager.getLogger(AtomicFiles.class);

    private AtomicFiles() {
        // Utility class - prevent instantiation
    }

    /**
     * Renames {@code source} over {@code target}, replacing it if present.
     *
     * <p>Falls back to a plain replacing move when the file system rejects
     * {@link StandardCopyOption#ATOMIC_MOVE}.
     *
     * @param source fully written file to move
     * @param target destination path
     * @throws IOException if the move fails
     */
    public static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported for {} -> {}; using replacing move", source, target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Builds a sibling path of {@code base} with its extension replaced by {@code suffix},
     * e.g. {@code user.dic} + {@code .dict_csv-<id>.tmp} gives {@code user.dict_csv-<id>.tmp}.
     */
    public static Path siblingWithSuffix(Path base, String suffix) {
        String name = base.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return base.resolveSibling(stem + suffix);
    }

    /**
     * Deletes the file if present. Failures are logged, never thrown.
     *
     * @param path file to delete (may be null)
     */
    public static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete temporary file {}: {}", path, e.toString());
        }
    }
}
