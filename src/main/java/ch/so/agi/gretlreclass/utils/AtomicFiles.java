package ch.so.agi.gretlreclass.utils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Helpers for the write-to-temporary-then-rename commit of local outputs.
 */
public final class AtomicFiles {

    public static final String TMP_SUFFIX = ".tmp";

    private AtomicFiles() {}

    /**
     * @return {@code <destination>.tmp}
     */
    public static Path temporarySibling(Path destination) {
        return destination.resolveSibling(destination.getFileName().toString() + TMP_SUFFIX);
    }

    /**
     * Moves the finished temporary file into place, atomically where the file
     * system supports it.
     */
    public static void commit(Path temporary, Path destination) throws IOException {
        try {
            Files.move(temporary, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temporary, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Deletes a temporary file or directory tree. A failure is attached to the
     * primary error as a suppressed exception.
     *
     * @param temporary file or directory to remove, may not exist
     * @param primary   the error that caused the cleanup
     */
    public static void discard(Path temporary, Throwable primary) {
        try {
            delete(temporary);
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    /**
     * Deletes a file or a directory tree if it exists.
     */
    public static void delete(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            try (Stream<Path> walk = Files.walk(path)) {
                for (Path p : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                    Files.deleteIfExists(p);
                }
            }
        } else {
            Files.deleteIfExists(path);
        }
    }
}
