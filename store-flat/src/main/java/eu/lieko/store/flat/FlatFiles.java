package eu.lieko.store.flat;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.StorageException;
import lombok.Cleanup;
import lombok.NonNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.Comparator;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * File helpers shared by the flat backends.
 */
final class FlatFiles {

    private static final Logger LOGGER = Logger.getLogger(FlatFiles.class.getSimpleName());

    private FlatFiles() {
    }

    /**
     * @return file content, or {@code null} if the file does not exist
     * @throws StorageException {@link ErrorCode#FILE_SYSTEM_ERROR} on read failure
     */
    static String read(@NonNull Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (NoSuchFileException exception) {
            return null;
        } catch (IOException exception) {
            throw new StorageException(ErrorCode.FILE_SYSTEM_ERROR, "Failed to read " + file + ": " + exception.getMessage(), exception);
        }
    }

    /**
     * Writes the content to a temporary sibling and moves it over the target.
     *
     * @throws StorageException {@link ErrorCode#FILE_SYSTEM_ERROR} on write failure
     */
    static void writeReplacing(@NonNull Path file, @NonNull String content) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp-" + UUID.randomUUID());
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(temp, content.getBytes(StandardCharsets.UTF_8));
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException exception) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException exception) {
            deleteQuietly(temp);
            throw new StorageException(ErrorCode.FILE_SYSTEM_ERROR, "Failed to write " + file + ": " + exception.getMessage(), exception);
        }
    }

    /**
     * @throws StorageException {@link ErrorCode#FILE_SYSTEM_ERROR} on delete failure
     */
    static boolean delete(@NonNull Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException exception) {
            throw new StorageException(ErrorCode.FILE_SYSTEM_ERROR, "Failed to delete " + file + ": " + exception.getMessage(), exception);
        }
    }

    /**
     * Deletes the directory tree.
     *
     * @return number of removed files matching the suffix
     * @throws StorageException {@link ErrorCode#FILE_SYSTEM_ERROR} on failure
     */
    static long deleteRecursive(@NonNull Path directory, @NonNull String suffix) {
        if (!Files.exists(directory)) {
            return 0;
        }
        try {
            @Cleanup Stream<Path> walk = Files.walk(directory);
            long removed = 0;
            for (Path path : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                boolean counted = Files.isRegularFile(path) && path.getFileName().toString().endsWith(suffix);
                Files.delete(path);
                if (counted) {
                    removed++;
                }
            }
            return removed;
        } catch (IOException exception) {
            throw new StorageException(ErrorCode.FILE_SYSTEM_ERROR, "Failed to delete " + directory + ": " + exception.getMessage(), exception);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException exception) {
            LOGGER.log(Level.WARNING, "Failed to remove temporary file " + file, exception);
        }
    }
}
