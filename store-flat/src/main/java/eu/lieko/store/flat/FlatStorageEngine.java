package eu.lieko.store.flat;

import com.google.gson.JsonParseException;
import eu.lieko.store.CollectionRef;
import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.StorageException;
import eu.lieko.store.json.JsonCodec;
import eu.lieko.store.storage.RecordMap;
import eu.lieko.store.storage.StorageEngine;
import lombok.Getter;
import lombok.NonNull;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * File-based storage engine. Each collection is one JSON object file mapping record id to record:
 * {@code <storageDir>/projects/<projectId>/<collection>.json}.
 * <p>
 * Every persist rewrites the whole file through a temporary sibling.
 */
public class FlatStorageEngine implements StorageEngine {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("lieko.store.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(FlatStorageEngine.class.getSimpleName());

    public static final String PROJECTS_DIR = "projects";
    public static final String FILE_SUFFIX = ".json";

    private final @Getter Path storageDir;
    private final @Getter Path projectsDir;
    private final JsonCodec codec;

    public FlatStorageEngine(@NonNull Path storageDir) {
        this(storageDir, new JsonCodec());
    }

    public FlatStorageEngine(@NonNull Path storageDir, @NonNull JsonCodec codec) {
        this.storageDir = storageDir.toAbsolutePath().normalize();
        this.projectsDir = this.storageDir.resolve(PROJECTS_DIR);
        this.codec = codec;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path storageDir;
        private JsonCodec codec;

        public Builder storageDir(@NonNull File dir) {
            this.storageDir = dir.toPath();
            return this;
        }

        public Builder storageDir(@NonNull Path dir) {
            this.storageDir = dir;
            return this;
        }

        public Builder codec(@NonNull JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        public FlatStorageEngine build() {
            if (this.storageDir == null) {
                throw new IllegalStateException("storageDir is required");
            }
            return new FlatStorageEngine(this.storageDir, (this.codec != null) ? this.codec : new JsonCodec());
        }
    }

    /**
     * Locks are keyed by the collection file.
     */
    @Override
    public String resourceKey(@NonNull CollectionRef ref) {
        return this.toFile(ref).toString();
    }

    // ==================== READ OPERATIONS ====================

    @Override
    public boolean exists(@NonNull CollectionRef ref) {
        return Files.isRegularFile(this.toFile(ref));
    }

    @Override
    public RecordMap load(@NonNull CollectionRef ref) {
        Path file = this.toFile(ref);
        String json = FlatFiles.read(file);
        if ((json == null) || json.trim().isEmpty()) {
            return RecordMap.empty();
        }

        try {
            Map<String, Object> raw = this.codec.readObject(json);
            return RecordMap.fromRaw(raw);
        } catch (JsonParseException | IllegalArgumentException exception) {
            LOGGER.log(Level.SEVERE, "Malformed collection file " + file, exception);
            throw new StorageException(ErrorCode.JSON_PARSING_ERROR,
                "Failed to parse collection " + ref.getName() + ": " + exception.getMessage(), exception);
        }
    }

    // ==================== WRITE OPERATIONS ====================

    @Override
    public void persist(@NonNull CollectionRef ref, @NonNull RecordMap records) {
        Path file = this.toFile(ref);
        FlatFiles.writeReplacing(file, this.codec.write(records.toRaw()));
        if (DEBUG) {
            LOGGER.info("Wrote " + records.size() + " records to " + file);
        }
    }

    // ==================== DELETE OPERATIONS ====================

    @Override
    public boolean drop(@NonNull CollectionRef ref) {
        return FlatFiles.delete(this.toFile(ref));
    }

    @Override
    public long dropProject(@NonNull String projectId) {
        Path projectDir = this.projectsDir.resolve(CollectionRef.requireValidName(projectId));
        return FlatFiles.deleteRecursive(projectDir, FILE_SUFFIX);
    }

    // ==================== HELPERS ====================

    private Path toFile(@NonNull CollectionRef ref) {
        return this.projectsDir.resolve(ref.getProjectId()).resolve(ref.getName() + FILE_SUFFIX);
    }
}
