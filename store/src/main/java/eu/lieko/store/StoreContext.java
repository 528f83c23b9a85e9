package eu.lieko.store;

import eu.lieko.store.lock.ResourceLock;
import eu.lieko.store.lock.WriteSerializer;
import eu.lieko.store.metadata.ProjectMetadataStore;
import eu.lieko.store.registry.CollectionRegistry;
import eu.lieko.store.storage.RecordMap;
import eu.lieko.store.storage.StorageEngine;
import lombok.Getter;
import lombok.NonNull;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Engine state of one running store: storage, metadata, write locks and the collection registry.
 * Create one per server instance and share it between all callers.
 */
@Getter
public class StoreContext implements Closeable {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("lieko.store.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(StoreContext.class.getSimpleName());

    private final StorageEngine storage;
    private final ProjectMetadataStore metadata;
    private final WriteSerializer writeSerializer;
    private final CollectionRegistry registry;
    private final Clock clock;

    public StoreContext(
        @NonNull StorageEngine storage,
        @NonNull ProjectMetadataStore metadata,
        @NonNull WriteSerializer writeSerializer,
        @NonNull Clock clock
    ) {
        this.storage = storage;
        this.metadata = metadata;
        this.writeSerializer = writeSerializer;
        this.clock = clock;
        this.registry = new CollectionRegistry(storage, metadata, writeSerializer, clock);
    }

    /**
     * @return current instant in ISO-8601 UTC form
     */
    public String now() {
        return Instant.now(this.clock).toString();
    }

    /**
     * Loads an existing collection. Not serialized against writers.
     *
     * @throws eu.lieko.store.error.NotFoundException if the collection does not exist
     */
    public RecordMap read(@NonNull CollectionRef ref) {
        this.registry.ensureExists(ref, false);
        return this.storage.load(ref);
    }

    /**
     * Runs a load-modify-persist cycle while holding the collection write lock.
     * The map is persisted only when the mutation changed it.
     *
     * @param createIfMissing whether a missing collection is created instead of failing
     */
    public <T> T write(@NonNull CollectionRef ref, boolean createIfMissing, @NonNull Function<RecordMap, T> mutation) {
        try (ResourceLock ignored = this.writeSerializer.acquire(this.storage.resourceKey(ref))) {
            this.registry.ensureExists(ref, createIfMissing);
            RecordMap records = this.storage.load(ref);
            T result = mutation.apply(records);
            if (records.isModified()) {
                this.storage.persist(ref, records);
            } else if (DEBUG) {
                LOGGER.info("Nothing changed in " + ref + ", skipping persist");
            }
            return result;
        }
    }

    @Override
    public void close() throws IOException {
        this.storage.close();
    }
}
