package eu.lieko.store.storage;

import eu.lieko.store.CollectionRef;
import lombok.NonNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Storage engine keeping every collection in memory. Content is copied on load and persist
 * so callers never share mutable state with the engine.
 */
public class InMemoryStorageEngine implements StorageEngine {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("lieko.store.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(InMemoryStorageEngine.class.getSimpleName());

    private final Map<CollectionRef, RecordMap> collections = new ConcurrentHashMap<>();

    @Override
    public boolean exists(@NonNull CollectionRef ref) {
        return this.collections.containsKey(ref);
    }

    @Override
    public RecordMap load(@NonNull CollectionRef ref) {
        RecordMap records = this.collections.get(ref);
        return (records == null) ? RecordMap.empty() : records.copy();
    }

    @Override
    public void persist(@NonNull CollectionRef ref, @NonNull RecordMap records) {
        this.collections.put(ref, records.copy());
        if (DEBUG) {
            LOGGER.info("Persisted " + records.size() + " records to " + ref);
        }
    }

    @Override
    public boolean drop(@NonNull CollectionRef ref) {
        return this.collections.remove(ref) != null;
    }

    @Override
    public long dropProject(@NonNull String projectId) {
        long removed = 0;
        for (CollectionRef ref : this.collections.keySet()) {
            if (ref.getProjectId().equals(projectId) && (this.collections.remove(ref) != null)) {
                removed++;
            }
        }
        return removed;
    }
}
