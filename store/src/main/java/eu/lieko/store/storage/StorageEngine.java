package eu.lieko.store.storage;

import eu.lieko.store.CollectionRef;
import lombok.NonNull;

import java.io.Closeable;
import java.io.IOException;

/**
 * Persists whole collections. Every write replaces the entire content of the container;
 * callers serialize writers of the same resource through the write serializer.
 */
public interface StorageEngine extends Closeable {

    /**
     * Identity of the container backing the collection, used as the write lock key.
     */
    default String resourceKey(@NonNull CollectionRef ref) {
        return ref.getValue();
    }

    boolean exists(@NonNull CollectionRef ref);

    /**
     * @return persisted records, or an empty map if the collection was never written
     * @throws eu.lieko.store.error.StorageException on I/O or parse failure
     */
    RecordMap load(@NonNull CollectionRef ref);

    /**
     * Replaces the stored content of the collection.
     *
     * @throws eu.lieko.store.error.StorageException on I/O failure
     */
    void persist(@NonNull CollectionRef ref, @NonNull RecordMap records);

    /**
     * @return true if a container was removed
     */
    boolean drop(@NonNull CollectionRef ref);

    /**
     * Removes every container of the project.
     *
     * @return number of removed containers
     */
    long dropProject(@NonNull String projectId);

    @Override
    default void close() throws IOException {
    }
}
