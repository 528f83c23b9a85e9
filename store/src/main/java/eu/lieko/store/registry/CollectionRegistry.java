package eu.lieko.store.registry;

import eu.lieko.store.CollectionRef;
import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.NotFoundException;
import eu.lieko.store.error.StorageException;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.lock.ResourceLock;
import eu.lieko.store.lock.WriteSerializer;
import eu.lieko.store.metadata.CollectionInfo;
import eu.lieko.store.metadata.ProjectMetadata;
import eu.lieko.store.metadata.ProjectMetadataStore;
import eu.lieko.store.storage.RecordMap;
import eu.lieko.store.storage.StorageEngine;
import lombok.NonNull;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Tracks which collections exist per project and creates them on demand.
 * <p>
 * The membership cache is read without locking. Every cache mutation happens together with
 * the matching metadata write while holding the metadata write lock, so both stay in lockstep.
 * Lock order is always collection lock first, metadata lock second.
 */
public class CollectionRegistry {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("lieko.store.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(CollectionRegistry.class.getSimpleName());

    private final StorageEngine storage;
    private final ProjectMetadataStore metadata;
    private final WriteSerializer writeSerializer;
    private final Clock clock;

    private final Map<String, Set<String>> cache = new ConcurrentHashMap<>();

    public CollectionRegistry(
        @NonNull StorageEngine storage,
        @NonNull ProjectMetadataStore metadata,
        @NonNull WriteSerializer writeSerializer,
        @NonNull Clock clock
    ) {
        this.storage = storage;
        this.metadata = metadata;
        this.writeSerializer = writeSerializer;
        this.clock = clock;
    }

    /**
     * Seeds the cache with the collections listed in the persisted metadata.
     */
    public void initialize() {
        try (ResourceLock ignored = this.writeSerializer.acquire(this.metadata.resourceKey())) {
            this.cache.clear();
            for (ProjectMetadata project : this.metadata.listProjects()) {
                this.cachedNames(project.getId()).addAll(project.collectionNames());
            }
        }
        if (DEBUG) {
            LOGGER.info("Loaded collections of " + this.cache.size() + " projects");
        }
    }

    // ==================== LOOKUP ====================

    public boolean isCached(@NonNull CollectionRef ref) {
        Set<String> names = this.cache.get(ref.getProjectId());
        return (names != null) && names.contains(ref.getName());
    }

    /**
     * @return whether the collection is known or its container exists
     */
    public boolean contains(@NonNull CollectionRef ref) {
        return this.isCached(ref) || this.storage.exists(ref);
    }

    /**
     * @return persisted collection list of the project
     * @throws NotFoundException {@link ErrorCode#PROJECT_NOT_FOUND} if the project is unknown
     */
    public List<CollectionInfo> list(@NonNull String projectId) {
        return this.metadata.requireProject(projectId).getCollections();
    }

    // ==================== ENSURE / CREATE ====================

    /**
     * Makes sure the collection exists, creating an empty one when allowed.
     *
     * @throws NotFoundException   {@link ErrorCode#COLLECTION_NOT_FOUND} when missing and not created,
     *                             {@link ErrorCode#PROJECT_NOT_FOUND} when metadata has no such project
     * @throws StorageException    {@link ErrorCode#COLLECTION_CREATION_FAILED} when the container cannot be written
     */
    public void ensureExists(@NonNull CollectionRef ref, boolean createIfMissing) {
        if (this.isCached(ref)) {
            return;
        }

        if (this.storage.exists(ref)) {
            // container present on disk but unknown to the cache
            try (ResourceLock ignored = this.writeSerializer.acquire(this.metadata.resourceKey())) {
                this.updateMetadata(ref.getProjectId(), () ->
                    this.metadata.addCollections(ref.getProjectId(), Collections.singletonList(ref.getName()), this.now()));
                this.cachedNames(ref.getProjectId()).add(ref.getName());
            }
            if (DEBUG) {
                LOGGER.info("Synced existing collection " + ref);
            }
            return;
        }

        if (!createIfMissing) {
            throw new NotFoundException(ErrorCode.COLLECTION_NOT_FOUND, "Collection not found: " + ref.getName());
        }

        this.register(ref.getProjectId(), Collections.singletonList(ref.getName()));
    }

    /**
     * Registers collections explicitly. Names already registered are left untouched.
     *
     * @return the project's full collection list
     */
    public List<CollectionInfo> register(@NonNull String projectId, @NonNull Collection<String> names) {
        List<CollectionRef> refs = this.toRefs(projectId, names);
        String now = this.now();

        try (ResourceLock ignored = this.writeSerializer.acquire(this.metadata.resourceKey())) {
            this.metadata.requireProject(projectId);

            for (CollectionRef ref : refs) {
                if (!this.storage.exists(ref)) {
                    this.createContainer(ref);
                }
            }

            List<String> created = refs.stream().map(CollectionRef::getName).collect(Collectors.toList());
            List<CollectionInfo> collections = this.updateMetadata(projectId, () -> this.metadata.addCollections(projectId, created, now));
            this.cachedNames(projectId).addAll(created);

            if (DEBUG) {
                LOGGER.info("Registered collections " + created + " in project " + projectId);
            }
            return collections;
        }
    }

    private void createContainer(CollectionRef ref) {
        try {
            this.storage.persist(ref, RecordMap.empty());
        } catch (StorageException exception) {
            LOGGER.log(Level.SEVERE, "Failed to create collection " + ref, exception);
            throw new StorageException(ErrorCode.COLLECTION_CREATION_FAILED,
                "Failed to create collection " + ref.getName() + ": " + exception.getMessage(), exception);
        }
    }

    // ==================== REMOVAL ====================

    /**
     * Removes collections from metadata and cache and drops their containers, each one under its
     * collection write lock. Unknown names are ignored.
     *
     * @return the project's remaining collection list
     * @throws NotFoundException {@link ErrorCode#PROJECT_NOT_FOUND} if the project is unknown
     */
    public List<CollectionInfo> deregister(@NonNull String projectId, @NonNull Collection<String> names) {
        List<CollectionRef> refs = this.toRefs(projectId, names);
        List<CollectionInfo> remaining = this.metadata.requireProject(projectId).getCollections();

        for (CollectionRef ref : refs) {
            try (ResourceLock ignored = this.writeSerializer.acquire(this.storage.resourceKey(ref))) {
                try (ResourceLock metadataLock = this.writeSerializer.acquire(this.metadata.resourceKey())) {
                    remaining = this.updateMetadata(projectId, () ->
                        this.metadata.removeCollections(projectId, Collections.singletonList(ref.getName()), this.now()));
                    this.cachedNames(projectId).remove(ref.getName());
                    this.storage.drop(ref);
                }
            }
        }

        if (DEBUG) {
            LOGGER.info("Deregistered collections " + refs + " from project " + projectId);
        }
        return remaining;
    }

    /**
     * Wipes an existing collection and removes it from the registry.
     *
     * @throws NotFoundException {@link ErrorCode#COLLECTION_NOT_FOUND} if the collection does not exist
     */
    public void drop(@NonNull CollectionRef ref) {
        try (ResourceLock ignored = this.writeSerializer.acquire(this.storage.resourceKey(ref))) {
            this.ensureExists(ref, false);
            this.storage.drop(ref);

            try (ResourceLock metadataLock = this.writeSerializer.acquire(this.metadata.resourceKey())) {
                if (this.metadata.getProject(ref.getProjectId()).isPresent()) {
                    this.updateMetadata(ref.getProjectId(), () ->
                        this.metadata.removeCollections(ref.getProjectId(), Collections.singletonList(ref.getName()), this.now()));
                }
                this.cachedNames(ref.getProjectId()).remove(ref.getName());
            }
        }
        if (DEBUG) {
            LOGGER.info("Dropped collection " + ref);
        }
    }

    /**
     * Forgets cached membership of a deleted project.
     */
    public void evictProject(@NonNull String projectId) {
        try (ResourceLock ignored = this.writeSerializer.acquire(this.metadata.resourceKey())) {
            this.cache.remove(projectId);
        }
    }

    // ==================== HELPERS ====================

    /**
     * Runs a metadata mutation, reporting storage failures as {@link ErrorCode#REGISTRATION_ERROR}.
     */
    private <T> T updateMetadata(String projectId, Supplier<T> mutation) {
        try {
            return mutation.get();
        } catch (StorageException exception) {
            LOGGER.log(Level.SEVERE, "Failed to update collections of project " + projectId, exception);
            throw new StorageException(ErrorCode.REGISTRATION_ERROR,
                "Failed to update collections of project " + projectId + ": " + exception.getMessage(), exception);
        }
    }

    private Set<String> cachedNames(String projectId) {
        return this.cache.computeIfAbsent(projectId, id -> ConcurrentHashMap.newKeySet());
    }

    private List<CollectionRef> toRefs(String projectId, Collection<String> names) {
        if (names.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST_BODY, "At least one collection name is required");
        }
        return new LinkedHashSet<>(names).stream()
            .map(name -> CollectionRef.of(projectId, (name == null) ? null : name.trim()))
            .collect(Collectors.toList());
    }

    private String now() {
        return Instant.now(this.clock).toString();
    }
}
