package eu.lieko.store.registry;

import eu.lieko.store.CollectionRef;
import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.NotFoundException;
import eu.lieko.store.error.StorageException;
import eu.lieko.store.lock.WriteSerializer;
import eu.lieko.store.metadata.CollectionInfo;
import eu.lieko.store.metadata.InMemoryProjectMetadataStore;
import eu.lieko.store.metadata.ProjectMetadata;
import eu.lieko.store.metadata.ProjectMetadataStore;
import eu.lieko.store.storage.InMemoryStorageEngine;
import eu.lieko.store.storage.RecordMap;
import eu.lieko.store.storage.StorageEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CollectionRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final CollectionRef USERS = CollectionRef.of("p1", "users");

    private InMemoryStorageEngine storage;
    private InMemoryProjectMetadataStore metadata;
    private CollectionRegistry registry;

    @BeforeEach
    void setUp() {
        this.storage = new InMemoryStorageEngine();
        this.metadata = new InMemoryProjectMetadataStore();
        this.metadata.saveProject(ProjectMetadata.of("p1", "Project"));
        this.registry = new CollectionRegistry(this.storage, this.metadata, new WriteSerializer(Duration.ofSeconds(5)), CLOCK);
        this.registry.initialize();
    }

    @Test
    void ensure_exists_creates_container_and_metadata() {
        this.registry.ensureExists(USERS, true);

        assertThat(this.storage.exists(USERS)).isTrue();
        assertThat(this.registry.isCached(USERS)).isTrue();
        assertThat(this.metadata.requireProject("p1").getCollections())
            .containsExactly(new CollectionInfo("users", "2024-05-01T10:00:00Z", "2024-05-01T10:00:00Z"));
        assertThat(this.metadata.requireProject("p1").getUpdatedAt()).isEqualTo("2024-05-01T10:00:00Z");
    }

    @Test
    void ensure_exists_without_create_fails_for_missing() {
        assertThatThrownBy(() -> this.registry.ensureExists(USERS, false))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("Collection not found: users")
            .extracting("errorCode")
            .isEqualTo(ErrorCode.COLLECTION_NOT_FOUND);

        assertThat(this.storage.exists(USERS)).isFalse();
        assertThat(this.metadata.requireProject("p1").getCollections()).isEmpty();
    }

    @Test
    void ensure_exists_syncs_container_unknown_to_metadata() {
        this.storage.persist(USERS, RecordMap.empty());

        this.registry.ensureExists(USERS, false);

        assertThat(this.registry.isCached(USERS)).isTrue();
        assertThat(this.metadata.requireProject("p1").collectionNames()).containsExactly("users");
    }

    @Test
    void ensure_exists_on_cache_hit_skips_storage() {
        StorageEngine spy = spy(new InMemoryStorageEngine());
        CollectionRegistry spied = new CollectionRegistry(spy, this.metadata, new WriteSerializer(), CLOCK);
        spied.ensureExists(USERS, true);
        clearInvocations(spy);

        spied.ensureExists(USERS, false);

        verify(spy, never()).exists(any());
        verify(spy, never()).persist(any(), any());
    }

    @Test
    void initialize_loads_cache_from_metadata() {
        this.registry.register("p1", List.of("users", "orders"));

        CollectionRegistry restarted = new CollectionRegistry(this.storage, this.metadata, new WriteSerializer(), CLOCK);
        restarted.initialize();

        assertThat(restarted.isCached(USERS)).isTrue();
        assertThat(restarted.isCached(CollectionRef.of("p1", "orders"))).isTrue();
    }

    @Test
    void register_unknown_project_fails() {
        assertThatThrownBy(() -> this.registry.register("p2", List.of("users")))
            .isInstanceOf(NotFoundException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.PROJECT_NOT_FOUND);
        assertThat(this.storage.exists(CollectionRef.of("p2", "users"))).isFalse();
    }

    @Test
    void register_wraps_storage_failure() {
        StorageEngine failing = mock(StorageEngine.class);
        when(failing.exists(any())).thenReturn(false);
        doThrow(new StorageException(ErrorCode.FILE_SYSTEM_ERROR, "disk full")).when(failing).persist(any(), any());
        CollectionRegistry broken = new CollectionRegistry(failing, this.metadata, new WriteSerializer(), CLOCK);

        assertThatThrownBy(() -> broken.register("p1", List.of("users")))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("disk full")
            .extracting("errorCode")
            .isEqualTo(ErrorCode.COLLECTION_CREATION_FAILED);

        assertThat(broken.isCached(USERS)).isFalse();
        assertThat(this.metadata.requireProject("p1").getCollections()).isEmpty();
    }

    @Test
    void metadata_failure_is_registration_error() {
        this.registry.register("p1", List.of("users"));
        ProjectMetadataStore failing = spy(this.metadata);
        doThrow(new StorageException(ErrorCode.FILE_SYSTEM_ERROR, "read-only")).when(failing).saveProject(any());
        CollectionRegistry broken = new CollectionRegistry(this.storage, failing, new WriteSerializer(), CLOCK);
        broken.initialize();

        assertThatThrownBy(() -> broken.register("p1", List.of("orders")))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("read-only")
            .extracting("errorCode")
            .isEqualTo(ErrorCode.REGISTRATION_ERROR);
        assertThat(broken.isCached(CollectionRef.of("p1", "orders"))).isFalse();

        assertThatThrownBy(() -> broken.deregister("p1", List.of("users")))
            .isInstanceOf(StorageException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.REGISTRATION_ERROR);
        assertThat(broken.isCached(USERS)).isTrue();
        assertThat(this.storage.exists(USERS)).isTrue();
        assertThat(this.metadata.requireProject("p1").collectionNames()).containsExactly("users");
    }

    @Test
    void deregister_unknown_project_fails() {
        assertThatThrownBy(() -> this.registry.deregister("p2", List.of("users")))
            .isInstanceOf(NotFoundException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.PROJECT_NOT_FOUND);
    }

    @Test
    void deregister_keeps_cache_and_metadata_in_lockstep() {
        this.registry.register("p1", List.of("users", "orders"));

        List<CollectionInfo> remaining = this.registry.deregister("p1", List.of("users"));

        assertThat(remaining).extracting(CollectionInfo::getName).containsExactly("orders");
        assertThat(this.registry.isCached(USERS)).isFalse();
        assertThat(this.storage.exists(USERS)).isFalse();
        assertThat(this.metadata.requireProject("p1").collectionNames()).containsExactly("orders");
    }

    @Test
    void drop_removes_everything() {
        this.registry.ensureExists(USERS, true);

        this.registry.drop(USERS);

        assertThat(this.registry.contains(USERS)).isFalse();
        assertThat(this.metadata.requireProject("p1").getCollections()).isEmpty();
    }

    @Test
    void list_unknown_project_fails() {
        assertThatThrownBy(() -> this.registry.list("nope"))
            .isInstanceOf(NotFoundException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.PROJECT_NOT_FOUND);
    }

    @Test
    void evict_project_forgets_cache() {
        this.registry.ensureExists(USERS, true);
        this.registry.evictProject("p1");

        assertThat(this.registry.isCached(USERS)).isFalse();
        assertThat(this.registry.contains(USERS)).isTrue();
    }
}
