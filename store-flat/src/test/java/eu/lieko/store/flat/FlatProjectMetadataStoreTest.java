package eu.lieko.store.flat;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.StorageException;
import eu.lieko.store.json.JsonCodec;
import eu.lieko.store.metadata.CollectionInfo;
import eu.lieko.store.metadata.ProjectMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlatProjectMetadataStoreTest {

    private static final String EXISTING = "{\n"
        + "  \"users\": [{\"id\": \"owner\", \"username\": \"admin\"}],\n"
        + "  \"projects\": [{\"id\": \"p1\", \"name\": \"Shop\", \"ownerId\": \"owner\", \"quota\": 10,"
        + " \"collections\": [{\"name\": \"users\", \"createdAt\": \"t0\", \"updatedAt\": \"t0\"}]}],\n"
        + "  \"tokens\": [{\"token\": \"abc\", \"projectId\": \"p1\", \"permission\": \"full\"}]\n"
        + "}";

    @TempDir
    Path tempDir;

    private void writeExisting() throws IOException {
        Files.write(this.tempDir.resolve(FlatProjectMetadataStore.FILE_NAME), EXISTING.getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, Object> readRaw() throws IOException {
        String json = new String(Files.readAllBytes(this.tempDir.resolve(FlatProjectMetadataStore.FILE_NAME)), StandardCharsets.UTF_8);
        return new JsonCodec().readObject(json);
    }

    @Test
    void missing_file_has_no_projects() {
        FlatProjectMetadataStore store = new FlatProjectMetadataStore(this.tempDir);

        assertThat(store.listProjects()).isEmpty();
        assertThat(store.getProject("p1")).isEmpty();
    }

    @Test
    void reads_existing_projects() throws IOException {
        this.writeExisting();
        FlatProjectMetadataStore store = new FlatProjectMetadataStore(this.tempDir);

        ProjectMetadata project = store.requireProject("p1");
        assertThat(project.getName()).isEqualTo("Shop");
        assertThat(project.getOwnerId()).isEqualTo("owner");
        assertThat(project.getCollections()).containsExactly(new CollectionInfo("users", "t0", "t0"));
    }

    @Test
    void updates_preserve_foreign_sections() throws IOException {
        this.writeExisting();
        FlatProjectMetadataStore store = new FlatProjectMetadataStore(this.tempDir);

        store.addCollections("p1", List.of("orders"), "t1");

        Map<String, Object> raw = this.readRaw();
        assertThat(raw.keySet()).containsExactly("users", "projects", "tokens");
        assertThat((List<?>) raw.get("users")).hasSize(1);
        assertThat((List<?>) raw.get("tokens")).hasSize(1);

        Map<?, ?> project = (Map<?, ?>) ((List<?>) raw.get("projects")).get(0);
        assertThat(project.get("quota")).isEqualTo(10L);
        assertThat(store.requireProject("p1").collectionNames()).containsExactly("users", "orders");
        assertThat(store.requireProject("p1").getUpdatedAt()).isEqualTo("t1");
    }

    @Test
    void save_creates_file_with_all_sections() throws IOException {
        FlatProjectMetadataStore store = new FlatProjectMetadataStore(this.tempDir);

        store.saveProject(ProjectMetadata.of("p9", "New"));

        assertThat(this.readRaw().keySet()).containsExactly("users", "projects", "tokens");
        assertThat(store.listProjects()).extracting(ProjectMetadata::getId).containsExactly("p9");
    }

    @Test
    void delete_project() throws IOException {
        this.writeExisting();
        FlatProjectMetadataStore store = new FlatProjectMetadataStore(this.tempDir);

        assertThat(store.deleteProject("p1")).isTrue();
        assertThat(store.deleteProject("p1")).isFalse();
        assertThat(store.listProjects()).isEmpty();
        assertThat((List<?>) this.readRaw().get("tokens")).hasSize(1);
    }

    @Test
    void malformed_file_is_parsing_error() throws IOException {
        Files.write(this.tempDir.resolve(FlatProjectMetadataStore.FILE_NAME), "{\"projects\": {}}".getBytes(StandardCharsets.UTF_8));
        FlatProjectMetadataStore store = new FlatProjectMetadataStore(this.tempDir);

        assertThatThrownBy(store::listProjects)
            .isInstanceOf(StorageException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.JSON_PARSING_ERROR);
    }
}
