package eu.lieko.store.flat;

import com.google.gson.JsonParseException;
import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.StorageException;
import eu.lieko.store.json.JsonCodec;
import eu.lieko.store.metadata.CollectionInfo;
import eu.lieko.store.metadata.ProjectMetadata;
import eu.lieko.store.metadata.ProjectMetadataStore;
import lombok.Getter;
import lombok.NonNull;

import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Project metadata kept in {@code <storageDir>/manageDB.json}, next to the {@code users} and
 * {@code tokens} sections owned by the account collaborator. Only project entries are rewritten;
 * every other section and unknown project keys are written back unchanged.
 */
public class FlatProjectMetadataStore implements ProjectMetadataStore {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("lieko.store.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(FlatProjectMetadataStore.class.getSimpleName());

    public static final String FILE_NAME = "manageDB.json";

    private static final String USERS = "users";
    private static final String PROJECTS = "projects";
    private static final String TOKENS = "tokens";

    private final @Getter Path file;
    private final JsonCodec codec;

    public FlatProjectMetadataStore(@NonNull Path storageDir) {
        this(storageDir, new JsonCodec());
    }

    public FlatProjectMetadataStore(@NonNull Path storageDir, @NonNull JsonCodec codec) {
        this.file = storageDir.toAbsolutePath().normalize().resolve(FILE_NAME);
        this.codec = codec;
    }

    @Override
    public String resourceKey() {
        return this.file.toString();
    }

    // ==================== READ OPERATIONS ====================

    @Override
    public Optional<ProjectMetadata> getProject(@NonNull String projectId) {
        return this.projectMaps(this.readDocument()).stream()
            .filter(project -> projectId.equals(project.get("id")))
            .findFirst()
            .map(FlatProjectMetadataStore::toProject);
    }

    @Override
    public List<ProjectMetadata> listProjects() {
        return this.projectMaps(this.readDocument()).stream()
            .map(FlatProjectMetadataStore::toProject)
            .collect(Collectors.toList());
    }

    // ==================== WRITE OPERATIONS ====================

    @Override
    public void saveProject(@NonNull ProjectMetadata project) {
        if (project.getId() == null) {
            throw new IllegalArgumentException("Project id cannot be null");
        }

        Map<String, Object> document = this.readDocument();
        List<Map<String, Object>> projects = this.projectMaps(document);

        Map<String, Object> target = projects.stream()
            .filter(entry -> project.getId().equals(entry.get("id")))
            .findFirst()
            .orElseGet(() -> {
                Map<String, Object> created = new LinkedHashMap<>();
                projects.add(created);
                return created;
            });
        writeProject(project, target);

        document.put(PROJECTS, projects);
        this.writeDocument(document);
        if (DEBUG) {
            LOGGER.info("Saved project " + project.getId() + " to " + this.file);
        }
    }

    @Override
    public boolean deleteProject(@NonNull String projectId) {
        Map<String, Object> document = this.readDocument();
        List<Map<String, Object>> projects = this.projectMaps(document);
        if (!projects.removeIf(project -> projectId.equals(project.get("id")))) {
            return false;
        }
        document.put(PROJECTS, projects);
        this.writeDocument(document);
        return true;
    }

    // ==================== SERIALIZATION ====================

    private Map<String, Object> readDocument() {
        String json = FlatFiles.read(this.file);
        if ((json == null) || json.trim().isEmpty()) {
            return emptyDocument();
        }
        try {
            Map<String, Object> document = this.codec.readObject(json);
            if ((document.get(PROJECTS) != null) && !(document.get(PROJECTS) instanceof List)) {
                throw new JsonParseException("'" + PROJECTS + "' must be an array");
            }
            return document;
        } catch (JsonParseException exception) {
            LOGGER.log(Level.SEVERE, "Invalid metadata file " + this.file, exception);
            throw new StorageException(ErrorCode.JSON_PARSING_ERROR, "Failed to parse " + FILE_NAME + ": " + exception.getMessage(), exception);
        }
    }

    private void writeDocument(Map<String, Object> document) {
        FlatFiles.writeReplacing(this.file, this.codec.write(document));
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> projectMaps(Map<String, Object> document) {
        Object projects = document.get(PROJECTS);
        List<Map<String, Object>> out = new ArrayList<>();
        if (projects instanceof List) {
            for (Object project : (List<?>) projects) {
                if (project instanceof Map) {
                    out.add((Map<String, Object>) project);
                }
            }
        }
        return out;
    }

    private static Map<String, Object> emptyDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(USERS, new ArrayList<>());
        document.put(PROJECTS, new ArrayList<>());
        document.put(TOKENS, new ArrayList<>());
        return document;
    }

    private static ProjectMetadata toProject(Map<String, Object> map) {
        ProjectMetadata project = new ProjectMetadata();
        project.setId(asString(map.get("id")));
        project.setName(asString(map.get("name")));
        project.setDescription(asString(map.get("description")));
        project.setOwnerId(asString(map.get("ownerId")));
        project.setCreatedAt(asString(map.get("createdAt")));
        project.setUpdatedAt(asString(map.get("updatedAt")));

        List<CollectionInfo> collections = new ArrayList<>();
        Object rawCollections = map.get("collections");
        if (rawCollections instanceof List) {
            for (Object raw : (List<?>) rawCollections) {
                if (raw instanceof Map) {
                    Map<?, ?> info = (Map<?, ?>) raw;
                    collections.add(new CollectionInfo(asString(info.get("name")), asString(info.get("createdAt")), asString(info.get("updatedAt"))));
                }
            }
        }
        project.setCollections(collections);
        return project;
    }

    private static void writeProject(ProjectMetadata project, Map<String, Object> target) {
        target.put("id", project.getId());
        putIfPresent(target, "name", project.getName());
        putIfPresent(target, "description", project.getDescription());
        putIfPresent(target, "ownerId", project.getOwnerId());

        List<Map<String, Object>> collections = new ArrayList<>();
        for (CollectionInfo info : project.getCollections()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", info.getName());
            entry.put("createdAt", info.getCreatedAt());
            entry.put("updatedAt", info.getUpdatedAt());
            collections.add(entry);
        }
        target.put("collections", collections);

        putIfPresent(target, "createdAt", project.getCreatedAt());
        putIfPresent(target, "updatedAt", project.getUpdatedAt());
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static String asString(Object value) {
        return (value == null) ? null : String.valueOf(value);
    }
}
