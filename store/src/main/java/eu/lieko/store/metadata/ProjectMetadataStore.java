package eu.lieko.store.metadata;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.NotFoundException;
import lombok.NonNull;

import java.util.*;

/**
 * Persisted project metadata, one container per deployment.
 * <p>
 * Implementations are not synchronized; the collection registry serializes every
 * mutation through the write lock named by {@link #resourceKey()}.
 */
public interface ProjectMetadataStore {

    default String resourceKey() {
        return "manageDB";
    }

    Optional<ProjectMetadata> getProject(@NonNull String projectId);

    List<ProjectMetadata> listProjects();

    /**
     * Creates or replaces the project entry.
     */
    void saveProject(@NonNull ProjectMetadata project);

    boolean deleteProject(@NonNull String projectId);

    default ProjectMetadata requireProject(@NonNull String projectId) {
        return this.getProject(projectId).orElseThrow(() ->
            new NotFoundException(ErrorCode.PROJECT_NOT_FOUND, "Project not found: " + projectId));
    }

    /**
     * Appends the names missing from the project's collection list; existing entries are untouched.
     *
     * @return the full collection list after the change
     * @throws NotFoundException {@link ErrorCode#PROJECT_NOT_FOUND} if the project is unknown
     */
    default List<CollectionInfo> addCollections(@NonNull String projectId, @NonNull Collection<String> names, @NonNull String timestamp) {
        ProjectMetadata project = this.requireProject(projectId);
        boolean changed = false;
        for (String name : new LinkedHashSet<>(names)) {
            if (!project.hasCollection(name)) {
                project.getCollections().add(new CollectionInfo(name, timestamp, timestamp));
                changed = true;
            }
        }
        if (changed) {
            project.setUpdatedAt(timestamp);
            this.saveProject(project);
        }
        return project.getCollections();
    }

    /**
     * @return the full collection list after the change
     * @throws NotFoundException {@link ErrorCode#PROJECT_NOT_FOUND} if the project is unknown
     */
    default List<CollectionInfo> removeCollections(@NonNull String projectId, @NonNull Collection<String> names, @NonNull String timestamp) {
        ProjectMetadata project = this.requireProject(projectId);
        Set<String> removed = new HashSet<>(names);
        if (project.getCollections().removeIf(info -> removed.contains(info.getName()))) {
            project.setUpdatedAt(timestamp);
            this.saveProject(project);
        }
        return project.getCollections();
    }
}
