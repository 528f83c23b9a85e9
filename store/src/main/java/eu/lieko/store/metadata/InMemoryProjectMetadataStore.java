package eu.lieko.store.metadata;

import lombok.NonNull;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryProjectMetadataStore implements ProjectMetadataStore {

    private final Map<String, ProjectMetadata> projects = new ConcurrentHashMap<>();

    @Override
    public Optional<ProjectMetadata> getProject(@NonNull String projectId) {
        return Optional.ofNullable(this.projects.get(projectId)).map(ProjectMetadata::copy);
    }

    @Override
    public List<ProjectMetadata> listProjects() {
        return this.projects.values().stream()
            .map(ProjectMetadata::copy)
            .sorted(Comparator.comparing(ProjectMetadata::getId))
            .collect(Collectors.toList());
    }

    @Override
    public void saveProject(@NonNull ProjectMetadata project) {
        if (project.getId() == null) {
            throw new IllegalArgumentException("Project id cannot be null");
        }
        this.projects.put(project.getId(), project.copy());
    }

    @Override
    public boolean deleteProject(@NonNull String projectId) {
        return this.projects.remove(projectId) != null;
    }
}
