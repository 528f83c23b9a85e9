package eu.lieko.store.metadata;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Project entry of the persisted metadata. Owned by the project-management collaborator,
 * the store only maintains {@link #getCollections()}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProjectMetadata {

    private String id;
    private String name;
    private String description;
    private String ownerId;
    private List<CollectionInfo> collections = new ArrayList<>();
    private String createdAt;
    private String updatedAt;

    public static ProjectMetadata of(@NonNull String id, @NonNull String name) {
        ProjectMetadata project = new ProjectMetadata();
        project.setId(id);
        project.setName(name);
        project.setDescription("");
        return project;
    }

    public boolean hasCollection(@NonNull String name) {
        return this.collections.stream().anyMatch(info -> name.equals(info.getName()));
    }

    public List<String> collectionNames() {
        return this.collections.stream()
            .map(CollectionInfo::getName)
            .collect(Collectors.toList());
    }

    public ProjectMetadata copy() {
        List<CollectionInfo> infos = this.collections.stream()
            .map(info -> new CollectionInfo(info.getName(), info.getCreatedAt(), info.getUpdatedAt()))
            .collect(Collectors.toCollection(ArrayList::new));
        return new ProjectMetadata(this.id, this.name, this.description, this.ownerId, infos, this.createdAt, this.updatedAt);
    }
}
