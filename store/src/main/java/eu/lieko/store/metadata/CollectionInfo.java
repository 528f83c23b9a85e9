package eu.lieko.store.metadata;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionInfo {

    private String name;
    private String createdAt;
    private String updatedAt;
}
