package eu.lieko.store;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.record.RecordIds;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identity of a collection: project id plus collection name.
 * Both parts are restricted to {@code [A-Za-z0-9_-]} as they become storage path segments.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CollectionRef {

    private final String projectId;
    private final String name;

    public static CollectionRef of(String projectId, String name) {
        return new CollectionRef(requireValidName(projectId), requireValidName(name));
    }

    public static String requireValidName(String name) {
        if ((name == null) || !RecordIds.ID_PATTERN.matcher(name).matches()) {
            throw new ValidationException(ErrorCode.INVALID_COLLECTION_NAME, "Invalid collection name: " + name);
        }
        return name;
    }

    /**
     * @return {@code projectId:name}, unique per collection
     */
    public String getValue() {
        return this.projectId + ":" + this.name;
    }

    @Override
    public String toString() {
        return this.getValue();
    }
}
