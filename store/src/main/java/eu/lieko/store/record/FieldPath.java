package eu.lieko.store.record;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dot-notation path into a record, e.g. {@code address.city}.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class FieldPath {

    private final String value;
    private final List<String> parts;

    public static FieldPath parse(@NonNull String path) {
        return new FieldPath(path, Collections.unmodifiableList(Arrays.asList(path.split("\\.", -1))));
    }

    /**
     * Whether every segment is non-empty ({@code a..b} and {@code .a} are not).
     */
    public boolean isWellFormed() {
        return this.parts.stream().noneMatch(String::isEmpty);
    }

    public String getLast() {
        return this.parts.get(this.parts.size() - 1);
    }

    public List<String> getParents() {
        return this.parts.subList(0, this.parts.size() - 1);
    }

    @Override
    public String toString() {
        return this.value;
    }
}
