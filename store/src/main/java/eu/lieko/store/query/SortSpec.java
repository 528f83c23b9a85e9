package eu.lieko.store.query;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.record.DataRecord;
import eu.lieko.store.record.FieldPath;
import eu.lieko.store.record.RecordValues;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Sort key in the {@code field:direction} wire form, e.g. {@code age:desc}.
 * <p>
 * Missing and null values sort last in both directions. Values of different kinds are ordered
 * number, string, boolean, array, object.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SortSpec {

    private final FieldPath path;
    private final SortDirection direction;

    public static SortSpec asc(@NonNull String path) {
        return new SortSpec(FieldPath.parse(path), SortDirection.ASC);
    }

    public static SortSpec desc(@NonNull String path) {
        return new SortSpec(FieldPath.parse(path), SortDirection.DESC);
    }

    /**
     * @param expression {@code field} or {@code field:asc} or {@code field:desc}
     * @throws ValidationException {@link ErrorCode#INVALID_SORT} on malformed expression
     */
    public static SortSpec parse(@NonNull String expression) {
        String trimmed = expression.trim();
        int separator = trimmed.indexOf(':');
        String field = (separator < 0) ? trimmed : trimmed.substring(0, separator).trim();
        String direction = (separator < 0) ? "asc" : trimmed.substring(separator + 1).trim();

        if (field.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_SORT, "Sort field is required: " + expression);
        }

        switch (direction.toLowerCase(Locale.ROOT)) {
            case "":
            case "asc":
                return asc(field);
            case "desc":
                return desc(field);
            default:
                throw new ValidationException(ErrorCode.INVALID_SORT, "Invalid sort direction: " + direction);
        }
    }

    /**
     * Parses a comma separated list of sort expressions, earlier keys take precedence.
     */
    public static List<SortSpec> parseAll(@NonNull String expressions) {
        List<SortSpec> specs = new ArrayList<>();
        for (String expression : expressions.split(",")) {
            specs.add(parse(expression));
        }
        return specs;
    }

    public Comparator<DataRecord> comparator() {
        return (record1, record2) -> {
            Object value1 = record1.resolve(this.path);
            Object value2 = record2.resolve(this.path);

            boolean missing1 = (value1 == null) || RecordValues.isAbsent(value1);
            boolean missing2 = (value2 == null) || RecordValues.isAbsent(value2);
            if (missing1 || missing2) {
                return Boolean.compare(missing1, missing2);
            }

            int cmp = RecordValues.compareForSort(value1, value2);
            return (this.direction == SortDirection.DESC) ? -cmp : cmp;
        };
    }

    @Override
    public String toString() {
        return this.path + ":" + this.direction.name().toLowerCase(Locale.ROOT);
    }
}
