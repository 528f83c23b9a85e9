package eu.lieko.store.record;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.ValidationException;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Record id format rules and id generation.
 */
public final class RecordIds {

    public static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

    private RecordIds() {
    }

    public static boolean isValid(Object id) {
        return (id instanceof String) && ID_PATTERN.matcher((String) id).matches();
    }

    /**
     * @return the id as a string
     * @throws ValidationException with {@link ErrorCode#INVALID_ID_FORMAT} if the id is malformed
     */
    public static String requireValid(Object id) {
        if (!isValid(id)) {
            throw new ValidationException(ErrorCode.INVALID_ID_FORMAT, "Invalid ID format: " + id);
        }
        return (String) id;
    }

    public static String generate() {
        return UUID.randomUUID().toString();
    }
}
