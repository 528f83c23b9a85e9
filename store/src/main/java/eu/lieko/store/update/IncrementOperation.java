package eu.lieko.store.update;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.record.FieldPath;
import lombok.Data;
import lombok.NonNull;

/**
 * Adds {@code delta} to the numeric value at {@code field}. Decrements use a negated delta.
 */
@Data
public class IncrementOperation {

    private final FieldPath field;
    private final Number delta;

    /**
     * @throws ValidationException {@link ErrorCode#INVALID_FIELD} for a malformed path or non-finite delta
     */
    public IncrementOperation(@NonNull FieldPath field, @NonNull Number delta) {
        if (!field.isWellFormed()) {
            throw new ValidationException(ErrorCode.INVALID_FIELD, "Invalid field path: '" + field + "'");
        }
        if (!Double.isFinite(delta.doubleValue())) {
            throw new ValidationException(ErrorCode.INVALID_FIELD, "Delta must be a finite number, got " + delta);
        }
        this.field = field;
        this.delta = delta;
    }

    public static IncrementOperation increment(@NonNull String field, @NonNull Number delta) {
        return new IncrementOperation(FieldPath.parse(field), delta);
    }

    public static IncrementOperation decrement(@NonNull String field, @NonNull Number delta) {
        return new IncrementOperation(FieldPath.parse(field), negate(delta));
    }

    private static Number negate(Number delta) {
        if ((delta instanceof Double) || (delta instanceof Float)) {
            return -delta.doubleValue();
        }
        long value = delta.longValue();
        return (value == Long.MIN_VALUE) ? -delta.doubleValue() : -value;
    }
}
