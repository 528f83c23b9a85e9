package eu.lieko.store.update;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.record.DataRecord;
import lombok.NonNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds new record versions for create, merge and increment operations.
 * Engine fields are always stamped here: callers cannot choose {@code createdAt} or {@code updatedAt}.
 */
public class RecordUpdateEvaluator {

    /**
     * @return new record with the given id and both timestamps set to {@code now}
     */
    public DataRecord create(@NonNull Map<String, ?> fields, @NonNull String id, @NonNull String now) {
        Map<String, Object> out = new LinkedHashMap<>(fields);
        out.put(DataRecord.ID, id);
        out.put(DataRecord.CREATED_AT, now);
        out.put(DataRecord.UPDATED_AT, now);
        return DataRecord.of(out);
    }

    /**
     * Shallow merge: patch keys overwrite, other keys persist. Keeps id and original {@code createdAt}.
     */
    public DataRecord merge(@NonNull DataRecord existing, @NonNull Map<String, ?> patch, @NonNull String now) {
        Map<String, Object> out = new LinkedHashMap<>(existing.asMap());
        out.putAll(patch);
        out.put(DataRecord.ID, existing.getId());
        out.put(DataRecord.CREATED_AT, (existing.getCreatedAt() != null) ? existing.getCreatedAt() : now);
        out.put(DataRecord.UPDATED_AT, now);
        return DataRecord.of(out);
    }

    /**
     * Applies the delta. Missing intermediate objects are created and a missing field counts as zero.
     *
     * @throws ValidationException {@link ErrorCode#INVALID_FIELD} when the current value is not a number
     *                             or an intermediate node is not an object
     */
    @SuppressWarnings("unchecked")
    public DataRecord applyIncrement(@NonNull DataRecord record, @NonNull IncrementOperation op, @NonNull String now) {
        Map<String, Object> out = record.toMutableMap();

        Map<String, Object> target = out;
        for (String part : op.getField().getParents()) {
            if (!target.containsKey(part)) {
                Map<String, Object> created = new LinkedHashMap<>();
                target.put(part, created);
                target = created;
                continue;
            }
            Object nested = target.get(part);
            if (!(nested instanceof Map)) {
                throw new ValidationException(ErrorCode.INVALID_FIELD,
                    "Cannot increment '" + op.getField() + "': '" + part + "' is not an object");
            }
            target = (Map<String, Object>) nested;
        }

        String leaf = op.getField().getLast();
        Object currentValue = target.containsKey(leaf) ? target.get(leaf) : 0L;
        if (!(currentValue instanceof Number)) {
            throw new ValidationException(ErrorCode.INVALID_FIELD,
                "Cannot increment '" + op.getField() + "': current value is not a number");
        }

        Number newValue = add((Number) currentValue, op.getDelta());
        if (!Double.isFinite(newValue.doubleValue())) {
            throw new ValidationException(ErrorCode.INVALID_FIELD, "Increment of '" + op.getField() + "' overflows");
        }
        target.put(leaf, newValue);
        out.put(DataRecord.UPDATED_AT, now);

        return DataRecord.of(out);
    }

    private static Number add(Number current, Number delta) {
        if (isIntegral(current) && isIntegral(delta)) {
            try {
                return Math.addExact(current.longValue(), delta.longValue());
            } catch (ArithmeticException ignored) {
                // long overflow, continue in floating point
            }
        }
        return current.doubleValue() + delta.doubleValue();
    }

    private static boolean isIntegral(Number number) {
        return (number instanceof Long) || (number instanceof Integer) || (number instanceof Short) || (number instanceof Byte);
    }
}
