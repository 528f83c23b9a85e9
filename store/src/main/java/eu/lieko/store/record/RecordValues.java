package eu.lieko.store.record;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.ValidationException;
import lombok.NonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * Utility methods for extracting, normalizing and comparing dynamic record values.
 * <p>
 * Normalized values are one of: {@code null}, {@link Boolean}, {@link Long}, {@link Double},
 * {@link String}, an unmodifiable {@link List} of normalized values, or an unmodifiable
 * {@link Map} from string keys to normalized values.
 */
public final class RecordValues {

    private static final Object ABSENT = new Object() {
        @Override
        public String toString() {
            return "<absent>";
        }
    };

    private RecordValues() {
    }

    /**
     * Marker returned by {@link #extractValue(Map, List)} when the path does not exist.
     * Distinct from an explicit {@code null} value.
     */
    public static Object absent() {
        return ABSENT;
    }

    public static boolean isAbsent(Object value) {
        return value == ABSENT;
    }

    /**
     * Extract a value from a nested map using a path.
     *
     * @param map   the map to extract from
     * @param parts the path parts (e.g., ["user", "profile", "name"])
     * @return the value at the path, or {@link #absent()} if any segment is missing
     */
    public static Object extractValue(Map<?, ?> map, @NonNull List<String> parts) {
        Object current = map;

        for (String part : parts) {
            if (!(current instanceof Map)) {
                return ABSENT;
            }
            Map<?, ?> node = (Map<?, ?>) current;
            if (!node.containsKey(part)) {
                return ABSENT;
            }
            current = node.get(part);
        }

        return current;
    }

    /**
     * Strict JSON equality. Numbers compare by value regardless of representation,
     * arrays and objects compare deeply, anything else must be of the same type.
     * Never coerces strings to numbers.
     */
    public static boolean compareEquals(Object value1, Object value2) {
        if ((value1 == null) || (value2 == null)) {
            return value1 == value2;
        }

        if ((value1 instanceof Number) && (value2 instanceof Number)) {
            return compareNumbers((Number) value1, (Number) value2) == 0;
        }

        if ((value1 instanceof List) && (value2 instanceof List)) {
            List<?> list1 = (List<?>) value1;
            List<?> list2 = (List<?>) value2;
            if (list1.size() != list2.size()) {
                return false;
            }
            for (int i = 0; i < list1.size(); i++) {
                if (!compareEquals(list1.get(i), list2.get(i))) {
                    return false;
                }
            }
            return true;
        }

        if ((value1 instanceof Map) && (value2 instanceof Map)) {
            Map<?, ?> map1 = (Map<?, ?>) value1;
            Map<?, ?> map2 = (Map<?, ?>) value2;
            if (!map1.keySet().equals(map2.keySet())) {
                return false;
            }
            for (Map.Entry<?, ?> entry : map1.entrySet()) {
                if (!compareEquals(entry.getValue(), map2.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }

        if (value1.getClass() == value2.getClass()) {
            return value1.equals(value2);
        }

        return false;
    }

    /**
     * Compare two values by the natural order of their common runtime type.
     * Numbers, strings and booleans are comparable with values of the same kind;
     * every other pairing is incomparable.
     *
     * @return comparison result, or empty when the values are incomparable
     */
    public static OptionalInt compareNatural(Object value1, Object value2) {
        if ((value1 instanceof Number) && (value2 instanceof Number)) {
            return OptionalInt.of(compareNumbers((Number) value1, (Number) value2));
        }
        if ((value1 instanceof String) && (value2 instanceof String)) {
            return OptionalInt.of(((String) value1).compareTo((String) value2));
        }
        if ((value1 instanceof Boolean) && (value2 instanceof Boolean)) {
            return OptionalInt.of(Boolean.compare((Boolean) value1, (Boolean) value2));
        }
        return OptionalInt.empty();
    }

    /**
     * Compare two present, non-null values for sorting.
     * Mixed types are ordered by kind: number, string, boolean, array, object.
     * Arrays and objects are equal among themselves so that sorting keeps their input order.
     */
    public static int compareForSort(@NonNull Object value1, @NonNull Object value2) {
        int rank = Integer.compare(sortRank(value1), sortRank(value2));
        if (rank != 0) {
            return rank;
        }
        return compareNatural(value1, value2).orElse(0);
    }

    private static int sortRank(Object value) {
        if (value instanceof Number) return 0;
        if (value instanceof String) return 1;
        if (value instanceof Boolean) return 2;
        if (value instanceof List) return 3;
        return 4;
    }

    private static int compareNumbers(Number number1, Number number2) {
        if (!isFinite(number1) || !isFinite(number2)) {
            return Double.compare(number1.doubleValue(), number2.doubleValue());
        }
        return toBigDecimal(number1).compareTo(toBigDecimal(number2));
    }

    private static boolean isFinite(Number number) {
        if ((number instanceof Double) || (number instanceof Float)) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if ((number instanceof Double) || (number instanceof Float)) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    /**
     * Case-insensitive substring search over every string reachable from the value,
     * descending into nested objects and arrays.
     *
     * @param value  value to scan
     * @param needle lower-cased search term
     */
    public static boolean containsText(Object value, @NonNull String needle) {
        if (value instanceof String) {
            return ((String) value).toLowerCase(Locale.ROOT).contains(needle);
        }
        if (value instanceof Map) {
            for (Object nested : ((Map<?, ?>) value).values()) {
                if (containsText(nested, needle)) {
                    return true;
                }
            }
            return false;
        }
        if (value instanceof Collection) {
            for (Object nested : (Collection<?>) value) {
                if (containsText(nested, needle)) {
                    return true;
                }
            }
        }
        return false;
    }

    // ==================== NORMALIZATION ====================

    /**
     * Convert an arbitrary Java value into its normalized, immutable form.
     *
     * @throws ValidationException if the value cannot be represented as JSON
     */
    public static Object normalize(Object value) {
        if ((value == null) || (value instanceof String) || (value instanceof Boolean)) {
            return value;
        }

        if (value instanceof Number) {
            return normalizeNumber((Number) value);
        }

        if (value instanceof CharSequence) {
            return value.toString();
        }

        if (value instanceof Map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (entry.getKey() == null) {
                    throw new ValidationException(ErrorCode.INVALID_REQUEST_BODY, "Field names cannot be null");
                }
                out.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return Collections.unmodifiableMap(out);
        }

        if (value instanceof Collection) {
            List<Object> out = new ArrayList<>(((Collection<?>) value).size());
            for (Object element : (Collection<?>) value) {
                out.add(normalize(element));
            }
            return Collections.unmodifiableList(out);
        }

        if (value instanceof Object[]) {
            return normalize(Arrays.asList((Object[]) value));
        }

        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }

        if ((value instanceof UUID) || (value instanceof TemporalAccessor)) {
            return value.toString();
        }

        throw new ValidationException(ErrorCode.INVALID_REQUEST_BODY,
            "Unsupported value type: " + value.getClass().getName());
    }

    private static Object normalizeNumber(Number number) {
        if ((number instanceof Long) || (number instanceof Integer) || (number instanceof Short) || (number instanceof Byte)) {
            return number.longValue();
        }
        if ((number instanceof BigInteger) && (((BigInteger) number).bitLength() < 64)) {
            return number.longValue();
        }
        double value = number.doubleValue();
        if (!Double.isFinite(value)) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST_BODY, "Numbers must be finite, got " + number);
        }
        return value;
    }

    /**
     * Deep copy of a normalized value into mutable {@link LinkedHashMap}s and {@link ArrayList}s.
     */
    @SuppressWarnings("unchecked")
    public static <T> T mutableCopy(T value) {
        if (value instanceof Map) {
            Map<String, Object> out = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, nested) -> out.put(String.valueOf(key), mutableCopy(nested)));
            return (T) out;
        }
        if (value instanceof Collection) {
            List<Object> out = new ArrayList<>();
            ((Collection<?>) value).forEach(nested -> out.add(mutableCopy(nested)));
            return (T) out;
        }
        return value;
    }
}
