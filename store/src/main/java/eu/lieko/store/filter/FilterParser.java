package eu.lieko.store.filter;

import com.google.gson.JsonParseException;
import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.filter.condition.Condition;
import eu.lieko.store.filter.predicate.Predicate;
import eu.lieko.store.filter.predicate.SimplePredicate;
import eu.lieko.store.filter.predicate.UnknownOperatorPredicate;
import eu.lieko.store.filter.predicate.string.SearchPredicate;
import eu.lieko.store.json.JsonCodec;
import eu.lieko.store.record.FieldPath;
import eu.lieko.store.record.RecordValues;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns filter documents into {@link Condition} trees.
 * <p>
 * Supported forms:
 * <ul>
 *   <li>{@code {"field": value}} - strict deep equality, dot paths allowed</li>
 *   <li>{@code {"field": {"$gt": 1, "$lt": 5}}} - operators, combined with AND</li>
 *   <li>{@code {"$and": [...]}} and {@code {"$or": [...]}} - arrays of sub-filters</li>
 *   <li>{@code {"$search": "term"}} - case-insensitive text search over all strings</li>
 * </ul>
 * Top-level keys are combined with AND. Unknown operators parse into conditions that never match.
 */
public class FilterParser {

    public static final String AND = "$and";
    public static final String OR = "$or";
    public static final String SEARCH = "$search";
    public static final String OPTIONS = "$options";

    private final JsonCodec codec;

    public FilterParser() {
        this(new JsonCodec());
    }

    public FilterParser(@NonNull JsonCodec codec) {
        this.codec = codec;
    }

    /**
     * @throws ValidationException {@link ErrorCode#INVALID_FILTER} on malformed JSON or filter structure
     */
    public Condition parse(@NonNull String json) {
        Object value;
        try {
            value = this.codec.read(json);
        } catch (JsonParseException exception) {
            throw invalid("Invalid filter JSON: " + exception.getMessage());
        }
        if (!(value instanceof Map)) {
            throw invalid("Filter must be a JSON object");
        }
        return this.parseObject(asObject(value));
    }

    /**
     * @throws ValidationException {@link ErrorCode#INVALID_FILTER} on malformed filter structure
     */
    public Condition parse(@NonNull Map<String, ?> filter) {
        Object normalized;
        try {
            normalized = RecordValues.normalize(filter);
        } catch (ValidationException exception) {
            throw invalid(exception.getMessage());
        }
        return this.parseObject(asObject(normalized));
    }

    private Condition parseObject(Map<String, Object> filter) {
        List<Predicate> predicates = new ArrayList<>();

        for (Map.Entry<String, Object> entry : filter.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();

            if (AND.equals(key)) {
                predicates.add(Condition.and(this.parseList(key, value)));
            } else if (OR.equals(key)) {
                predicates.add(Condition.or(this.parseList(key, value)));
            } else if (SEARCH.equals(key)) {
                if (!(value instanceof String)) {
                    throw invalid(SEARCH + " requires a string");
                }
                predicates.add(new SearchPredicate((String) value));
            } else if (key.startsWith("$")) {
                predicates.add(new UnknownOperatorPredicate(key));
            } else {
                predicates.add(this.parseField(FieldPath.parse(key), value));
            }
        }

        return Condition.and(predicates);
    }

    private List<Condition> parseList(String key, Object value) {
        if (!(value instanceof List)) {
            throw invalid(key + " requires an array of filters");
        }
        List<Condition> conditions = new ArrayList<>();
        for (Object element : (List<?>) value) {
            if (!(element instanceof Map)) {
                throw invalid(key + " elements must be objects");
            }
            conditions.add(this.parseObject(asObject(element)));
        }
        return conditions;
    }

    private Condition parseField(FieldPath path, Object value) {
        if (!isOperatorObject(value)) {
            return Condition.and(path, SimplePredicate.eq(value));
        }

        Map<String, Object> operators = asObject(value);
        if (operators.containsKey(OPTIONS) && !operators.containsKey("$regex")) {
            throw invalid(OPTIONS + " requires $regex on " + path);
        }

        List<Predicate> predicates = new ArrayList<>();
        for (Map.Entry<String, Object> entry : operators.entrySet()) {
            String operator = entry.getKey();
            Object operand = entry.getValue();

            switch (operator) {
                case "$eq":
                    predicates.add(SimplePredicate.eq(operand));
                    break;
                case "$ne":
                    predicates.add(SimplePredicate.ne(operand));
                    break;
                case "$gt":
                    predicates.add(SimplePredicate.gt(operand));
                    break;
                case "$gte":
                    predicates.add(SimplePredicate.gte(operand));
                    break;
                case "$lt":
                    predicates.add(SimplePredicate.lt(operand));
                    break;
                case "$lte":
                    predicates.add(SimplePredicate.lte(operand));
                    break;
                case "$in":
                    predicates.add(SimplePredicate.in(requireList(operator, operand)));
                    break;
                case "$nin":
                    predicates.add(SimplePredicate.notIn(requireList(operator, operand)));
                    break;
                case "$contains":
                    predicates.add(SimplePredicate.contains(requireString(operator, operand)));
                    break;
                case "$regex":
                    predicates.add(SimplePredicate.regex(compile(requireString(operator, operand), operators.get(OPTIONS))));
                    break;
                case OPTIONS:
                    break;
                default:
                    predicates.add(new UnknownOperatorPredicate(operator));
            }
        }

        return Condition.and(path, predicates.toArray(new Predicate[0]));
    }

    /**
     * Compiles a pattern with {@code i}, {@code m}, {@code s} and {@code x} option flags.
     */
    static Pattern compile(String regex, Object options) {
        int flags = 0;
        if (options != null) {
            if (!(options instanceof String)) {
                throw invalid(OPTIONS + " must be a string");
            }
            for (char flag : ((String) options).toCharArray()) {
                switch (flag) {
                    case 'i':
                        flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                        break;
                    case 'm':
                        flags |= Pattern.MULTILINE;
                        break;
                    case 's':
                        flags |= Pattern.DOTALL;
                        break;
                    case 'x':
                        flags |= Pattern.COMMENTS;
                        break;
                    default:
                        throw invalid("Unsupported regex option: " + flag);
                }
            }
        }
        try {
            return Pattern.compile(regex, flags);
        } catch (PatternSyntaxException exception) {
            throw invalid("Invalid regex: " + exception.getDescription());
        }
    }

    private static boolean isOperatorObject(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        return ((Map<?, ?>) value).keySet().stream().anyMatch(key -> String.valueOf(key).startsWith("$"));
    }

    private static List<?> requireList(String operator, Object operand) {
        if (!(operand instanceof List)) {
            throw invalid(operator + " requires an array");
        }
        return (List<?>) operand;
    }

    private static String requireString(String operator, Object operand) {
        if (!(operand instanceof String)) {
            throw invalid(operator + " requires a string");
        }
        return (String) operand;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value) {
        return (Map<String, Object>) value;
    }

    private static ValidationException invalid(String message) {
        return new ValidationException(ErrorCode.INVALID_FILTER, message);
    }
}
