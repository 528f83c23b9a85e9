package eu.lieko.store.filter.condition;

import eu.lieko.store.filter.predicate.Predicate;
import eu.lieko.store.record.FieldPath;
import eu.lieko.store.record.RecordValues;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Combination of predicates. With a path, the predicates test the value under that path
 * of the checked map; without one, they test the checked value itself.
 * An empty AND matches everything, an empty OR matches nothing.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Condition implements Predicate {

    private final LogicalOperator operator;
    private final FieldPath path;
    private final Predicate[] predicates;

    public static Condition and(@NonNull Predicate... predicates) {
        return new Condition(LogicalOperator.AND, null, predicates);
    }

    public static Condition and(@NonNull List<? extends Predicate> predicates) {
        return and(predicates.toArray(new Predicate[0]));
    }

    public static Condition and(@NonNull FieldPath path, @NonNull Predicate... predicates) {
        if (predicates.length <= 0) throw new IllegalArgumentException("one or more predicate is required");
        return new Condition(LogicalOperator.AND, path, predicates);
    }

    public static Condition or(@NonNull Predicate... predicates) {
        return new Condition(LogicalOperator.OR, null, predicates);
    }

    public static Condition or(@NonNull List<? extends Predicate> predicates) {
        return or(predicates.toArray(new Predicate[0]));
    }

    @Override
    public boolean check(Object leftOperand) {
        Object value = leftOperand;
        if (this.path != null) {
            value = (leftOperand instanceof Map)
                ? RecordValues.extractValue((Map<?, ?>) leftOperand, this.path.getParts())
                : RecordValues.absent();
        }

        Object operand = value;
        if (this.operator == LogicalOperator.AND) {
            return Arrays.stream(this.predicates).allMatch(p -> p.check(operand));
        }
        if (this.operator == LogicalOperator.OR) {
            return Arrays.stream(this.predicates).anyMatch(p -> p.check(operand));
        }
        throw new IllegalArgumentException("Unsupported operator: " + this.operator);
    }
}
