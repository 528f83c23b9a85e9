package eu.lieko.store.filter.predicate;

import eu.lieko.store.filter.predicate.collection.InPredicate;
import eu.lieko.store.filter.predicate.collection.NotInPredicate;
import eu.lieko.store.filter.predicate.equality.EqPredicate;
import eu.lieko.store.filter.predicate.equality.NePredicate;
import eu.lieko.store.filter.predicate.numeric.GtPredicate;
import eu.lieko.store.filter.predicate.numeric.GtePredicate;
import eu.lieko.store.filter.predicate.numeric.LtPredicate;
import eu.lieko.store.filter.predicate.numeric.LtePredicate;
import eu.lieko.store.filter.predicate.string.ContainsPredicate;
import eu.lieko.store.filter.predicate.string.RegexPredicate;
import eu.lieko.store.record.RecordValues;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Predicate comparing the resolved value against a fixed right operand.
 * An absent left operand never matches.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class SimplePredicate implements Predicate {

    private final Object rightOperand;

    @Override
    public boolean check(Object leftOperand) {
        if (RecordValues.isAbsent(leftOperand)) {
            return false;
        }
        return this.test(leftOperand);
    }

    /**
     * @param leftOperand present value, possibly {@code null}
     */
    protected abstract boolean test(Object leftOperand);

    /**
     * {@code field == value}, strict and deep
     */
    public static SimplePredicate eq(Object rightOperand) {
        return new EqPredicate(rightOperand);
    }

    /**
     * {@code field != value}
     */
    public static SimplePredicate ne(Object rightOperand) {
        return new NePredicate(rightOperand);
    }

    /**
     * {@code field > value}
     */
    public static SimplePredicate gt(Object rightOperand) {
        return new GtPredicate(rightOperand);
    }

    /**
     * {@code field >= value}
     */
    public static SimplePredicate gte(Object rightOperand) {
        return new GtePredicate(rightOperand);
    }

    /**
     * {@code field < value}
     */
    public static SimplePredicate lt(Object rightOperand) {
        return new LtPredicate(rightOperand);
    }

    /**
     * {@code field <= value}
     */
    public static SimplePredicate lte(Object rightOperand) {
        return new LtePredicate(rightOperand);
    }

    /**
     * {@code field IN (value1, value2, ...)}
     */
    public static SimplePredicate in(@NonNull Object... values) {
        return new InPredicate(Arrays.asList(values));
    }

    public static SimplePredicate in(@NonNull List<?> values) {
        return new InPredicate(values);
    }

    /**
     * {@code field NOT IN (value1, value2, ...)}
     */
    public static SimplePredicate notIn(@NonNull Object... values) {
        return new NotInPredicate(Arrays.asList(values));
    }

    public static SimplePredicate notIn(@NonNull List<?> values) {
        return new NotInPredicate(values);
    }

    /**
     * {@code field LIKE '%substring%'}, case-sensitive, strings only
     */
    public static SimplePredicate contains(@NonNull String substring) {
        return new ContainsPredicate(substring);
    }

    /**
     * Pattern found anywhere in the string value.
     */
    public static SimplePredicate regex(@NonNull Pattern pattern) {
        return new RegexPredicate(pattern);
    }
}
