package eu.lieko.store.filter.predicate;

import java.util.OptionalInt;

import static eu.lieko.store.record.RecordValues.compareNatural;

/**
 * Ordering predicate. Values of different kinds (or nulls, arrays, objects) are incomparable
 * and never match.
 */
public abstract class ComparisonPredicate extends SimplePredicate {

    protected ComparisonPredicate(Object rightOperand) {
        super(rightOperand);
    }

    @Override
    protected boolean test(Object leftOperand) {
        OptionalInt result = compareNatural(leftOperand, this.getRightOperand());
        return result.isPresent() && this.results(result.getAsInt());
    }

    public abstract boolean results(int compareResult);
}
