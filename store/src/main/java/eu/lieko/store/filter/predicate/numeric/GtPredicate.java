package eu.lieko.store.filter.predicate.numeric;

import eu.lieko.store.filter.predicate.ComparisonPredicate;

/**
 * VALUE greater than X
 * {@code val > x}
 */
public class GtPredicate extends ComparisonPredicate {

    public GtPredicate(Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult > 0;
    }
}
