package eu.lieko.store.filter.predicate.numeric;

import eu.lieko.store.filter.predicate.ComparisonPredicate;

/**
 * VALUE greater than or equal to X
 * {@code val >= x}
 */
public class GtePredicate extends ComparisonPredicate {

    public GtePredicate(Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult >= 0;
    }
}
