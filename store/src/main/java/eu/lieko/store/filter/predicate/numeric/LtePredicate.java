package eu.lieko.store.filter.predicate.numeric;

import eu.lieko.store.filter.predicate.ComparisonPredicate;

/**
 * VALUE less than or equal to X
 * {@code val <= x}
 */
public class LtePredicate extends ComparisonPredicate {

    public LtePredicate(Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult <= 0;
    }
}
