package eu.lieko.store.filter.predicate.numeric;

import eu.lieko.store.filter.predicate.ComparisonPredicate;

/**
 * VALUE less than X
 * {@code val < x}
 */
public class LtPredicate extends ComparisonPredicate {

    public LtPredicate(Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult < 0;
    }
}
