package eu.lieko.store.filter.predicate.equality;

import eu.lieko.store.filter.predicate.SimplePredicate;

import static eu.lieko.store.record.RecordValues.compareEquals;

/**
 * VALUE equals X
 * {@code val == x}
 */
public class EqPredicate extends SimplePredicate {

    public EqPredicate(Object rightOperand) {
        super(rightOperand);
    }

    @Override
    protected boolean test(Object leftOperand) {
        return compareEquals(leftOperand, this.getRightOperand());
    }
}
