package eu.lieko.store.filter.predicate.string;

import eu.lieko.store.filter.predicate.SimplePredicate;
import lombok.NonNull;

/**
 * String contains predicate, case-sensitive.
 * {@code field contains "substring"}
 */
public class ContainsPredicate extends SimplePredicate {

    public ContainsPredicate(@NonNull String substring) {
        super(substring);
    }

    @Override
    protected boolean test(Object leftOperand) {
        return (leftOperand instanceof String) && ((String) leftOperand).contains((String) this.getRightOperand());
    }
}
