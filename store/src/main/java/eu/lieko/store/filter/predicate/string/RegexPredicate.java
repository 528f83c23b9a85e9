package eu.lieko.store.filter.predicate.string;

import eu.lieko.store.filter.predicate.SimplePredicate;
import lombok.NonNull;

import java.util.regex.Pattern;

/**
 * String matches pattern anywhere (not anchored).
 * {@code field ~ /pattern/}
 */
public class RegexPredicate extends SimplePredicate {

    public RegexPredicate(@NonNull Pattern pattern) {
        super(pattern);
    }

    @Override
    protected boolean test(Object leftOperand) {
        return (leftOperand instanceof String) && ((Pattern) this.getRightOperand()).matcher((String) leftOperand).find();
    }
}
