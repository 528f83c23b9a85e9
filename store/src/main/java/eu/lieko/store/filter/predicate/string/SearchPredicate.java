package eu.lieko.store.filter.predicate.string;

import eu.lieko.store.filter.predicate.SimplePredicate;
import lombok.NonNull;

import java.util.Locale;

import static eu.lieko.store.record.RecordValues.containsText;

/**
 * Case-insensitive substring match against every string reachable from the value,
 * including strings nested in objects and arrays.
 */
public class SearchPredicate extends SimplePredicate {

    public SearchPredicate(@NonNull String term) {
        super(term.toLowerCase(Locale.ROOT));
    }

    @Override
    protected boolean test(Object leftOperand) {
        return containsText(leftOperand, (String) this.getRightOperand());
    }
}
