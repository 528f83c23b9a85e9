package eu.lieko.store.filter.predicate;

import lombok.Data;
import lombok.NonNull;

/**
 * Placeholder for an unsupported {@code $operator}. Never matches.
 */
@Data
public class UnknownOperatorPredicate implements Predicate {

    private final @NonNull String operator;

    @Override
    public boolean check(Object leftOperand) {
        return false;
    }
}
