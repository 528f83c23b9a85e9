package eu.lieko.store.filter.predicate.collection;

import eu.lieko.store.filter.predicate.SimplePredicate;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;

import static eu.lieko.store.record.RecordValues.compareEquals;

/**
 * VALUE in collection
 * {@code val in [x, y, z]}
 */
public class InPredicate extends SimplePredicate {

    public InPredicate(@NonNull Collection<?> values) {
        super(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    @Override
    protected boolean test(Object leftOperand) {
        Collection<?> collection = (Collection<?>) this.getRightOperand();
        return collection.stream().anyMatch(value -> compareEquals(leftOperand, value));
    }
}
