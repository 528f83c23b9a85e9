package eu.lieko.store.filter.predicate.collection;

import eu.lieko.store.filter.predicate.SimplePredicate;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;

import static eu.lieko.store.record.RecordValues.compareEquals;

/**
 * VALUE not in collection
 * {@code val not in [x, y, z]}
 */
public class NotInPredicate extends SimplePredicate {

    public NotInPredicate(@NonNull Collection<?> values) {
        super(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    @Override
    protected boolean test(Object leftOperand) {
        Collection<?> collection = (Collection<?>) this.getRightOperand();
        return collection.stream().noneMatch(value -> compareEquals(leftOperand, value));
    }
}
