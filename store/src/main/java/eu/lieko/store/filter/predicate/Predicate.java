package eu.lieko.store.filter.predicate;

/**
 * Test applied to a resolved value. The value may be {@link eu.lieko.store.record.RecordValues#absent()}
 * when the field path does not exist. Implementations never throw.
 */
public interface Predicate {

    boolean check(Object leftOperand);
}
