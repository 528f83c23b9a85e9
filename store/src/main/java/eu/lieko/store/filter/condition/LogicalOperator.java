package eu.lieko.store.filter.condition;

public enum LogicalOperator {
    AND,
    OR
}
