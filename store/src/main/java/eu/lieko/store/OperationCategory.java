package eu.lieko.store;

/**
 * Access level an operation requires.
 */
public enum OperationCategory {
    READ,
    WRITE,
    FULL
}
