package eu.lieko.store.batch;

import lombok.Data;

import java.util.List;

/**
 * Outcome of a batch call. Both lists keep input order and {@code total} equals the input size.
 */
@Data
public class BatchResult {

    private final List<BatchItemResult> results;
    private final List<BatchItemError> errors;
    private final int total;

    public boolean hasErrors() {
        return !this.errors.isEmpty();
    }
}
