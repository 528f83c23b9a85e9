package eu.lieko.store.filter;

import eu.lieko.store.filter.condition.Condition;
import eu.lieko.store.record.DataRecord;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Evaluates parsed filters against records in memory.
 */
public class RecordFilterEvaluator {

    /**
     * @param condition filter to apply, {@code null} matches every record
     */
    public boolean matches(@NonNull DataRecord record, Condition condition) {
        return (condition == null) || condition.check(record.asMap());
    }

    /**
     * @return matching records in input order
     */
    public List<DataRecord> filter(@NonNull Collection<DataRecord> records, Condition condition) {
        return records.stream()
            .filter(record -> this.matches(record, condition))
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
