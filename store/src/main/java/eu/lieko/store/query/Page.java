package eu.lieko.store.query;

import eu.lieko.store.record.DataRecord;
import lombok.Data;

import java.util.List;

/**
 * One slice of a query result.
 * {@code totalCount} counts every match before slicing. Without a limit both page numbers are 1.
 */
@Data
public class Page {

    private final List<DataRecord> records;
    private final long totalCount;
    private final long currentPage;
    private final long maxPage;
}
