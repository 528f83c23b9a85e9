package eu.lieko.store.query;

import eu.lieko.store.filter.RecordFilterEvaluator;
import eu.lieko.store.record.DataRecord;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs filter, sort, slice and projection over a record set, in that order.
 */
@RequiredArgsConstructor
public class QueryPipeline {

    private final RecordFilterEvaluator filterEvaluator;

    public QueryPipeline() {
        this(new RecordFilterEvaluator());
    }

    public Page execute(@NonNull Collection<DataRecord> records, @NonNull QueryOptions options) {
        // WHERE
        List<DataRecord> matched = this.filterEvaluator.filter(records, options.getFilter());

        // ORDER BY (List.sort is stable)
        if (options.hasSort()) {
            matched.sort(this.buildComparator(options.getSort()));
        }

        long totalCount = matched.size();

        // SKIP / LIMIT
        int from = (int) Math.min(options.getOffset(), totalCount);
        int to = options.hasLimit() ? (int) Math.min((long) from + options.getLimit(), totalCount) : (int) totalCount;
        List<DataRecord> slice = matched.subList(from, to);

        // projection
        List<DataRecord> output = options.hasProjection()
            ? slice.stream().map(record -> record.project(options.getFields())).collect(Collectors.toList())
            : slice.stream().collect(Collectors.toList());

        long currentPage = options.hasLimit() ? ((options.getOffset() / options.getLimit()) + 1) : 1;
        long maxPage = options.hasLimit() ? ((totalCount + options.getLimit() - 1) / options.getLimit()) : 1;

        return new Page(output, totalCount, currentPage, maxPage);
    }

    protected Comparator<DataRecord> buildComparator(@NonNull List<SortSpec> sort) {
        Comparator<DataRecord> comparator = null;
        for (SortSpec spec : sort) {
            comparator = (comparator == null) ? spec.comparator() : comparator.thenComparing(spec.comparator());
        }
        return comparator;
    }
}
