package eu.lieko.store.query;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.filter.FilterParser;
import eu.lieko.store.filter.condition.Condition;
import eu.lieko.store.record.FieldPath;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Filter, sort, slice and projection of a collection query.
 *
 * <pre>{@code
 * QueryOptions.builder()
 *     .filter("{\"age\":{\"$gte\":18}}")
 *     .sort("name:asc")
 *     .offset(20)
 *     .limit(10)
 *     .fields("name", "address.city")
 *     .build();
 * }</pre>
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QueryOptions {

    private final Condition filter;
    private final List<SortSpec> sort;
    private final int offset;
    private final int limit;
    private final List<FieldPath> fields;

    public static QueryOptions all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasFilter() {
        return this.filter != null;
    }

    public boolean hasSort() {
        return !this.sort.isEmpty();
    }

    public boolean hasLimit() {
        return this.limit > 0;
    }

    public boolean hasProjection() {
        return !this.fields.isEmpty();
    }

    public QueryOptions withFilter(Condition filter) {
        return new QueryOptions(filter, this.sort, this.offset, this.limit, this.fields);
    }

    public static class Builder {
        private Condition filter;
        private final List<SortSpec> sort = new ArrayList<>();
        private int offset;
        private int limit;
        private final List<FieldPath> fields = new ArrayList<>();

        public Builder filter(Condition filter) {
            this.filter = filter;
            return this;
        }

        /**
         * @throws ValidationException {@link ErrorCode#INVALID_FILTER} on malformed filter
         */
        public Builder filter(@NonNull String json) {
            this.filter = new FilterParser().parse(json);
            return this;
        }

        public Builder filter(@NonNull Map<String, ?> filter) {
            this.filter = new FilterParser().parse(filter);
            return this;
        }

        public Builder sort(@NonNull SortSpec... specs) {
            this.sort.addAll(Arrays.asList(specs));
            return this;
        }

        /**
         * @param expressions {@code field:direction} list, comma separated
         * @throws ValidationException {@link ErrorCode#INVALID_SORT} on malformed expression
         */
        public Builder sort(@NonNull String expressions) {
            this.sort.addAll(SortSpec.parseAll(expressions));
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        /**
         * @param limit maximum records returned, 0 for no limit
         */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder fields(@NonNull String... fields) {
            for (String field : fields) {
                String trimmed = field.trim();
                if (!trimmed.isEmpty()) {
                    this.fields.add(FieldPath.parse(trimmed));
                }
            }
            return this;
        }

        /**
         * @param fields comma separated field list
         */
        public Builder fieldList(@NonNull String fields) {
            return this.fields(fields.split(","));
        }

        /**
         * @throws ValidationException {@link ErrorCode#INVALID_PAGINATION} for negative offset or limit
         */
        public QueryOptions build() {
            if ((this.offset < 0) || (this.limit < 0)) {
                throw new ValidationException(ErrorCode.INVALID_PAGINATION,
                    "Offset and limit must not be negative (offset=" + this.offset + ", limit=" + this.limit + ")");
            }
            return new QueryOptions(
                this.filter,
                Collections.unmodifiableList(new ArrayList<>(this.sort)),
                this.offset,
                this.limit,
                Collections.unmodifiableList(new ArrayList<>(this.fields))
            );
        }
    }
}
