package eu.lieko.store;

import eu.lieko.store.batch.BatchProcessor;
import eu.lieko.store.batch.BatchResult;
import eu.lieko.store.batch.RecordUpdate;
import eu.lieko.store.error.ConflictException;
import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.NotFoundException;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.filter.FilterParser;
import eu.lieko.store.filter.RecordFilterEvaluator;
import eu.lieko.store.filter.condition.Condition;
import eu.lieko.store.filter.predicate.string.SearchPredicate;
import eu.lieko.store.lock.WriteSerializer;
import eu.lieko.store.metadata.CollectionInfo;
import eu.lieko.store.metadata.InMemoryProjectMetadataStore;
import eu.lieko.store.metadata.ProjectMetadataStore;
import eu.lieko.store.query.Page;
import eu.lieko.store.query.QueryOptions;
import eu.lieko.store.query.QueryPipeline;
import eu.lieko.store.record.DataRecord;
import eu.lieko.store.record.FieldPath;
import eu.lieko.store.record.RecordEntry;
import eu.lieko.store.record.RecordIds;
import eu.lieko.store.storage.RecordMap;
import eu.lieko.store.storage.StorageEngine;
import eu.lieko.store.update.IncrementOperation;
import eu.lieko.store.update.RecordUpdateEvaluator;
import lombok.Getter;
import lombok.NonNull;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Operation surface of the store. Every call is scoped to the caller's project and checks
 * the caller's permission tier before validating input or touching data.
 * <p>
 * Read operations are not serialized against writers. Write operations hold the collection
 * write lock across their whole load-modify-persist cycle.
 */
public class RecordStore implements Closeable {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("lieko.store.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(RecordStore.class.getSimpleName());

    private final @Getter StoreContext context;
    private final FilterParser filterParser;
    private final RecordFilterEvaluator filterEvaluator;
    private final QueryPipeline queryPipeline;
    private final RecordUpdateEvaluator updateEvaluator;
    private final BatchProcessor batchProcessor;

    public RecordStore(@NonNull StoreContext context) {
        this.context = context;
        this.filterParser = new FilterParser();
        this.filterEvaluator = new RecordFilterEvaluator();
        this.queryPipeline = new QueryPipeline(this.filterEvaluator);
        this.updateEvaluator = new RecordUpdateEvaluator();
        this.batchProcessor = new BatchProcessor(context, this.updateEvaluator);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StorageEngine storage;
        private ProjectMetadataStore metadata;
        private Duration lockTimeout;
        private Clock clock = Clock.systemUTC();

        public Builder storage(@NonNull StorageEngine storage) {
            this.storage = storage;
            return this;
        }

        public Builder metadata(@NonNull ProjectMetadataStore metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * @param lockTimeout maximum wait for a write lock, zero waits forever
         */
        public Builder lockTimeout(@NonNull Duration lockTimeout) {
            this.lockTimeout = lockTimeout;
            return this;
        }

        public Builder clock(@NonNull Clock clock) {
            this.clock = clock;
            return this;
        }

        public RecordStore build() {
            if (this.storage == null) {
                throw new IllegalStateException("storage is required");
            }
            ProjectMetadataStore metadataStore = (this.metadata != null) ? this.metadata : new InMemoryProjectMetadataStore();
            WriteSerializer writeSerializer = (this.lockTimeout != null) ? new WriteSerializer(this.lockTimeout) : new WriteSerializer();

            StoreContext context = new StoreContext(this.storage, metadataStore, writeSerializer, this.clock);
            context.getRegistry().initialize();
            return new RecordStore(context);
        }
    }

    // ==================== CREATE ====================

    /**
     * Creates a record, generating an id when none is given. Creates the collection if missing.
     *
     * @throws ConflictException {@link ErrorCode#RECORD_EXISTS} when the id is taken
     */
    public DataRecord insert(@NonNull AccessScope scope, @NonNull String collection, Map<String, ?> fields) {
        scope.require(OperationCategory.WRITE);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        requireBody(fields);

        Object rawId = fields.get(DataRecord.ID);
        String id = ((rawId == null) || "".equals(rawId)) ? RecordIds.generate() : RecordIds.requireValid(rawId);

        return this.context.write(ref, true, records -> {
            if (records.contains(id)) {
                throw new ConflictException(ErrorCode.RECORD_EXISTS, "Record '" + id + "' already exists");
            }
            DataRecord record = this.updateEvaluator.create(fields, id, this.context.now());
            records.put(id, record);
            this.debug("insert", ref, id);
            return record;
        });
    }

    /**
     * Upsert: merges into the existing record or creates a new one. Creates the collection if missing.
     */
    public DataRecord set(@NonNull AccessScope scope, @NonNull String collection, Object id, Map<String, ?> fields) {
        scope.require(OperationCategory.WRITE);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        String recordId = RecordIds.requireValid(id);
        requireBody(fields);

        return this.context.write(ref, true, records -> {
            String now = this.context.now();
            DataRecord existing = records.get(recordId);
            DataRecord record = (existing == null)
                ? this.updateEvaluator.create(fields, recordId, now)
                : this.updateEvaluator.merge(existing, fields, now);
            records.put(recordId, record);
            this.debug("set", ref, recordId);
            return record;
        });
    }

    // ==================== READ ====================

    /**
     * @throws NotFoundException {@link ErrorCode#RECORD_NOT_FOUND} when there is no such record
     */
    public DataRecord get(@NonNull AccessScope scope, @NonNull String collection, Object id) {
        return this.get(scope, collection, id, Collections.emptyList());
    }

    /**
     * @param fields projection, empty for the whole record
     * @throws NotFoundException {@link ErrorCode#RECORD_NOT_FOUND} when there is no such record
     */
    public DataRecord get(@NonNull AccessScope scope, @NonNull String collection, Object id, @NonNull List<String> fields) {
        scope.require(OperationCategory.READ);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        String recordId = RecordIds.requireValid(id);

        DataRecord record = this.context.read(ref).find(recordId).orElseThrow(() ->
            new NotFoundException(ErrorCode.RECORD_NOT_FOUND, "No record found in " + collection + " with ID " + recordId));

        return fields.isEmpty() ? record : record.project(toPaths(fields));
    }

    /**
     * @return first record in insertion order matching the filter, empty if none does
     */
    public Optional<DataRecord> findOne(@NonNull AccessScope scope, @NonNull String collection, Condition filter) {
        scope.require(OperationCategory.READ);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);

        return this.context.read(ref).values().stream()
            .filter(record -> this.filterEvaluator.matches(record, filter))
            .findFirst();
    }

    /**
     * @param filterJson filter in its JSON wire form
     */
    public Optional<DataRecord> findOne(@NonNull AccessScope scope, @NonNull String collection, @NonNull String filterJson) {
        scope.require(OperationCategory.READ);
        return this.findOne(scope, collection, this.filterParser.parse(filterJson));
    }

    public Page find(@NonNull AccessScope scope, @NonNull String collection, @NonNull QueryOptions options) {
        scope.require(OperationCategory.READ);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        return this.queryPipeline.execute(this.context.read(ref).values(), options);
    }

    /**
     * Case-insensitive text search, combined with the filter of the options when present.
     *
     * @param searchFields fields to search in (nested values included), empty for every field
     * @throws ValidationException {@link ErrorCode#MISSING_REQUIRED_FIELDS} when the term is blank
     */
    public Page search(@NonNull AccessScope scope, @NonNull String collection, String term,
                       @NonNull List<String> searchFields, @NonNull QueryOptions options) {
        scope.require(OperationCategory.READ);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        if ((term == null) || term.trim().isEmpty()) {
            throw new ValidationException(ErrorCode.MISSING_REQUIRED_FIELDS, "Search term required");
        }

        SearchPredicate predicate = new SearchPredicate(term);
        Condition search = searchFields.isEmpty()
            ? Condition.and(predicate)
            : Condition.or(toPaths(searchFields).stream()
                .map(path -> Condition.and(path, predicate))
                .collect(Collectors.toList()));

        Condition where = options.hasFilter() ? Condition.and(options.getFilter(), search) : search;
        return this.queryPipeline.execute(this.context.read(ref).values(), options.withFilter(where));
    }

    public Page search(@NonNull AccessScope scope, @NonNull String collection, String term) {
        return this.search(scope, collection, term, Collections.emptyList(), QueryOptions.all());
    }

    /**
     * @param filter records to count, {@code null} counts all
     */
    public long count(@NonNull AccessScope scope, @NonNull String collection, Condition filter) {
        scope.require(OperationCategory.READ);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        return this.context.read(ref).values().stream()
            .filter(record -> this.filterEvaluator.matches(record, filter))
            .count();
    }

    public long count(@NonNull AccessScope scope, @NonNull String collection) {
        return this.count(scope, collection, (Condition) null);
    }

    public long count(@NonNull AccessScope scope, @NonNull String collection, @NonNull String filterJson) {
        scope.require(OperationCategory.READ);
        return this.count(scope, collection, this.filterParser.parse(filterJson));
    }

    public List<String> keys(@NonNull AccessScope scope, @NonNull String collection) {
        scope.require(OperationCategory.READ);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        return this.context.read(ref).ids();
    }

    public List<RecordEntry> entries(@NonNull AccessScope scope, @NonNull String collection) {
        scope.require(OperationCategory.READ);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        return this.context.read(ref).entrySet().stream()
            .map(entry -> new RecordEntry(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList());
    }

    public long size(@NonNull AccessScope scope, @NonNull String collection) {
        scope.require(OperationCategory.READ);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        return this.context.read(ref).size();
    }

    // ==================== UPDATE ====================

    /**
     * Shallow-merges the patch into an existing record.
     *
     * @throws NotFoundException {@link ErrorCode#RECORD_NOT_FOUND} when there is no such record
     */
    public DataRecord update(@NonNull AccessScope scope, @NonNull String collection, Object id, Map<String, ?> patch) {
        scope.require(OperationCategory.WRITE);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        String recordId = RecordIds.requireValid(id);
        requireBody(patch);

        return this.context.write(ref, false, records -> {
            DataRecord existing = requireRecord(records, collection, recordId);
            DataRecord record = this.updateEvaluator.merge(existing, patch, this.context.now());
            records.put(recordId, record);
            this.debug("update", ref, recordId);
            return record;
        });
    }

    /**
     * Adds the delta to a numeric field. A missing field counts as zero and missing
     * intermediate objects are created.
     *
     * @param delta amount to add, {@code null} adds one
     * @throws ValidationException {@link ErrorCode#MISSING_REQUIRED_FIELDS} when no field is named,
     *                             {@link ErrorCode#INVALID_FIELD} when the field holds a non-number
     */
    public DataRecord increment(@NonNull AccessScope scope, @NonNull String collection, Object id, String field, Number delta) {
        scope.require(OperationCategory.WRITE);
        return this.applyIncrement(scope, collection, id, IncrementOperation.increment(requireField(field), orOne(delta)));
    }

    public DataRecord increment(@NonNull AccessScope scope, @NonNull String collection, Object id, String field) {
        return this.increment(scope, collection, id, field, null);
    }

    /**
     * @param delta amount to subtract, {@code null} subtracts one
     */
    public DataRecord decrement(@NonNull AccessScope scope, @NonNull String collection, Object id, String field, Number delta) {
        scope.require(OperationCategory.WRITE);
        return this.applyIncrement(scope, collection, id, IncrementOperation.decrement(requireField(field), orOne(delta)));
    }

    public DataRecord decrement(@NonNull AccessScope scope, @NonNull String collection, Object id, String field) {
        return this.decrement(scope, collection, id, field, null);
    }

    private DataRecord applyIncrement(AccessScope scope, String collection, Object id, IncrementOperation operation) {
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        String recordId = RecordIds.requireValid(id);

        return this.context.write(ref, false, records -> {
            DataRecord existing = requireRecord(records, collection, recordId);
            DataRecord record = this.updateEvaluator.applyIncrement(existing, operation, this.context.now());
            records.put(recordId, record);
            this.debug("increment " + operation.getField(), ref, recordId);
            return record;
        });
    }

    // ==================== DELETE ====================

    /**
     * Idempotent delete.
     *
     * @return whether a record was removed
     */
    public boolean delete(@NonNull AccessScope scope, @NonNull String collection, Object id) {
        scope.require(OperationCategory.FULL);
        CollectionRef ref = CollectionRef.of(scope.getProjectId(), collection);
        String recordId = RecordIds.requireValid(id);

        return this.context.write(ref, false, records -> {
            boolean removed = records.remove(recordId);
            this.debug(removed ? "delete" : "delete (absent)", ref, recordId);
            return removed;
        });
    }

    // ==================== BATCH ====================

    public BatchResult batchSet(@NonNull AccessScope scope, @NonNull String collection, List<? extends Map<String, ?>> records) {
        scope.require(OperationCategory.WRITE);
        return this.batchProcessor.batchSet(CollectionRef.of(scope.getProjectId(), collection), records);
    }

    public BatchResult batchGet(@NonNull AccessScope scope, @NonNull String collection, List<?> ids) {
        scope.require(OperationCategory.READ);
        return this.batchProcessor.batchGet(CollectionRef.of(scope.getProjectId(), collection), ids);
    }

    public BatchResult batchUpdate(@NonNull AccessScope scope, @NonNull String collection, List<RecordUpdate> updates) {
        scope.require(OperationCategory.WRITE);
        return this.batchProcessor.batchUpdate(CollectionRef.of(scope.getProjectId(), collection), updates);
    }

    public BatchResult batchDelete(@NonNull AccessScope scope, @NonNull String collection, List<?> ids) {
        scope.require(OperationCategory.FULL);
        return this.batchProcessor.batchDelete(CollectionRef.of(scope.getProjectId(), collection), ids);
    }

    // ==================== COLLECTIONS ====================

    /**
     * Existence probe, available to any caller of the project.
     */
    public boolean hasCollection(@NonNull AccessScope scope, @NonNull String collection) {
        return this.context.getRegistry().contains(CollectionRef.of(scope.getProjectId(), collection));
    }

    public List<CollectionInfo> listCollections(@NonNull AccessScope scope) {
        scope.require(OperationCategory.READ);
        return this.context.getRegistry().list(scope.getProjectId());
    }

    public List<CollectionInfo> registerCollections(@NonNull AccessScope scope, @NonNull Collection<String> names) {
        scope.require(OperationCategory.WRITE);
        return this.context.getRegistry().register(scope.getProjectId(), names);
    }

    public List<CollectionInfo> deleteCollections(@NonNull AccessScope scope, @NonNull Collection<String> names) {
        scope.require(OperationCategory.FULL);
        return this.context.getRegistry().deregister(scope.getProjectId(), names);
    }

    public void dropCollection(@NonNull AccessScope scope, @NonNull String collection) {
        scope.require(OperationCategory.FULL);
        this.context.getRegistry().drop(CollectionRef.of(scope.getProjectId(), collection));
    }

    @Override
    public void close() throws IOException {
        this.context.close();
    }

    // ==================== HELPERS ====================

    private static void requireBody(Map<String, ?> fields) {
        if (fields == null) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST_BODY, "Record fields are required");
        }
    }

    private static String requireField(String field) {
        if ((field == null) || field.trim().isEmpty()) {
            throw new ValidationException(ErrorCode.MISSING_REQUIRED_FIELDS, "Field name required");
        }
        return field;
    }

    private static Number orOne(Number delta) {
        return (delta == null) ? 1L : delta;
    }

    private static DataRecord requireRecord(RecordMap records, String collection, String id) {
        DataRecord record = records.get(id);
        if (record == null) {
            throw new NotFoundException(ErrorCode.RECORD_NOT_FOUND, "Record '" + id + "' not found in '" + collection + "'");
        }
        return record;
    }

    private static List<FieldPath> toPaths(List<String> fields) {
        return fields.stream()
            .map(String::trim)
            .filter(field -> !field.isEmpty())
            .map(FieldPath::parse)
            .collect(Collectors.toList());
    }

    private void debug(String operation, CollectionRef ref, String id) {
        if (DEBUG) {
            LOGGER.info(operation + " " + ref + "/" + id);
        }
    }
}
