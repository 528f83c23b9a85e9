package eu.lieko.store.batch;

import eu.lieko.store.CollectionRef;
import eu.lieko.store.StoreContext;
import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.record.DataRecord;
import eu.lieko.store.record.RecordIds;
import eu.lieko.store.storage.RecordMap;
import eu.lieko.store.update.RecordUpdateEvaluator;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Applies one action to many records of a collection with independent per-item outcomes.
 * <p>
 * Item failures never abort sibling items. Mutating batches run under a single collection lock
 * and persist once at the end, or not at all when no item changed anything.
 */
public class BatchProcessor {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("lieko.store.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(BatchProcessor.class.getSimpleName());

    public static final String DELETED = "deleted";
    public static final String NOTHING_TO_DELETE = "nothing to delete";

    private final StoreContext context;
    private final RecordUpdateEvaluator updateEvaluator;

    public BatchProcessor(@NonNull StoreContext context) {
        this(context, new RecordUpdateEvaluator());
    }

    public BatchProcessor(@NonNull StoreContext context, @NonNull RecordUpdateEvaluator updateEvaluator) {
        this.context = context;
        this.updateEvaluator = updateEvaluator;
    }

    // ==================== WRITE OPERATIONS ====================

    /**
     * Inserts new records, generating ids where missing. Creates the collection if needed.
     */
    public BatchResult batchSet(@NonNull CollectionRef ref, List<? extends Map<String, ?>> records) {
        requireNonEmpty(records, "Records");

        return this.context.write(ref, true, map -> {
            String now = this.context.now();
            Collector collector = new Collector(records.size());

            for (int index = 0; index < records.size(); index++) {
                Map<String, ?> fields = records.get(index);
                if (fields == null) {
                    collector.error(index, null, ErrorCode.INVALID_REQUEST_BODY, "Invalid record format");
                    continue;
                }

                Object rawId = fields.get(DataRecord.ID);
                boolean generated = (rawId == null) || "".equals(rawId);
                String id = generated ? RecordIds.generate() : String.valueOf(rawId);

                if (!generated && !RecordIds.isValid(rawId)) {
                    collector.error(index, id, ErrorCode.INVALID_ID_FORMAT, "Invalid ID format: " + id);
                    continue;
                }
                if (map.contains(id)) {
                    collector.error(index, id, ErrorCode.RECORD_EXISTS, "Record '" + id + "' already exists");
                    continue;
                }

                try {
                    DataRecord record = this.updateEvaluator.create(fields, id, now);
                    map.put(id, record);
                    collector.success(BatchItemResult.success(index, id, record));
                } catch (ValidationException exception) {
                    collector.error(BatchItemError.of(index, id, exception));
                }
            }

            return collector.finish(ref, "batchSet");
        });
    }

    /**
     * Shallow-merges patches into existing records.
     */
    public BatchResult batchUpdate(@NonNull CollectionRef ref, List<RecordUpdate> updates) {
        requireNonEmpty(updates, "Updates");

        return this.context.write(ref, false, map -> {
            String now = this.context.now();
            Collector collector = new Collector(updates.size());

            for (int index = 0; index < updates.size(); index++) {
                RecordUpdate update = updates.get(index);
                if (update == null) {
                    collector.error(index, null, ErrorCode.INVALID_REQUEST_BODY, "Invalid update format");
                    continue;
                }

                String id = (update.getId() == null) ? null : String.valueOf(update.getId());
                if (!RecordIds.isValid(update.getId())) {
                    collector.error(index, id, ErrorCode.INVALID_ID_FORMAT, "Invalid ID format: " + id);
                    continue;
                }

                DataRecord existing = map.get(id);
                if (existing == null) {
                    collector.error(index, id, ErrorCode.RECORD_NOT_FOUND, "Record '" + id + "' not found");
                    continue;
                }
                if (update.getPatch() == null) {
                    collector.error(index, id, ErrorCode.INVALID_REQUEST_BODY, "Invalid update data");
                    continue;
                }

                try {
                    DataRecord record = this.updateEvaluator.merge(existing, update.getPatch(), now);
                    map.put(id, record);
                    collector.success(BatchItemResult.success(index, id, record));
                } catch (ValidationException exception) {
                    collector.error(BatchItemError.of(index, id, exception));
                }
            }

            return collector.finish(ref, "batchUpdate");
        });
    }

    /**
     * Removes records. Ids that do not exist are reported as successes.
     */
    public BatchResult batchDelete(@NonNull CollectionRef ref, List<?> ids) {
        requireNonEmpty(ids, "IDs");

        return this.context.write(ref, false, map -> {
            Collector collector = new Collector(ids.size());

            for (int index = 0; index < ids.size(); index++) {
                Object rawId = ids.get(index);
                String id = (rawId == null) ? null : String.valueOf(rawId);
                if (!RecordIds.isValid(rawId)) {
                    collector.error(index, id, ErrorCode.INVALID_ID_FORMAT, "Invalid ID format: " + id);
                    continue;
                }

                boolean removed = map.remove(id);
                collector.success(BatchItemResult.success(index, id, removed ? DELETED : NOTHING_TO_DELETE));
            }

            return collector.finish(ref, "batchDelete");
        });
    }

    // ==================== READ OPERATIONS ====================

    public BatchResult batchGet(@NonNull CollectionRef ref, List<?> ids) {
        requireNonEmpty(ids, "IDs");

        RecordMap map = this.context.read(ref);
        Collector collector = new Collector(ids.size());

        for (int index = 0; index < ids.size(); index++) {
            Object rawId = ids.get(index);
            String id = (rawId == null) ? null : String.valueOf(rawId);
            if (!RecordIds.isValid(rawId)) {
                collector.error(index, id, ErrorCode.INVALID_ID_FORMAT, "Invalid ID format: " + id);
                continue;
            }

            DataRecord record = map.get(id);
            if (record == null) {
                collector.error(index, id, ErrorCode.RECORD_NOT_FOUND, "Record '" + id + "' not found");
                continue;
            }
            collector.success(BatchItemResult.success(index, id, record));
        }

        return collector.finish(ref, "batchGet");
    }

    // ==================== HELPERS ====================

    private static void requireNonEmpty(List<?> items, String name) {
        if ((items == null) || items.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_REQUEST_BODY, name + " must be a non-empty array");
        }
    }

    private static final class Collector {

        private final int total;
        private final List<BatchItemResult> results = new ArrayList<>();
        private final List<BatchItemError> errors = new ArrayList<>();

        private Collector(int total) {
            this.total = total;
        }

        private void success(BatchItemResult result) {
            this.results.add(result);
        }

        private void error(BatchItemError error) {
            this.errors.add(error);
        }

        private void error(int index, String id, ErrorCode code, String message) {
            this.errors.add(BatchItemError.of(index, id, code, message));
        }

        private BatchResult finish(CollectionRef ref, String operation) {
            if (DEBUG) {
                LOGGER.info(operation + " on " + ref + ": " + this.results.size() + " succeeded, " + this.errors.size() + " failed");
            }
            return new BatchResult(
                Collections.unmodifiableList(this.results),
                Collections.unmodifiableList(this.errors),
                this.total
            );
        }
    }
}
