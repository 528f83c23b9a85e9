package eu.lieko.store.test.e2e;

import eu.lieko.store.AccessScope;
import eu.lieko.store.PermissionTier;
import eu.lieko.store.RecordStore;
import eu.lieko.store.record.DataRecord;
import eu.lieko.store.test.containers.BackendContainer;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wrapper that provides both BackendContainer and a ready store for E2E tests.
 * Automatic cleanup handled by @AfterEach in E2ETestBase.
 *
 * Usage in tests:
 * <pre>
 * @ParameterizedTest(name = "{0}")
 * @MethodSource("allBackendsWithContext")
 * void test_something(BackendTestContext btc) {
 *     btc.set("users", "u1", "name", "Bob");
 *     // test code here - zero boilerplate!
 * }
 * </pre>
 */
@Getter
public class BackendTestContext implements AutoCloseable {

    private static final ThreadLocal<BackendTestContext> CURRENT = new ThreadLocal<>();

    private final BackendContainer backend;
    private RecordStore store;

    private final AccessScope full = AccessScope.of(BackendContainer.PROJECT_ID, PermissionTier.FULL);
    private final AccessScope write = AccessScope.of(BackendContainer.PROJECT_ID, PermissionTier.WRITE);
    private final AccessScope read = AccessScope.of(BackendContainer.PROJECT_ID, PermissionTier.READ);
    private final AccessScope none = AccessScope.of(BackendContainer.PROJECT_ID, PermissionTier.NONE);

    private BackendTestContext(BackendContainer backend) {
        this.backend = backend;
        this.store = backend.createStore();

        // Register for cleanup
        CURRENT.set(this);
    }

    public static BackendTestContext create(BackendContainer backend) {
        return new BackendTestContext(backend);
    }

    static BackendTestContext getCurrent() {
        return CURRENT.get();
    }

    static void clearCurrent() {
        CURRENT.remove();
    }

    /**
     * Simulates a restart: a new store over the same persisted state.
     */
    public RecordStore reopen() {
        this.store = this.backend.reopenStore();
        return this.store;
    }

    // Convenience helpers

    public DataRecord set(String collection, String id, Object... keyValues) {
        return this.store.set(this.full, collection, id, fields(keyValues));
    }

    public static Map<String, Object> fields(Object... keyValues) {
        if ((keyValues.length % 2) != 0) {
            throw new IllegalArgumentException("key/value pairs expected");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put((String) keyValues[i], keyValues[i + 1]);
        }
        return fields;
    }

    @Override
    public String toString() {
        return this.backend.getName();
    }

    @Override
    public void close() throws Exception {
        this.backend.close();
        clearCurrent();
    }
}
