package eu.lieko.store.test.e2e;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.NotFoundException;
import eu.lieko.store.error.ValidationException;
import eu.lieko.store.record.DataRecord;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static eu.lieko.store.test.e2e.BackendTestContext.fields;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * E2E increment/decrement tests against ALL backends.
 */
public class IncrementE2ETest extends E2ETestBase {

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_increment_missing_field_starts_at_zero(BackendTestContext btc) {
        btc.set("users", "u1", "name", "Bob");

        DataRecord updated = btc.getStore().increment(btc.getWrite(), "users", "u1", "score", 5);

        assertThat(updated.get("score")).isEqualTo(5L);
        assertThat(btc.getStore().get(btc.getRead(), "users", "u1").get("score")).isEqualTo(5L);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_increment_existing_and_decrement(BackendTestContext btc) {
        btc.set("users", "u1", "score", 10);

        btc.getStore().increment(btc.getWrite(), "users", "u1", "score", 7);
        DataRecord updated = btc.getStore().decrement(btc.getWrite(), "users", "u1", "score", 2);

        assertThat(updated.get("score")).isEqualTo(15L);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_increment_defaults_to_one(BackendTestContext btc) {
        btc.set("users", "u1", "score", 10);

        btc.getStore().increment(btc.getWrite(), "users", "u1", "score");
        btc.getStore().increment(btc.getWrite(), "users", "u1", "score");
        DataRecord updated = btc.getStore().decrement(btc.getWrite(), "users", "u1", "score");

        assertThat(updated.get("score")).isEqualTo(11L);
        assertThat(btc.getStore().get(btc.getRead(), "users", "u1").get("score")).isEqualTo(11L);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_increment_without_field_is_rejected(BackendTestContext btc) {
        btc.set("users", "u1", "score", 10);

        assertThatThrownBy(() -> btc.getStore().increment(btc.getWrite(), "users", "u1", null, 1))
            .isInstanceOf(ValidationException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.MISSING_REQUIRED_FIELDS);
        assertThatThrownBy(() -> btc.getStore().decrement(btc.getWrite(), "users", "u1", " "))
            .isInstanceOf(ValidationException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.MISSING_REQUIRED_FIELDS);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_increment_fractional(BackendTestContext btc) {
        btc.set("users", "u1", "balance", 1);

        DataRecord updated = btc.getStore().increment(btc.getWrite(), "users", "u1", "balance", 0.5);

        assertThat(updated.get("balance")).isEqualTo(1.5);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_increment_nested_creates_containers(BackendTestContext btc) {
        btc.set("users", "u1", "stats", fields("visits", 3));

        btc.getStore().increment(btc.getWrite(), "users", "u1", "stats.visits", 1);
        DataRecord updated = btc.getStore().increment(btc.getWrite(), "users", "u1", "stats.daily.monday", 2);

        assertThat(updated.get("stats")).isEqualTo(fields("visits", 4L, "daily", fields("monday", 2L)));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_increment_non_numeric_is_invalid_field(BackendTestContext btc) {
        DataRecord original = btc.set("users", "u1", "name", "Bob", "nickname", null);

        assertThatThrownBy(() -> btc.getStore().increment(btc.getWrite(), "users", "u1", "name", 1))
            .isInstanceOf(ValidationException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_FIELD);
        assertThatThrownBy(() -> btc.getStore().increment(btc.getWrite(), "users", "u1", "nickname", 1))
            .isInstanceOf(ValidationException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_FIELD);
        assertThatThrownBy(() -> btc.getStore().increment(btc.getWrite(), "users", "u1", "name.length", 1))
            .isInstanceOf(ValidationException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_FIELD);
        assertThatThrownBy(() -> btc.getStore().increment(btc.getWrite(), "users", "u1", "a..b", 1))
            .isInstanceOf(ValidationException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.INVALID_FIELD);

        assertThat(btc.getStore().get(btc.getRead(), "users", "u1")).isEqualTo(original);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("allBackendsWithContext")
    void test_increment_missing_record(BackendTestContext btc) {
        btc.set("users", "u1", "score", 1);

        assertThatThrownBy(() -> btc.getStore().increment(btc.getWrite(), "users", "u2", "score", 1))
            .isInstanceOf(NotFoundException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.RECORD_NOT_FOUND);
    }
}
