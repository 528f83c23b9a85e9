package eu.lieko.store.lock;

import eu.lieko.store.error.ErrorCode;
import eu.lieko.store.error.StorageException;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Exclusive per-resource write locks with bounded waiting.
 * <p>
 * Only writers are serialized; readers never take these locks. Lock entries are reference counted
 * and dropped once no thread holds or waits for them.
 * <p>
 * The default wait bound can be configured via the system property
 * {@code lieko.store.lockTimeoutMs} (default: 30000, 0 waits forever).
 */
public class WriteSerializer {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("lieko.store.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(WriteSerializer.class.getSimpleName());

    private static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(
        Long.parseLong(System.getProperty("lieko.store.lockTimeoutMs", "30000")));

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final @Getter Duration timeout;

    public WriteSerializer() {
        this(DEFAULT_TIMEOUT);
    }

    public WriteSerializer(@NonNull Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Lock timeout cannot be negative");
        }
        this.timeout = timeout;
    }

    /**
     * Waits for exclusive access to the resource.
     *
     * @return lock released by {@link ResourceLock#close()}
     * @throws StorageException {@link ErrorCode#LOCK_TIMEOUT} when the wait bound elapses,
     *                          {@link ErrorCode#LOCK_INTERRUPTED} when the thread is interrupted
     */
    public ResourceLock acquire(@NonNull String resourceKey) {
        LockEntry entry = this.locks.compute(resourceKey, (key, existing) -> {
            LockEntry current = (existing == null) ? new LockEntry() : existing;
            current.users++;
            return current;
        });

        boolean acquired;
        try {
            if (this.timeout.isZero()) {
                entry.lock.lockInterruptibly();
                acquired = true;
            } else {
                acquired = entry.lock.tryLock(this.timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            this.releaseEntry(resourceKey, entry);
            throw new StorageException(ErrorCode.LOCK_INTERRUPTED, "Interrupted while waiting for lock on " + resourceKey, exception);
        }

        if (!acquired) {
            this.releaseEntry(resourceKey, entry);
            throw new StorageException(ErrorCode.LOCK_TIMEOUT,
                "Timed out after " + this.timeout.toMillis() + " ms waiting for lock on " + resourceKey);
        }

        if (DEBUG) {
            LOGGER.info("Acquired lock on " + resourceKey);
        }
        return new ResourceLock(this, resourceKey, entry);
    }

    boolean isLocked(@NonNull String resourceKey) {
        LockEntry entry = this.locks.get(resourceKey);
        return (entry != null) && entry.lock.isLocked();
    }

    /**
     * @return number of resources currently held or waited for
     */
    int activeCount() {
        return this.locks.size();
    }

    void release(@NonNull ResourceLock resourceLock) {
        LockEntry entry = resourceLock.getEntry();
        entry.lock.unlock();
        this.releaseEntry(resourceLock.getResourceKey(), entry);
        if (DEBUG) {
            LOGGER.info("Released lock on " + resourceLock.getResourceKey());
        }
    }

    private void releaseEntry(String resourceKey, LockEntry entry) {
        this.locks.computeIfPresent(resourceKey, (key, existing) -> {
            if (existing != entry) {
                return existing;
            }
            existing.users--;
            return (existing.users == 0) ? null : existing;
        });
    }

    static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
