package eu.lieko.store.lock;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Held write lock on a single resource. Closing releases it; repeated closes are ignored.
 */
public final class ResourceLock implements AutoCloseable {

    private final WriteSerializer owner;
    private final @Getter String resourceKey;
    private final @Getter(AccessLevel.PACKAGE) WriteSerializer.LockEntry entry;
    private final AtomicBoolean released = new AtomicBoolean();

    ResourceLock(@NonNull WriteSerializer owner, @NonNull String resourceKey, @NonNull WriteSerializer.LockEntry entry) {
        this.owner = owner;
        this.resourceKey = resourceKey;
        this.entry = entry;
    }

    public boolean isReleased() {
        return this.released.get();
    }

    @Override
    public void close() {
        if (this.released.compareAndSet(false, true)) {
            this.owner.release(this);
        }
    }
}
