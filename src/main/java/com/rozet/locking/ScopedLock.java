package com.rozet.locking;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by {@link FileLockManager#scopedAcquire}. Use it in a try-with-resources
 * block so the lock is released on every exit path. Closing twice releases once.
 */
public final class ScopedLock implements AutoCloseable {

    private final FileLockManager manager;
    private final FileLock lock;
    private final AtomicBoolean released = new AtomicBoolean();

    ScopedLock(FileLockManager manager, FileLock lock) {
        this.manager = manager;
        this.lock = lock;
    }

    public FileLock lock() {
        return lock;
    }

    public String resourceKey() {
        return lock.resourceKey();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            manager.release(lock);
        }
    }
}
