package com.rozet.locking;

import com.rozet.orchestration.model.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local table of exclusive locks keyed by normalized absolute path.
 * <p>
 * Waiters block on a condition that is signalled whenever a lock is released, and wake up
 * at least once per poll interval so that expired locks and cancelled signals are noticed
 * without a release. The table itself is guarded by a single mutex held only for
 * bookkeeping.
 */
@Slf4j
public class FileLockManager {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(10);

    private final Map<String, FileLock> locks = new HashMap<>();
    private final ReentrantLock tableLock = new ReentrantLock();
    private final Condition lockReleased = tableLock.newCondition();
    private final long pollIntervalNanos;

    public FileLockManager() {
        this(DEFAULT_POLL_INTERVAL);
    }

    public FileLockManager(Duration pollInterval) {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive.");
        }
        this.pollIntervalNanos = pollInterval.toNanos();
    }

    public FileLock acquire(String key, Duration timeout) {
        return acquire(key, timeout, null, CancellationSignal.none());
    }

    public FileLock acquire(String key, Duration timeout, @Nullable Duration expiry) {
        return acquire(key, timeout, expiry, CancellationSignal.none());
    }

    /**
     * Acquires the lock for {@code key}, waiting at most {@code timeout}.
     *
     * @throws LockTimeoutException if a live lock is still held when the timeout elapses
     * @throws CancellationException if the signal is cancelled or the thread is interrupted while waiting
     */
    public FileLock acquire(String key, Duration timeout, @Nullable Duration expiry, CancellationSignal cancellation) {
        String resourceKey = normalize(key);
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
        tableLock.lock();
        try {
            while (true) {
                FileLock existing = liveLock(resourceKey, Instant.now());
                if (existing == null) {
                    FileLock lock = new FileLock(resourceKey, Instant.now(), expiry);
                    locks.put(resourceKey, lock);
                    log.debug("Acquired lock for {}", resourceKey);
                    return lock;
                }
                if (cancellation.isCancelled()) {
                    throw new CancellationException("Lock acquisition cancelled for " + resourceKey);
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new LockTimeoutException(resourceKey, timeout);
                }
                lockReleased.awaitNanos(Math.min(remaining, pollIntervalNanos));
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting for lock on " + resourceKey);
            cancelled.initCause(ex);
            throw cancelled;
        } finally {
            tableLock.unlock();
        }
    }

    public ScopedLock scopedAcquire(String key, Duration timeout) {
        return scopedAcquire(key, timeout, null, CancellationSignal.none());
    }

    public ScopedLock scopedAcquire(String key, Duration timeout, @Nullable Duration expiry) {
        return scopedAcquire(key, timeout, expiry, CancellationSignal.none());
    }

    public ScopedLock scopedAcquire(String key, Duration timeout, @Nullable Duration expiry, CancellationSignal cancellation) {
        return new ScopedLock(this, acquire(key, timeout, expiry, cancellation));
    }

    /**
     * Releases the lock for {@code key}. Releasing a key that holds no lock is logged and ignored.
     */
    public void release(String key) {
        String resourceKey = normalize(key);
        tableLock.lock();
        try {
            if (locks.remove(resourceKey) != null) {
                log.debug("Released lock for {}", resourceKey);
                lockReleased.signalAll();
            } else {
                log.warn("Attempted to release non-existent lock for {}", resourceKey);
            }
        } finally {
            tableLock.unlock();
        }
    }

    /**
     * Releases {@code lock} only if it is still the record held for its key, so a holder whose
     * lock expired cannot remove a lock granted to someone else afterwards.
     */
    void release(FileLock lock) {
        tableLock.lock();
        try {
            if (locks.remove(lock.resourceKey(), lock)) {
                log.debug("Released lock for {}", lock.resourceKey());
                lockReleased.signalAll();
            } else {
                log.warn("Lock for {} was no longer held at release time", lock.resourceKey());
            }
        } finally {
            tableLock.unlock();
        }
    }

    public boolean isLocked(String key) {
        String resourceKey = normalize(key);
        tableLock.lock();
        try {
            return liveLock(resourceKey, Instant.now()) != null;
        } finally {
            tableLock.unlock();
        }
    }

    public int cleanupExpired() {
        Instant now = Instant.now();
        int removed = 0;
        tableLock.lock();
        try {
            Iterator<Map.Entry<String, FileLock>> iterator = locks.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, FileLock> entry = iterator.next();
                if (entry.getValue().isExpired(now)) {
                    iterator.remove();
                    removed++;
                    log.debug("Cleaned up expired lock for {}", entry.getKey());
                }
            }
            if (removed > 0) {
                lockReleased.signalAll();
            }
            return removed;
        } finally {
            tableLock.unlock();
        }
    }

    public List<FileLock> snapshot() {
        Instant now = Instant.now();
        tableLock.lock();
        try {
            List<FileLock> live = new ArrayList<>();
            for (FileLock lock : locks.values()) {
                if (!lock.isExpired(now)) {
                    live.add(lock);
                }
            }
            live.sort(Comparator.comparing(FileLock::resourceKey));
            return live;
        } finally {
            tableLock.unlock();
        }
    }

    static String normalize(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Lock key must not be blank.");
        }
        return Path.of(key).toAbsolutePath().normalize().toString();
    }

    // Caller must hold tableLock.
    @Nullable
    private FileLock liveLock(String resourceKey, Instant now) {
        FileLock existing = locks.get(resourceKey);
        if (existing != null && existing.isExpired(now)) {
            log.debug("Removing expired lock for {}", resourceKey);
            locks.remove(resourceKey);
            return null;
        }
        return existing;
    }
}
