package com.rozet.api;

import com.rozet.locking.FileLock;

import java.time.Duration;
import java.time.Instant;

public record LockView(
        String resourceKey,
        Instant acquiredAt,
        Duration expiry
) {

    public static LockView from(FileLock lock) {
        return new LockView(lock.resourceKey(), lock.acquiredAt(), lock.expiry());
    }
}
