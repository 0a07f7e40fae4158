package com.rozet.locking;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * A single entry in the lock table. A record without expiry stays live until released.
 */
public record FileLock(
        String resourceKey,
        Instant acquiredAt,
        @Nullable Duration expiry
) {

    public boolean isExpired(Instant now) {
        if (expiry == null) {
            return false;
        }
        return Duration.between(acquiredAt, now).compareTo(expiry) >= 0;
    }

    public boolean isExpired() {
        return isExpired(Instant.now());
    }
}
