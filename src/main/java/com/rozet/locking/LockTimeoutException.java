package com.rozet.locking;

import java.time.Duration;
import java.util.Locale;

public class LockTimeoutException extends RuntimeException {

    private final String resourceKey;
    private final Duration timeout;

    public LockTimeoutException(String resourceKey, Duration timeout) {
        super("Could not acquire lock for " + resourceKey + " within " + formatSeconds(timeout) + "s");
        this.resourceKey = resourceKey;
        this.timeout = timeout;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static String formatSeconds(Duration timeout) {
        double seconds = timeout.toMillis() / 1000.0;
        return String.format(Locale.ROOT, "%.1f", seconds);
    }
}
