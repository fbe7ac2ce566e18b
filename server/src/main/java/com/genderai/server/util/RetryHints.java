package com.genderai.server.util;

import java.time.Duration;
import java.time.Instant;

public final class RetryHints {

    private RetryHints() {
    }

    /**
     * Whole seconds from {@code now} until {@code retryAfter}, rounded up and
     * never below 1. Used for the Retry-After header, messages and health.
     */
    public static long secondsUntil(Instant now, Instant retryAfter) {
        long millis = Duration.between(now, retryAfter).toMillis();
        return Math.max(1L, (millis + 999) / 1000);
    }
}
