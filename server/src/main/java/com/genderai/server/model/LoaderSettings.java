package com.genderai.server.model;

import java.nio.file.Path;
import java.time.Duration;

public class LoaderSettings {
    private final String bucket;
    private final String prefix;
    private final Path cacheDir;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Duration loadTimeout;

    public LoaderSettings(String bucket, String prefix, Path cacheDir, Duration initialBackoff,
            Duration maxBackoff, Duration loadTimeout) {
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("Initial backoff must be positive");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Max backoff must not be below the initial backoff");
        }
        this.bucket = bucket;
        this.prefix = prefix;
        this.cacheDir = cacheDir;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.loadTimeout = loadTimeout;
    }

    public String getBucket() {
        return bucket;
    }

    public String getPrefix() {
        return prefix;
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public Duration getLoadTimeout() {
        return loadTimeout;
    }

    /**
     * Delay before the next attempt after {@code failedAttempts} consecutive
     * failures: initial * 2^(n-1), capped.
     */
    public Duration backoffFor(int failedAttempts) {
        int exponent = Math.max(0, Math.min(failedAttempts - 1, 30));
        long millis = initialBackoff.toMillis() << exponent;
        if (millis <= 0 || millis > maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(millis);
    }
}
