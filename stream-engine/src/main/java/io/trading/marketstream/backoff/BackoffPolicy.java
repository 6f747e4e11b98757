package io.trading.marketstream.backoff;

import io.trading.marketstream.config.StreamConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter for reconnection attempts.
 *
 * <pre>
 * delay(attempt) = min(maxDelay, baseDelay * 2^attempt) * jitter,  jitter uniform in [0.5, 1.0]
 * </pre>
 *
 * Pure: holds no attempt state. Callers keep the count in a {@link BackoffState}.
 */
public final class BackoffPolicy {

    static final double MIN_JITTER = 0.5;
    static final double MAX_JITTER = 1.0;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final DoubleSupplier jitterSource;

    /**
     * Creates a policy.
     *
     * @param baseDelay    Delay for attempt 0
     * @param maxDelay     Ceiling applied before jitter
     * @param maxAttempts  Attempts before exhaustion, 0 for unlimited
     * @param jitterSource Supplies values in [0, 1) mapped onto [0.5, 1.0]
     */
    public BackoffPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts, DoubleSupplier jitterSource) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay cannot be less than baseDelay");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts cannot be negative");
        }
        if (jitterSource == null) {
            throw new IllegalArgumentException("jitterSource cannot be null");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.jitterSource = jitterSource;
    }

    /**
     * Creates a policy from stream configuration with random jitter.
     */
    public static BackoffPolicy from(StreamConfig config) {
        return new BackoffPolicy(
            config.baseDelay(),
            config.maxDelay(),
            config.maxReconnectAttempts(),
            () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    /**
     * Returns the capped delay for an attempt before jitter is applied.
     * Non-decreasing in attempt.
     */
    public Duration ceilingFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt cannot be negative");
        }
        long baseMillis = baseDelay.toMillis();
        long maxMillis = maxDelay.toMillis();
        // 2^62 already overflows any realistic base delay
        if (attempt >= 62 || baseMillis > (maxMillis >> Math.min(attempt, 62))) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(maxMillis, baseMillis << attempt));
    }

    /**
     * Returns the jittered delay before retrying after the given attempt count.
     */
    public Duration delay(int attempt) {
        double jitter = MIN_JITTER + (MAX_JITTER - MIN_JITTER) * clamp(jitterSource.getAsDouble());
        return Duration.ofMillis(Math.round(ceilingFor(attempt).toMillis() * jitter));
    }

    /**
     * Returns whether no further attempt is allowed.
     */
    public boolean isExhausted(int attempt) {
        return maxAttempts > 0 && attempt >= maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static double clamp(double value) {
        if (value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
