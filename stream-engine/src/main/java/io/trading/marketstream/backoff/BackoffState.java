package io.trading.marketstream.backoff;

import java.time.Duration;

/**
 * Attempt counter and next eligible retry time of one subscription.
 * Confined to the subscription's worker thread.
 */
public final class BackoffState {

    private final BackoffPolicy policy;

    private int attempt = 0;
    private long nextEligibleAtMillis = 0;

    public BackoffState(BackoffPolicy policy) {
        this.policy = policy;
    }

    /**
     * Records a failed or interrupted connection attempt.
     */
    public void recordFailure() {
        attempt++;
    }

    /**
     * Clears the attempt count; called on every transition into ACTIVE.
     */
    public void reset() {
        attempt = 0;
        nextEligibleAtMillis = 0;
    }

    /**
     * Returns whether the policy allows no further attempt.
     */
    public boolean isExhausted() {
        return policy.isExhausted(attempt);
    }

    /**
     * Computes the delay before the next attempt and records when it becomes eligible.
     */
    public Duration nextDelay() {
        Duration delay = policy.delay(attempt);
        nextEligibleAtMillis = System.currentTimeMillis() + delay.toMillis();
        return delay;
    }

    public int getAttempt() {
        return attempt;
    }

    public long getNextEligibleAtMillis() {
        return nextEligibleAtMillis;
    }

    public BackoffPolicy getPolicy() {
        return policy;
    }
}
