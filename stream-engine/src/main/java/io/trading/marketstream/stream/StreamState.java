package io.trading.marketstream.stream;

/**
 * Lifecycle state of one subscription.
 * Transitions only move forward, except ACTIVE and RECONNECTING which may alternate until closed.
 */
public enum StreamState {
    IDLE,
    CONNECTING,
    ACTIVE,
    RECONNECTING,
    CLOSING,
    CLOSED;

    /**
     * Returns whether the stream can no longer deliver data.
     */
    public boolean isTerminal() {
        return this == CLOSING || this == CLOSED;
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
