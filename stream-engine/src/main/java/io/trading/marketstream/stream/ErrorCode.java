package io.trading.marketstream.stream;

/**
 * Stream error codes and their category.
 */
public enum ErrorCode {
    ALREADY_SUBSCRIBED(ErrorCategory.USAGE, "already subscribed"),
    NOT_SUBSCRIBED(ErrorCategory.USAGE, "not subscribed"),
    STREAM_CLOSED(ErrorCategory.USAGE, "stream is closed"),
    DECODE_FAILED(ErrorCategory.PROTOCOL, "message could not be decoded"),
    REJECTED(ErrorCategory.PROTOCOL, "request rejected by exchange"),
    DISCONNECTED(ErrorCategory.CONNECTIVITY, "disconnected"),
    CONNECT_TIMEOUT(ErrorCategory.CONNECTIVITY, "connect timed out"),
    PONG_TIMEOUT(ErrorCategory.CONNECTIVITY, "no pong within timeout"),
    SNAPSHOT_FAILED(ErrorCategory.CONNECTIVITY, "order book snapshot failed"),
    SEQUENCE_GAP(ErrorCategory.CONSISTENCY, "order book sequence gap"),
    SUBSCRIPTION_CANCELLED(ErrorCategory.TERMINAL, "subscription cancelled"),
    RECONNECT_EXHAUSTED(ErrorCategory.TERMINAL, "reconnect attempts exhausted"),
    RECONNECT_DISABLED(ErrorCategory.TERMINAL, "connection lost and reconnect is disabled");

    private final ErrorCategory category;
    private final String description;

    ErrorCode(ErrorCategory category, String description) {
        this.category = category;
        this.description = description;
    }

    public ErrorCategory category() {
        return category;
    }

    public String description() {
        return description;
    }

    public boolean isTerminal() {
        return category == ErrorCategory.TERMINAL;
    }
}
