package io.trading.marketstream.stream;

import io.trading.marketstream.parser.model.Exchange;

/**
 * Error raised by, or reported on, a market data stream.
 * Usage errors are thrown from {@link MarketStream} methods; every other category is
 * delivered on the stream's error channel.
 */
public class StreamException extends RuntimeException {

    private final ErrorCode code;
    private final Exchange exchange;
    private final String streamName;

    public StreamException(ErrorCode code, Exchange exchange, String streamName, String message) {
        this(code, exchange, streamName, message, null);
    }

    public StreamException(ErrorCode code, Exchange exchange, String streamName, String message, Throwable cause) {
        super(format(exchange, streamName, message == null ? code.description() : message, cause), cause);
        this.code = code;
        this.exchange = exchange;
        this.streamName = streamName;
    }

    private static String format(Exchange exchange, String streamName, String message, Throwable cause) {
        StringBuilder text = new StringBuilder()
            .append('[').append(exchange == null ? "-" : exchange.getDisplayName()).append("] stream ")
            .append(streamName).append(": ").append(message);
        if (cause != null && cause.getMessage() != null) {
            text.append(": ").append(cause.getMessage());
        }
        return text.toString();
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.category();
    }

    public Exchange getExchange() {
        return exchange;
    }

    public String getStreamName() {
        return streamName;
    }

    public boolean isTerminal() {
        return code.isTerminal();
    }
}
