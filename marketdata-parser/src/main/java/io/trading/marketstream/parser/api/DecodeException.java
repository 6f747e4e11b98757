package io.trading.marketstream.parser.api;

/**
 * Thrown when a raw exchange message cannot be decoded.
 * Decode failures are not fatal for a stream: the message is dropped and the error reported.
 */
public class DecodeException extends Exception {

    private final String rawMessage;

    public DecodeException(String message, String rawMessage) {
        super(message);
        this.rawMessage = rawMessage;
    }

    public DecodeException(String message, String rawMessage, Throwable cause) {
        super(message, cause);
        this.rawMessage = rawMessage;
    }

    /**
     * Returns the message that failed to decode.
     */
    public String getRawMessage() {
        return rawMessage;
    }
}
