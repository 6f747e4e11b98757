package io.trading.marketstream.stream;

/**
 * How a stream error is handled.
 */
public enum ErrorCategory {
    /** Misuse of the stream API, thrown to the caller. */
    USAGE,
    /** Undecodable or unexpected message; reported, stream continues. */
    PROTOCOL,
    /** Connection loss or liveness failure; drives a reconnect. */
    CONNECTIVITY,
    /** Order book divergence; handled like connectivity, never patched over. */
    CONSISTENCY,
    /** Stream is finished; both channels close after it. */
    TERMINAL
}
