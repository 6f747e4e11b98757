package io.trading.marketstream.transport;

/**
 * Callbacks for a {@link TransportConnection}, invoked on a transport thread.
 */
public interface TransportListener {

    void onMessage(String text);

    /**
     * A liveness reply arrived at the protocol level.
     */
    void onPong();

    /**
     * The connection is gone. Called exactly once per connection.
     *
     * @param cause failure that closed it, or null for an orderly close
     */
    void onClosed(Throwable cause);
}
