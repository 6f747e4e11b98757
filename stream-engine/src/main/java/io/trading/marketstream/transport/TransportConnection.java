package io.trading.marketstream.transport;

/**
 * One open WebSocket connection. Only the owning connection slot writes to it.
 */
public interface TransportConnection {

    /**
     * Sends a text frame. Sending on a closed connection is ignored.
     */
    void send(String text);

    /**
     * Sends a protocol-level ping frame.
     */
    void ping();

    boolean isOpen();

    /**
     * Closes the connection; the listener then receives its close signal.
     */
    void close();
}
