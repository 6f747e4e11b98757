package io.trading.marketstream.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens physical WebSocket connections to an exchange.
 */
public interface Transport extends AutoCloseable {

    /**
     * Opens a connection.
     *
     * @param endpoint WebSocket URI
     * @param name     connection name for logs
     * @param listener receives inbound traffic and exactly one close signal, once the returned
     *                 future has completed normally
     * @return future completed when the handshake succeeds, or exceptionally when it fails
     */
    CompletableFuture<TransportConnection> open(URI endpoint, String name, TransportListener listener);

    /**
     * Releases threads shared by all connections of this transport.
     */
    @Override
    void close();
}
