package io.trading.marketstream.parser.api;

import io.trading.marketstream.parser.model.Exchange;

/**
 * Decodes raw WebSocket messages from an exchange into normalized market data.
 * Implementations must be safe to call from a single connection thread; they hold no
 * per-message state between calls.
 */
public interface MarketDataDecoder {

    /**
     * Gets the exchange this decoder understands.
     */
    Exchange getExchange();

    /**
     * Decodes one raw message.
     *
     * @param message The raw JSON message from the exchange
     * @return the decoded message, never null
     * @throws DecodeException if the message is malformed or of an unknown shape
     */
    DecodedMessage decode(String message) throws DecodeException;
}
