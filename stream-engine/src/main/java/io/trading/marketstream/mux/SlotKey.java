package io.trading.marketstream.mux;

import io.trading.marketstream.parser.model.FeedClass;

import java.net.URI;

/**
 * Connections are shared between subscriptions with the same endpoint and feed class.
 */
record SlotKey(URI endpoint, FeedClass feedClass) {

    @Override
    public String toString() {
        return feedClass.name().toLowerCase() + "@" + endpoint.getHost();
    }
}
