package io.trading.marketstream.channel;

/**
 * What a full data channel does with a new item.
 */
public enum OverflowPolicy {
    /** Keep the pending items, drop the incoming one. */
    DROP_NEWEST,
    /** Evict the oldest pending item to make room for the incoming one. */
    DROP_OLDEST
}
