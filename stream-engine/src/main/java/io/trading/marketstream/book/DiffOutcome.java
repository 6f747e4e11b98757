package io.trading.marketstream.book;

/**
 * What the consistency engine did with an incoming diff or snapshot.
 */
public enum DiffOutcome {
    /** The replica advanced and a new version was published. */
    APPLIED,
    /** The update was entirely below the watermark and was discarded. */
    STALE,
    /** Updates were missed; the replica is invalidated until a new snapshot is applied. */
    GAP,
    /** No snapshot yet; the diff was held for replay. */
    BUFFERED,
    /** The replica is invalidated; the diff was dropped. */
    IGNORED
}
