package io.trading.marketstream.book;

import io.trading.marketstream.parser.model.DepthDiff;
import io.trading.marketstream.parser.model.OrderBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one order book replica consistent with the exchange using a snapshot plus diffs.
 *
 * <p>A diff is applicable when {@code firstUpdateId <= lastUpdateId + 1 <= finalUpdateId}. Diffs
 * below the watermark are stale and dropped. A diff that starts beyond {@code lastUpdateId + 1}
 * is a gap: the replica is invalidated, buffered diffs are discarded and the gap is reported
 * exactly once. Nothing is applied again until a new snapshot arrives.
 *
 * <p>Updates are made by a single thread, the owning connection's worker. Readers on any thread
 * call {@link #current()}, which returns the last fully applied immutable replica.
 */
public final class OrderBookEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrderBookEngine.class);

    /**
     * Synchronization state of the replica.
     */
    public enum State {
        AWAITING_SNAPSHOT,
        SYNCED,
        INVALIDATED
    }

    private final String name;
    private final int maxBufferedDiffs;
    private final Deque<DepthDiff> buffered = new ArrayDeque<>();
    private final AtomicReference<OrderBookReplica> published = new AtomicReference<>();

    private volatile State state = State.AWAITING_SNAPSHOT;
    private OrderBookReplica replica;
    private boolean snapshotRequested = false;
    private long gapCount = 0;

    public OrderBookEngine(String name, int maxBufferedDiffs) {
        if (maxBufferedDiffs < 1) {
            throw new IllegalArgumentException("maxBufferedDiffs must be positive");
        }
        this.name = name;
        this.maxBufferedDiffs = maxBufferedDiffs;
    }

    /**
     * Handles an incremental update.
     */
    public DiffOutcome onDiff(DepthDiff diff) {
        switch (state) {
            case INVALIDATED:
                return DiffOutcome.IGNORED;
            case AWAITING_SNAPSHOT:
                if (buffered.size() == maxBufferedDiffs) {
                    buffered.pollFirst();
                }
                buffered.addLast(diff);
                return DiffOutcome.BUFFERED;
            default:
                return applyInSync(diff);
        }
    }

    /**
     * Replaces the replica with a snapshot and replays buffered diffs on top of it.
     * Accepted in any state: exchanges re-send snapshots after a service restart.
     *
     * @return APPLIED when the replica is synced, GAP when buffered diffs do not connect to the snapshot
     */
    public DiffOutcome onSnapshot(OrderBook snapshot) {
        replica = OrderBookReplica.fromSnapshot(snapshot);
        state = State.SYNCED;
        snapshotRequested = false;

        while (!buffered.isEmpty()) {
            DiffOutcome outcome = applyInSync(buffered.pollFirst());
            if (outcome == DiffOutcome.GAP) {
                return outcome;
            }
        }
        published.set(replica);
        LOGGER.debug("{}: Snapshot applied at lastUpdateId={}", name, replica.getLastUpdateId());
        return DiffOutcome.APPLIED;
    }

    private DiffOutcome applyInSync(DepthDiff diff) {
        long next = replica.getLastUpdateId() + 1;
        if (diff.finalUpdateId() < next) {
            return DiffOutcome.STALE;
        }
        if (diff.firstUpdateId() > next) {
            LOGGER.warn("{}: Sequence gap, expected update {} but diff covers [{}, {}]",
                name, next, diff.firstUpdateId(), diff.finalUpdateId());
            gapCount++;
            invalidate();
            return DiffOutcome.GAP;
        }
        replica = replica.apply(diff);
        published.set(replica);
        return DiffOutcome.APPLIED;
    }

    /**
     * Drops the replica and any buffered diffs. Diffs are ignored until {@link #reset()}.
     */
    public void invalidate() {
        state = State.INVALIDATED;
        replica = null;
        buffered.clear();
        snapshotRequested = false;
        published.set(null);
    }

    /**
     * Starts a new synchronization round: diffs are buffered until the next snapshot.
     */
    public void reset() {
        invalidate();
        state = State.AWAITING_SNAPSHOT;
    }

    /**
     * Marks that a snapshot fetch is in flight.
     *
     * @return true if no fetch was in flight for this round
     */
    public boolean markSnapshotRequested() {
        if (state != State.AWAITING_SNAPSHOT || snapshotRequested) {
            return false;
        }
        snapshotRequested = true;
        return true;
    }

    /**
     * Returns the last fully applied replica, or null while not synced.
     */
    public OrderBookReplica current() {
        return published.get();
    }

    public State getState() {
        return state;
    }

    public boolean isSynced() {
        return state == State.SYNCED;
    }

    public int bufferedCount() {
        return buffered.size();
    }

    public long getGapCount() {
        return gapCount;
    }

    public String getName() {
        return name;
    }
}
