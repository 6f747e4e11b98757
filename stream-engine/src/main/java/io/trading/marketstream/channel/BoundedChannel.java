package io.trading.marketstream.channel;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, non-blocking-send channel with a single owning sender.
 *
 * The write side is a {@link Sender} that can be claimed exactly once; whoever holds it is the
 * only writer and the only one able to close the channel. Consumers only ever see the
 * {@link ReceiveChannel} view. Sending on, or closing, a closed channel is a contract
 * violation and fails with {@link IllegalStateException}.
 *
 * With capacity 0 the channel behaves like an unbuffered hand-off: an item is accepted only
 * when a receiver is already waiting for it, otherwise it is dropped.
 *
 * @param <T> item type
 */
public final class BoundedChannel<T> implements ReceiveChannel<T> {

    private final String name;
    private final int capacity;
    private final OverflowPolicy overflowPolicy;
    private final ArrayDeque<T> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicBoolean senderClaimed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong(0);

    private int waitingReceivers = 0;
    private boolean closed = false;

    public BoundedChannel(String name, int capacity, OverflowPolicy overflowPolicy) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity cannot be negative");
        }
        if (overflowPolicy == null) {
            throw new IllegalArgumentException("overflowPolicy cannot be null");
        }
        this.name = name;
        this.capacity = capacity;
        this.overflowPolicy = overflowPolicy;
        this.items = new ArrayDeque<>(Math.max(capacity, 1));
    }

    /**
     * Hands out the write side of this channel. Can only be called once.
     *
     * @throws IllegalStateException if the sender was already claimed
     */
    public Sender claimSender() {
        if (!senderClaimed.compareAndSet(false, true)) {
            throw new IllegalStateException(name + ": sender already claimed");
        }
        return new Sender();
    }

    @Override
    public T receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            waitingReceivers++;
            try {
                while (items.isEmpty() && !closed) {
                    notEmpty.await();
                }
            } finally {
                waitingReceivers--;
            }
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            waitingReceivers++;
            try {
                while (items.isEmpty() && !closed && remaining > 0) {
                    remaining = notEmpty.awaitNanos(remaining);
                }
            } finally {
                waitingReceivers--;
            }
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T tryReceive() {
        lock.lock();
        try {
            return items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    public OverflowPolicy overflowPolicy() {
        return overflowPolicy;
    }

    @Override
    public String toString() {
        return "BoundedChannel{" + name + ", capacity=" + capacity + ", policy=" + overflowPolicy + '}';
    }

    /**
     * Write side of a {@link BoundedChannel}. Not shared: exactly one owner sends and closes.
     */
    public final class Sender {

        private Sender() {
        }

        /**
         * Offers an item without blocking, applying the channel's overflow policy when full.
         *
         * @return true if the item is now pending in the channel
         * @throws IllegalStateException if the channel is closed
         */
        public boolean offer(T item) {
            return offer(item, overflowPolicy);
        }

        /**
         * Offers an item, evicting the oldest pending item if the channel is full.
         * Used for items that must not be lost, such as terminal errors.
         *
         * @return true if the item is now pending in the channel
         * @throws IllegalStateException if the channel is closed
         */
        public boolean offerEvicting(T item) {
            return offer(item, OverflowPolicy.DROP_OLDEST);
        }

        private boolean offer(T item, OverflowPolicy policy) {
            if (item == null) {
                throw new IllegalArgumentException("item cannot be null");
            }
            lock.lock();
            try {
                if (closed) {
                    throw new IllegalStateException(name + ": send on closed channel");
                }
                if (capacity == 0) {
                    if (waitingReceivers > items.size()) {
                        items.addLast(item);
                        notEmpty.signal();
                        return true;
                    }
                    dropped.incrementAndGet();
                    return false;
                }
                if (items.size() < capacity) {
                    items.addLast(item);
                    notEmpty.signal();
                    return true;
                }
                dropped.incrementAndGet();
                if (policy == OverflowPolicy.DROP_NEWEST) {
                    return false;
                }
                items.pollFirst();
                items.addLast(item);
                notEmpty.signal();
                return true;
            } finally {
                lock.unlock();
            }
        }

        /**
         * Closes the channel. Pending items stay receivable.
         *
         * @throws IllegalStateException if the channel is already closed
         */
        public void close() {
            lock.lock();
            try {
                if (closed) {
                    throw new IllegalStateException(name + ": channel already closed");
                }
                closed = true;
                notEmpty.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }
}
