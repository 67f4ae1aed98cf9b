package rac.util;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A closeable FIFO handing messages from producers to a single consuming worker.
 * <p>
 * With a capacity of one the channel is a hand-off: a producer blocks until the
 * worker polled the previous message. The worker never blocks. Closing the
 * channel discards the pending messages and wakes every blocked producer,
 * which then gets the closed indication instead of a failure.
 *
 * @param <E> the message type
 */
public final class Channel<E> {

    final ArrayDeque<E> queue;

    final int capacity;

    final ReentrantLock lock;

    final Condition notFull;

    boolean closed;

    public Channel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity > 0 required but it was " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>(Math.min(capacity, 16));
        this.lock = new ReentrantLock();
        this.notFull = lock.newCondition();
    }

    /**
     * @param <E> the message type
     * @return a channel that never blocks its producers
     */
    public static <E> Channel<E> unbounded() {
        return new Channel<>(Integer.MAX_VALUE);
    }

    /**
     * @param <E> the message type
     * @return a channel with exactly one slot
     */
    public static <E> Channel<E> handOff() {
        return new Channel<>(1);
    }

    /**
     * Appends a message, waiting for a free slot if the channel is full.
     *
     * @param e the message, not null
     * @return false if the channel was closed before or while waiting
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean put(E e) throws InterruptedException {
        final ReentrantLock lock = this.lock;
        lock.lockInterruptibly();
        try {
            while (!closed && queue.size() == capacity) {
                notFull.await();
            }
            if (closed) {
                return false;
            }
            queue.offer(e);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest message without waiting.
     *
     * @return the message or null if the channel is empty or closed
     */
    public E poll() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            if (closed) {
                return null;
            }
            E e = queue.poll();
            if (e != null) {
                notFull.signal();
            }
            return e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel, discarding the pending messages. Idempotent.
     */
    public void close() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            queue.clear();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        final ReentrantLock lock = this.lock;
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }
}
