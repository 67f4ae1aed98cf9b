package rac.subject;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

import rac.util.RacConfig;

/**
 * A subject remembering the last {@code capacity} values: an actor joining
 * later receives that window, in order, then the live values, or the
 * terminal event once the subject terminated.
 *
 * @param <T> the value type
 */
public final class ReplaySubject<T> extends Subject<T> {

    final int capacity;

    final ArrayDeque<T> buffer;

    public ReplaySubject() {
        this(Object.class, RacConfig.REPLAY_CAPACITY);
    }

    public ReplaySubject(int capacity) {
        this(Object.class, capacity);
    }

    public ReplaySubject(Class<?> type, int capacity) {
        super(type);
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity > 0 required but it was " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 16));
    }

    @Override
    public Subject<T> similar() {
        return new ReplaySubject<>(type, capacity);
    }

    @Override
    synchronized void cache(T t) {
        if (buffer.size() == capacity) {
            buffer.poll();
        }
        buffer.offer(t);
    }

    @Override
    synchronized List<T> replay() {
        return new ArrayList<>(buffer);
    }

    public int capacity() {
        return capacity;
    }
}
