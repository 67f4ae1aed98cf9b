package rac.subject;

import java.util.Collections;
import java.util.List;

/**
 * A subject remembering the latest value: an actor joining after a value was
 * emitted receives it first, then the live values. Once terminated, joining
 * actors receive only the terminal event.
 *
 * @param <T> the value type
 */
public final class RecentSubject<T> extends Subject<T> {

    T latest;

    public RecentSubject() {
        this(Object.class);
    }

    public RecentSubject(Class<?> type) {
        super(type);
    }

    @Override
    public Subject<T> similar() {
        return new RecentSubject<>(type);
    }

    @Override
    synchronized void cache(T t) {
        latest = t;
    }

    @Override
    synchronized List<T> replay() {
        T v = latest;
        if (v == null || isTerminated()) {
            return Collections.emptyList();
        }
        return Collections.singletonList(v);
    }

    /**
     * @return the latest value or null if none was emitted yet
     */
    public synchronized T getValue() {
        return latest;
    }
}
