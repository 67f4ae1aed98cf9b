package rac.actor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import rac.flow.Actor;

/**
 * An actor that keeps every received value, and the terminal event, for later
 * inspection.
 *
 * @param <T> the value type
 */
public final class KeepActor<T> implements Actor<T> {

    final Class<?> type;

    final List<T> values;

    volatile Throwable error;

    volatile boolean completed;

    public KeepActor(Class<?> type) {
        this.type = Objects.requireNonNull(type, "type");
        this.values = new ArrayList<>();
    }

    @Override
    public Class<?> type() {
        return type;
    }

    @Override
    public void onNext(T t) {
        synchronized (values) {
            values.add(t);
        }
    }

    @Override
    public void onError(Throwable e) {
        error = e;
    }

    @Override
    public void onComplete() {
        completed = true;
    }

    /**
     * @return a snapshot of the values received so far
     */
    public List<T> values() {
        synchronized (values) {
            return new ArrayList<>(values);
        }
    }

    public Throwable error() {
        return error;
    }

    public boolean isCompleted() {
        return completed;
    }

    public boolean isTerminated() {
        return completed || error != null;
    }
}
