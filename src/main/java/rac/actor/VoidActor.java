package rac.actor;

import java.util.Objects;

import rac.flow.Actor;

/**
 * An actor that ignores every event.
 *
 * @param <T> the value type
 */
public final class VoidActor<T> implements Actor<T> {

    final Class<?> type;

    public VoidActor(Class<?> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public Class<?> type() {
        return type;
    }

    @Override
    public void onNext(T t) {
        // ignored
    }

    @Override
    public void onError(Throwable e) {
        // ignored
    }

    @Override
    public void onComplete() {
        // ignored
    }
}
