package rac.observable;

import java.util.Objects;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.Subscriptions;

/**
 * Emits a single value, then completes.
 *
 * @param <T> the value type
 */
final class ObservableJust<T> extends Observable<T> {

    final T value;

    ObservableJust(T value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public Class<?> type() {
        return value.getClass();
    }

    @Override
    protected Subscription onSubscribe(Actor<? super T> actor) {
        actor.onNext(value);
        actor.onComplete();
        return Subscriptions.empty();
    }
}
