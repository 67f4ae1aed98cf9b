package rac.observable;

import java.util.Objects;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.Subscriptions;

/**
 * Completes immediately.
 *
 * @param <T> the value type
 */
final class ObservableEmpty<T> extends Observable<T> {

    private static final ObservableEmpty<Object> INSTANCE = new ObservableEmpty<>(Object.class);

    final Class<?> type;

    ObservableEmpty(Class<?> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @SuppressWarnings("unchecked")
    static <T> Observable<T> instance() {
        return (Observable<T>) INSTANCE;
    }

    @Override
    public Class<?> type() {
        return type;
    }

    @Override
    protected Subscription onSubscribe(Actor<? super T> actor) {
        actor.onComplete();
        return Subscriptions.empty();
    }
}
