package rac.observable;

import java.util.Objects;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.Subscriptions;

/**
 * Signals the same error to every actor.
 *
 * @param <T> the value type
 */
final class ObservableError<T> extends Observable<T> {

    final Class<?> type;

    final Throwable error;

    ObservableError(Class<?> type, Throwable error) {
        this.type = Objects.requireNonNull(type, "type");
        this.error = Objects.requireNonNull(error, "error");
    }

    @Override
    public Class<?> type() {
        return type;
    }

    @Override
    protected Subscription onSubscribe(Actor<? super T> actor) {
        actor.onError(error);
        return Subscriptions.empty();
    }
}
