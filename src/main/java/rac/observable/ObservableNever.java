package rac.observable;

import java.util.Objects;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.BooleanSubscription;

/**
 * Never signals anything.
 *
 * @param <T> the value type
 */
final class ObservableNever<T> extends Observable<T> {

    private static final ObservableNever<Object> INSTANCE = new ObservableNever<>(Object.class);

    final Class<?> type;

    ObservableNever(Class<?> type) {
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
        return new BooleanSubscription();
    }
}
