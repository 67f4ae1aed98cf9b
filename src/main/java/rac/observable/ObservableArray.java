package rac.observable;

import java.util.Objects;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.BooleanSubscription;

/**
 * Emits the elements of an array, in order, then completes. Every
 * subscription traverses the array anew.
 *
 * @param <T> the value type
 */
final class ObservableArray<T> extends Observable<T> {

    final Class<?> type;

    final T[] array;

    ObservableArray(Class<?> type, T[] array) {
        this.type = Objects.requireNonNull(type, "type");
        this.array = Objects.requireNonNull(array, "array");
    }

    @Override
    public Class<?> type() {
        return type;
    }

    @Override
    protected Subscription onSubscribe(Actor<? super T> actor) {
        BooleanSubscription bs = new BooleanSubscription();
        for (T t : array) {
            if (bs.isDisposed() || isDisposed(actor)) {
                return bs;
            }
            if (t == null) {
                actor.onError(new NullPointerException("The " + type.getSimpleName() + " array contains a null element"));
                return bs;
            }
            actor.onNext(t);
        }
        if (!bs.isDisposed() && !isDisposed(actor)) {
            actor.onComplete();
        }
        return bs;
    }
}
