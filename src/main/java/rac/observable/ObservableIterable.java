package rac.observable;

import java.util.Iterator;
import java.util.Objects;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.BooleanSubscription;
import rac.subscription.Subscriptions;
import rac.util.ExceptionHelper;

/**
 * Emits the contents of an Iterable source. Every subscription asks for a new
 * Iterator.
 *
 * @param <T> the value type
 */
final class ObservableIterable<T> extends Observable<T> {

    final Class<?> type;

    final Iterable<? extends T> iterable;

    ObservableIterable(Class<?> type, Iterable<? extends T> iterable) {
        this.type = Objects.requireNonNull(type, "type");
        this.iterable = Objects.requireNonNull(iterable, "iterable");
    }

    @Override
    public Class<?> type() {
        return type;
    }

    @Override
    protected Subscription onSubscribe(Actor<? super T> actor) {
        Iterator<? extends T> it;

        try {
            it = iterable.iterator();
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            actor.onError(e);
            return Subscriptions.empty();
        }

        if (it == null) {
            actor.onError(new NullPointerException("The iterator is null"));
            return Subscriptions.empty();
        }

        BooleanSubscription bs = new BooleanSubscription();

        for (;;) {
            if (bs.isDisposed() || isDisposed(actor)) {
                return bs;
            }

            boolean b;
            T t;

            try {
                b = it.hasNext();
                t = b ? it.next() : null;
            } catch (Throwable e) {
                ExceptionHelper.throwIfFatal(e);
                actor.onError(e);
                return bs;
            }

            if (!b) {
                actor.onComplete();
                return bs;
            }

            if (t == null) {
                actor.onError(new NullPointerException("The iterator returned a null value"));
                return bs;
            }

            actor.onNext(t);
        }
    }
}
