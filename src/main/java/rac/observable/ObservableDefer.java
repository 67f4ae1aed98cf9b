package rac.observable;

import java.util.Objects;
import java.util.function.Supplier;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.Subscriptions;
import rac.util.ExceptionHelper;

/**
 * Asks a supplier for the Observable to subscribe to, for each actor.
 *
 * @param <T> the value type
 */
final class ObservableDefer<T> extends Observable<T> {

    final Supplier<? extends Observable<? extends T>> supplier;

    ObservableDefer(Supplier<? extends Observable<? extends T>> supplier) {
        this.supplier = Objects.requireNonNull(supplier, "supplier");
    }

    @Override
    protected Subscription onSubscribe(Actor<? super T> actor) {
        Observable<? extends T> p;

        try {
            p = supplier.get();
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            actor.onError(e);
            return Subscriptions.empty();
        }

        if (p == null) {
            actor.onError(new NullPointerException("The supplier returned a null Observable"));
            return Subscriptions.empty();
        }

        return p.subscribe(actor);
    }
}
