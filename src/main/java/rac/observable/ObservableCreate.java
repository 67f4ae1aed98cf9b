package rac.observable;

import java.util.Objects;
import java.util.function.Function;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.DeferredSubscription;
import rac.util.ExceptionHelper;
import rac.util.UnsignalledExceptions;

/**
 * Calls a user function with an emitter for each subscription; the function
 * returns the teardown of that subscription.
 * <p>
 * The emitter enforces the event grammar on behalf of the user code and stops
 * forwarding once the returned handle is disposed.
 *
 * @param <T> the value type
 */
final class ObservableCreate<T> extends Observable<T> {

    final Class<?> type;

    final Function<? super Actor<T>, ? extends Subscription> onSubscribe;

    ObservableCreate(Class<?> type, Function<? super Actor<T>, ? extends Subscription> onSubscribe) {
        this.type = Objects.requireNonNull(type, "type");
        this.onSubscribe = Objects.requireNonNull(onSubscribe, "onSubscribe");
    }

    @Override
    public Class<?> type() {
        return type;
    }

    @Override
    protected Subscription onSubscribe(Actor<? super T> actor) {
        CreateEmitter<T> emitter = new CreateEmitter<>(actor);
        Subscription s;
        try {
            s = onSubscribe.apply(emitter);
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            emitter.onError(e);
            return emitter;
        }
        if (s != null) {
            emitter.set(s);
        }
        return emitter;
    }

    static final class CreateEmitter<T> extends DeferredSubscription implements Actor<T> {
        final Actor<? super T> actual;

        boolean done;

        volatile boolean cancelled;

        CreateEmitter(Actor<? super T> actual) {
            this.actual = actual;
        }

        @Override
        public void onNext(T t) {
            Objects.requireNonNull(t, "t");
            if (cancelled) {
                return;
            }
            if (done) {
                UnsignalledExceptions.onNextDropped(t);
                return;
            }
            actual.onNext(t);
        }

        @Override
        public void onError(Throwable e) {
            Objects.requireNonNull(e, "e");
            if (cancelled) {
                return;
            }
            if (done) {
                UnsignalledExceptions.onErrorDropped(e);
                return;
            }
            done = true;
            actual.onError(e);
        }

        @Override
        public void onComplete() {
            if (cancelled || done) {
                return;
            }
            done = true;
            actual.onComplete();
        }

        @Override
        public void unsubscribe() {
            cancelled = true;
            super.unsubscribe();
        }

        @Override
        public boolean isDisposed() {
            return cancelled;
        }
    }
}
