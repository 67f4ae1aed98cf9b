package rac.operator;

import java.util.Objects;
import java.util.function.BiFunction;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.observable.Observable;
import rac.proxy.ProxyActor;
import rac.proxy.ProxyObservable;
import rac.proxy.SourceProxy;
import rac.subscription.DeferredSubscription;
import rac.util.ExceptionHelper;

/**
 * Switches to a fallback Observable when the source signals an error. The
 * handler receives the error and the source, so it may resubscribe to it.
 * <p>
 * Errors of the fallback are forwarded as they are.
 *
 * @param <T> the value type
 */
final class OperatorCatchError<T> implements Operator<T, T>, SourceProxy<T, T> {

    final BiFunction<? super Throwable, ? super Observable<T>, ? extends Observable<? extends T>> handler;

    OperatorCatchError(BiFunction<? super Throwable, ? super Observable<T>, ? extends Observable<? extends T>> handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public Observable<T> apply(Observable<T> source) {
        return ProxyObservable.ofSource(source, this);
    }

    @Override
    public Observable<T> proxySource(Observable<? extends T> source) {
        return new CatchErrorObservable<>(source, handler);
    }

    @Override
    public Class<?> outputType(Class<?> inputType) {
        return inputType;
    }

    static final class CatchErrorObservable<T> extends Observable<T> {
        final Observable<? extends T> source;

        final BiFunction<? super Throwable, ? super Observable<T>, ? extends Observable<? extends T>> handler;

        CatchErrorObservable(Observable<? extends T> source,
                BiFunction<? super Throwable, ? super Observable<T>, ? extends Observable<? extends T>> handler) {
            this.source = source;
            this.handler = handler;
        }

        @Override
        public Class<?> type() {
            return source.type();
        }

        @SuppressWarnings("unchecked")
        @Override
        protected Subscription onSubscribe(Actor<? super T> actor) {
            CatchErrorActor<T> parent = new CatchErrorActor<>(actor, (Observable<T>) source, handler);
            parent.onUpstream(source.subscribe(parent));
            return parent;
        }
    }

    static final class CatchErrorActor<T> extends ProxyActor<T, T> {
        final Observable<T> source;

        final BiFunction<? super Throwable, ? super Observable<T>, ? extends Observable<? extends T>> handler;

        final DeferredSubscription fallback;

        CatchErrorActor(Actor<? super T> actual, Observable<T> source,
                BiFunction<? super Throwable, ? super Observable<T>, ? extends Observable<? extends T>> handler) {
            super(actual);
            this.source = source;
            this.handler = handler;
            this.fallback = new DeferredSubscription();
        }

        @Override
        public void onNext(T t) {
            if (isDropped(t)) {
                return;
            }
            actual.onNext(t);
        }

        @SuppressWarnings("unchecked")
        @Override
        public void onError(Throwable e) {
            if (cancelled || done) {
                super.onError(e);
                return;
            }
            done = true;

            Observable<T> next;
            try {
                next = (Observable<T>) handler.apply(e, source);
            } catch (Throwable ex) {
                ExceptionHelper.throwIfFatal(ex);
                actual.onError(ex);
                return;
            }
            if (next == null) {
                actual.onError(new NullPointerException("The error handler returned a null Observable"));
                return;
            }

            fallback.set(next.subscribe(new FallbackActor<>(actual, this)));
        }

        @Override
        public void unsubscribe() {
            super.unsubscribe();
            fallback.unsubscribe();
        }
    }

    /** Forwards the events of the fallback unless the subscription was disposed. */
    static final class FallbackActor<T> implements Actor<T>, Subscription {
        final Actor<? super T> actual;

        final CatchErrorActor<?> parent;

        FallbackActor(Actor<? super T> actual, CatchErrorActor<?> parent) {
            this.actual = actual;
            this.parent = parent;
        }

        @Override
        public void onNext(T t) {
            if (!parent.isDisposed()) {
                actual.onNext(t);
            }
        }

        @Override
        public void onError(Throwable e) {
            if (!parent.isDisposed()) {
                actual.onError(e);
            }
        }

        @Override
        public void onComplete() {
            if (!parent.isDisposed()) {
                actual.onComplete();
            }
        }

        @Override
        public void unsubscribe() {
            parent.unsubscribe();
        }

        @Override
        public boolean isDisposed() {
            return parent.isDisposed();
        }
    }
}
