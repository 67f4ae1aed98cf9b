package rac.operator;

import java.util.Objects;
import java.util.function.Consumer;

import rac.flow.Actor;
import rac.observable.Observable;
import rac.proxy.ActorProxy;
import rac.proxy.ProxyActor;
import rac.proxy.ProxyObservable;
import rac.util.ExceptionHelper;
import rac.util.UnsignalledExceptions;

/**
 * Peeks at the events of the source before forwarding them unchanged.
 * <p>
 * A failing next or complete callback turns into an error; a failing error
 * callback is reported as dropped next to the original error.
 *
 * @param <T> the value type
 */
final class OperatorTap<T> implements Operator<T, T>, ActorProxy<T, T> {

    final Consumer<? super T> onNextCall;

    final Consumer<? super Throwable> onErrorCall;

    final Runnable onCompleteCall;

    OperatorTap(Consumer<? super T> onNextCall, Consumer<? super Throwable> onErrorCall, Runnable onCompleteCall) {
        this.onNextCall = onNextCall;
        this.onErrorCall = onErrorCall;
        this.onCompleteCall = onCompleteCall;
        if (onNextCall == null && onErrorCall == null && onCompleteCall == null) {
            throw new NullPointerException("At least one of the callbacks must be non-null");
        }
    }

    @Override
    public Observable<T> apply(Observable<T> source) {
        Objects.requireNonNull(source, "source");
        return ProxyObservable.ofActor(source, this);
    }

    @Override
    public Actor<? super T> proxyActor(Actor<? super T> downstream) {
        return new TapActor<>(downstream, this);
    }

    @Override
    public Class<?> outputType(Class<?> inputType) {
        return inputType;
    }

    static final class TapActor<T> extends ProxyActor<T, T> {
        final OperatorTap<T> parent;

        TapActor(Actor<? super T> actual, OperatorTap<T> parent) {
            super(actual);
            this.parent = parent;
        }

        @Override
        public void onNext(T t) {
            if (isDropped(t)) {
                return;
            }
            if (parent.onNextCall != null) {
                try {
                    parent.onNextCall.accept(t);
                } catch (Throwable e) {
                    fail(e);
                    return;
                }
            }
            actual.onNext(t);
        }

        @Override
        public void onError(Throwable e) {
            if (cancelled || done) {
                super.onError(e);
                return;
            }
            if (parent.onErrorCall != null) {
                try {
                    parent.onErrorCall.accept(e);
                } catch (Throwable ex) {
                    ExceptionHelper.throwIfFatal(ex);
                    UnsignalledExceptions.onErrorDropped(ex, e);
                }
            }
            super.onError(e);
        }

        @Override
        public void onComplete() {
            if (cancelled || done) {
                return;
            }
            if (parent.onCompleteCall != null) {
                try {
                    parent.onCompleteCall.run();
                } catch (Throwable e) {
                    fail(e);
                    return;
                }
            }
            super.onComplete();
        }
    }
}
