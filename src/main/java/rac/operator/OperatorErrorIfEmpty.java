package rac.operator;

import java.util.Objects;
import java.util.function.Supplier;

import rac.flow.Actor;
import rac.observable.Observable;
import rac.proxy.ActorProxy;
import rac.proxy.ProxyActor;
import rac.proxy.ProxyObservable;
import rac.util.ExceptionHelper;

/**
 * Signals an error, created by a supplier, if the source completes without
 * any value.
 *
 * @param <T> the value type
 */
final class OperatorErrorIfEmpty<T> implements Operator<T, T>, ActorProxy<T, T> {

    final Supplier<? extends Throwable> errorSupplier;

    OperatorErrorIfEmpty(Supplier<? extends Throwable> errorSupplier) {
        this.errorSupplier = Objects.requireNonNull(errorSupplier, "errorSupplier");
    }

    @Override
    public Observable<T> apply(Observable<T> source) {
        return ProxyObservable.ofActor(source, this);
    }

    @Override
    public Actor<? super T> proxyActor(Actor<? super T> downstream) {
        return new ErrorIfEmptyActor<>(downstream, errorSupplier);
    }

    @Override
    public Class<?> outputType(Class<?> inputType) {
        return inputType;
    }

    static final class ErrorIfEmptyActor<T> extends ProxyActor<T, T> {
        final Supplier<? extends Throwable> errorSupplier;

        boolean hasValue;

        ErrorIfEmptyActor(Actor<? super T> actual, Supplier<? extends Throwable> errorSupplier) {
            super(actual);
            this.errorSupplier = errorSupplier;
        }

        @Override
        public void onNext(T t) {
            if (isDropped(t)) {
                return;
            }
            hasValue = true;
            actual.onNext(t);
        }

        @Override
        public void onComplete() {
            if (cancelled || done) {
                return;
            }
            if (hasValue) {
                super.onComplete();
                return;
            }
            Throwable e;
            try {
                e = errorSupplier.get();
            } catch (Throwable ex) {
                ExceptionHelper.throwIfFatal(ex);
                e = ex;
            }
            if (e == null) {
                e = new NullPointerException("The error supplier returned a null Throwable");
            }
            super.onError(e);
        }
    }
}
