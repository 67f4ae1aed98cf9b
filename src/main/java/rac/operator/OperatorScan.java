package rac.operator;

import java.util.Objects;
import java.util.function.BiFunction;

import rac.flow.Actor;
import rac.observable.Observable;
import rac.proxy.ActorProxy;
import rac.proxy.ProxyActor;
import rac.proxy.ProxyObservable;

/**
 * Aggregates the source values with the help of an accumulator function and
 * emits the intermediate results. The seed is not emitted.
 *
 * @param <T> the source value type
 * @param <R> the aggregate type
 */
final class OperatorScan<T, R> implements Operator<T, R>, ActorProxy<T, R> {

    final R seed;

    final BiFunction<R, ? super T, R> accumulator;

    OperatorScan(R seed, BiFunction<R, ? super T, R> accumulator) {
        this.seed = Objects.requireNonNull(seed, "seed");
        this.accumulator = Objects.requireNonNull(accumulator, "accumulator");
    }

    @Override
    public Observable<R> apply(Observable<T> source) {
        return ProxyObservable.ofActor(source, this);
    }

    @Override
    public Actor<? super T> proxyActor(Actor<? super R> downstream) {
        return new ScanActor<>(downstream, accumulator, seed);
    }

    static final class ScanActor<T, R> extends ProxyActor<T, R> {
        final BiFunction<R, ? super T, R> accumulator;

        R value;

        ScanActor(Actor<? super R> actual, BiFunction<R, ? super T, R> accumulator, R value) {
            super(actual);
            this.accumulator = accumulator;
            this.value = value;
        }

        @Override
        public void onNext(T t) {
            if (isDropped(t)) {
                return;
            }

            R r;

            try {
                r = accumulator.apply(value, t);
            } catch (Throwable e) {
                fail(e);
                return;
            }

            if (r == null) {
                fail(new NullPointerException("The accumulator returned a null value"));
                return;
            }

            value = r;
            actual.onNext(r);
        }

        @Override
        public void onError(Throwable e) {
            value = null;
            super.onError(e);
        }

        @Override
        public void onComplete() {
            value = null;
            super.onComplete();
        }
    }
}
