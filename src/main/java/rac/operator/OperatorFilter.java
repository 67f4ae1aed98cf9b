package rac.operator;

import java.util.Objects;
import java.util.function.Predicate;

import rac.flow.Actor;
import rac.observable.Observable;
import rac.proxy.ActorProxy;
import rac.proxy.ProxyActor;
import rac.proxy.ProxyObservable;

/**
 * Filters out values that make a filter function return false.
 *
 * @param <T> the value type
 */
final class OperatorFilter<T> implements Operator<T, T>, ActorProxy<T, T> {

    final Predicate<? super T> predicate;

    OperatorFilter(Predicate<? super T> predicate) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public Observable<T> apply(Observable<T> source) {
        return ProxyObservable.ofActor(source, this);
    }

    @Override
    public Actor<? super T> proxyActor(Actor<? super T> downstream) {
        return new FilterActor<>(downstream, predicate);
    }

    @Override
    public Class<?> outputType(Class<?> inputType) {
        return inputType;
    }

    static final class FilterActor<T> extends ProxyActor<T, T> {
        final Predicate<? super T> predicate;

        FilterActor(Actor<? super T> actual, Predicate<? super T> predicate) {
            super(actual);
            this.predicate = predicate;
        }

        @Override
        public void onNext(T t) {
            if (isDropped(t)) {
                return;
            }

            boolean b;

            try {
                b = predicate.test(t);
            } catch (Throwable e) {
                fail(e);
                return;
            }
            if (b) {
                actual.onNext(t);
            }
        }
    }
}
