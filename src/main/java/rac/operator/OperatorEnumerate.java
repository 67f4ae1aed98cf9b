package rac.operator;

import rac.flow.Actor;
import rac.observable.Observable;
import rac.proxy.ActorProxy;
import rac.proxy.ProxyActor;
import rac.proxy.ProxyObservable;

/**
 * Pairs every value with its 1-based index.
 *
 * @param <T> the value type
 */
final class OperatorEnumerate<T> implements Operator<T, Enumerated<T>>, ActorProxy<T, Enumerated<T>> {

    @Override
    public Observable<Enumerated<T>> apply(Observable<T> source) {
        return ProxyObservable.ofActor(source, this);
    }

    @Override
    public Actor<? super T> proxyActor(Actor<? super Enumerated<T>> downstream) {
        return new EnumerateActor<>(downstream);
    }

    @Override
    public Class<?> outputType(Class<?> inputType) {
        return Enumerated.class;
    }

    static final class EnumerateActor<T> extends ProxyActor<T, Enumerated<T>> {
        long index;

        EnumerateActor(Actor<? super Enumerated<T>> actual) {
            super(actual);
        }

        @Override
        public void onNext(T t) {
            if (isDropped(t)) {
                return;
            }
            actual.onNext(new Enumerated<>(t, ++index));
        }
    }
}
