package rac.operator;

import java.util.Objects;
import java.util.function.Function;

import rac.flow.Actor;
import rac.observable.Observable;
import rac.proxy.ActorProxy;
import rac.proxy.ProxyActor;
import rac.proxy.ProxyObservable;

/**
 * Maps the values of the source one-on-one via a mapper function.
 *
 * @param <T> the source value type
 * @param <R> the result value type
 */
final class OperatorMap<T, R> implements Operator<T, R>, ActorProxy<T, R> {

    final Class<?> type;

    final Function<? super T, ? extends R> mapper;

    OperatorMap(Class<?> type, Function<? super T, ? extends R> mapper) {
        this.type = Objects.requireNonNull(type, "type");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Observable<R> apply(Observable<T> source) {
        return ProxyObservable.ofActor(source, this);
    }

    @Override
    public Actor<? super T> proxyActor(Actor<? super R> downstream) {
        return new MapActor<>(downstream, mapper);
    }

    @Override
    public Class<?> outputType(Class<?> inputType) {
        return type;
    }

    static final class MapActor<T, R> extends ProxyActor<T, R> {
        final Function<? super T, ? extends R> mapper;

        MapActor(Actor<? super R> actual, Function<? super T, ? extends R> mapper) {
            super(actual);
            this.mapper = mapper;
        }

        @Override
        public void onNext(T t) {
            if (isDropped(t)) {
                return;
            }

            R v;

            try {
                v = mapper.apply(t);
            } catch (Throwable e) {
                fail(e);
                return;
            }

            if (v == null) {
                fail(new NullPointerException("The mapper returned a null value."));
                return;
            }

            actual.onNext(v);
        }
    }
}
