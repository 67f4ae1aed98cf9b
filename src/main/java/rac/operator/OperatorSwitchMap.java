package rac.operator;

import java.util.Objects;
import java.util.function.Function;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.observable.Observable;
import rac.observable.ObservableSource;
import rac.proxy.ProxyActor;
import rac.proxy.ProxyObservable;
import rac.proxy.SourceProxy;
import rac.subscription.DeferredSubscription;
import rac.util.ExceptionHelper;

/**
 * Maps each value of the source into an inner Observable and relays the
 * values of the most recent inner only: a new source value disposes the
 * previous inner before subscribing the next one.
 * <p>
 * Completes once the source completed and the active inner, if any, completed.
 *
 * @param <T> the source value type
 * @param <R> the inner value type
 */
final class OperatorSwitchMap<T, R> implements Operator<T, R>, SourceProxy<T, R> {

    final Class<?> type;

    final Function<? super T, ? extends Observable<? extends R>> mapper;

    OperatorSwitchMap(Class<?> type, Function<? super T, ? extends Observable<? extends R>> mapper) {
        this.type = Objects.requireNonNull(type, "type");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Observable<R> apply(Observable<T> source) {
        return ProxyObservable.ofSource(source, this);
    }

    @Override
    public Observable<R> proxySource(Observable<? extends T> source) {
        return new SwitchMapObservable<>(source, mapper, type);
    }

    @Override
    public Class<?> outputType(Class<?> inputType) {
        return type;
    }

    static final class SwitchMapObservable<T, R> extends ObservableSource<T, R> {
        final Function<? super T, ? extends Observable<? extends R>> mapper;

        final Class<?> type;

        SwitchMapObservable(Observable<? extends T> source, Function<? super T, ? extends Observable<? extends R>> mapper,
                Class<?> type) {
            super(source);
            this.mapper = mapper;
            this.type = type;
        }

        @Override
        public Class<?> type() {
            return type;
        }

        @Override
        protected Subscription onSubscribe(Actor<? super R> actor) {
            SwitchMapActor<T, R> parent = new SwitchMapActor<>(actor, mapper);
            parent.onUpstream(source.subscribe(parent));
            return parent;
        }
    }

    static final class SwitchMapActor<T, R> extends ProxyActor<T, R> {
        final Function<? super T, ? extends Observable<? extends R>> mapper;

        SwitchInner<R> active;

        long index;

        boolean outerDone;

        SwitchMapActor(Actor<? super R> actual, Function<? super T, ? extends Observable<? extends R>> mapper) {
            super(actual);
            this.mapper = mapper;
        }

        @Override
        public void onNext(T t) {
            Observable<? extends R> p;
            SwitchInner<R> inner;
            SwitchInner<R> previous;
            synchronized (this) {
                if (isDropped(t)) {
                    return;
                }

                try {
                    p = mapper.apply(t);
                } catch (Throwable e) {
                    ExceptionHelper.throwIfFatal(e);
                    terminate(e);
                    return;
                }

                if (p == null) {
                    terminate(new NullPointerException("The mapper returned a null Observable"));
                    return;
                }

                inner = new SwitchInner<>(this, ++index);
                previous = active;
                active = inner;
            }

            if (previous != null) {
                previous.unsubscribe();
            }
            inner.set(p.subscribe(inner));
        }

        @Override
        public synchronized void onError(Throwable e) {
            if (cancelled) {
                return;
            }
            if (done) {
                super.onError(e);
                return;
            }
            terminate(e);
        }

        @Override
        public synchronized void onComplete() {
            if (cancelled || done) {
                return;
            }
            outerDone = true;
            if (active == null) {
                done = true;
                actual.onComplete();
            }
        }

        synchronized void innerNext(SwitchInner<R> inner, R r) {
            if (active == inner && !cancelled && !done) {
                actual.onNext(r);
            }
        }

        synchronized void innerError(SwitchInner<R> inner, Throwable e) {
            if (active == inner && !cancelled && !done) {
                terminate(e);
            }
        }

        synchronized void innerComplete(SwitchInner<R> inner) {
            if (active != inner) {
                return;
            }
            active = null;
            if (!cancelled && !done && outerDone) {
                done = true;
                actual.onComplete();
            }
        }

        void terminate(Throwable e) {
            done = true;
            SwitchInner<R> a = active;
            active = null;
            if (a != null) {
                a.unsubscribe();
            }
            disposeUpstream();
            actual.onError(e);
        }

        @Override
        public void unsubscribe() {
            super.unsubscribe();
            SwitchInner<R> a;
            synchronized (this) {
                a = active;
                active = null;
            }
            if (a != null) {
                a.unsubscribe();
            }
        }
    }

    static final class SwitchInner<R> extends DeferredSubscription implements Actor<R> {
        final SwitchMapActor<?, R> parent;

        final long index;

        SwitchInner(SwitchMapActor<?, R> parent, long index) {
            this.parent = parent;
            this.index = index;
        }

        @Override
        public void onNext(R r) {
            parent.innerNext(this, r);
        }

        @Override
        public void onError(Throwable e) {
            parent.innerError(this, e);
        }

        @Override
        public void onComplete() {
            parent.innerComplete(this);
        }

        @Override
        public String toString() {
            return "SwitchInner#" + index;
        }
    }
}
