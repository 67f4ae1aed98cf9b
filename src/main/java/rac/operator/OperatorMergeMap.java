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
import rac.util.InnerTracker;

/**
 * Maps each value of the source into an inner Observable, subscribes to it
 * right away and merges the values of all active inners.
 * <p>
 * Completes once the source and every inner completed; the first error, of
 * the source or of an inner, disposes everything else and is forwarded once.
 *
 * @param <T> the source value type
 * @param <R> the inner value type
 */
final class OperatorMergeMap<T, R> implements Operator<T, R>, SourceProxy<T, R> {

    final Class<?> type;

    final Function<? super T, ? extends Observable<? extends R>> mapper;

    OperatorMergeMap(Class<?> type, Function<? super T, ? extends Observable<? extends R>> mapper) {
        this.type = Objects.requireNonNull(type, "type");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public Observable<R> apply(Observable<T> source) {
        return ProxyObservable.ofSource(source, this);
    }

    @Override
    public Observable<R> proxySource(Observable<? extends T> source) {
        return new MergeMapObservable<>(source, mapper, type);
    }

    @Override
    public Class<?> outputType(Class<?> inputType) {
        return type;
    }

    static final class MergeMapObservable<T, R> extends ObservableSource<T, R> {
        final Function<? super T, ? extends Observable<? extends R>> mapper;

        final Class<?> type;

        MergeMapObservable(Observable<? extends T> source, Function<? super T, ? extends Observable<? extends R>> mapper,
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
            MergeMapActor<T, R> parent = new MergeMapActor<>(actor, mapper);
            parent.onUpstream(source.subscribe(parent));
            return parent;
        }
    }

    static final class MergeMapActor<T, R> extends ProxyActor<T, R> {
        final Function<? super T, ? extends Observable<? extends R>> mapper;

        final InnerTracker<MergeInner<R>> inners;

        boolean outerDone;

        MergeMapActor(Actor<? super R> actual, Function<? super T, ? extends Observable<? extends R>> mapper) {
            super(actual);
            this.mapper = mapper;
            this.inners = new InnerTracker<MergeInner<R>>() {
                @Override
                protected void unsubscribeEntry(MergeInner<R> entry) {
                    entry.unsubscribe();
                }

                @Override
                protected void setIndex(MergeInner<R> entry, int index) {
                    entry.index = index;
                }
            };
        }

        @Override
        public void onNext(T t) {
            Observable<? extends R> p;
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
            }

            MergeInner<R> inner = new MergeInner<>(this);
            if (inners.add(inner)) {
                inner.set(p.subscribe(inner));
            }
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
            if (inners.isEmpty()) {
                done = true;
                actual.onComplete();
            }
        }

        synchronized void innerNext(R r) {
            if (!cancelled && !done) {
                actual.onNext(r);
            }
        }

        synchronized void innerError(Throwable e) {
            if (!cancelled && !done) {
                terminate(e);
            }
        }

        synchronized void innerComplete(MergeInner<R> inner) {
            inners.remove(inner.index);
            if (!cancelled && !done && outerDone && inners.isEmpty()) {
                done = true;
                actual.onComplete();
            }
        }

        void terminate(Throwable e) {
            done = true;
            inners.unsubscribe();
            disposeUpstream();
            actual.onError(e);
        }

        @Override
        public void unsubscribe() {
            super.unsubscribe();
            inners.unsubscribe();
        }
    }

    static final class MergeInner<R> extends DeferredSubscription implements Actor<R> {
        final MergeMapActor<?, R> parent;

        int index;

        boolean done;

        MergeInner(MergeMapActor<?, R> parent) {
            this.parent = parent;
        }

        @Override
        public void onNext(R r) {
            if (!done) {
                parent.innerNext(r);
            }
        }

        @Override
        public void onError(Throwable e) {
            if (!done) {
                done = true;
                parent.innerError(e);
            }
        }

        @Override
        public void onComplete() {
            if (!done) {
                done = true;
                parent.innerComplete(this);
            }
        }
    }
}
