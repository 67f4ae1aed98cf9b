package rac.observable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.DeferredSubscription;
import rac.subscription.Subscriptions;
import rac.util.ExceptionHelper;

/**
 * Combines the latest values of a fixed list of sources.
 * <p>
 * Every slot tracks whether it completed, whether it ever had a value and
 * whether it was updated since the last emission. A combination is emitted
 * when every slot was updated, or completed with a value, and not every slot
 * completed; the updated flags are then reset to the completed flags. The
 * result completes when all slots completed or when a slot completed without
 * ever having a value. The first error disposes the other slots.
 *
 * @param <T> the value type of the sources
 * @param <R> the combined type
 */
final class ObservableCollectLatest<T, R> extends Observable<R> {

    final List<? extends Observable<? extends T>> sources;

    final Function<? super List<T>, ? extends R> mapper;

    final Class<?> type;

    ObservableCollectLatest(List<? extends Observable<? extends T>> sources, Function<? super List<T>, ? extends R> mapper,
            Class<?> type) {
        this.sources = Objects.requireNonNull(sources, "sources");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = Objects.requireNonNull(type, "type");
    }

    static <T> Function<List<T>, List<T>> copy() {
        return ArrayList::new;
    }

    @Override
    public Class<?> type() {
        return type;
    }

    @Override
    protected Subscription onSubscribe(Actor<? super R> actor) {
        int n = sources.size();
        if (n == 0) {
            actor.onComplete();
            return Subscriptions.empty();
        }

        CollectLatestCoordinator<T, R> parent = new CollectLatestCoordinator<>(actor, mapper, n);

        for (int i = 0; i < n; i++) {
            if (parent.isDisposed()) {
                break;
            }
            Observable<? extends T> p = sources.get(i);
            if (p == null) {
                parent.innerError(new NullPointerException("The " + i + "th source is null"));
                break;
            }
            CollectLatestInner<T> inner = parent.inners[i];
            inner.set(p.subscribe(inner));
        }
        return parent;
    }

    static final class CollectLatestCoordinator<T, R> implements Subscription {
        final Actor<? super R> actual;

        final Function<? super List<T>, ? extends R> mapper;

        final CollectLatestInner<T>[] inners;

        final Object[] values;

        final boolean[] completed;

        final boolean[] hasValue;

        final boolean[] updated;

        boolean done;

        volatile boolean cancelled;

        @SuppressWarnings("unchecked")
        CollectLatestCoordinator(Actor<? super R> actual, Function<? super List<T>, ? extends R> mapper, int n) {
            this.actual = actual;
            this.mapper = mapper;
            this.values = new Object[n];
            this.completed = new boolean[n];
            this.hasValue = new boolean[n];
            this.updated = new boolean[n];
            CollectLatestInner<T>[] a = new CollectLatestInner[n];
            for (int i = 0; i < n; i++) {
                a[i] = new CollectLatestInner<>(this, i);
            }
            this.inners = a;
        }

        @SuppressWarnings("unchecked")
        synchronized void innerNext(int index, T value) {
            if (done || cancelled) {
                return;
            }
            values[index] = value;
            hasValue[index] = true;
            updated[index] = true;

            int n = values.length;
            boolean allCompleted = true;
            for (int j = 0; j < n; j++) {
                if (!updated[j] && !(completed[j] && hasValue[j])) {
                    return;
                }
                allCompleted &= completed[j];
            }
            if (allCompleted) {
                return;
            }

            List<T> list = new ArrayList<>(n);
            for (int j = 0; j < n; j++) {
                updated[j] = completed[j];
                list.add((T) values[j]);
            }

            R r;
            try {
                r = mapper.apply(list);
            } catch (Throwable e) {
                ExceptionHelper.throwIfFatal(e);
                innerError(e);
                return;
            }
            if (r == null) {
                innerError(new NullPointerException("The mapper returned a null value"));
                return;
            }
            actual.onNext(r);
        }

        synchronized void innerError(Throwable e) {
            if (done || cancelled) {
                return;
            }
            done = true;
            disposeAll();
            actual.onError(e);
        }

        synchronized void innerComplete(int index) {
            if (done || cancelled) {
                return;
            }
            completed[index] = true;
            boolean allCompleted = true;
            for (boolean c : completed) {
                allCompleted &= c;
            }
            if (allCompleted || !hasValue[index]) {
                done = true;
                disposeAll();
                actual.onComplete();
            }
        }

        void disposeAll() {
            for (CollectLatestInner<T> inner : inners) {
                inner.unsubscribe();
            }
        }

        @Override
        public void unsubscribe() {
            if (!cancelled) {
                cancelled = true;
                disposeAll();
            }
        }

        @Override
        public boolean isDisposed() {
            return cancelled || done;
        }
    }

    static final class CollectLatestInner<T> extends DeferredSubscription implements Actor<T> {
        final CollectLatestCoordinator<T, ?> parent;

        final int index;

        CollectLatestInner(CollectLatestCoordinator<T, ?> parent, int index) {
            this.parent = parent;
            this.index = index;
        }

        @Override
        public void onNext(T t) {
            parent.innerNext(index, t);
        }

        @Override
        public void onError(Throwable e) {
            parent.innerError(e);
        }

        @Override
        public void onComplete() {
            parent.innerComplete(index);
        }
    }
}
