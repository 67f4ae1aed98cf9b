package rac.subject;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.observable.Observable;
import rac.util.UnsignalledExceptions;

/**
 * Dispatches next, error and complete events to zero-to-many actors.
 * <p>
 * The registry is a copy-on-write array: an emission iterates the array taken
 * before the pass, so actors registering or leaving during a pass do not
 * disturb it. Events received after a terminal event are dropped. A terminated
 * subject signals its terminal event to late actors, after the values the
 * variant replays.
 * <p>
 * A joining actor is registered only after its replay. A value emitted
 * reentrantly during that replay, for example by the joining actor itself,
 * is cached by the variant but not delivered to the joining actor.
 *
 * @param <T> the input and output value type
 */
public abstract class Subject<T> extends Observable<T> implements Actor<T> {

    private static final Logger LOG = LoggerFactory.getLogger(Subject.class);

    @SuppressWarnings("rawtypes")
    static final SubjectInner[] EMPTY = new SubjectInner[0];

    @SuppressWarnings("rawtypes")
    static final SubjectInner[] TERMINATED = new SubjectInner[0];

    final Class<?> type;

    @SuppressWarnings("unchecked")
    volatile SubjectInner<T>[] actors = EMPTY;
    @SuppressWarnings("rawtypes")
    static final AtomicReferenceFieldUpdater<Subject, SubjectInner[]> ACTORS =
            AtomicReferenceFieldUpdater.newUpdater(Subject.class, SubjectInner[].class, "actors");

    volatile Throwable error;

    protected Subject(Class<?> type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override
    public final Class<?> type() {
        return type;
    }

    /**
     * Creates a new, empty subject of the same variant and element type.
     *
     * @return the new subject
     */
    public abstract Subject<T> similar();

    /**
     * Records a value about to be emitted, for the late actors.
     *
     * @param t the value
     */
    void cache(T t) {

    }

    /**
     * @return the values a new actor receives before the live ones
     */
    abstract List<T> replay();

    @Override
    public final void onNext(T t) {
        Objects.requireNonNull(t, "t");
        if (actors == TERMINATED) {
            UnsignalledExceptions.onNextDropped(t);
            return;
        }
        cache(t);
        for (SubjectInner<T> s : actors) {
            s.onNext(t);
        }
    }

    @Override
    public final void onError(Throwable e) {
        Objects.requireNonNull(e, "e");
        if (actors == TERMINATED) {
            UnsignalledExceptions.onErrorDropped(e);
            return;
        }
        error = e;
        @SuppressWarnings("unchecked")
        SubjectInner<T>[] a = ACTORS.getAndSet(this, TERMINATED);
        if (a == TERMINATED) {
            UnsignalledExceptions.onErrorDropped(e);
            return;
        }
        LOG.trace("{} terminated with error {}", this, e.toString());
        for (SubjectInner<T> s : a) {
            s.onError(e);
        }
    }

    @Override
    public final void onComplete() {
        if (actors == TERMINATED) {
            return;
        }
        @SuppressWarnings("unchecked")
        SubjectInner<T>[] a = ACTORS.getAndSet(this, TERMINATED);
        if (a == TERMINATED) {
            return;
        }
        LOG.trace("{} completed", this);
        for (SubjectInner<T> s : a) {
            s.onComplete();
        }
    }

    @Override
    protected final Subscription onSubscribe(Actor<? super T> actor) {
        SubjectInner<T> inner = new SubjectInner<>(actor, this);

        for (T t : replay()) {
            if (inner.cancelled) {
                return inner;
            }
            actor.onNext(t);
        }

        if (!add(inner)) {
            if (!inner.cancelled) {
                Throwable e = error;
                if (e != null) {
                    actor.onError(e);
                } else {
                    actor.onComplete();
                }
            }
        }
        return inner;
    }

    boolean add(SubjectInner<T> s) {
        SubjectInner<T>[] a = actors;
        if (a == TERMINATED) {
            return false;
        }

        synchronized (this) {
            a = actors;
            if (a == TERMINATED) {
                return false;
            }
            int len = a.length;

            @SuppressWarnings("unchecked")
            SubjectInner<T>[] b = new SubjectInner[len + 1];
            System.arraycopy(a, 0, b, 0, len);
            b[len] = s;

            actors = b;

            return true;
        }
    }

    @SuppressWarnings("unchecked")
    void remove(SubjectInner<T> s) {
        SubjectInner<T>[] a = actors;
        if (a == TERMINATED || a == EMPTY) {
            return;
        }

        synchronized (this) {
            a = actors;
            if (a == TERMINATED || a == EMPTY) {
                return;
            }
            int len = a.length;

            int j = -1;

            for (int i = 0; i < len; i++) {
                if (a[i] == s) {
                    j = i;
                    break;
                }
            }
            if (j < 0) {
                return;
            }
            if (len == 1) {
                actors = EMPTY;
                return;
            }

            SubjectInner<T>[] b = new SubjectInner[len - 1];
            System.arraycopy(a, 0, b, 0, j);
            System.arraycopy(a, j + 1, b, j, len - j - 1);

            actors = b;
        }
    }

    public final boolean hasActors() {
        SubjectInner<T>[] s = actors;
        return s != EMPTY && s != TERMINATED;
    }

    public final int actorCount() {
        return actors.length;
    }

    public final boolean isTerminated() {
        return actors == TERMINATED;
    }

    public final boolean hasCompleted() {
        return actors == TERMINATED && error == null;
    }

    public final boolean hasError() {
        return actors == TERMINATED && error != null;
    }

    public final Throwable getError() {
        return actors == TERMINATED ? error : null;
    }

    /**
     * The registration token of one actor; disposing it removes that actor only.
     *
     * @param <T> the value type
     */
    static final class SubjectInner<T> implements Subscription {

        final Actor<? super T> actual;

        final Subject<T> parent;

        volatile boolean cancelled;

        SubjectInner(Actor<? super T> actual, Subject<T> parent) {
            this.actual = actual;
            this.parent = parent;
        }

        void onNext(T t) {
            if (!cancelled) {
                actual.onNext(t);
            }
        }

        void onError(Throwable e) {
            if (!cancelled) {
                actual.onError(e);
            }
        }

        void onComplete() {
            if (!cancelled) {
                actual.onComplete();
            }
        }

        @Override
        public void unsubscribe() {
            if (!cancelled) {
                cancelled = true;
                parent.remove(this);
            }
        }

        @Override
        public boolean isDisposed() {
            return cancelled;
        }
    }
}
