package rac.observable;

import java.util.Objects;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.operator.Operators;
import rac.subject.RecentSubject;

/**
 * A placeholder whose actual source is supplied later with {@link #set(Observable)}.
 * <p>
 * Actors always relay the latest source set: setting a new source switches
 * every current actor over to it.
 *
 * @param <T> the value type
 */
public final class ObservableLazy<T> extends Observable<T> {

    final Class<?> type;

    final RecentSubject<Observable<? extends T>> pending;

    final Observable<T> switched;

    ObservableLazy(Class<?> type) {
        this.type = Objects.requireNonNull(type, "type");
        this.pending = new RecentSubject<>();
        this.switched = pending.pipe(Operators.<Observable<? extends T>, T>switchMap(o -> o));
    }

    @Override
    public Class<?> type() {
        return type;
    }

    /**
     * Supplies the source the actors relay from now on.
     *
     * @param source the actual source
     */
    public void set(Observable<? extends T> source) {
        pending.onNext(Objects.requireNonNull(source, "source"));
    }

    @Override
    protected Subscription onSubscribe(Actor<? super T> actor) {
        return switched.subscribe(actor);
    }
}
