package rac.observable;

import java.util.Objects;

/**
 * Base class for observables that are fed by a single upstream source.
 *
 * @param <T> the upstream value type
 * @param <R> the output value type
 */
public abstract class ObservableSource<T, R> extends Observable<R> {

    protected final Observable<? extends T> source;

    protected ObservableSource(Observable<? extends T> source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Returns the upstream source.
     *
     * @return the upstream source
     */
    public final Observable<? extends T> source() {
        return source;
    }
}
