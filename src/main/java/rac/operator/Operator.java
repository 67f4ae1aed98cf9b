package rac.operator;

import java.util.Objects;

import rac.observable.Observable;

/**
 * A transformation of one Observable into another, applied with
 * {@link Observable#pipe(Operator)}.
 * <p>
 * Operators are values independent of any particular source: the same
 * instance can be applied to many sources.
 *
 * @param <T> the upstream value type
 * @param <R> the downstream value type
 */
@FunctionalInterface
public interface Operator<T, R> {

    Observable<R> apply(Observable<T> source);

    /**
     * Composes this operator with another one, applied after this.
     *
     * @param <V> the resulting value type
     * @param after the operator to apply to the output of this operator
     * @return the composed operator
     */
    default <V> Operator<T, V> andThen(Operator<R, V> after) {
        Objects.requireNonNull(after, "after");
        return source -> after.apply(apply(source));
    }
}
