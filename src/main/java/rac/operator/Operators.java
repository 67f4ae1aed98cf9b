package rac.operator;

import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import rac.observable.Observable;
import rac.scheduler.Scheduler;
import rac.scheduler.Schedulers;

/**
 * Factories of the built-in operators.
 */
public enum Operators {
    ;

    public static <T, R> Operator<T, R> map(Function<? super T, ? extends R> mapper) {
        return new OperatorMap<>(Object.class, mapper);
    }

    /**
     * Maps every value and declares the type of the results, so typed actors
     * are checked once at subscription.
     *
     * @param <T> the source value type
     * @param <R> the result value type
     * @param type the result type
     * @param mapper the mapper function
     * @return the new operator
     */
    public static <T, R> Operator<T, R> map(Class<R> type, Function<? super T, ? extends R> mapper) {
        return new OperatorMap<>(type, mapper);
    }

    public static <T> Operator<T, T> filter(Predicate<? super T> predicate) {
        return new OperatorFilter<>(predicate);
    }

    public static <T, R> Operator<T, R> scan(R seed, BiFunction<R, ? super T, R> accumulator) {
        return new OperatorScan<>(seed, accumulator);
    }

    public static <T> Operator<T, T> tap(Consumer<? super T> onNext) {
        return new OperatorTap<>(onNext, null, null);
    }

    public static <T> Operator<T, T> tap(Consumer<? super T> onNext, Consumer<? super Throwable> onError,
            Runnable onComplete) {
        return new OperatorTap<>(onNext, onError, onComplete);
    }

    public static <T> Operator<T, Enumerated<T>> enumerate() {
        return new OperatorEnumerate<>();
    }

    public static <T> Operator<T, T> errorIfEmpty(Supplier<? extends Throwable> errorSupplier) {
        return new OperatorErrorIfEmpty<>(errorSupplier);
    }

    /**
     * Continues with the Observable returned by the handler when the source
     * fails; the handler receives the error and the source.
     *
     * @param <T> the value type
     * @param handler the error handler
     * @return the new operator
     */
    public static <T> Operator<T, T> catchError(
            BiFunction<? super Throwable, ? super Observable<T>, ? extends Observable<? extends T>> handler) {
        return new OperatorCatchError<>(handler);
    }

    public static <T> Operator<T, T> safe() {
        return new OperatorSafe<>();
    }

    public static <T> Operator<T, T> delay(long delayMillis) {
        return new OperatorDelay<>(delayMillis, Schedulers.dedicated());
    }

    public static <T> Operator<T, T> delay(long delayMillis, Scheduler scheduler) {
        return new OperatorDelay<>(delayMillis, scheduler);
    }

    public static <T> Operator<T, T> async() {
        return new OperatorAsync<>(Schedulers.dedicated());
    }

    public static <T> Operator<T, T> async(Scheduler scheduler) {
        return new OperatorAsync<>(scheduler);
    }

    public static <T, R> Operator<T, R> mergeMap(Function<? super T, ? extends Observable<? extends R>> mapper) {
        return new OperatorMergeMap<>(Object.class, mapper);
    }

    public static <T, R> Operator<T, R> mergeMap(Class<R> type,
            Function<? super T, ? extends Observable<? extends R>> mapper) {
        return new OperatorMergeMap<>(type, mapper);
    }

    public static <T> Operator<Observable<T>, T> mergeAll() {
        return new OperatorMergeMap<>(Object.class, Function.<Observable<T>>identity());
    }

    public static <T, R> Operator<T, R> switchMap(Function<? super T, ? extends Observable<? extends R>> mapper) {
        return new OperatorSwitchMap<>(Object.class, mapper);
    }

    public static <T, R> Operator<T, R> switchMap(Class<R> type,
            Function<? super T, ? extends Observable<? extends R>> mapper) {
        return new OperatorSwitchMap<>(type, mapper);
    }

    public static <T> Operator<Observable<T>, T> switchAll() {
        return new OperatorSwitchMap<>(Object.class, Function.<Observable<T>>identity());
    }
}
