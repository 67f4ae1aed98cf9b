package rac.observable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import org.reactivestreams.Publisher;

import rac.actor.Actors;
import rac.actor.LambdaActor;
import rac.flow.Actor;
import rac.flow.Sink;
import rac.flow.Subscription;
import rac.operator.Operator;
import rac.scheduler.Scheduler;
import rac.scheduler.Schedulers;
import rac.subscription.Subscriptions;

/**
 * A source of values pushed to the actors subscribed to it.
 * <p>
 * {@link #subscribe(Sink)} validates the sink and resolves the type contract
 * between {@link #type()} and the sink's declared type before the source runs;
 * the events then follow the grammar {@code next* (error | complete)?}.
 * Operators are applied with the {@code pipe} methods.
 *
 * @param <T> the value type
 */
public abstract class Observable<T> {

    /**
     * The declared element type of this source, {@code Object.class} if unknown.
     *
     * @return the element type, never null
     */
    public Class<?> type() {
        return Object.class;
    }

    /**
     * Subscribes the sink to this source.
     *
     * @param sink the receiver of the events
     * @return the handle that stops the delivery, never null
     * @throws rac.util.InvalidActorException if the sink is not a valid actor
     * @throws rac.util.InconsistentDataTypeException if the declared types are incompatible
     */
    public final Subscription subscribe(Sink<? super T> sink) {
        Actor<T> actor = Actors.conform(sink, type());
        Subscription s = onSubscribe(actor);
        return s != null ? s : Subscriptions.empty();
    }

    public final Subscription subscribe(Consumer<? super T> onNext) {
        return subscribe(Actors.lambda(onNext));
    }

    public final Subscription subscribe(Consumer<? super T> onNext, Consumer<Throwable> onError) {
        return subscribe(new LambdaActor<>(onNext, onError, () -> { }));
    }

    public final Subscription subscribe(Consumer<? super T> onNext, Consumer<Throwable> onError, Runnable onComplete) {
        return subscribe(Actors.lambda(onNext, onError, onComplete));
    }

    /**
     * Starts the delivery to an actor that already conforms to this source.
     *
     * @param actor the actor, never null
     * @return the handle of the delivery, null is treated as the void handle
     */
    protected abstract Subscription onSubscribe(Actor<? super T> actor);

    /**
     * Synchronous sources stop early when their actor is also a handle that was
     * disposed while receiving a value.
     */
    static boolean isDisposed(Object actor) {
        return actor instanceof Subscription && ((Subscription) actor).isDisposed();
    }

    public final <R> Observable<R> pipe(Operator<T, R> op) {
        return op.apply(this);
    }

    public final <A, R> Observable<R> pipe(Operator<T, A> op1, Operator<A, R> op2) {
        return op2.apply(op1.apply(this));
    }

    public final <A, B, R> Observable<R> pipe(Operator<T, A> op1, Operator<A, B> op2, Operator<B, R> op3) {
        return op3.apply(op2.apply(op1.apply(this)));
    }

    public final <A, B, C, R> Observable<R> pipe(Operator<T, A> op1, Operator<A, B> op2, Operator<B, C> op3,
            Operator<C, R> op4) {
        return op4.apply(op3.apply(op2.apply(op1.apply(this))));
    }

    // ---------------------------------------------------------------------------------
    // sources

    public static <T> Observable<T> of(T value) {
        return new ObservableJust<>(value);
    }

    @SafeVarargs
    public static <T> Observable<T> from(T... values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            return completed(values.getClass().getComponentType());
        }
        if (values.length == 1) {
            return new ObservableJust<>(values[0]);
        }
        return new ObservableArray<>(values.getClass().getComponentType(), values);
    }

    public static <T> Observable<T> from(Iterable<? extends T> iterable) {
        return new ObservableIterable<>(Object.class, iterable);
    }

    public static <T> Observable<T> from(Class<T> type, Iterable<? extends T> iterable) {
        return new ObservableIterable<>(type, iterable);
    }

    public static <T> Observable<T> completed() {
        return ObservableEmpty.instance();
    }

    public static <T> Observable<T> completed(Class<?> type) {
        return new ObservableEmpty<>(type);
    }

    public static <T> Observable<T> faulted(Throwable error) {
        return new ObservableError<>(Object.class, error);
    }

    public static <T> Observable<T> faulted(Class<T> type, Throwable error) {
        return new ObservableError<>(type, error);
    }

    public static <T> Observable<T> never() {
        return ObservableNever.instance();
    }

    public static <T> Observable<T> never(Class<T> type) {
        return new ObservableNever<>(type);
    }

    /**
     * Emits {@code 0L} after the delay, then completes, on a dedicated worker.
     *
     * @param delayMillis the delay in milliseconds
     * @return the new source
     */
    public static Observable<Long> timer(long delayMillis) {
        return new ObservableTimer(delayMillis, TimeUnit.MILLISECONDS, Schedulers.dedicated());
    }

    public static Observable<Long> timer(long delay, TimeUnit unit, Scheduler scheduler) {
        return new ObservableTimer(delay, unit, scheduler);
    }

    /**
     * Creates a source from a function that receives the actor and returns the
     * teardown of the delivery.
     *
     * @param <T> the value type
     * @param onSubscribe called for each subscription
     * @return the new source
     */
    public static <T> Observable<T> create(Function<? super Actor<T>, ? extends Subscription> onSubscribe) {
        return new ObservableCreate<>(Object.class, onSubscribe);
    }

    public static <T> Observable<T> create(Class<T> type, Function<? super Actor<T>, ? extends Subscription> onSubscribe) {
        return new ObservableCreate<>(type, onSubscribe);
    }

    public static <T> Observable<T> defer(Supplier<? extends Observable<? extends T>> supplier) {
        return new ObservableDefer<>(supplier);
    }

    public static <T> Observable<T> fromPublisher(Publisher<? extends T> publisher) {
        return new ObservablePublisher<>(Object.class, publisher);
    }

    public static <T> Observable<T> fromPublisher(Class<T> type, Publisher<? extends T> publisher) {
        return new ObservablePublisher<>(type, publisher);
    }

    public static <T> ObservableLazy<T> lazy() {
        return new ObservableLazy<>(Object.class);
    }

    public static <T> ObservableLazy<T> lazy(Class<T> type) {
        return new ObservableLazy<>(type);
    }

    /**
     * Combines the latest value of every source into a list.
     *
     * @param <T> the common value type
     * @param sources the sources, one slot each
     * @return the new source
     */
    public static <T> Observable<List<T>> collectLatest(List<? extends Observable<? extends T>> sources) {
        return new ObservableCollectLatest<>(sources, ObservableCollectLatest.<T>copy(), List.class);
    }

    public static <T, R> Observable<R> collectLatest(List<? extends Observable<? extends T>> sources,
            Function<? super List<T>, ? extends R> mapper) {
        return new ObservableCollectLatest<>(sources, mapper, Object.class);
    }

    @SafeVarargs
    public static <T> Observable<List<T>> collectLatest(Observable<? extends T>... sources) {
        return collectLatest(Arrays.asList(sources));
    }
}
