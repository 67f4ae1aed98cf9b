package rac.flow;

/**
 * A sink accepting all three events.
 * <p>
 * The events delivered to an actor follow the grammar
 * {@code onNext* (onError | onComplete)?}: no event follows a terminal one.
 * Calls are never concurrent with each other.
 *
 * @param <T> the value type
 */
public interface Actor<T> extends NextActor<T>, ErrorActor<T>, CompletionActor<T> {

}
