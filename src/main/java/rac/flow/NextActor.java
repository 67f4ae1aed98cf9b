package rac.flow;

/**
 * A sink that only listens for {@code next} events.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface NextActor<T> extends Sink<T> {

    /**
     * Receives the next value.
     *
     * @param t the value, never null
     */
    void onNext(T t);
}
