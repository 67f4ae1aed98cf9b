package rac.flow;

/**
 * A sink that only listens for the {@code error} terminal event.
 *
 * @param <T> the value type of the stream it is attached to
 */
@FunctionalInterface
public interface ErrorActor<T> extends Sink<T> {

    /**
     * Receives the terminal error of the stream.
     *
     * @param e the error, never null
     */
    void onError(Throwable e);
}
