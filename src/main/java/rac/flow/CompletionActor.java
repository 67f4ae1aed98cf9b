package rac.flow;

/**
 * A sink that only listens for the {@code complete} terminal event.
 *
 * @param <T> the value type of the stream it is attached to
 */
@FunctionalInterface
public interface CompletionActor<T> extends Sink<T> {

    /**
     * Receives the completion of the stream.
     */
    void onComplete();
}
