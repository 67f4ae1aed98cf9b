package rac.flow;

/**
 * Root of the actor capabilities: anything that can be handed to
 * {@code Observable.subscribe}.
 * <p>
 * A sink accepts some subset of the three events {@code next}, {@code error} and
 * {@code complete}, depending on which of {@link NextActor}, {@link ErrorActor},
 * {@link CompletionActor} or {@link Actor} it implements.
 *
 * @param <T> the accepted value type
 */
public interface Sink<T> {

    /**
     * The declared element type of this sink.
     * <p>
     * {@code Object.class} means the sink accepts any value and no runtime check
     * is performed on delivery.
     *
     * @return the declared element type, never null
     */
    default Class<?> type() {
        return Object.class;
    }
}
