package rac.proxy;

/**
 * Proxy descriptor wrapping both the actor and the source of a subscription.
 * The actor is wrapped first, so the proxied source receives the final
 * upstream-facing actor.
 *
 * @param <T> the value type
 */
public interface ActorSourceProxy<T> extends ActorProxy<T, T>, SourceProxy<T, T> {

    @Override
    default Class<?> outputType(Class<?> inputType) {
        return inputType;
    }
}
