package rac.proxy;

import rac.flow.Actor;

/**
 * Proxy descriptor wrapping the downstream actor of a subscription into the
 * actor subscribed to the upstream source.
 *
 * @param <T> the upstream value type
 * @param <R> the downstream value type
 */
@FunctionalInterface
public interface ActorProxy<T, R> {

    /**
     * Creates the upstream-facing actor of one subscription.
     *
     * @param downstream the actor to forward to
     * @return the actor to subscribe upstream with
     */
    Actor<? super T> proxyActor(Actor<? super R> downstream);

    /**
     * @param inputType the declared type of the upstream source
     * @return the declared type of the proxied output, {@code Object.class} if unknown
     */
    default Class<?> outputType(Class<?> inputType) {
        return Object.class;
    }
}
