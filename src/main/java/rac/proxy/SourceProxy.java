package rac.proxy;

import rac.observable.Observable;

/**
 * Proxy descriptor replacing the upstream source of a subscription by an
 * Observable that runs additional machinery around it.
 *
 * @param <T> the upstream value type
 * @param <R> the downstream value type
 */
@FunctionalInterface
public interface SourceProxy<T, R> {

    /**
     * @param source the upstream source
     * @return the Observable to subscribe to instead
     */
    Observable<R> proxySource(Observable<? extends T> source);

    /**
     * @param inputType the declared type of the upstream source
     * @return the declared type of the proxied output, {@code Object.class} if unknown
     */
    default Class<?> outputType(Class<?> inputType) {
        return Object.class;
    }
}
