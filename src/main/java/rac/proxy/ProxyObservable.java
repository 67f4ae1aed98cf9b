package rac.proxy;

import java.util.Objects;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.observable.Observable;
import rac.observable.ObservableSource;
import rac.subscription.Subscriptions;

/**
 * Applies a proxy descriptor to a source for each subscription: the actor is
 * wrapped first, then the (possibly proxied) source is subscribed with it.
 * <p>
 * The kind of descriptor is resolved once, at construction.
 *
 * @param <T> the upstream value type
 * @param <R> the downstream value type
 */
public final class ProxyObservable<T, R> extends ObservableSource<T, R> {

    final ActorProxy<T, R> actorProxy;

    final SourceProxy<T, ?> sourceProxy;

    final Class<?> outputType;

    ProxyObservable(Observable<? extends T> source, ActorProxy<T, R> actorProxy, SourceProxy<T, ?> sourceProxy,
            Class<?> outputType) {
        super(source);
        this.actorProxy = actorProxy;
        this.sourceProxy = sourceProxy;
        this.outputType = outputType;
    }

    public static <T, R> ProxyObservable<T, R> ofActor(Observable<? extends T> source, ActorProxy<T, R> proxy) {
        Objects.requireNonNull(proxy, "proxy");
        if (proxy instanceof SourceProxy) {
            @SuppressWarnings("unchecked")
            SourceProxy<T, ?> sp = (SourceProxy<T, ?>) proxy;
            return new ProxyObservable<>(source, proxy, sp, proxy.outputType(source.type()));
        }
        return new ProxyObservable<>(source, proxy, null, proxy.outputType(source.type()));
    }

    public static <T, R> ProxyObservable<T, R> ofSource(Observable<? extends T> source, SourceProxy<T, R> proxy) {
        Objects.requireNonNull(proxy, "proxy");
        if (proxy instanceof ActorProxy) {
            @SuppressWarnings("unchecked")
            ActorProxy<T, R> ap = (ActorProxy<T, R>) proxy;
            return new ProxyObservable<>(source, ap, proxy, proxy.outputType(source.type()));
        }
        return new ProxyObservable<>(source, null, proxy, proxy.outputType(source.type()));
    }

    public static <T> ProxyObservable<T, T> of(Observable<? extends T> source, ActorSourceProxy<T> proxy) {
        Objects.requireNonNull(proxy, "proxy");
        return new ProxyObservable<>(source, proxy, proxy, proxy.outputType(source.type()));
    }

    @Override
    public Class<?> type() {
        return outputType;
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    @Override
    protected Subscription onSubscribe(Actor<? super R> actor) {
        Actor<?> proxied = actorProxy != null ? actorProxy.proxyActor(actor) : actor;
        Objects.requireNonNull(proxied, "The actor proxy returned a null actor");

        Observable src = sourceProxy != null ? sourceProxy.proxySource(source) : source;
        Objects.requireNonNull(src, "The source proxy returned a null source");

        Subscription upstream = src.subscribe(proxied);

        if (proxied == actor) {
            return upstream;
        }
        if (proxied instanceof ProxyActor) {
            if (upstream != proxied) {
                ((ProxyActor<?, ?>) proxied).onUpstream(upstream);
            }
            return (ProxyActor<?, ?>) proxied;
        }
        if (proxied instanceof Subscription) {
            return Subscriptions.composite((Subscription) proxied, upstream);
        }
        return upstream;
    }
}
