package rac.proxy;

import java.util.Objects;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.subscription.DeferredSubscription;
import rac.util.ExceptionHelper;
import rac.util.UnsignalledExceptions;

/**
 * Base class of the upstream-facing actors created by actor proxies.
 * <p>
 * Enforces the event grammar with a {@code done} flag, drops everything once
 * disposed and forwards the terminal events once. The handle of the upstream
 * subscription is attached after the upstream {@code subscribe} returned;
 * disposing this actor disposes it, even when it arrives late.
 *
 * @param <T> the upstream value type
 * @param <R> the downstream value type
 */
public abstract class ProxyActor<T, R> implements Actor<T>, Subscription {

    protected final Actor<? super R> actual;

    final DeferredSubscription upstream;

    protected boolean done;

    protected volatile boolean cancelled;

    protected ProxyActor(Actor<? super R> actual) {
        this.actual = Objects.requireNonNull(actual, "actual");
        this.upstream = new DeferredSubscription();
    }

    /**
     * Attaches the handle of the upstream subscription.
     *
     * @param s the upstream handle
     */
    public final void onUpstream(Subscription s) {
        upstream.set(s);
    }

    /**
     * Returns true if the value should not be processed, logging it as dropped
     * after termination.
     *
     * @param t the value
     * @return true if the value must be ignored
     */
    protected final boolean isDropped(T t) {
        if (cancelled) {
            return true;
        }
        if (done) {
            UnsignalledExceptions.onNextDropped(t);
            return true;
        }
        return false;
    }

    /**
     * Terminates with an error raised by a user callback: the upstream is
     * disposed and the error forwarded once.
     *
     * @param e the failure
     */
    protected final void fail(Throwable e) {
        ExceptionHelper.throwIfFatal(e);
        done = true;
        upstream.unsubscribe();
        actual.onError(e);
    }

    /**
     * Disposes the upstream subscription without touching the downstream.
     */
    protected final void disposeUpstream() {
        upstream.unsubscribe();
    }

    @Override
    public void onError(Throwable e) {
        if (cancelled) {
            return;
        }
        if (done) {
            UnsignalledExceptions.onErrorDropped(e);
            return;
        }
        done = true;
        actual.onError(e);
    }

    @Override
    public void onComplete() {
        if (cancelled || done) {
            return;
        }
        done = true;
        actual.onComplete();
    }

    @Override
    public void unsubscribe() {
        cancelled = true;
        upstream.unsubscribe();
    }

    @Override
    public boolean isDisposed() {
        return cancelled || upstream.isDisposed();
    }

    public final boolean isTerminated() {
        return done;
    }
}
