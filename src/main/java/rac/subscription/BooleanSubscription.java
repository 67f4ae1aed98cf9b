package rac.subscription;

import rac.flow.Subscription;

/**
 * A flag-only handle: synchronous sources check it between deliveries.
 */
public final class BooleanSubscription implements Subscription {

    volatile boolean disposed;

    @Override
    public void unsubscribe() {
        disposed = true;
    }

    @Override
    public boolean isDisposed() {
        return disposed;
    }
}
