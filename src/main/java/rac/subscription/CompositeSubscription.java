package rac.subscription;

import java.util.Objects;

import rac.flow.Subscription;

/**
 * Disposes a fixed list of children in the supplied order, the first time
 * {@link #unsubscribe()} is called.
 */
public final class CompositeSubscription implements Subscription {

    final Subscription[] children;

    volatile boolean disposed;

    public CompositeSubscription(Subscription... children) {
        Objects.requireNonNull(children, "children");
        for (Subscription s : children) {
            Objects.requireNonNull(s, "The children contain a null Subscription");
        }
        this.children = children.clone();
    }

    @Override
    public void unsubscribe() {
        if (disposed) {
            return;
        }
        synchronized (this) {
            if (disposed) {
                return;
            }
            disposed = true;
        }
        for (Subscription s : children) {
            s.unsubscribe();
        }
    }

    @Override
    public boolean isDisposed() {
        return disposed;
    }
}
