package rac.subscription;

import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import rac.flow.Subscription;

/**
 * Atomic holder of an upstream Subscription that may arrive after a disposal
 * was requested; such a late Subscription is disposed immediately.
 */
public class DeferredSubscription implements Subscription {

    volatile Subscription current;
    static final AtomicReferenceFieldUpdater<DeferredSubscription, Subscription> CURRENT =
            AtomicReferenceFieldUpdater.newUpdater(DeferredSubscription.class, Subscription.class, "current");

    /**
     * Sets the held Subscription if none was set before.
     *
     * @param s the Subscription to hold
     * @return false if this holder was already disposed, in which case {@code s}
     * is disposed, or already held another Subscription
     */
    public final boolean set(Subscription s) {
        if (CURRENT.compareAndSet(this, null, s)) {
            return true;
        }
        s.unsubscribe();
        return false;
    }

    /**
     * Replaces the held Subscription without disposing the previous one.
     *
     * @param s the new Subscription
     * @return false if this holder was already disposed, in which case {@code s}
     * is disposed
     */
    public final boolean replace(Subscription s) {
        for (;;) {
            Subscription a = current;
            if (a == Subscriptions.disposed()) {
                s.unsubscribe();
                return false;
            }
            if (CURRENT.compareAndSet(this, a, s)) {
                return true;
            }
        }
    }

    /**
     * Replaces the held Subscription and disposes the previous one.
     *
     * @param s the new Subscription, null clears the holder
     * @return false if this holder was already disposed
     */
    public final boolean swap(Subscription s) {
        for (;;) {
            Subscription a = current;
            if (a == Subscriptions.disposed()) {
                if (s != null) {
                    s.unsubscribe();
                }
                return false;
            }
            if (CURRENT.compareAndSet(this, a, s)) {
                if (a != null) {
                    a.unsubscribe();
                }
                return true;
            }
        }
    }

    /**
     * @return the currently held Subscription or null
     */
    public final Subscription get() {
        Subscription a = current;
        return a == Subscriptions.disposed() ? null : a;
    }

    @Override
    public void unsubscribe() {
        Subscription a = current;
        if (a != Subscriptions.disposed()) {
            a = CURRENT.getAndSet(this, Subscriptions.disposed());
            if (a != null && a != Subscriptions.disposed()) {
                a.unsubscribe();
            }
        }
    }

    @Override
    public boolean isDisposed() {
        return current == Subscriptions.disposed();
    }
}
