package rac.subscription;

import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import rac.flow.Subscription;

/**
 * Runs an action on the first unsubscribe.
 */
final class ActionSubscription implements Subscription {

    volatile Runnable action;
    static final AtomicReferenceFieldUpdater<ActionSubscription, Runnable> ACTION =
            AtomicReferenceFieldUpdater.newUpdater(ActionSubscription.class, Runnable.class, "action");

    ActionSubscription(Runnable action) {
        this.action = action;
    }

    @Override
    public void unsubscribe() {
        Runnable r = action;
        if (r != null) {
            r = ACTION.getAndSet(this, null);
            if (r != null) {
                r.run();
            }
        }
    }

    @Override
    public boolean isDisposed() {
        return action == null;
    }
}
