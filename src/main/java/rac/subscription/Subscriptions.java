package rac.subscription;

import java.util.Objects;

import rac.flow.Subscription;

/**
 * Utility methods to create and combine Subscriptions.
 */
public enum Subscriptions {
    ;

    /**
     * The void teardown: a handle that has nothing to release.
     *
     * @return the shared no-op {@link Subscription}, it always reports disposed
     */
    public static Subscription empty() {
        return EmptySubscription.INSTANCE;
    }

    /**
     * A singleton Subscription that represents a disposed slot of an atomic holder.
     * It should not be handed out to clients as it marks a terminal state.
     *
     * @return the shared disposed marker
     */
    public static Subscription disposed() {
        return DisposedSubscription.INSTANCE;
    }

    /**
     * Creates a handle that runs the given action on the first unsubscribe.
     *
     * @param action the action to run once
     * @return the new Subscription
     */
    public static Subscription from(Runnable action) {
        return new ActionSubscription(Objects.requireNonNull(action, "action"));
    }

    /**
     * Creates a handle that disposes all the given subscriptions, in order, on
     * the first unsubscribe.
     *
     * @param subscriptions the children
     * @return the new Subscription
     */
    public static Subscription composite(Subscription... subscriptions) {
        return new CompositeSubscription(subscriptions);
    }

    enum EmptySubscription implements Subscription {
        INSTANCE;

        @Override
        public void unsubscribe() {
            // nothing to release
        }

        @Override
        public boolean isDisposed() {
            return true;
        }

        @Override
        public String toString() {
            return "EmptySubscription";
        }
    }

    enum DisposedSubscription implements Subscription {
        INSTANCE;

        @Override
        public void unsubscribe() {
            // already disposed
        }

        @Override
        public boolean isDisposed() {
            return true;
        }

        @Override
        public String toString() {
            return "DisposedSubscription";
        }
    }
}
