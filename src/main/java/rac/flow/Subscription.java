package rac.flow;

/**
 * Handle to an active delivery relationship, returned by every subscribe call.
 * <p>Call to {@link #unsubscribe()} is idempotent: disposing an already disposed
 * handle is a no-op.
 */
@FunctionalInterface
public interface Subscription {

    /**
     * Stops the delivery and releases the resources (upstream subscriptions,
     * workers, timers) owned by the relationship.
     */
    void unsubscribe();

    /**
     * Returns true if this handle is known to be disposed.
     * <p>
     * Implementations that do not track their state return false.
     *
     * @return true if disposed
     */
    default boolean isDisposed() {
        return false;
    }
}
