package rac.flow;

/**
 * The event capability of a sink, resolved once per subscription.
 */
public enum ActorTrait {
    /** Accepts next, error and complete. */
    BASE(true, true, true),
    /** Accepts next only. */
    NEXT(true, false, false),
    /** Accepts error only. */
    ERROR(false, true, false),
    /** Accepts complete only. */
    COMPLETION(false, false, true),
    /** Not usable as an actor: any delivery is a contract violation. */
    INVALID(false, false, false);

    final boolean next;

    final boolean error;

    final boolean complete;

    ActorTrait(boolean next, boolean error, boolean complete) {
        this.next = next;
        this.error = error;
        this.complete = complete;
    }

    public boolean acceptsNext() {
        return next;
    }

    public boolean acceptsError() {
        return error;
    }

    public boolean acceptsComplete() {
        return complete;
    }

    public boolean isValid() {
        return this != INVALID;
    }
}
