package rac.util;

/**
 * Thrown when an event is delivered to, or a subscription is attempted with, an
 * object that is not a valid actor.
 */
public final class InvalidActorException extends ContractViolationException {

    private static final long serialVersionUID = 2946414375366322545L;

    public InvalidActorException(Object candidate) {
        super("Type " + (candidate == null ? "null" : candidate.getClass().getName())
                + " is not a valid actor type. Implement one of Actor, NextActor, ErrorActor or CompletionActor.");
    }
}
