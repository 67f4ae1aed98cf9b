package rac.actor;

import java.util.Objects;
import java.util.function.Consumer;

import rac.flow.Actor;
import rac.flow.ActorTrait;
import rac.flow.CompletionActor;
import rac.flow.ErrorActor;
import rac.flow.NextActor;
import rac.flow.Sink;
import rac.util.InconsistentDataTypeException;
import rac.util.InvalidActorException;

/**
 * The type-contract layer: classification of sink candidates, the per-call
 * delivery primitives and the once-per-subscription wiring of a sink to a source.
 * Also hosts the factories of the ready-made actors.
 */
public enum Actors {
    ;

    /**
     * Determines whether the candidate is usable as an actor, which events it
     * accepts and its element type.
     * <p>
     * A candidate implementing all three of {@link NextActor}, {@link ErrorActor}
     * and {@link CompletionActor} is {@link ActorTrait#BASE}; one implementing
     * exactly one of them has the matching single-event trait. Anything else,
     * {@code null} included, is {@link ActorTrait#INVALID}.
     *
     * @param candidate the object to classify
     * @return the classification, never null
     */
    public static ActorType classify(Object candidate) {
        if (!(candidate instanceof Sink)) {
            return ActorType.INVALID;
        }
        Class<?> type = ((Sink<?>) candidate).type();
        if (type == null) {
            return ActorType.INVALID;
        }
        if (candidate instanceof Actor) {
            return new ActorType(ActorTrait.BASE, type);
        }
        boolean n = candidate instanceof NextActor;
        boolean e = candidate instanceof ErrorActor;
        boolean c = candidate instanceof CompletionActor;

        if (n && e && c) {
            return new ActorType(ActorTrait.BASE, type);
        }
        if (n && !e && !c) {
            return new ActorType(ActorTrait.NEXT, type);
        }
        if (!n && e && !c) {
            return new ActorType(ActorTrait.ERROR, type);
        }
        if (!n && !e && c) {
            return new ActorType(ActorTrait.COMPLETION, type);
        }
        return ActorType.INVALID;
    }

    /**
     * Delivers a value to the candidate, classifying it on this call.
     *
     * @param <T> the value type
     * @param actor the receiver
     * @param data the value, not null
     * @throws InvalidActorException if the candidate is not an actor
     * @throws InconsistentDataTypeException if the actor does not accept the value type
     */
    @SuppressWarnings("unchecked")
    public static <T> void next(Object actor, T data) {
        Objects.requireNonNull(data, "data");
        ActorType at = classify(actor);
        if (!at.trait.isValid()) {
            throw new InvalidActorException(actor);
        }
        if (!at.accepts(data.getClass())) {
            throw new InconsistentDataTypeException(actor, at.type, data.getClass());
        }
        if (at.trait.acceptsNext()) {
            ((NextActor<T>) actor).onNext(data);
        }
    }

    /**
     * Delivers an error to the candidate, classifying it on this call.
     *
     * @param actor the receiver
     * @param e the error, not null
     * @throws InvalidActorException if the candidate is not an actor
     */
    public static void error(Object actor, Throwable e) {
        Objects.requireNonNull(e, "e");
        ActorType at = classify(actor);
        if (!at.trait.isValid()) {
            throw new InvalidActorException(actor);
        }
        if (at.trait.acceptsError()) {
            ((ErrorActor<?>) actor).onError(e);
        }
    }

    /**
     * Delivers the completion to the candidate, classifying it on this call.
     *
     * @param actor the receiver
     * @throws InvalidActorException if the candidate is not an actor
     */
    public static void complete(Object actor) {
        ActorType at = classify(actor);
        if (!at.trait.isValid()) {
            throw new InvalidActorException(actor);
        }
        if (at.trait.acceptsComplete()) {
            ((CompletionActor<?>) actor).onComplete();
        }
    }

    /**
     * Resolves the wiring of a sink to a source declaring the given element type.
     * <p>
     * The result accepts all three events and only forwards those the sink's
     * capability accepts. When both types are known they are compared here, once;
     * when only the sink declares a type, the result checks every value.
     *
     * @param <T> the value type
     * @param sink the sink to wire
     * @param sourceType the element type declared by the source, {@code Object.class} if unknown
     * @return the actor to deliver to
     * @throws InvalidActorException if the sink is not a valid actor
     * @throws InconsistentDataTypeException if the declared types are incompatible
     */
    @SuppressWarnings("unchecked")
    public static <T> Actor<T> conform(Sink<? super T> sink, Class<?> sourceType) {
        ActorType at = classify(sink);
        if (!at.trait.isValid()) {
            throw new InvalidActorException(sink);
        }
        boolean check = false;
        if (at.isTyped()) {
            if (sourceType != Object.class) {
                if (!at.accepts(sourceType)) {
                    throw new InconsistentDataTypeException(sink, at.type, sourceType);
                }
            } else {
                check = true;
            }
        }

        Actor<T> a;
        switch (at.trait) {
            case NEXT:
                a = new NextOnlyActor<>((NextActor<T>) sink);
                break;
            case ERROR:
                a = new ErrorOnlyActor<>((ErrorActor<T>) sink);
                break;
            case COMPLETION:
                a = new CompletionOnlyActor<>((CompletionActor<T>) sink);
                break;
            default:
                if (sink instanceof Actor) {
                    a = (Actor<T>) sink;
                } else {
                    a = new CompositeCapabilityActor<>(sink);
                }
        }
        if (check) {
            return new CheckedActor<>(a, at.type, sink);
        }
        return a;
    }

    public static <T> LambdaActor<T> lambda(Consumer<? super T> onNext, Consumer<Throwable> onError, Runnable onComplete) {
        return new LambdaActor<>(onNext, onError, onComplete);
    }

    public static <T> LambdaActor<T> lambda(Consumer<? super T> onNext) {
        return new LambdaActor<>(onNext, LambdaActor.ERROR_DROPPED, LambdaActor.NOOP);
    }

    public static <T> KeepActor<T> keep(Class<T> type) {
        return new KeepActor<>(type);
    }

    public static <T> KeepActor<T> keep() {
        return new KeepActor<>(Object.class);
    }

    public static <T> VoidActor<T> ignore() {
        return new VoidActor<>(Object.class);
    }

    public static <T> VoidActor<T> ignore(Class<T> type) {
        return new VoidActor<>(type);
    }

    public static <T> LoggerActor<T> logger() {
        return new LoggerActor<>("LogActor");
    }

    public static <T> LoggerActor<T> logger(String name) {
        return new LoggerActor<>(name);
    }

    static final class NextOnlyActor<T> implements Actor<T> {
        final NextActor<T> actual;

        NextOnlyActor(NextActor<T> actual) {
            this.actual = actual;
        }

        @Override
        public void onNext(T t) {
            actual.onNext(t);
        }

        @Override
        public void onError(Throwable e) {
            // not accepted by the capability
        }

        @Override
        public void onComplete() {
            // not accepted by the capability
        }
    }

    static final class ErrorOnlyActor<T> implements Actor<T> {
        final ErrorActor<T> actual;

        ErrorOnlyActor(ErrorActor<T> actual) {
            this.actual = actual;
        }

        @Override
        public void onNext(T t) {
            // not accepted by the capability
        }

        @Override
        public void onError(Throwable e) {
            actual.onError(e);
        }

        @Override
        public void onComplete() {
            // not accepted by the capability
        }
    }

    static final class CompletionOnlyActor<T> implements Actor<T> {
        final CompletionActor<T> actual;

        CompletionOnlyActor(CompletionActor<T> actual) {
            this.actual = actual;
        }

        @Override
        public void onNext(T t) {
            // not accepted by the capability
        }

        @Override
        public void onError(Throwable e) {
            // not accepted by the capability
        }

        @Override
        public void onComplete() {
            actual.onComplete();
        }
    }

    /** A sink implementing the three capability interfaces without {@link Actor}. */
    static final class CompositeCapabilityActor<T> implements Actor<T> {
        final NextActor<T> next;
        final ErrorActor<T> error;
        final CompletionActor<T> complete;

        @SuppressWarnings("unchecked")
        CompositeCapabilityActor(Sink<? super T> sink) {
            this.next = (NextActor<T>) sink;
            this.error = (ErrorActor<T>) sink;
            this.complete = (CompletionActor<T>) sink;
        }

        @Override
        public void onNext(T t) {
            next.onNext(t);
        }

        @Override
        public void onError(Throwable e) {
            error.onError(e);
        }

        @Override
        public void onComplete() {
            complete.onComplete();
        }
    }

    /** Checks each value against the declared type of a sink wired to an untyped source. */
    static final class CheckedActor<T> implements Actor<T> {
        final Actor<T> actual;
        final Class<?> type;
        final Object original;

        CheckedActor(Actor<T> actual, Class<?> type, Object original) {
            this.actual = actual;
            this.type = type;
            this.original = original;
        }

        @Override
        public void onNext(T t) {
            if (!type.isInstance(t)) {
                throw new InconsistentDataTypeException(original, type, t.getClass());
            }
            actual.onNext(t);
        }

        @Override
        public void onError(Throwable e) {
            actual.onError(e);
        }

        @Override
        public void onComplete() {
            actual.onComplete();
        }
    }
}
