package rac.actor;

import java.util.Objects;
import java.util.function.Consumer;

import rac.flow.Actor;
import rac.util.ExceptionHelper;
import rac.util.UnsignalledExceptions;

/**
 * An actor that forwards the events to lambdas.
 * <p>
 * A failing {@code onNext} lambda terminates this actor: the failure is routed to
 * the error lambda and later events are dropped.
 *
 * @param <T> the value type
 */
public final class LambdaActor<T> implements Actor<T> {

    static final Consumer<Throwable> ERROR_DROPPED = UnsignalledExceptions::onErrorDropped;

    static final Runnable NOOP = () -> { };

    final Consumer<? super T> onNextCall;

    final Consumer<Throwable> onErrorCall;

    final Runnable onCompleteCall;

    boolean done;

    public LambdaActor(Consumer<? super T> onNextCall, Consumer<Throwable> onErrorCall, Runnable onCompleteCall) {
        this.onNextCall = Objects.requireNonNull(onNextCall, "onNextCall");
        this.onErrorCall = Objects.requireNonNull(onErrorCall, "onErrorCall");
        this.onCompleteCall = Objects.requireNonNull(onCompleteCall, "onCompleteCall");
    }

    @Override
    public void onNext(T t) {
        if (done) {
            UnsignalledExceptions.onNextDropped(t);
            return;
        }
        try {
            onNextCall.accept(t);
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            onError(e);
        }
    }

    @Override
    public void onError(Throwable t) {
        if (done) {
            UnsignalledExceptions.onErrorDropped(t);
            return;
        }
        done = true;
        try {
            onErrorCall.accept(t);
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            UnsignalledExceptions.onErrorDropped(e, t);
        }
    }

    @Override
    public void onComplete() {
        if (done) {
            return;
        }
        done = true;
        try {
            onCompleteCall.run();
        } catch (Throwable e) {
            ExceptionHelper.throwIfFatal(e);
            UnsignalledExceptions.onErrorDropped(e);
        }
    }
}
