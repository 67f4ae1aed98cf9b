package rac.operator;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.observable.Observable;
import rac.observable.ObservableSource;
import rac.proxy.ProxyActor;
import rac.scheduler.Scheduler;
import rac.util.Channel;
import rac.util.UnsignalledExceptions;

/**
 * Upstream-facing actor of the bridge operators: every event becomes a
 * message on a private channel that one worker drains, in order, towards the
 * downstream actor.
 * <p>
 * The worker runs one message per task and schedules the next task only while
 * messages are pending, so an idle bridge holds no thread of a shared executor.
 * <p>
 * Disposal sets the cancellation flag, closes the channel, disposes the
 * upstream and shuts the worker down, in this order.
 *
 * @param <T> the value type
 */
abstract class BridgeActor<T> extends ProxyActor<T, T> implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(BridgeActor.class);

    final Channel<Message<T>> channel;

    final Scheduler scheduler;

    volatile Scheduler.Worker worker;

    volatile int pending;
    @SuppressWarnings("rawtypes")
    static final AtomicIntegerFieldUpdater<BridgeActor> PENDING =
            AtomicIntegerFieldUpdater.newUpdater(BridgeActor.class, "pending");

    BridgeActor(Actor<? super T> actual, Channel<Message<T>> channel, Scheduler scheduler) {
        super(actual);
        this.channel = channel;
        this.scheduler = scheduler;
    }

    /**
     * @return the time the worker waits before taking each message, in nanoseconds
     */
    abstract long spacingNanos();

    final void start() {
        Scheduler.Worker w = scheduler.createWorker();
        worker = w;
        if (cancelled) {
            w.shutdown();
            return;
        }
        LOG.debug("Bridge worker started: {}", this);
    }

    /**
     * Subscribes this bridge to its upstream and attaches the returned handle.
     *
     * @param source the upstream source
     */
    void subscribeUpstream(Observable<? extends T> source) {
        onUpstream(source.subscribe(this));
    }

    @Override
    public final void onNext(T t) {
        if (isDropped(t)) {
            return;
        }
        enqueue(Message.data(t));
    }

    @Override
    public final void onError(Throwable e) {
        if (cancelled) {
            return;
        }
        if (done) {
            UnsignalledExceptions.onErrorDropped(e);
            return;
        }
        done = true;
        enqueue(Message.error(e));
    }

    @Override
    public final void onComplete() {
        if (cancelled || done) {
            return;
        }
        done = true;
        enqueue(Message.complete());
    }

    final void enqueue(Message<T> m) {
        try {
            if (!channel.put(m)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while handing {} to the bridge worker, disposing the subscription", m);
            unsubscribe();
            return;
        }
        if (PENDING.getAndIncrement(this) == 0) {
            scheduleNext();
        }
    }

    final void scheduleNext() {
        Scheduler.Worker w = worker;
        long spacing = spacingNanos();
        Subscription task = spacing > 0L ? w.schedule(this, spacing, TimeUnit.NANOSECONDS) : w.schedule(this);
        if (task == Scheduler.REJECTED && !cancelled) {
            cancelled = true;
            channel.close();
            disposeUpstream();
            w.shutdown();
            LOG.warn("The scheduler rejected the bridge worker: {}", this);
            actual.onError(new RejectedExecutionException("The scheduler rejected the bridge worker"));
        }
    }

    @Override
    public final void run() {
        if (cancelled) {
            return;
        }
        Message<T> m = channel.poll();
        if (m == null) {
            return;
        }
        if (!deliver(m)) {
            channel.close();
            Scheduler.Worker w = worker;
            if (w != null) {
                w.shutdown();
            }
            LOG.debug("Bridge worker stopped: {}", this);
            return;
        }
        if (PENDING.decrementAndGet(this) != 0) {
            scheduleNext();
        }
    }

    /**
     * Forwards one message downstream.
     *
     * @param m the message
     * @return false if the bridge is finished
     */
    final boolean deliver(Message<T> m) {
        try {
            switch (m.kind) {
                case DATA:
                    actual.onNext(m.value);
                    return !cancelled;
                case ERROR:
                    actual.onError(m.error);
                    return false;
                default:
                    actual.onComplete();
                    return false;
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            LOG.error("Delivery failed on the bridge worker", e);
            if (!cancelled && m.kind == Message.Kind.DATA) {
                cancelled = true;
                channel.close();
                disposeUpstream();
                try {
                    actual.onError(e);
                } catch (VirtualMachineError ex) {
                    throw ex;
                } catch (Throwable ex) {
                    UnsignalledExceptions.onErrorDropped(ex, e);
                }
            }
            return false;
        }
    }

    @Override
    public void unsubscribe() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        channel.close();
        disposeUpstream();
        Scheduler.Worker w = worker;
        if (w != null) {
            w.shutdown();
        }
    }

    @Override
    public final boolean isDisposed() {
        return cancelled;
    }

    /**
     * A tagged event.
     *
     * @param <T> the value type
     */
    static final class Message<T> {
        enum Kind { DATA, ERROR, COMPLETE }

        final Kind kind;

        final T value;

        final Throwable error;

        Message(Kind kind, T value, Throwable error) {
            this.kind = kind;
            this.value = value;
            this.error = error;
        }

        static <T> Message<T> data(T value) {
            return new Message<>(Kind.DATA, value, null);
        }

        static <T> Message<T> error(Throwable e) {
            return new Message<>(Kind.ERROR, null, e);
        }

        static <T> Message<T> complete() {
            return new Message<>(Kind.COMPLETE, null, null);
        }

        @Override
        public String toString() {
            return kind + (kind == Kind.DATA ? "(" + value + ")" : kind == Kind.ERROR ? "(" + error + ")" : "");
        }
    }

    /**
     * The proxied source of a bridge: starts the worker of the bridge actor,
     * then has the bridge subscribe itself upstream.
     *
     * @param <T> the value type
     */
    static final class BridgeObservable<T> extends ObservableSource<T, T> {

        BridgeObservable(Observable<? extends T> source) {
            super(source);
        }

        @Override
        public Class<?> type() {
            return source.type();
        }

        @Override
        protected Subscription onSubscribe(Actor<? super T> actor) {
            if (!(actor instanceof BridgeActor)) {
                throw new IllegalArgumentException("A bridge source expects the actor of its bridge but got " + actor);
            }
            @SuppressWarnings("unchecked")
            BridgeActor<T> bridge = (BridgeActor<T>) actor;
            bridge.start();
            bridge.subscribeUpstream(source);
            return bridge;
        }
    }
}
