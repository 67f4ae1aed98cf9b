package rac.observable;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.scheduler.Scheduler;

/**
 * Emits {@code 0L} after a delay on a worker of the given Scheduler, then
 * completes. The worker is shut down once the timer fired or the handle was
 * disposed.
 */
final class ObservableTimer extends Observable<Long> {

    final long delay;

    final TimeUnit unit;

    final Scheduler scheduler;

    ObservableTimer(long delay, TimeUnit unit, Scheduler scheduler) {
        this.delay = delay;
        this.unit = Objects.requireNonNull(unit, "unit");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public Class<?> type() {
        return Long.class;
    }

    @Override
    protected Subscription onSubscribe(Actor<? super Long> actor) {
        Scheduler.Worker worker = scheduler.createWorker();
        TimerRunnable r = new TimerRunnable(actor, worker);
        if (worker.schedule(r, delay, unit) == Scheduler.REJECTED) {
            worker.shutdown();
            actor.onError(new IllegalStateException("The scheduler rejected the timer"));
        }
        return r;
    }

    static final class TimerRunnable implements Runnable, Subscription {
        final Actor<? super Long> actual;

        final Scheduler.Worker worker;

        volatile boolean cancelled;

        TimerRunnable(Actor<? super Long> actual, Scheduler.Worker worker) {
            this.actual = actual;
            this.worker = worker;
        }

        @Override
        public void run() {
            try {
                if (!cancelled) {
                    actual.onNext(0L);
                    if (!cancelled) {
                        actual.onComplete();
                    }
                }
            } finally {
                worker.shutdown();
            }
        }

        @Override
        public void unsubscribe() {
            if (!cancelled) {
                cancelled = true;
                worker.shutdown();
            }
        }

        @Override
        public boolean isDisposed() {
            return cancelled;
        }
    }
}
