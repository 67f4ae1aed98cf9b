package rac.operator;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import rac.flow.Actor;
import rac.observable.Observable;
import rac.proxy.ActorSourceProxy;
import rac.proxy.ProxyObservable;
import rac.scheduler.Scheduler;
import rac.util.Channel;

/**
 * Delivers the events of the source on a worker of its own, waiting the delay
 * before taking each queued event: a burst of events comes out one delay apart.
 * The producer never blocks.
 *
 * @param <T> the value type
 */
final class OperatorDelay<T> implements Operator<T, T>, ActorSourceProxy<T> {

    final long delayMillis;

    final Scheduler scheduler;

    OperatorDelay(long delayMillis, Scheduler scheduler) {
        if (delayMillis < 0L) {
            throw new IllegalArgumentException("delayMillis >= 0 required but it was " + delayMillis);
        }
        this.delayMillis = delayMillis;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public Observable<T> apply(Observable<T> source) {
        return ProxyObservable.of(source, this);
    }

    @Override
    public Actor<? super T> proxyActor(Actor<? super T> downstream) {
        return new DelayActor<>(downstream, TimeUnit.MILLISECONDS.toNanos(delayMillis), scheduler);
    }

    @Override
    public Observable<T> proxySource(Observable<? extends T> source) {
        return new BridgeActor.BridgeObservable<>(source);
    }

    static final class DelayActor<T> extends BridgeActor<T> {
        final long delayNanos;

        DelayActor(Actor<? super T> actual, long delayNanos, Scheduler scheduler) {
            super(actual, Channel.unbounded(), scheduler);
            this.delayNanos = delayNanos;
        }

        @Override
        long spacingNanos() {
            return delayNanos;
        }
    }
}
