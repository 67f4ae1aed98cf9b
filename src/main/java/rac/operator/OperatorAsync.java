package rac.operator;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.observable.Observable;
import rac.proxy.ActorSourceProxy;
import rac.proxy.ProxyObservable;
import rac.scheduler.Scheduler;
import rac.scheduler.Schedulers;
import rac.util.Channel;

/**
 * Hands the events of the source to a worker of its own through a single slot:
 * the producer waits until the worker took the previous event.
 * <p>
 * The source is subscribed on a thread of its own, so {@code subscribe} returns
 * without waiting for a synchronous producer.
 *
 * @param <T> the value type
 */
final class OperatorAsync<T> implements Operator<T, T>, ActorSourceProxy<T> {

    final Scheduler scheduler;

    OperatorAsync(Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public Observable<T> apply(Observable<T> source) {
        return ProxyObservable.of(source, this);
    }

    @Override
    public Actor<? super T> proxyActor(Actor<? super T> downstream) {
        return new AsyncActor<>(downstream, scheduler);
    }

    @Override
    public Observable<T> proxySource(Observable<? extends T> source) {
        return new BridgeActor.BridgeObservable<>(source);
    }

    static final class AsyncActor<T> extends BridgeActor<T> {

        private static final Logger LOG = LoggerFactory.getLogger(AsyncActor.class);

        volatile Scheduler.Worker producer;

        AsyncActor(Actor<? super T> actual, Scheduler scheduler) {
            super(actual, Channel.handOff(), scheduler);
        }

        @Override
        long spacingNanos() {
            return 0L;
        }

        @Override
        void subscribeUpstream(Observable<? extends T> source) {
            Scheduler.Worker p = Schedulers.dedicated().createWorker();
            producer = p;
            if (cancelled) {
                p.shutdown();
                return;
            }
            Subscription task = p.schedule(() -> {
                try {
                    onUpstream(source.subscribe(this));
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (Throwable e) {
                    LOG.error("Subscribing the source of an async bridge failed", e);
                    onError(e);
                } finally {
                    p.shutdown();
                }
            });
            if (task == Scheduler.REJECTED) {
                onError(new RejectedExecutionException("The producer worker rejected the subscription"));
            }
        }

        @Override
        public void unsubscribe() {
            super.unsubscribe();
            Scheduler.Worker p = producer;
            if (p != null) {
                p.shutdown();
            }
        }
    }
}
