package rac.observable;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.util.UnsignalledExceptions;

/**
 * Subscribes to a Reactive Streams {@link Publisher}, requests everything and
 * forwards the signals; disposing the handle cancels the Reactive Streams
 * subscription.
 *
 * @param <T> the value type
 */
final class ObservablePublisher<T> extends Observable<T> {

    final Class<?> type;

    final Publisher<? extends T> publisher;

    ObservablePublisher(Class<?> type, Publisher<? extends T> publisher) {
        this.type = Objects.requireNonNull(type, "type");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public Class<?> type() {
        return type;
    }

    @Override
    protected Subscription onSubscribe(Actor<? super T> actor) {
        PublisherActor<T> parent = new PublisherActor<>(actor);
        publisher.subscribe(parent);
        return parent;
    }

    static final class PublisherActor<T> implements Subscriber<T>, Subscription {

        static final org.reactivestreams.Subscription CANCELLED = new org.reactivestreams.Subscription() {
            @Override
            public void request(long n) {
                // cancelled
            }

            @Override
            public void cancel() {
                // cancelled
            }
        };

        final Actor<? super T> actual;

        volatile org.reactivestreams.Subscription s;
        @SuppressWarnings("rawtypes")
        static final AtomicReferenceFieldUpdater<PublisherActor, org.reactivestreams.Subscription> S =
                AtomicReferenceFieldUpdater.newUpdater(PublisherActor.class, org.reactivestreams.Subscription.class, "s");

        boolean done;

        PublisherActor(Actor<? super T> actual) {
            this.actual = actual;
        }

        @Override
        public void onSubscribe(org.reactivestreams.Subscription s) {
            Objects.requireNonNull(s, "s");
            if (S.compareAndSet(this, null, s)) {
                s.request(Long.MAX_VALUE);
            } else {
                s.cancel();
            }
        }

        @Override
        public void onNext(T t) {
            if (s == CANCELLED) {
                return;
            }
            if (done) {
                UnsignalledExceptions.onNextDropped(t);
                return;
            }
            actual.onNext(t);
        }

        @Override
        public void onError(Throwable t) {
            if (s == CANCELLED) {
                return;
            }
            if (done) {
                UnsignalledExceptions.onErrorDropped(t);
                return;
            }
            done = true;
            actual.onError(t);
        }

        @Override
        public void onComplete() {
            if (s == CANCELLED || done) {
                return;
            }
            done = true;
            actual.onComplete();
        }

        @Override
        public void unsubscribe() {
            org.reactivestreams.Subscription a = s;
            if (a != CANCELLED) {
                a = S.getAndSet(this, CANCELLED);
                if (a != null && a != CANCELLED) {
                    a.cancel();
                }
            }
        }

        @Override
        public boolean isDisposed() {
            return s == CANCELLED;
        }
    }
}
