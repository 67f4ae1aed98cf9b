package rac.observable;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Assert;
import org.junit.Test;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;

import rac.flow.Subscription;
import rac.test.TestActor;

public class ObservablePublisherTest {

    /** Emits values when told to, recording requests and cancellation. */
    static final class ManualPublisher implements Publisher<Integer> {
        final AtomicLong requested = new AtomicLong();
        final AtomicBoolean cancelled = new AtomicBoolean();
        final AtomicReference<Subscriber<? super Integer>> subscriber = new AtomicReference<>();

        @Override
        public void subscribe(Subscriber<? super Integer> s) {
            subscriber.set(s);
            s.onSubscribe(new org.reactivestreams.Subscription() {
                @Override
                public void request(long n) {
                    requested.addAndGet(n);
                }

                @Override
                public void cancel() {
                    cancelled.set(true);
                }
            });
        }
    }

    @Test
    public void requestsEverythingAndForwards() {
        ManualPublisher pub = new ManualPublisher();
        TestActor<Integer> ts = new TestActor<>();

        Observable.fromPublisher(Integer.class, pub).subscribe(ts);

        Assert.assertEquals(Long.MAX_VALUE, pub.requested.get());

        pub.subscriber.get().onNext(1);
        pub.subscriber.get().onNext(2);
        pub.subscriber.get().onComplete();

        ts.assertResult(1, 2);
    }

    @Test
    public void errorIsForwarded() {
        ManualPublisher pub = new ManualPublisher();
        TestActor<Integer> ts = new TestActor<>();

        Observable.fromPublisher(pub).subscribe(ts);
        pub.subscriber.get().onError(new IllegalStateException("forced failure"));

        ts.assertFailure(IllegalStateException.class);
    }

    @Test
    public void unsubscribeCancels() {
        ManualPublisher pub = new ManualPublisher();
        TestActor<Integer> ts = new TestActor<>();

        Subscription s = Observable.fromPublisher(pub).subscribe(ts);
        pub.subscriber.get().onNext(1);

        s.unsubscribe();

        Assert.assertTrue(pub.cancelled.get());
        Assert.assertTrue(s.isDisposed());

        pub.subscriber.get().onNext(2);
        ts.assertIncomplete(1);
    }
}
