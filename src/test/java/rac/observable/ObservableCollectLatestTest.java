package rac.observable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import rac.flow.Subscription;
import rac.subject.DirectSubject;
import rac.test.TestActor;

public class ObservableCollectLatestTest {

    @Test
    public void justAndRange() {
        TestActor<List<Integer>> ts = new TestActor<>();

        Observable.<Integer>collectLatest(Observable.of(1), Observable.from(1, 2)).subscribe(ts);

        ts.assertResult(Arrays.asList(1, 1), Arrays.asList(1, 2));
    }

    @Test
    public void emptyListCompletes() {
        TestActor<List<Integer>> ts = new TestActor<>();

        Observable.<Integer>collectLatest(Collections.<Observable<Integer>>emptyList()).subscribe(ts);

        ts.assertResult();
    }

    @Test
    public void waitsForEverySlot() {
        DirectSubject<Integer> a = new DirectSubject<>();
        DirectSubject<Integer> b = new DirectSubject<>();
        TestActor<List<Integer>> ts = new TestActor<>();

        Observable.<Integer>collectLatest(a, b).subscribe(ts);

        a.onNext(1);
        a.onNext(2);
        ts.assertNoValues();

        b.onNext(10);
        ts.assertValues(Arrays.asList(2, 10));

        a.onNext(3);
        ts.assertValueCount(1);

        b.onNext(20);
        ts.assertValues(Arrays.asList(2, 10), Arrays.asList(3, 20));
        ts.assertNotComplete();
    }

    @Test
    public void completedSlotKeepsItsValue() {
        DirectSubject<Integer> a = new DirectSubject<>();
        DirectSubject<Integer> b = new DirectSubject<>();
        TestActor<List<Integer>> ts = new TestActor<>();

        Observable.<Integer>collectLatest(a, b).subscribe(ts);

        a.onNext(1);
        a.onComplete();
        b.onNext(10);
        b.onNext(20);
        ts.assertValues(Arrays.asList(1, 10), Arrays.asList(1, 20)).assertNotComplete();

        b.onComplete();
        ts.assertComplete();
    }

    @Test
    public void slotCompletingWithoutValueCompletes() {
        DirectSubject<Integer> a = new DirectSubject<>();
        DirectSubject<Integer> b = new DirectSubject<>();
        TestActor<List<Integer>> ts = new TestActor<>();

        Observable.<Integer>collectLatest(a, b).subscribe(ts);

        a.onComplete();

        ts.assertResult();
        Assert.assertFalse(b.hasActors());
    }

    @Test
    public void errorDisposesOtherSlots() {
        DirectSubject<Integer> a = new DirectSubject<>();
        DirectSubject<Integer> b = new DirectSubject<>();
        TestActor<List<Integer>> ts = new TestActor<>();

        Observable.<Integer>collectLatest(a, b).subscribe(ts);

        a.onError(new IllegalStateException("forced failure"));

        ts.assertFailure(IllegalStateException.class);
        Assert.assertFalse(b.hasActors());
    }

    @Test
    public void failingFirstSourceSkipsTheRest() {
        DirectSubject<Integer> b = new DirectSubject<>();
        TestActor<List<Integer>> ts = new TestActor<>();

        Observable.<Integer>collectLatest(Observable.<Integer>faulted(new RuntimeException()), b).subscribe(ts);

        ts.assertFailure(RuntimeException.class);
        Assert.assertFalse(b.hasActors());
    }

    @Test
    public void mapperIsApplied() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.<Integer, Integer>collectLatest(Arrays.asList(Observable.of(1), Observable.from(2, 3)),
                list -> list.get(0) + list.get(1)).subscribe(ts);

        ts.assertResult(3, 4);
    }

    @Test
    public void unsubscribeDisposesEverySlot() {
        DirectSubject<Integer> a = new DirectSubject<>();
        DirectSubject<Integer> b = new DirectSubject<>();
        TestActor<List<Integer>> ts = new TestActor<>();

        Subscription s = Observable.<Integer>collectLatest(a, b).subscribe(ts);
        s.unsubscribe();

        Assert.assertFalse(a.hasActors());
        Assert.assertFalse(b.hasActors());
        Assert.assertTrue(s.isDisposed());
    }
}
