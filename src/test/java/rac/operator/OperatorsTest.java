package rac.operator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import rac.flow.Actor;
import rac.flow.Subscription;
import rac.observable.Observable;
import rac.subject.DirectSubject;
import rac.test.TestActor;
import rac.util.InconsistentDataTypeException;

public class OperatorsTest {

    @Test
    public void map() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.from(1, 2, 3).pipe(Operators.<Integer, Integer>map(v -> v * 10)).subscribe(ts);

        ts.assertResult(10, 20, 30);
    }

    @Test
    public void mapDeclaresType() {
        Observable<String> o = Observable.from(1, 2).pipe(Operators.<Integer, String>map(String.class, v -> "#" + v));

        Assert.assertEquals(String.class, o.type());
        Assert.assertEquals(Object.class,
                Observable.from(1, 2).pipe(Operators.<Integer, String>map(v -> "#" + v)).type());

        TestActor<String> ts = new TestActor<>(String.class);
        o.subscribe(ts);
        ts.assertResult("#1", "#2");
    }

    @Test
    public void mapperFailureDisposesSource() {
        DirectSubject<Integer> subject = new DirectSubject<>();
        TestActor<Integer> ts = new TestActor<>();

        subject.pipe(Operators.<Integer, Integer>map(v -> {
            if (v == 2) {
                throw new IllegalStateException("forced failure");
            }
            return v;
        })).subscribe(ts);

        subject.onNext(1);
        subject.onNext(2);
        subject.onNext(3);

        ts.assertFailure(IllegalStateException.class, 1);
        Assert.assertFalse(subject.hasActors());
    }

    @Test
    public void mapperReturnsNull() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.from(1, 2).pipe(Operators.<Integer, Integer>map(v -> null)).subscribe(ts);

        ts.assertFailure(NullPointerException.class);
    }

    @Test
    public void filter() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.from(1, 2, 3, 4, 5, 6).pipe(Operators.<Integer>filter(v -> v % 2 == 0)).subscribe(ts);

        ts.assertResult(2, 4, 6);
    }

    @Test
    public void filterKeepsType() {
        Assert.assertEquals(Integer.class, Observable.from(1, 2).pipe(Operators.<Integer>filter(v -> true)).type());
    }

    @Test
    public void scanEmitsIntermediateResults() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.from(1, 2, 3, 4).pipe(Operators.<Integer, Integer>scan(0, (a, b) -> a + b)).subscribe(ts);

        ts.assertResult(1, 3, 6, 10);
    }

    @Test
    public void scanIsFreshPerSubscription() {
        Observable<Integer> o = Observable.from(1, 2).pipe(Operators.<Integer, Integer>scan(10, (a, b) -> a + b));

        TestActor<Integer> ts1 = new TestActor<>();
        TestActor<Integer> ts2 = new TestActor<>();
        o.subscribe(ts1);
        o.subscribe(ts2);

        ts1.assertResult(11, 13);
        ts2.assertResult(11, 13);
    }

    @Test
    public void tapSeesEveryEvent() {
        List<String> events = new ArrayList<>();
        TestActor<Integer> ts = new TestActor<>();

        Observable.from(1, 2).pipe(Operators.<Integer>tap(v -> events.add("next " + v), e -> events.add("error"),
                () -> events.add("complete"))).subscribe(ts);

        ts.assertResult(1, 2);
        Assert.assertEquals(Arrays.asList("next 1", "next 2", "complete"), events);
    }

    @Test
    public void tapSeesError() {
        List<Throwable> errors = new ArrayList<>();
        TestActor<Integer> ts = new TestActor<>();
        IllegalStateException ex = new IllegalStateException("forced failure");

        Observable.<Integer>faulted(ex).pipe(Operators.<Integer>tap(null, errors::add, null)).subscribe(ts);

        ts.assertFailure(IllegalStateException.class);
        Assert.assertEquals(Arrays.<Throwable>asList(ex), errors);
    }

    @Test
    public void tapFailureBecomesError() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.from(1, 2).pipe(Operators.<Integer>tap(v -> {
            throw new IllegalArgumentException();
        })).subscribe(ts);

        ts.assertFailure(IllegalArgumentException.class);
    }

    @Test(expected = NullPointerException.class)
    public void tapNeedsACallback() {
        Operators.<Integer>tap(null, null, null);
    }

    @Test
    public void enumerateCountsFromOne() {
        TestActor<Enumerated<Integer>> ts = new TestActor<>();

        Observable.from(3, 2, 1).pipe(Operators.<Integer>enumerate()).subscribe(ts);

        ts.assertResult(new Enumerated<>(3, 1), new Enumerated<>(2, 2), new Enumerated<>(1, 3));
        Assert.assertEquals("(3, 1)", ts.values().get(0).toString());
        Assert.assertEquals(Integer.valueOf(3), ts.values().get(0).value());
        Assert.assertEquals(1L, ts.values().get(0).index());
    }

    @Test
    public void errorIfEmptyPassesValues() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.from(1, 2).pipe(Operators.<Integer>errorIfEmpty(IllegalStateException::new)).subscribe(ts);

        ts.assertResult(1, 2);
    }

    @Test
    public void errorIfEmptySignalsError() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.<Integer>completed()
                .pipe(Operators.<Integer>errorIfEmpty(() -> new IllegalStateException("empty")))
                .subscribe(ts);

        ts.assertFailure(IllegalStateException.class).assertErrorMessage("empty");
    }

    @Test
    public void errorIfEmptyForwardsSourceError() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.<Integer>faulted(new IllegalArgumentException())
                .pipe(Operators.<Integer>errorIfEmpty(IllegalStateException::new))
                .subscribe(ts);

        ts.assertFailure(IllegalArgumentException.class);
    }

    @Test
    public void catchErrorSwitchesToFallback() {
        DirectSubject<Integer> subject = new DirectSubject<>();
        TestActor<Integer> ts = new TestActor<>();

        subject.pipe(Operators.<Integer>catchError((e, src) -> Observable.from(10, 20))).subscribe(ts);

        subject.onNext(1);
        subject.onError(new IllegalStateException());

        ts.assertResult(1, 10, 20);
    }

    @Test
    public void catchErrorCanResubscribeSource() {
        int[] attempts = { 0 };
        Observable<Integer> source = Observable.defer(() -> {
            if (attempts[0]++ == 0) {
                return Observable.faulted(new IllegalStateException());
            }
            return Observable.from(1, 2);
        });
        TestActor<Integer> ts = new TestActor<>();

        source.pipe(Operators.<Integer>catchError((e, src) -> src)).subscribe(ts);

        ts.assertResult(1, 2);
        Assert.assertEquals(2, attempts[0]);
    }

    @Test
    public void catchErrorHandlerFailure() {
        TestActor<Integer> ts = new TestActor<>();

        Observable.<Integer>faulted(new IllegalStateException())
                .pipe(Operators.<Integer>catchError((e, src) -> {
                    throw new IllegalArgumentException();
                }))
                .subscribe(ts);

        ts.assertFailure(IllegalArgumentException.class);
    }

    @Test
    public void catchErrorUnsubscribeDisposesFallback() {
        DirectSubject<Integer> subject = new DirectSubject<>();
        DirectSubject<Integer> fallback = new DirectSubject<>();
        TestActor<Integer> ts = new TestActor<>();

        Subscription s = subject.pipe(Operators.<Integer>catchError((e, src) -> fallback)).subscribe(ts);

        subject.onError(new IllegalStateException());
        Assert.assertTrue(fallback.hasActors());

        fallback.onNext(1);
        s.unsubscribe();
        fallback.onNext(2);

        ts.assertIncomplete(1);
        Assert.assertFalse(fallback.hasActors());
    }

    @Test
    public void safeTurnsTypeViolationIntoError() {
        TestActor<Object> ts = new TestActor<>(Integer.class);

        Observable.<Object>from(Arrays.<Object>asList("a", "b")).pipe(Operators.safe()).subscribe(ts);

        ts.assertFailure(InconsistentDataTypeException.class);
    }

    @Test
    public void safeTurnsDownstreamFailureIntoError() {
        DirectSubject<Integer> subject = new DirectSubject<>();
        TestActor<Integer> ts = new TestActor<>();

        subject.pipe(Operators.<Integer>safe()).subscribe(new Actor<Integer>() {
            @Override
            public void onNext(Integer t) {
                if (t == 2) {
                    throw new IllegalStateException("forced failure");
                }
                ts.onNext(t);
            }

            @Override
            public void onError(Throwable e) {
                ts.onError(e);
            }

            @Override
            public void onComplete() {
                ts.onComplete();
            }
        });

        subject.onNext(1);
        subject.onNext(2);
        subject.onNext(3);

        ts.assertFailure(IllegalStateException.class, 1).assertErrorMessage("forced failure");
        Assert.assertFalse(subject.hasActors());
    }

    @Test
    public void andThenComposes() {
        Operator<Integer, Integer> op = Operators.<Integer>filter(v -> v > 1)
                .andThen(Operators.<Integer, Integer>map(v -> v * 100));
        TestActor<Integer> ts = new TestActor<>();

        Observable.from(1, 2, 3).pipe(op).subscribe(ts);

        ts.assertResult(200, 300);
    }

    @Test
    public void pipeChainsOperators() {
        TestActor<String> ts = new TestActor<>();

        Observable.from(1, 2, 3, 4).pipe(
                Operators.<Integer>filter(v -> v % 2 == 0),
                Operators.<Integer, Integer>map(v -> v + 1),
                Operators.<Integer, Integer>scan(0, (a, b) -> a + b),
                Operators.<Integer, String>map(String::valueOf)).subscribe(ts);

        ts.assertResult("3", "8");
    }
}
