package rac.actor;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import rac.flow.Actor;
import rac.flow.ActorTrait;
import rac.flow.CompletionActor;
import rac.flow.ErrorActor;
import rac.flow.NextActor;
import rac.test.TestActor;
import rac.util.InconsistentDataTypeException;
import rac.util.InvalidActorException;

public class ActorsTest {

    static final class NextAndError implements NextActor<Integer>, ErrorActor<Integer> {
        @Override
        public void onNext(Integer t) {
        }

        @Override
        public void onError(Throwable e) {
        }
    }

    static final class AllThree implements NextActor<Integer>, ErrorActor<Integer>, CompletionActor<Integer> {
        final List<Object> events = new ArrayList<>();

        @Override
        public void onNext(Integer t) {
            events.add(t);
        }

        @Override
        public void onError(Throwable e) {
            events.add(e);
        }

        @Override
        public void onComplete() {
            events.add("complete");
        }
    }

    @Test
    public void classifyTraits() {
        NextActor<Integer> n = v -> { };
        ErrorActor<Integer> e = ex -> { };
        CompletionActor<Integer> c = () -> { };

        Assert.assertEquals(ActorTrait.BASE, Actors.classify(new TestActor<Integer>()).trait());
        Assert.assertEquals(ActorTrait.BASE, Actors.classify(new AllThree()).trait());
        Assert.assertEquals(ActorTrait.NEXT, Actors.classify(n).trait());
        Assert.assertEquals(ActorTrait.ERROR, Actors.classify(e).trait());
        Assert.assertEquals(ActorTrait.COMPLETION, Actors.classify(c).trait());
    }

    @Test
    public void classifyInvalid() {
        Assert.assertEquals(ActorTrait.INVALID, Actors.classify(null).trait());
        Assert.assertEquals(ActorTrait.INVALID, Actors.classify("not an actor").trait());
        Assert.assertEquals(ActorTrait.INVALID, Actors.classify(new NextAndError()).trait());
        Assert.assertFalse(Actors.classify(null).trait().isValid());
    }

    @Test
    public void classifyType() {
        ActorType at = Actors.classify(new TestActor<Integer>(Integer.class));

        Assert.assertEquals(Integer.class, at.type());
        Assert.assertTrue(at.isTyped());
        Assert.assertTrue(at.accepts(Integer.class));
        Assert.assertFalse(at.accepts(String.class));

        Assert.assertFalse(Actors.classify(new TestActor<Integer>()).isTyped());
    }

    @Test
    public void primitiveDeclaredTypeMeansItsWrapper() {
        TestActor<Object> ts = new TestActor<>(int.class);
        ActorType at = Actors.classify(ts);

        Assert.assertEquals(Integer.class, at.type());
        Assert.assertTrue(at.accepts(Integer.class));
        Assert.assertTrue(at.accepts(int.class));
        Assert.assertFalse(at.accepts(Long.class));

        Actors.next(ts, 1);

        Actor<Object> a = Actors.conform(ts, Object.class);
        a.onNext(2);
        Assert.assertSame(ts, Actors.conform(ts, Integer.class));

        ts.assertValues(1, 2);
    }

    @Test
    public void deliveryPrimitives() {
        TestActor<Integer> ts = new TestActor<>(Integer.class);

        Actors.next(ts, 1);
        Actors.next(ts, 2);
        Actors.complete(ts);

        ts.assertResult(1, 2);
    }

    @Test
    public void errorPrimitive() {
        TestActor<Integer> ts = new TestActor<>();
        IllegalStateException ex = new IllegalStateException("forced failure");

        Actors.error(ts, ex);

        ts.assertNoValues()
          .assertNotComplete()
          .assertError(ex);
    }

    @Test
    public void nextTypeMismatchHasNoSideEffect() {
        TestActor<Object> ts = new TestActor<>(Integer.class);

        try {
            Actors.next(ts, "one");
            Assert.fail("Should have thrown");
        } catch (InconsistentDataTypeException ex) {
            Assert.assertEquals(Integer.class, ex.expected());
            Assert.assertEquals(String.class, ex.found());
        }

        ts.assertNoEvents();
    }

    @Test(expected = InvalidActorException.class)
    public void nextToInvalid() {
        Actors.next("not an actor", 1);
    }

    @Test(expected = InvalidActorException.class)
    public void errorToInvalid() {
        Actors.error(null, new RuntimeException());
    }

    @Test(expected = InvalidActorException.class)
    public void completeToInvalid() {
        Actors.complete(new Object());
    }

    @Test
    public void capabilityDispatch() {
        List<Object> events = new ArrayList<>();
        NextActor<Integer> n = events::add;
        CompletionActor<Integer> c = () -> events.add("complete");

        Actors.next(n, 1);
        Actors.complete(n);
        Actors.error(n, new RuntimeException());
        Actors.complete(c);
        Actors.next(c, 2);

        Assert.assertEquals(2, events.size());
        Assert.assertEquals(1, events.get(0));
        Assert.assertEquals("complete", events.get(1));
    }

    @Test
    public void conformKnownCompatibleIsUnwrapped() {
        TestActor<Number> ts = new TestActor<>(Number.class);

        Actor<Integer> a = Actors.conform(ts, Integer.class);

        Assert.assertSame(ts, a);
    }

    @Test(expected = InconsistentDataTypeException.class)
    public void conformKnownIncompatible() {
        Actors.conform(new TestActor<String>(String.class), Integer.class);
    }

    @Test
    public void conformUnknownSourceChecksEachValue() {
        TestActor<Object> ts = new TestActor<>(Integer.class);

        Actor<Object> a = Actors.conform(ts, Object.class);

        Assert.assertNotSame(ts, a);

        a.onNext(1);
        try {
            a.onNext("two");
            Assert.fail("Should have thrown");
        } catch (InconsistentDataTypeException expected) {
            // expected
        }
        a.onComplete();

        ts.assertResult(1);
    }

    @Test
    public void conformCapabilities() {
        AllThree all = new AllThree();
        Actor<Integer> a = Actors.conform(all, Integer.class);

        a.onNext(1);
        a.onComplete();

        Assert.assertEquals(2, all.events.size());

        List<Object> events = new ArrayList<>();
        ErrorActor<Integer> e = events::add;
        Actor<Integer> b = Actors.conform(e, Integer.class);

        b.onNext(1);
        b.onComplete();
        RuntimeException ex = new RuntimeException();
        b.onError(ex);

        Assert.assertEquals(1, events.size());
        Assert.assertSame(ex, events.get(0));
    }

    @Test(expected = InvalidActorException.class)
    public void conformInvalid() {
        Actors.conform(new NextAndError(), Integer.class);
    }
}
