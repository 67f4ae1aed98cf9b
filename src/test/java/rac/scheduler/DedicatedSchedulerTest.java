package rac.scheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Assert;
import org.junit.Test;

import rac.flow.Subscription;

public class DedicatedSchedulerTest {

    @Test
    public void runsOnNamedDaemonThread() throws Exception {
        Scheduler.Worker w = new DedicatedScheduler("test-worker", true).createWorker();
        try {
            AtomicReference<Thread> thread = new AtomicReference<>();
            CountDownLatch cdl = new CountDownLatch(1);

            w.schedule(() -> {
                thread.set(Thread.currentThread());
                cdl.countDown();
            });

            Assert.assertTrue(cdl.await(5, TimeUnit.SECONDS));
            Assert.assertNotSame(Thread.currentThread(), thread.get());
            Assert.assertTrue(thread.get().getName(), thread.get().getName().startsWith("test-worker-"));
            Assert.assertTrue(thread.get().isDaemon());
        } finally {
            w.shutdown();
        }
    }

    @Test
    public void tasksRunInOrder() throws Exception {
        Scheduler.Worker w = Schedulers.dedicated().createWorker();
        try {
            List<Integer> list = new ArrayList<>();
            CountDownLatch cdl = new CountDownLatch(1);

            for (int i = 0; i < 100; i++) {
                int j = i;
                w.schedule(() -> list.add(j));
            }
            w.schedule(cdl::countDown);

            Assert.assertTrue(cdl.await(5, TimeUnit.SECONDS));
            Assert.assertEquals(100, list.size());
            for (int i = 0; i < 100; i++) {
                Assert.assertEquals(i, list.get(i).intValue());
            }
        } finally {
            w.shutdown();
        }
    }

    @Test
    public void workersUseDistinctThreads() throws Exception {
        Scheduler.Worker w1 = Schedulers.dedicated().createWorker();
        Scheduler.Worker w2 = Schedulers.dedicated().createWorker();
        try {
            AtomicReference<Thread> t1 = new AtomicReference<>();
            AtomicReference<Thread> t2 = new AtomicReference<>();
            CountDownLatch cdl = new CountDownLatch(2);

            w1.schedule(() -> {
                t1.set(Thread.currentThread());
                cdl.countDown();
            });
            w2.schedule(() -> {
                t2.set(Thread.currentThread());
                cdl.countDown();
            });

            Assert.assertTrue(cdl.await(5, TimeUnit.SECONDS));
            Assert.assertNotSame(t1.get(), t2.get());
        } finally {
            w1.shutdown();
            w2.shutdown();
        }
    }

    @Test
    public void delayedTaskWaits() throws Exception {
        Scheduler.Worker w = Schedulers.dedicated().createWorker();
        try {
            CountDownLatch cdl = new CountDownLatch(1);
            long start = System.nanoTime();

            w.schedule(cdl::countDown, 50, TimeUnit.MILLISECONDS);

            Assert.assertTrue(cdl.await(5, TimeUnit.SECONDS));
            Assert.assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50));
        } finally {
            w.shutdown();
        }
    }

    @Test
    public void cancelledDelayedTaskDoesNotRun() throws Exception {
        Scheduler.Worker w = Schedulers.dedicated().createWorker();
        try {
            AtomicInteger count = new AtomicInteger();

            Subscription s = w.schedule(count::incrementAndGet, 100, TimeUnit.MILLISECONDS);
            s.unsubscribe();

            Thread.sleep(250);

            Assert.assertEquals(0, count.get());
            Assert.assertTrue(s.isDisposed());
        } finally {
            w.shutdown();
        }
    }

    @Test
    public void shutdownRejectsAndCancelsPending() throws Exception {
        Scheduler.Worker w = Schedulers.dedicated().createWorker();
        AtomicInteger count = new AtomicInteger();

        w.schedule(count::incrementAndGet, 100, TimeUnit.MILLISECONDS);
        w.shutdown();
        w.shutdown();

        Assert.assertTrue(w.isShutdown());
        Assert.assertSame(Scheduler.REJECTED, w.schedule(count::incrementAndGet));
        Assert.assertSame(Scheduler.REJECTED, w.schedule(count::incrementAndGet, 10, TimeUnit.MILLISECONDS));

        Thread.sleep(250);

        Assert.assertEquals(0, count.get());
    }
}
