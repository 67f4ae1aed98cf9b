package rac.scheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class ExecutorSchedulerTest {

    ScheduledExecutorService exec;

    @Before
    public void before() {
        exec = Executors.newScheduledThreadPool(4);
    }

    @After
    public void after() {
        exec.shutdownNow();
    }

    @Test
    public void workerTasksNeverOverlap() throws Exception {
        Scheduler.Worker w = Schedulers.fromExecutorService(exec).createWorker();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger overlaps = new AtomicInteger();
        AtomicInteger counter = new AtomicInteger();
        CountDownLatch cdl = new CountDownLatch(1000);

        for (int i = 0; i < 1000; i++) {
            w.schedule(() -> {
                if (running.incrementAndGet() != 1) {
                    overlaps.incrementAndGet();
                }
                counter.incrementAndGet();
                running.decrementAndGet();
                cdl.countDown();
            });
        }

        Assert.assertTrue(cdl.await(5, TimeUnit.SECONDS));
        Assert.assertEquals(0, overlaps.get());
        Assert.assertEquals(1000, counter.get());
        w.shutdown();
    }

    @Test
    public void workerShutdownKeepsSharedExecutor() {
        Scheduler scheduler = Schedulers.fromExecutorService(exec);
        Scheduler.Worker w = scheduler.createWorker();

        w.shutdown();

        Assert.assertTrue(w.isShutdown());
        Assert.assertFalse(exec.isShutdown());
        Assert.assertFalse(scheduler.createWorker().isShutdown());
    }

    @Test
    public void failingTaskDoesNotStopWorker() throws Exception {
        Scheduler.Worker w = Schedulers.fromExecutorService(exec).createWorker();
        CountDownLatch cdl = new CountDownLatch(1);

        w.schedule(() -> {
            throw new IllegalStateException("forced failure");
        });
        w.schedule(cdl::countDown);

        Assert.assertTrue(cdl.await(5, TimeUnit.SECONDS));
        w.shutdown();
    }

    @Test
    public void schedulerShutdownStopsExecutor() {
        Scheduler scheduler = Schedulers.fromExecutorService(exec);

        scheduler.shutdown();

        Assert.assertTrue(exec.isShutdown());
    }
}
