package rac.scheduler;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rac.util.RacConfig;

/**
 * A Scheduler that gives every worker its own new thread; the thread ends when
 * the worker is shut down and its running task returned.
 */
public final class DedicatedScheduler implements Scheduler, ThreadFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DedicatedScheduler.class);

    static final AtomicLong COUNTER = new AtomicLong();

    final String prefix;

    final boolean daemon;

    public DedicatedScheduler() {
        this(RacConfig.WORKER_PREFIX, RacConfig.WORKER_DAEMON);
    }

    public DedicatedScheduler(String prefix, boolean daemon) {
        this.prefix = prefix;
        this.daemon = daemon;
    }

    @Override
    public Worker createWorker() {
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(1, this);
        exec.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        exec.setRemoveOnCancelPolicy(true);
        return new ExecutorScheduler.ExecutorWorker(exec, true);
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, prefix + "-" + COUNTER.incrementAndGet());
        t.setDaemon(daemon);
        LOG.debug("Starting worker thread {}", t.getName());
        return t;
    }
}
