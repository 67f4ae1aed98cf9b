package rac.scheduler;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rac.flow.Subscription;
import rac.util.ExceptionHelper;
import rac.util.UnsignalledExceptions;

/**
 * Wraps an existing ScheduledExecutorService and provides Scheduler services over it,
 * sharing the executor among workers. Each worker trampolines its tasks so they
 * run in FIFO order and never concurrently.
 */
public final class ExecutorScheduler implements Scheduler {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorScheduler.class);

    final ScheduledExecutorService executor;

    final boolean ownsExecutor;

    public ExecutorScheduler(ScheduledExecutorService executor) {
        this(executor, false);
    }

    ExecutorScheduler(ScheduledExecutorService executor, boolean ownsExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    @Override
    public Worker createWorker() {
        return new ExecutorWorker(executor, ownsExecutor);
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }

    static final class ExecutorWorker implements Worker, Runnable {
        final ScheduledExecutorService executor;

        final boolean ownsExecutor;

        final Queue<ScheduledTask> queue;

        volatile boolean stopped;

        Set<ScheduledTask> tasks;

        volatile int wip;
        static final AtomicIntegerFieldUpdater<ExecutorWorker> WIP =
                AtomicIntegerFieldUpdater.newUpdater(ExecutorWorker.class, "wip");

        ExecutorWorker(ScheduledExecutorService executor, boolean ownsExecutor) {
            this.executor = executor;
            this.ownsExecutor = ownsExecutor;
            this.queue = new ArrayDeque<>();
            this.tasks = new HashSet<>();
        }

        @Override
        public Subscription schedule(Runnable task) {
            if (stopped) {
                return REJECTED;
            }
            ScheduledTask st = new ScheduledTask(task, this);
            synchronized (this) {
                if (stopped) {
                    return REJECTED;
                }
                queue.offer(st);
            }
            if (WIP.getAndIncrement(this) == 0) {
                try {
                    executor.execute(this);
                } catch (RejectedExecutionException ex) {
                    shutdown();
                    return REJECTED;
                }
            }
            return st;
        }

        @Override
        public Subscription schedule(Runnable task, long delay, TimeUnit unit) {
            if (delay <= 0L) {
                return schedule(task);
            }
            if (stopped) {
                return REJECTED;
            }
            ScheduledTask st = new ScheduledTask(task, this);
            synchronized (this) {
                if (stopped) {
                    return REJECTED;
                }
                tasks.add(st);
            }
            Future<?> f;
            try {
                f = executor.schedule(() -> enqueueDelayed(st), delay, unit);
            } catch (RejectedExecutionException ex) {
                shutdown();
                return REJECTED;
            }
            st.future = f;
            if (stopped) {
                f.cancel(false);
                return REJECTED;
            }
            return st;
        }

        void enqueueDelayed(ScheduledTask st) {
            synchronized (this) {
                if (stopped || tasks == null) {
                    return;
                }
                tasks.remove(st);
                queue.offer(st);
            }
            if (WIP.getAndIncrement(this) == 0) {
                run();
            }
        }

        @Override
        public void run() {
            do {
                ScheduledTask t;
                synchronized (this) {
                    t = stopped ? null : queue.poll();
                    if (stopped) {
                        queue.clear();
                    }
                }
                if (t != null) {
                    t.run();
                }
            } while (WIP.decrementAndGet(this) != 0);
        }

        @Override
        public void shutdown() {
            if (stopped) {
                return;
            }
            Set<ScheduledTask> set;
            synchronized (this) {
                if (stopped) {
                    return;
                }
                stopped = true;
                set = tasks;
                tasks = null;
                queue.clear();
            }
            for (ScheduledTask t : set) {
                t.cancelFuture();
            }
            if (ownsExecutor) {
                executor.shutdown();
            }
            LOG.debug("Worker shut down: {}", this);
        }

        @Override
        public boolean isShutdown() {
            return stopped;
        }
    }

    static final class ScheduledTask implements Runnable, Subscription {
        final Runnable run;

        final ExecutorWorker parent;

        volatile boolean cancelled;

        volatile Future<?> future;

        ScheduledTask(Runnable run, ExecutorWorker parent) {
            this.run = run;
            this.parent = parent;
        }

        @Override
        public void run() {
            if (!cancelled && !parent.stopped) {
                try {
                    run.run();
                } catch (Throwable ex) {
                    ExceptionHelper.throwIfFatal(ex);
                    UnsignalledExceptions.onErrorDropped(ex);
                }
            }
        }

        void cancelFuture() {
            cancelled = true;
            Future<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }

        @Override
        public void unsubscribe() {
            cancelFuture();
        }

        @Override
        public boolean isDisposed() {
            return cancelled;
        }
    }
}
