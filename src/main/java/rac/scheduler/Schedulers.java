package rac.scheduler;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Factories of the built-in Schedulers.
 */
public enum Schedulers {
    ;

    static final Scheduler DEDICATED = new DedicatedScheduler();

    /**
     * The default Scheduler of the bridge operators: a new thread per worker.
     *
     * @return the shared dedicated-thread Scheduler
     */
    public static Scheduler dedicated() {
        return DEDICATED;
    }

    /**
     * @param executor the executor to share among workers
     * @return a Scheduler running its workers on the given executor
     */
    public static Scheduler fromExecutorService(ScheduledExecutorService executor) {
        return new ExecutorScheduler(executor);
    }
}
