package rac.scheduler;

import java.util.concurrent.TimeUnit;

import rac.flow.Subscription;

/**
 * Provides an abstract asynchronous boundary to operators.
 */
public interface Scheduler {

    /**
     * Creates a worker of this Scheduler that executes tasks in a strict
     * FIFO order, guaranteed non-concurrently with each other.
     * <p>
     * Once the Worker is no longer in use, one should call shutdown() on it to
     * release any resources the particular Scheduler may have used.
     *
     * @return the Worker instance.
     */
    Worker createWorker();

    /**
     * Instructs this Scheduler to release all resources and reject
     * any new workers' tasks.
     */
    default void shutdown() {

    }

    /**
     * A worker representing an asynchronous boundary that executes tasks in
     * a FIFO order, guaranteed non-concurrently with respect to each other.
     * <p>
     * Shutting down a worker never shuts down other Workers of the same
     * Scheduler.
     */
    interface Worker {

        /**
         * Schedules the task on this worker.
         * @param task the task to schedule
         * @return the Subscription that cancels this particular task or
         * {@link #REJECTED} if the worker has been shut down
         */
        Subscription schedule(Runnable task);

        /**
         * Schedules the task on this worker after the given delay.
         * @param task the task to schedule
         * @param delay the delay amount, non-positive values indicate non-delayed scheduling
         * @param unit the unit of measure of the delay amount
         * @return the Subscription that cancels this particular task or
         * {@link #REJECTED} if the worker has been shut down
         */
        Subscription schedule(Runnable task, long delay, TimeUnit unit);

        /**
         * Cancels the pending tasks, rejects new ones and releases the resources
         * associated with this worker. A running task is not interrupted. Idempotent.
         */
        void shutdown();

        boolean isShutdown();
    }

    /**
     * Returned by the schedule() methods if the Scheduler or the Worker has been shut down.
     */
    Subscription REJECTED = new Subscription() {
        @Override
        public void unsubscribe() {
            // deliberately no-op
        }

        @Override
        public boolean isDisposed() {
            return true;
        }

        @Override
        public String toString() {
            return "Rejected task";
        }
    };
}
