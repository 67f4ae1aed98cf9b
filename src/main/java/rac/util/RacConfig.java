package rac.util;

/**
 * Library-wide settings, read once from JVM system properties.
 */
public final class RacConfig {

    /** Thread name prefix of the dedicated bridge workers. */
    public static final String WORKER_PREFIX =
            System.getProperty("rac.worker.prefix", "rac-worker");

    /** Whether worker threads are daemon threads. */
    public static final boolean WORKER_DAEMON =
            Boolean.parseBoolean(System.getProperty("rac.worker.daemon", "true"));

    /** Default number of values kept by a {@code ReplaySubject}. */
    public static final int REPLAY_CAPACITY =
            Integer.getInteger("rac.replay.capacity", 16);

    /** Log values dropped after termination at warn level instead of debug. */
    public static final boolean TRACE_DROPPED =
            Boolean.parseBoolean(System.getProperty("rac.trace.dropped", "false"));

    private RacConfig() {
        throw new IllegalStateException("No instances!");
    }
}
