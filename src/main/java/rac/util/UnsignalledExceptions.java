package rac.util;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that let's the developer react to
 * exceptions and values that can't be signalled due to the state
 * of the streams.
 */
public final class UnsignalledExceptions {

    private static final Logger LOG = LoggerFactory.getLogger(UnsignalledExceptions.class);

    /**
     * Utility class.
     */
    private UnsignalledExceptions() {
        throw new IllegalStateException("No instances!");
    }

    /**
     * The error consumer lambda, null will revert to the default behavior.
     */
    private static volatile Consumer<Throwable> errorConsumer;

    /**
     * Prevents changing the errorConsumer.
     * This can be used for environments which wants to preset a handler
     * but prevent others from changing it.
     */
    private static volatile boolean locked;

    /**
     * Returns the current error consumer instance or null if none is set.
     * <p>
     * This allows chaining of error consumers if necessary.
     *
     * @return the current error consumer instance or null if none is set
     */
    public static Consumer<Throwable> getErrorConsumer() {
        return errorConsumer;
    }

    /**
     * Sets the current error consumer if not locked down.
     * <p>
     * Setting it to null will reset the handling behavior to default.
     *
     * @param newConsumer the new consumer to set
     */
    public static void setErrorConsumer(Consumer<Throwable> newConsumer) {
        if (!locked) {
            errorConsumer = newConsumer;
        }
    }

    /**
     * Locks down the error consumer and prevents any further changes to
     * the handler.
     */
    public static void lockdown() {
        locked = true;
    }

    /**
     * Take an unsignalled data and handle it.
     *
     * @param <T> the type of the value dropped
     * @param t the dropped data
     */
    public static <T> void onNextDropped(T t) {
        if (RacConfig.TRACE_DROPPED) {
            LOG.warn("Value dropped after termination: {}", t);
        } else {
            LOG.debug("Value dropped after termination: {}", t);
        }
    }

    /**
     * Take an unsignalled exception that is masking another one due to callback failure.
     *
     * @param e the exception to handle
     * @param root the masked exception, may be null
     */
    public static void onErrorDropped(Throwable e, Throwable root) {
        if (root != null && root != e) {
            e.addSuppressed(root);
        }
        onErrorDropped(e);
    }

    /**
     * Take an unsignalled exception and handle it.
     *
     * @param e the exception to handle, if null, a new NullPointerException is instantiated
     */
    public static void onErrorDropped(Throwable e) {
        if (e == null) {
            e = new NullPointerException();
        }
        ExceptionHelper.throwIfFatal(e);

        Consumer<Throwable> h = errorConsumer;

        if (h == null) {
            LOG.error("Error dropped after termination", e);
        } else {
            try {
                h.accept(e);
            } catch (Throwable ex) {
                LOG.error("Error consumer failed", ex);
                LOG.error("Error dropped after termination", e);
            }
        }
    }
}
