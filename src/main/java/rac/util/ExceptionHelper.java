package rac.util;

/**
 * Utility methods for classifying exceptions caught around user callbacks.
 */
public enum ExceptionHelper {
    ;

    /**
     * Rethrows the given exception if it must not be turned into a stream
     * {@code error}: contract violations and fatal JVM errors.
     *
     * @param t the caught exception
     */
    public static void throwIfFatal(Throwable t) {
        if (t instanceof ContractViolationException) {
            throw (ContractViolationException) t;
        }
        if (t instanceof VirtualMachineError) {
            throw (VirtualMachineError) t;
        }
        if (t instanceof LinkageError) {
            throw (LinkageError) t;
        }
    }

    /**
     * Rethrows the given exception as an unchecked one.
     *
     * @param t the exception
     * @return never returns, declared so callers can write {@code throw propagate(t)}
     */
    public static RuntimeException propagate(Throwable t) {
        if (t instanceof RuntimeException) {
            throw (RuntimeException) t;
        }
        if (t instanceof Error) {
            throw (Error) t;
        }
        throw new IllegalStateException(t);
    }
}
