package rac.util;

/**
 * Thrown when the data type produced by a source is not accepted by the declared
 * element type of the actor it is wired to.
 */
public final class InconsistentDataTypeException extends ContractViolationException {

    private static final long serialVersionUID = -1925566337498536171L;

    final Class<?> expected;

    final Class<?> found;

    public InconsistentDataTypeException(Object actor, Class<?> expected, Class<?> found) {
        super("Actor of type " + actor.getClass().getName() + " expects data to be of type "
                + expected.getName() + ", but data of type " + found.getName() + " has been found.");
        this.expected = expected;
        this.found = found;
    }

    public Class<?> expected() {
        return expected;
    }

    public Class<?> found() {
        return found;
    }
}
