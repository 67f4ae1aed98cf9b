package rac.util;

/**
 * Signals a wiring defect: an object that does not satisfy the actor or observable
 * contract, or a value whose type the receiving actor does not accept.
 * <p>
 * Contract violations are thrown at the point of violation and are never
 * delivered as a stream {@code error} event.
 */
public class ContractViolationException extends RuntimeException {

    private static final long serialVersionUID = -6164380391454419383L;

    public ContractViolationException(String message) {
        super(message);
    }
}
