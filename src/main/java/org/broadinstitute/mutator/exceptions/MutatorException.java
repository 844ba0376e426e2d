package org.broadinstitute.mutator.exceptions;

/**
 * <p/>
 * Class MutatorException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class MutatorException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public MutatorException( String msg ) {
        super(msg);
    }

    public MutatorException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of MutatorException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends MutatorException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
        public ShouldNeverReachHereException( final String s, final Throwable throwable ) {
            super(s, throwable);
        }
        public ShouldNeverReachHereException( final Throwable throwable) {this("Should never reach here.", throwable);}
    }

    /**
     * <p/>
     * Thrown when a caller breaks an invariant that an operation depends on, e.g. asking to split a reference
     * block with a variant it does not contain. The upstream state is already inconsistent, so this is never retried.
     */
    public static class ContractViolation extends MutatorException {
        private static final long serialVersionUID = 0L;

        public ContractViolation( final String message ) {
            super("Contract violation: " + message);
        }
    }
}
