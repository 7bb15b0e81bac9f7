package org.broadinstitute.msa.exceptions;

/**
 * <p/>
 * Class MSAException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class MSAException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public MSAException( String msg ) {
        super(msg);
    }

    public MSAException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends MSAException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
    }
}
