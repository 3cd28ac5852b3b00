package org.polycore.exceptions;

/**
 * <p/>
 * Class PolyCoreException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class PolyCoreException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public PolyCoreException( String msg ) {
        super(msg);
    }

    public PolyCoreException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of PolyCoreException for common kinds of errors
     */

    /**
     * A collapsed group index that no longer reproduces its input sequences.
     */
    public static class CorruptGroupIndex extends PolyCoreException {
        private static final long serialVersionUID = 0L;

        public CorruptGroupIndex( final String sampleId, final int copyIndex, final int groupId ) {
            super(String.format("Copy %d of sample %s is indexed to group %d but is not a member of it", copyIndex, sampleId, groupId));
        }
    }
}
