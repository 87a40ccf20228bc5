package pedsim;

/**
 * Basic runtime exception that, for now, just provides the same constructors as the parent class.
 * Every error raised while reading pedigree definitions is (a subclass of) this exception.
 */
public class PedSimException extends RuntimeException {
    public PedSimException(final String message) {
        super(message);
    }

    public PedSimException(final String message, final Throwable throwable) {
        super(message, throwable);
    }
}
