package benchgrid.protocol;

/**
 * A malformed or unexpected wire message. Servers log it and drop the
 * offending connection; a worker treats it as fatal.
 */
public class ProtocolException extends RuntimeException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
