package arbor.core.exception;

/**
 * Thrown when parsing data and finding that it is not structured as expected.
 */
public final class ParseException extends Exception {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
