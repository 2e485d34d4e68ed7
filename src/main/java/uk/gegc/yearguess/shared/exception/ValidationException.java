package uk.gegc.yearguess.shared.exception;

/**
 * Thrown when caller-supplied input is rejected before any state is touched.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
