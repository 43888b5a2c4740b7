package de.bsommerfeld.quizbank.core.error;

/**
 * Thrown when externally supplied input is malformed.
 */
public class ValidationException extends QuizbankException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
