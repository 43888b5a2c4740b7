package de.bsommerfeld.quizbank.core.error;

/**
 * Root of the error taxonomy. Callers at the process boundary map
 * {@link NotFoundException} and {@link ValidationException} to client errors
 * and {@link PersistenceException} to server errors.
 */
public abstract class QuizbankException extends RuntimeException {

    protected QuizbankException(String message) {
        super(message);
    }

    protected QuizbankException(String message, Throwable cause) {
        super(message, cause);
    }
}
