package de.bsommerfeld.quizbank.core.error;

/**
 * Thrown when the underlying store fails: constraint violations, I/O errors,
 * malformed statements, or rows that reference missing rows.
 */
public class PersistenceException extends QuizbankException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
