package de.bsommerfeld.quizbank.core.domain;

import de.bsommerfeld.quizbank.core.error.ValidationException;

/**
 * Parsing of question ids supplied from outside the process (path segments,
 * CLI arguments).
 */
public final class QuestionIds {

    private QuestionIds() {
    }

    /**
     * Parses a positive question id.
     *
     * @throws ValidationException if the value is blank, not a number or not
     *                             positive
     */
    public static long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Question id must not be blank");
        }
        long id;
        try {
            id = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Question id is not a number: '" + raw + "'", e);
        }
        if (id <= 0) {
            throw new ValidationException("Question id must be positive: " + id);
        }
        return id;
    }
}
