package de.bsommerfeld.quizbank.core.domain;

import java.util.List;

/**
 * A question reconstructed from its {@code question_bodies} row and the
 * options linked to it. The option list keeps the stored
 * {@code option_order} sequence and is never re-sorted by id or content.
 *
 * <p>
 * Option identities are not stable across updates: every update replaces
 * all option rows, so a caller that wants to update again must start from a
 * freshly read question.
 *
 * @param id      the question body id
 * @param body    the question text
 * @param options options in display order, immutable
 */
public record Question(long id, String body, List<Option> options) {

    public Question {
        options = options == null ? List.of() : List.copyOf(options);
    }

    /**
     * Returns a copy with the given body, keeping id and options.
     */
    public Question withBody(String newBody) {
        return new Question(id, newBody, options);
    }

    /**
     * Returns a copy with the given options, keeping id and body.
     */
    public Question withOptions(List<Option> newOptions) {
        return new Question(id, body, newOptions);
    }
}
