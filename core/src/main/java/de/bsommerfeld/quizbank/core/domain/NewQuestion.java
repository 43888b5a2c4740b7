package de.bsommerfeld.quizbank.core.domain;

import java.util.List;

/**
 * Input for question creation: the question text plus its options in the
 * order they should be presented.
 */
public record NewQuestion(String body, List<NewOption> options) {

    public NewQuestion {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
