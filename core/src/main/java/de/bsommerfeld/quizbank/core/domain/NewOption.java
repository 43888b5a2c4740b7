package de.bsommerfeld.quizbank.core.domain;

/**
 * Option input for question creation. Carries no id; the store assigns one.
 */
public record NewOption(String body, boolean correct) {
}
