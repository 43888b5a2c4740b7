package de.bsommerfeld.quizbank.core.domain;

/**
 * A single answer option as stored in the {@code options} table.
 *
 * @param id      store-assigned row id, {@code 0} if the option has not been
 *                persisted yet
 * @param body    the option text
 * @param correct whether choosing this option answers the question correctly
 */
public record Option(long id, String body, boolean correct) {

    /**
     * Unpersisted option, e.g. one appended by a caller before an update.
     */
    public Option(String body, boolean correct) {
        this(0L, body, correct);
    }

    public boolean isPersisted() {
        return id > 0;
    }
}
