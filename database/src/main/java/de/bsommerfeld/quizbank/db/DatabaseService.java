package de.bsommerfeld.quizbank.db;

import de.bsommerfeld.quizbank.core.domain.NewQuestion;
import de.bsommerfeld.quizbank.core.domain.Question;
import de.bsommerfeld.quizbank.core.error.NotFoundException;
import de.bsommerfeld.quizbank.core.error.PersistenceException;

import java.util.List;

/**
 * Question persistence as seen by callers outside the database module.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}: SQLite file, one connection per call</li>
 * <li>{@link TestDatabaseService}: in-memory store for TEST mode, pre-seeded
 * with generated questions</li>
 * </ul>
 * Switching happens at the Guice module level.
 *
 * <p>
 * All methods throw {@link PersistenceException} when the store fails. Writes
 * are atomic: after a failure nothing of the attempted write is visible.
 */
public interface DatabaseService {

    /**
     * Creates the schema. Runs once, on a fresh store; failure is fatal.
     *
     * @throws IllegalStateException if the schema cannot be created
     */
    void initialize();

    /**
     * Persists the question and its options in the given order.
     *
     * @return the id of the new question
     */
    long createQuestion(NewQuestion question);

    /**
     * @throws NotFoundException if no question has this id
     */
    Question getQuestion(long id);

    /**
     * All questions in id order, each with its options in stored order.
     */
    List<Question> getAllQuestions();

    /**
     * Replaces body and options of {@code question.id()}. Option ids are
     * reassigned by every update.
     *
     * @throws NotFoundException if the question does not exist
     */
    void updateQuestion(Question question);

    /**
     * Removes the question together with its options and links.
     *
     * @throws NotFoundException if the question does not exist
     */
    void deleteQuestion(Question question);

    /**
     * Reads the question, then deletes it.
     *
     * @throws NotFoundException if the question does not exist
     */
    default void deleteQuestion(long id) {
        deleteQuestion(getQuestion(id));
    }

    int countQuestions();
}
