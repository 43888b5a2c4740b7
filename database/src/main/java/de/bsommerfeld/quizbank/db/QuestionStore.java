package de.bsommerfeld.quizbank.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.quizbank.core.domain.NewOption;
import de.bsommerfeld.quizbank.core.domain.Option;
import de.bsommerfeld.quizbank.core.domain.Question;
import de.bsommerfeld.quizbank.core.error.NotFoundException;
import de.bsommerfeld.quizbank.core.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Question-level reads and writes over {@code question_bodies},
 * {@link OptionStore} and {@link LinkStore}.
 *
 * <h3>Transaction boundaries</h3>
 * Every write runs in one transaction via {@link Transactions}: the question
 * body, its option rows and its link rows are committed together or not at
 * all. A failed write is rolled back before the error leaves this class.
 *
 * <h3>Update semantics</h3>
 * Updates are full replacements. All option and link rows of the question are
 * deleted and recreated from the supplied options in their list order, so
 * option ids change on every update even when the content does not. Callers
 * should update a question they obtained from a read.
 *
 * <h3>Errors</h3>
 * Driver failures surface as {@link PersistenceException}; a missing question
 * body as {@link NotFoundException}. A link row pointing to a missing option
 * is a consistency violation and is reported as {@link PersistenceException}.
 */
@Singleton
public class QuestionStore {

    private static final Logger LOG = LoggerFactory.getLogger(QuestionStore.class);

    private final OptionStore optionStore;
    private final LinkStore linkStore;

    @Inject
    public QuestionStore(OptionStore optionStore, LinkStore linkStore) {
        this.optionStore = optionStore;
        this.linkStore = linkStore;
    }

    // =====================================================================
    // Writes
    // =====================================================================

    /**
     * Inserts the question body, one option row per entry of
     * {@code orderedOptions} and the link rows recording their order.
     *
     * @return the new question id
     */
    public long createQuestion(Connection conn, String body, List<NewOption> orderedOptions) {
        try {
            long questionId = Transactions.inTransaction(conn, c -> {
                long id = insertBody(c, body);
                List<Long> optionIds = new ArrayList<>(orderedOptions.size());
                for (NewOption option : orderedOptions) {
                    optionIds.add(optionStore.createOption(c, option.body(), option.correct()));
                }
                linkStore.createLinks(c, id, optionIds);
                return id;
            });
            LOG.debug("[DB] Created question {} with {} options", questionId, orderedOptions.size());
            return questionId;
        } catch (SQLException e) {
            throw failure("create question", e);
        }
    }

    /**
     * Replaces body and options of {@code question.id()}.
     *
     * <p>
     * The option rows removed are the ones currently linked to the question,
     * read inside the same transaction. With a question obtained from a read
     * these are exactly the supplied options; supplied ids that are not linked
     * to this question are left alone.
     *
     * @throws NotFoundException if the question body does not exist
     */
    public void updateQuestion(Connection conn, Question question) {
        long questionId = question.id();
        try {
            Transactions.runInTransaction(conn, c -> {
                if (updateBody(c, questionId, question.body()) == 0) {
                    throw new NotFoundException("Question", questionId);
                }

                List<Long> staleOptionIds = linkStore.readLinkedOptionIds(c, questionId);
                warnOnForeignOptions(questionId, question.options(), staleOptionIds);
                linkStore.deleteLinksForQuestion(c, questionId);

                List<Long> newOptionIds = new ArrayList<>(question.options().size());
                for (Long staleId : staleOptionIds) {
                    optionStore.deleteOption(c, staleId);
                }
                for (Option option : question.options()) {
                    newOptionIds.add(optionStore.createOption(c, option.body(), option.correct()));
                }
                linkStore.createLinks(c, questionId, newOptionIds);
            });
            LOG.debug("[DB] Replaced question {} ({} options)", questionId, question.options().size());
        } catch (SQLException e) {
            throw failure("update question " + questionId, e);
        }
    }

    /**
     * Deletes the question's options, then its links, then its body.
     *
     * @throws NotFoundException if the question body does not exist
     */
    public void deleteQuestion(Connection conn, Question question) {
        long questionId = question.id();
        try {
            Transactions.runInTransaction(conn, c -> {
                List<Long> optionIds = linkStore.readLinkedOptionIds(c, questionId);
                warnOnForeignOptions(questionId, question.options(), optionIds);
                for (Long optionId : optionIds) {
                    optionStore.deleteOption(c, optionId);
                }
                linkStore.deleteLinksForQuestion(c, questionId);
                if (deleteBody(c, questionId) == 0) {
                    throw new NotFoundException("Question", questionId);
                }
            });
            LOG.debug("[DB] Deleted question {}", questionId);
        } catch (SQLException e) {
            throw failure("delete question " + questionId, e);
        }
    }

    // =====================================================================
    // Reads
    // =====================================================================

    /**
     * @throws NotFoundException if no question body has this id
     */
    public Question readQuestion(Connection conn, long id) {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-question-body"))) {
            ps.setLong(1, id);
            String body;
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException("Question", id);
                }
                body = rs.getString("body");
            }
            return new Question(id, body, resolveOptions(conn, id));
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read question " + id, e);
        }
    }

    /**
     * Reads every question in id order, each with its options resolved the
     * same way as {@link #readQuestion}.
     */
    public List<Question> readAllQuestions(Connection conn) {
        try {
            List<Question> bodies = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-question-bodies"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    bodies.add(new Question(rs.getLong("id"), rs.getString("body"), List.of()));
                }
            }

            List<Question> questions = new ArrayList<>(bodies.size());
            for (Question q : bodies) {
                questions.add(q.withOptions(resolveOptions(conn, q.id())));
            }
            return questions;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to read questions", e);
        }
    }

    public int countQuestions(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-question-bodies"));
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to count questions", e);
        }
    }

    /**
     * Loads the options linked to {@code questionId} in {@code option_order}.
     */
    private List<Option> resolveOptions(Connection conn, long questionId) throws SQLException {
        List<Long> optionIds = linkStore.readLinkedOptionIds(conn, questionId);
        List<Option> options = new ArrayList<>(optionIds.size());
        for (Long optionId : optionIds) {
            try {
                options.add(optionStore.readOption(conn, optionId));
            } catch (NotFoundException e) {
                throw new PersistenceException(
                        "Question " + questionId + " links to missing option " + optionId, e);
            }
        }
        return options;
    }

    // =====================================================================
    // question_bodies rows
    // =====================================================================

    private long insertBody(Connection conn, String body) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-question-body"))) {
            ps.setString(1, body);
            ps.executeUpdate();
        }
        return OptionStore.lastInsertId(conn);
    }

    private int updateBody(Connection conn, long id, String body) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-question-body"))) {
            ps.setString(1, body);
            ps.setLong(2, id);
            return ps.executeUpdate();
        }
    }

    private int deleteBody(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-question-body"))) {
            ps.setLong(1, id);
            return ps.executeUpdate();
        }
    }

    /**
     * Supplied option ids that are not linked to the question point at another
     * question's options or at nothing; they are never deleted.
     */
    private void warnOnForeignOptions(long questionId, List<Option> supplied, List<Long> linkedIds) {
        Set<Long> linked = new HashSet<>(linkedIds);
        for (Option option : supplied) {
            if (option.isPersisted() && !linked.contains(option.id())) {
                LOG.warn("Option {} is not linked to question {}; left untouched", option.id(), questionId);
            }
        }
    }

    private PersistenceException failure(String action, SQLException e) {
        LOG.warn("Rolled back '{}': {}", action, e.getMessage());
        return new PersistenceException("Failed to " + action, e);
    }
}
