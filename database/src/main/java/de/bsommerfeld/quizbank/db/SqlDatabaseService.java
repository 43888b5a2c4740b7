package de.bsommerfeld.quizbank.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.quizbank.core.domain.NewQuestion;
import de.bsommerfeld.quizbank.core.domain.Question;
import de.bsommerfeld.quizbank.core.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.function.Function;

/**
 * SQLite-backed {@link DatabaseService}.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per call and closed when the call
 * returns. SQLite serializes writers at the file level, so there is nothing
 * to gain from pooling; concurrent writers to the same question are ordered
 * by SQLite's locking, not by this class.
 *
 * <h3>Transaction boundaries</h3>
 * Owned by {@link QuestionStore}. Reads run in auto-commit mode.
 *
 * @see SqlLoader
 * @see SchemaManager
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    public static final String DATABASE_FILE = "database.file";

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);

    private final String dbUrl;
    private final SchemaManager schemaManager;
    private final QuestionStore questionStore;

    @Inject
    public SqlDatabaseService(@Named(DATABASE_FILE) Path databaseFile,
            SchemaManager schemaManager, QuestionStore questionStore) {
        this.dbUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();
        this.schemaManager = schemaManager;
        this.questionStore = questionStore;
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    @Override
    public void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            schemaManager.initialize(conn);
        } catch (SQLException e) {
            LOG.error("Schema creation failed for {}", dbUrl, e);
            throw new IllegalStateException("Database initialization failed", e);
        }
    }

    @Override
    public long createQuestion(NewQuestion question) {
        return withConnection("create question",
                conn -> questionStore.createQuestion(conn, question.body(), question.options()));
    }

    @Override
    public Question getQuestion(long id) {
        return withConnection("read question " + id, conn -> questionStore.readQuestion(conn, id));
    }

    @Override
    public List<Question> getAllQuestions() {
        return withConnection("read questions", questionStore::readAllQuestions);
    }

    @Override
    public void updateQuestion(Question question) {
        withConnection("update question " + question.id(), conn -> {
            questionStore.updateQuestion(conn, question);
            return null;
        });
    }

    @Override
    public void deleteQuestion(Question question) {
        withConnection("delete question " + question.id(), conn -> {
            questionStore.deleteQuestion(conn, question);
            return null;
        });
    }

    @Override
    public int countQuestions() {
        return withConnection("count questions", questionStore::countQuestions);
    }

    /**
     * Opens a connection for the duration of {@code call}. Failures to open or
     * close the connection become {@link PersistenceException}s; exceptions
     * from the call itself pass through unchanged.
     */
    private <T> T withConnection(String action, Function<Connection, T> call) {
        try (Connection conn = getConnection()) {
            return call.apply(conn);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to " + action + ": connection error", e);
        }
    }
}
