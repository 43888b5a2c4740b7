package de.bsommerfeld.quizbank.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.quizbank.core.config.DatabaseConfig;
import de.bsommerfeld.quizbank.core.domain.NewOption;
import de.bsommerfeld.quizbank.core.domain.NewQuestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * First-run setup of the SQLite file. The schema is created only when the
 * database file does not exist yet; an existing file is used as-is. A file
 * whose schema or seed could not be written is deleted again.
 */
@Singleton
public class DatabaseBootstrap {

    /**
     * Seeded into every freshly created database.
     */
    public static final NewQuestion EXAMPLE_QUESTION = new NewQuestion("a",
            List.of(new NewOption("b", true), new NewOption("c", false)));

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseBootstrap.class);

    private final DatabaseService databaseService;
    private final Path databaseFile;
    private final boolean seedOnCreate;

    @Inject
    public DatabaseBootstrap(DatabaseService databaseService,
            @Named(SqlDatabaseService.DATABASE_FILE) Path databaseFile, DatabaseConfig config) {
        this.databaseService = databaseService;
        this.databaseFile = databaseFile;
        this.seedOnCreate = config.isSeedOnCreate();
    }

    /**
     * Prepares the store for use.
     *
     * @return {@code true} if a new database was created
     * @throws IllegalStateException if the schema cannot be created
     */
    public boolean open() {
        if (Files.exists(databaseFile)) {
            LOG.info("Using existing database {}", databaseFile);
            return false;
        }

        createParentDirectory();
        try {
            databaseService.initialize();
            if (seedOnCreate) {
                long id = databaseService.createQuestion(EXAMPLE_QUESTION);
                LOG.info("Seeded example question {}", id);
            }
        } catch (RuntimeException e) {
            removeIncompleteFile(e);
            throw e;
        }
        return true;
    }

    /**
     * SQLite creates the file on connect, so a failed setup leaves one behind
     * that the next start would take for a usable database.
     */
    private void removeIncompleteFile(RuntimeException cause) {
        try {
            if (Files.deleteIfExists(databaseFile)) {
                LOG.warn("Removed incomplete database {}", databaseFile);
            }
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private void createParentDirectory() {
        Path parent = databaseFile.toAbsolutePath().getParent();
        if (parent == null || Files.exists(parent))
            return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create database directory " + parent, e);
        }
    }
}
