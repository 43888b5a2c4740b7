package de.bsommerfeld.quizbank.app;

import ch.qos.logback.classic.Level;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.quizbank.core.config.ApplicationMode;
import de.bsommerfeld.quizbank.core.config.QuizbankConfig;
import de.bsommerfeld.quizbank.core.domain.Question;
import de.bsommerfeld.quizbank.db.DatabaseBootstrap;
import de.bsommerfeld.quizbank.db.DatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point. Wires the application, prepares the store on first
 * run and reports what it holds. Transport layers embed
 * {@link DatabaseService} from the injector created here.
 */
public final class QuizbankApp {

    private static final Logger LOG = LoggerFactory.getLogger(QuizbankApp.class);
    static final String BASE_LOGGER = "de.bsommerfeld.quizbank";

    private QuizbankApp() {
    }

    public static void main(String[] args) {
        try {
            start(Guice.createInjector(new AppModule()));
        } catch (RuntimeException e) {
            LOG.error("Startup failed", e);
            System.exit(1);
        }
    }

    /**
     * Applies {@code debug-mode}, runs the bootstrap (PROD only) and logs the
     * stored questions.
     *
     * @return the ready database service
     */
    static DatabaseService start(Injector injector) {
        if (injector.getInstance(QuizbankConfig.class).isDebugMode()) {
            enableDebugLogging();
        }

        ApplicationMode mode = injector.getInstance(ApplicationMode.class);
        if (!mode.isTest()) {
            injector.getInstance(DatabaseBootstrap.class).open();
        }

        DatabaseService db = injector.getInstance(DatabaseService.class);
        int count = db.countQuestions();
        LOG.info("Question store ready with {} question(s).", count);
        if (LOG.isDebugEnabled()) {
            for (Question q : db.getAllQuestions()) {
                LOG.debug("  #{} '{}' ({} options)", q.id(), q.body(), q.options().size());
            }
        }
        return db;
    }

    /**
     * Raises the application loggers to DEBUG when Logback is the bound
     * backend; other bindings keep their own configuration.
     */
    static void enableDebugLogging() {
        Logger base = LoggerFactory.getLogger(BASE_LOGGER);
        if (base instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) base).setLevel(Level.DEBUG);
            LOG.debug("Debug mode enabled");
        } else {
            LOG.warn("debug-mode is set but the logging backend is not Logback");
        }
    }
}
