package de.bsommerfeld.quizbank.app;

import com.google.inject.AbstractModule;
import com.google.inject.name.Names;
import de.bsommerfeld.quizbank.core.config.ApplicationMode;
import de.bsommerfeld.quizbank.core.config.ConfigurationLoader;
import de.bsommerfeld.quizbank.core.config.DatabaseConfig;
import de.bsommerfeld.quizbank.core.config.QuizbankConfig;
import de.bsommerfeld.quizbank.core.util.StorageUtils;
import de.bsommerfeld.quizbank.db.DatabaseService;
import de.bsommerfeld.quizbank.db.SqlDatabaseService;
import de.bsommerfeld.quizbank.db.TestDatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module for application wiring: configuration, database location and
 * the PROD/TEST choice of {@link DatabaseService}.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path configFile;
    private final ApplicationMode forcedMode;

    public AppModule() {
        this(StorageUtils.getConfigFile(StorageUtils.APP_NAME), null);
    }

    /**
     * @param forcedMode mode to use regardless of environment and config,
     *                   or {@code null} to resolve it
     */
    AppModule(Path configFile, ApplicationMode forcedMode) {
        this.configFile = configFile;
        this.forcedMode = forcedMode;
    }

    @Override
    protected void configure() {
        LOG.info("Loading configuration from: {}", configFile.toAbsolutePath());
        QuizbankConfig config = ConfigurationLoader.from(configFile).load();
        ApplicationMode mode = forcedMode != null ? forcedMode : ApplicationMode.resolve(config.getMode());

        bind(ApplicationMode.class).toInstance(mode);
        bind(QuizbankConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());

        // Relative database paths resolve next to config.toml.
        Path baseDir = configFile.toAbsolutePath().getParent();
        Path databaseFile = config.getDatabase().resolveFile(baseDir);
        bind(Path.class).annotatedWith(Names.named(SqlDatabaseService.DATABASE_FILE)).toInstance(databaseFile);

        LOG.info("Application mode: {}", mode);
        if (mode.isTest()) {
            bind(DatabaseService.class).to(TestDatabaseService.class);
        } else {
            bind(DatabaseService.class).to(SqlDatabaseService.class);
        }
    }
}
