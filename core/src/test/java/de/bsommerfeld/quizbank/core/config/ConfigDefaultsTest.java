package de.bsommerfeld.quizbank.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void quizbankConfig_shouldInitializeWithDefaults() {
        var config = new QuizbankConfig();

        assertFalse(config.isDebugMode());
        assertEquals("PROD", config.getMode());
        assertNotNull(config.getDatabase());
    }

    @Test
    void databaseConfig_shouldDefaultToDataFileAndSeeding() {
        var config = new DatabaseConfig();

        assertEquals("data.sqlite3", config.getFile());
        assertTrue(config.isSeedOnCreate());
    }

    @Test
    void setDatabase_shouldReplaceNullWithDefaults() {
        var config = new QuizbankConfig();
        config.setDatabase(null);
        assertNotNull(config.getDatabase());
    }

    @Test
    void resolveFile_shouldResolveRelativePathAgainstBaseDir() {
        var config = new DatabaseConfig();
        Path base = Path.of("/srv/quizbank").toAbsolutePath();

        assertEquals(base.resolve("data.sqlite3"), config.resolveFile(base));
    }

    @Test
    void resolveFile_shouldKeepAbsolutePath() {
        var config = new DatabaseConfig();
        Path absolute = Path.of("/var/lib/quiz.db").toAbsolutePath();
        config.setFile(absolute.toString());

        assertEquals(absolute, config.resolveFile(Path.of("/elsewhere").toAbsolutePath()));
    }
}
