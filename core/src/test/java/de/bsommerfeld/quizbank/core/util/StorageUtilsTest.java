package de.bsommerfeld.quizbank.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldBeAbsoluteAndNamedAfterApp() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.isAbsolute());
        assertEquals("test-app", dir.getFileName().toString());
    }

    @Test
    void getConfigFile_shouldDefaultToConfigTomlInAppDataDir() {
        String original = System.getProperty("quizbank.config");
        try {
            System.clearProperty("quizbank.config");
            assertEquals(StorageUtils.getAppDataDir("test-app").resolve("config.toml"),
                    StorageUtils.getConfigFile("test-app"));
        } finally {
            if (original != null)
                System.setProperty("quizbank.config", original);
        }
    }

    @Test
    void getConfigFile_shouldHonourOverrideProperty() {
        String original = System.getProperty("quizbank.config");
        try {
            System.setProperty("quizbank.config", "custom/quiz.toml");
            Path file = StorageUtils.getConfigFile("test-app");
            assertTrue(file.isAbsolute());
            assertTrue(file.endsWith(Path.of("custom", "quiz.toml")));
        } finally {
            if (original != null)
                System.setProperty("quizbank.config", original);
            else
                System.clearProperty("quizbank.config");
        }
    }
}
