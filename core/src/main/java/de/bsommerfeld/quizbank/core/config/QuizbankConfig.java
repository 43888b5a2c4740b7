package de.bsommerfeld.quizbank.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of config.toml.
 */
public class QuizbankConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("mode")
    private String mode = ApplicationMode.PROD.name();

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public void setDatabase(DatabaseConfig database) {
        this.database = database == null ? new DatabaseConfig() : database;
    }
}
