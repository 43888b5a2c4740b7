package de.bsommerfeld.quizbank.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * Location of the SQLite file and first-run behaviour. Values come from the
 * {@code [database]} section of config.toml.
 */
public class DatabaseConfig {

    @JsonProperty("file")
    private String file = "data.sqlite3";

    @JsonProperty("seed-on-create")
    private boolean seedOnCreate = true;

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public boolean isSeedOnCreate() {
        return seedOnCreate;
    }

    public void setSeedOnCreate(boolean seedOnCreate) {
        this.seedOnCreate = seedOnCreate;
    }

    /**
     * Resolves {@link #getFile()} against {@code baseDir} unless it is already
     * absolute.
     */
    public Path resolveFile(Path baseDir) {
        Path path = Path.of(file);
        return path.isAbsolute() ? path : baseDir.resolve(path).toAbsolutePath();
    }
}
