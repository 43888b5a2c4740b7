package de.bsommerfeld.quizbank.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Which {@code DatabaseService} backs the process. PROD persists to the
 * SQLite file, TEST serves a pre-seeded in-memory store and never touches
 * disk.
 *
 * <p>
 * Sources in order of precedence: the {@value #PROPERTY} system property,
 * the {@value #ENV} environment variable, the {@code mode} key of
 * config.toml. The first non-blank source decides.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    public static final String PROPERTY = "app.mode";
    public static final String ENV = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Mode from the process environment alone.
     */
    public static ApplicationMode get() {
        return resolve(null);
    }

    /**
     * Mode from the process environment, falling back to the value configured
     * in config.toml.
     */
    public static ApplicationMode resolve(String configured) {
        return firstSet(System.getProperty(PROPERTY), System.getenv(ENV), configured);
    }

    static ApplicationMode firstSet(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return parse(candidate);
            }
        }
        return PROD;
    }

    /**
     * Case-insensitive; unknown names fall back to PROD so a typo cannot
     * silently swap the real store for the in-memory one.
     */
    public static ApplicationMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', using PROD", value);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
