package de.bsommerfeld.mindshare.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Which store the job runs against. PROD reads and writes the configured
 * SQLite file; TEST uses an in-memory store seeded with generated records and
 * skips the database URL check.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    public static final String PROPERTY = "app.mode";
    public static final String ENV = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /** Reads {@value #PROPERTY}, then {@value #ENV}; PROD when unset or unknown. */
    public static ApplicationMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isBlank()) {
            mode = System.getenv(ENV);
        }
        return parse(mode);
    }

    static ApplicationMode parse(String mode) {
        if (mode == null || mode.isBlank()) {
            return PROD;
        }
        try {
            return valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', running as PROD", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
