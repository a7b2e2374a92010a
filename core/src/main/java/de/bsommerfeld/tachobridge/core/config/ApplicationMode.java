package de.bsommerfeld.tachobridge.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Running mode of the application. {@link #TEST} swaps every on-disk store
 * for an in-memory one so a session can be exercised without touching the
 * user's saved credentials or cards.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    static final String PROPERTY = "tachobridge.mode";
    static final String ENVIRONMENT = "TACHOBRIDGE_MODE";

    /**
     * Resolves the mode from the {@code tachobridge.mode} system property,
     * then the {@code TACHOBRIDGE_MODE} environment variable. Defaults to
     * {@link #PROD}.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System::getenv);
    }

    static ApplicationMode resolve(String property, UnaryOperator<String> environment) {
        String mode = property;
        if (mode == null || mode.isBlank()) {
            mode = environment.apply(ENVIRONMENT);
        }
        if (mode == null || mode.isBlank()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', falling back to PROD", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
