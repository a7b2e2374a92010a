package de.bsommerfeld.tachobridge.api;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version of the running build, injected into
 * {@code tachobridge-version.properties} through Maven resource filtering.
 */
public final class ApplicationVersion {

    private static final String UNKNOWN = "0.0.0";
    private static final String VERSION = readVersion();

    private ApplicationVersion() {
    }

    public static String get() {
        return VERSION;
    }

    private static String readVersion() {
        try (InputStream in = ApplicationVersion.class.getResourceAsStream("/tachobridge-version.properties")) {
            if (in == null) {
                return UNKNOWN;
            }
            Properties props = new Properties();
            props.load(in);
            String version = props.getProperty("app.version", UNKNOWN);
            // Unfiltered resource when running from an IDE without the Maven build.
            return version.startsWith("${") ? UNKNOWN : version;
        } catch (IOException e) {
            return UNKNOWN;
        }
    }
}
