package de.bsommerfeld.tachobridge.core.i18n;

import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.core.config.GlobalConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Provides the localized status and error texts shown to the user. Resolves
 * translations from {@code i18n/messages_{locale}.properties} bundles on the
 * classpath; the locale comes from
 * {@link de.bsommerfeld.tachobridge.core.config.UserConfig#getLanguage()}.
 *
 * <p>
 * Keys missing from the active bundle fail hard instead of falling back to
 * the raw key, so translation gaps show up during development.
 */
@Singleton
public class I18nService {

    private static final Logger LOG = LoggerFactory.getLogger(I18nService.class);
    private static final String BUNDLE_NAME = "i18n.messages";

    private volatile Locale currentLocale;
    private volatile ResourceBundle resourceBundle;

    @Inject
    public I18nService(GlobalConfig config) {
        this(Locale.forLanguageTag(config.getUser().getLanguage()));
    }

    public I18nService(Locale locale) {
        this.currentLocale = locale;
        loadBundle();
    }

    /** Switches the active locale and reloads the bundle. */
    public void setLocale(Locale locale) {
        LOG.info("Switching locale from {} to {}", currentLocale, locale);
        this.currentLocale = locale;
        loadBundle();
    }

    public Locale getCurrentLocale() {
        return currentLocale;
    }

    /**
     * Returns the localized string for the given key.
     *
     * @throws IllegalStateException if the key is missing
     */
    public String get(String key) {
        try {
            return resourceBundle.getString(key);
        } catch (MissingResourceException e) {
            LOG.error("Missing translation for key: {}", key);
            throw new IllegalStateException("Translation missing for key: " + key, e);
        }
    }

    /**
     * Returns the localized string with {@link MessageFormat} placeholders
     * ({@code {0}}, {@code {1}}, ...) resolved.
     */
    public String get(String key, Object... args) {
        String pattern = get(key);
        if (args == null || args.length == 0) {
            return pattern;
        }
        try {
            return new MessageFormat(pattern, currentLocale).format(args);
        } catch (IllegalArgumentException e) {
            LOG.error("Error formatting string for key: {}", key, e);
            throw new IllegalStateException("I18n formatting error for key: " + key, e);
        }
    }

    private void loadBundle() {
        try {
            // No fallback to the JVM locale: a language without bundle gets the English base bundle
            this.resourceBundle = ResourceBundle.getBundle(BUNDLE_NAME, currentLocale,
                    ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
        } catch (MissingResourceException e) {
            LOG.error("Failed to load resource bundle '{}' for locale '{}'", BUNDLE_NAME, currentLocale, e);
            throw new IllegalStateException("Failed to load i18n bundle: " + BUNDLE_NAME, e);
        }
    }
}
