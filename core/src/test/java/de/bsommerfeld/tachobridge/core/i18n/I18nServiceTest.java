package de.bsommerfeld.tachobridge.core.i18n;

import de.bsommerfeld.tachobridge.core.config.GlobalConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class I18nServiceTest {

    @Test
    void get_shouldResolveDutchByDefault() {
        I18nService i18n = new I18nService(new GlobalConfig());

        assertEquals("Niet verbonden met TransportKlok.", i18n.get("status.not-connected"));
    }

    @Test
    void get_shouldResolveEnglishBaseBundle() {
        I18nService i18n = new I18nService(Locale.ENGLISH);

        assertEquals("Not connected to TransportKlok.", i18n.get("status.not-connected"));
    }

    @Test
    void get_shouldFormatArguments() {
        I18nService i18n = new I18nService(Locale.ENGLISH);

        assertEquals("Connected to TransportKlok and TrackMijn as Jan Jansen.",
                i18n.get("status.connected", "Jan Jansen"));
    }

    @Test
    void get_shouldFailOnMissingKey() {
        I18nService i18n = new I18nService(Locale.ENGLISH);

        assertThrows(IllegalStateException.class, () -> i18n.get("does.not.exist"));
    }

    @Test
    void setLocale_shouldSwitchBundle() {
        I18nService i18n = new I18nService(Locale.ENGLISH);
        i18n.setLocale(Locale.forLanguageTag("nl"));

        assertEquals("nl", i18n.getCurrentLocale().getLanguage());
        assertEquals("Meld je aan bij TransportKlok.", i18n.get("status.sign-in"));
    }

    @Test
    void bundles_shouldDefineTheSameKeys() throws IOException {
        Properties english = load("/i18n/messages.properties");
        Properties dutch = load("/i18n/messages_nl.properties");

        assertFalse(english.isEmpty());
        assertEquals(english.keySet(), dutch.keySet());
    }

    private static Properties load(String resource) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = I18nServiceTest.class.getResourceAsStream(resource)) {
            assertNotNull(in, resource);
            properties.load(in);
        }
        return properties;
    }
}
