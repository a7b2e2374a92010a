package de.bsommerfeld.tachobridge.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BridgeIdentifiersTest {

    private static final String FORMAT = "TBA\\d{13}";

    @Test
    void normalize_shouldGenerateForNull() {
        assertTrue(BridgeIdentifiers.normalize(null).matches(FORMAT));
    }

    @Test
    void normalize_shouldGenerateForValueWithoutDigits() {
        assertTrue(BridgeIdentifiers.normalize("garbage").matches(FORMAT));
    }

    @Test
    void normalize_shouldKeepValidIdentifier() {
        assertEquals("TBA1234567890123", BridgeIdentifiers.normalize("TBA1234567890123"));
    }

    @Test
    void normalize_shouldPadShortDigitRuns() {
        assertEquals("TBA0000000000042", BridgeIdentifiers.normalize("abc42"));
    }

    @Test
    void normalize_shouldKeepTrailingDigitsOfLongValues() {
        assertEquals("TBA3456789012345", BridgeIdentifiers.normalize("TBA123456789012345"));
    }

    @Test
    void generate_shouldProduceValidIdentifiers() {
        for (int i = 0; i < 50; i++) {
            assertTrue(BridgeIdentifiers.isValid(BridgeIdentifiers.generate()));
        }
    }

    @Test
    void isValid_shouldRejectWrongPrefixAndLength() {
        assertFalse(BridgeIdentifiers.isValid("TBB1234567890123"));
        assertFalse(BridgeIdentifiers.isValid("TBA123"));
        assertFalse(BridgeIdentifiers.isValid(null));
    }
}
