package de.bsommerfeld.tachobridge.core.domain;

import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Generation and normalization of the bridge client identifier, a
 * 16-character token of the form {@code "TBA" + 13 digits} that identifies
 * this physical device to the Fleet service for its whole lifetime.
 */
public final class BridgeIdentifiers {

    public static final String PREFIX = "TBA";
    public static final int DIGITS = 13;

    private static final Pattern VALID = Pattern.compile("^TBA\\d{13}$");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    private BridgeIdentifiers() {
    }

    public static boolean isValid(String identifier) {
        return identifier != null && VALID.matcher(identifier).matches();
    }

    /**
     * Returns a well-formed identifier for whatever was found in storage.
     * Valid identifiers are returned unchanged. Otherwise up to 13 trailing
     * digits are kept and left-padded with zeros; a value without any digit
     * (including {@code null}) is replaced by a freshly generated identifier.
     */
    public static String normalize(String identifier) {
        if (isValid(identifier)) {
            return identifier;
        }

        String digits = identifier == null ? "" : NON_DIGIT.matcher(identifier).replaceAll("");
        if (digits.isEmpty()) {
            return generate();
        }
        if (digits.length() > DIGITS) {
            digits = digits.substring(digits.length() - DIGITS);
        }
        return PREFIX + "0".repeat(DIGITS - digits.length()) + digits;
    }

    public static String generate() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder builder = new StringBuilder(PREFIX.length() + DIGITS).append(PREFIX);
        for (int i = 0; i < DIGITS; i++) {
            builder.append(random.nextInt(10));
        }
        return builder.toString();
    }
}
