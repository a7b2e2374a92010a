package de.bsommerfeld.tachobridge.connection;

/**
 * Base of every failure the connection layer reports to its callers.
 *
 * <p>
 * The exception message is technical detail for the log. What the user sees
 * is resolved from {@link #messageKey()} through the i18n bundle, so a
 * failure never shows a raw status code or stack trace.
 */
public class ConnectionException extends Exception {

    private final String messageKey;

    public ConnectionException(String messageKey, String message) {
        super(message);
        this.messageKey = messageKey;
    }

    public ConnectionException(String messageKey, String message, Throwable cause) {
        super(message, cause);
        this.messageKey = messageKey;
    }

    /** i18n key of the user-facing text for this failure. */
    public String messageKey() {
        return messageKey;
    }
}
