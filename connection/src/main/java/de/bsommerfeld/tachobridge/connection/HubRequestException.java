package de.bsommerfeld.tachobridge.connection;

/**
 * An authenticated Hub call failed after the single permitted session
 * refresh, or returned a response lacking a required field.
 */
public class HubRequestException extends ConnectionException {

    private final int statusCode;

    public HubRequestException(String messageKey, String message, int statusCode) {
        super(messageKey, message);
        this.statusCode = statusCode;
    }

    public HubRequestException(String messageKey, String message, int statusCode, Throwable cause) {
        super(messageKey, message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status, {@code -1} for transport failures and malformed responses. */
    public int statusCode() {
        return statusCode;
    }
}
