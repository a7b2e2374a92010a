package de.bsommerfeld.tachobridge.connection;

/**
 * A status check answered with something other than the expected
 * present/absent statuses. Covers both the authorization poll and the bridge
 * client existence check.
 */
public class VerificationException extends ConnectionException {

    private final int statusCode;

    public VerificationException(String messageKey, String message, int statusCode, Throwable cause) {
        super(messageKey, message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the rejected check, {@code -1} if no response arrived. */
    public int statusCode() {
        return statusCode;
    }

    /** The request never got an answer (connection refused, timeout, ...). */
    public boolean isTransportFailure() {
        return statusCode < 0;
    }
}
