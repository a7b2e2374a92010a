package de.bsommerfeld.tachobridge.connection;

/**
 * The Hub refused to start a device authorization, or answered without a
 * token or approval URL. Nothing has been persisted when this is thrown.
 */
public class AuthorizationStartException extends ConnectionException {

    public AuthorizationStartException(String messageKey, String message) {
        super(messageKey, message);
    }

    public AuthorizationStartException(String messageKey, String message, Throwable cause) {
        super(messageKey, message, cause);
    }
}
