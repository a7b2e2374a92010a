package de.bsommerfeld.tachobridge.connection;

/**
 * The bridge client registration could not be created or verified within the
 * bounded number of attempts.
 */
public class BridgeClientResolutionException extends ConnectionException {

    public BridgeClientResolutionException(String messageKey, String message) {
        super(messageKey, message);
    }

    public BridgeClientResolutionException(String messageKey, String message, Throwable cause) {
        super(messageKey, message, cause);
    }
}
