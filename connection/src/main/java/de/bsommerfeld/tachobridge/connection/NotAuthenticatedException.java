package de.bsommerfeld.tachobridge.connection;

/**
 * No device or session token is available; the user has to sign in.
 */
public class NotAuthenticatedException extends ConnectionException {

    public NotAuthenticatedException(String message) {
        super(MessageKeys.ERROR_NOT_AUTHENTICATED, message);
    }
}
