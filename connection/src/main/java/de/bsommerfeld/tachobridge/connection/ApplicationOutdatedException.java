package de.bsommerfeld.tachobridge.connection;

/**
 * A backend answered {@code 426 Upgrade Required}: this build is too old to
 * talk to it. Nothing short of installing a newer version helps.
 */
public class ApplicationOutdatedException extends ConnectionException {

    public ApplicationOutdatedException(String message, Throwable cause) {
        super(MessageKeys.ERROR_OUTDATED, message, cause);
    }
}
