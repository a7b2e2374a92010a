package de.bsommerfeld.tachobridge.connection;

/**
 * Coarse connection state shown to the user.
 */
public enum ConnectionStatus {
    /** Credentials are being validated or a login is in progress. */
    LOADING,
    /** No usable credentials; the user has to connect. */
    NEEDS_LOGIN,
    /** Signed in, bridge registered. */
    READY
}
