package de.bsommerfeld.tachobridge.store;

/**
 * Thrown when a store cannot write its file. Losing a freshly derived token
 * silently would force a full re-login on the next start, so write failures
 * always propagate.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
