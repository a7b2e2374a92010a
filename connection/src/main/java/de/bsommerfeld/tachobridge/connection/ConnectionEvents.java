package de.bsommerfeld.tachobridge.connection;

import de.bsommerfeld.tachobridge.connection.card.ReconciliationPlan;

/**
 * Events posted by the connection layer on the
 * {@link de.bsommerfeld.tachobridge.core.event.ApplicationEventBus}.
 */
public class ConnectionEvents {

    public record AuthorizationStateChanged(AuthorizationState previous, AuthorizationState current) {
    }

    /**
     * @param message localized text describing the status
     */
    public record ConnectionStatusChanged(ConnectionStatus status, String message) {
    }

    /** Fired after a reconciliation pass was applied to the local registry. */
    public record CardsSynchronized(ReconciliationPlan plan) {
    }
}
