package de.bsommerfeld.tachobridge.connection;

/**
 * States of the browser-based device authorization handshake.
 *
 * <pre>
 * IDLE ─▶ AWAITING_USER_CONFIRMATION ─▶ VERIFYING ─▶ FINALIZING ─▶ READY
 *                 │                         │             │
 *                 ▼                         ▼             ▼
 *              EXPIRED                    FAILED ◀────────┘
 * </pre>
 *
 * {@code FAILED} and {@code EXPIRED} return to {@code IDLE} on the next start.
 */
public enum AuthorizationState {
    IDLE,
    AWAITING_USER_CONFIRMATION,
    VERIFYING,
    FINALIZING,
    READY,
    EXPIRED,
    FAILED;

    /** The handshake is waiting on the user or on the backend. */
    public boolean isInProgress() {
        return this == AWAITING_USER_CONFIRMATION || this == VERIFYING || this == FINALIZING;
    }
}
