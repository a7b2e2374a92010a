package de.bsommerfeld.tachobridge.connection;

import de.bsommerfeld.tachobridge.core.domain.UserIdentity;

/**
 * Result of the role gate applied to every freshly fetched user. A rejected
 * login is a value, not an exception, so no caller can mistake it for a
 * network failure worth retrying.
 */
public sealed interface LoginOutcome permits LoginOutcome.Accepted, LoginOutcome.Rejected {

    UserIdentity user();

    /** Applies the role gate: employees are rejected, every other role accepted. */
    static LoginOutcome evaluate(UserIdentity user) {
        if (user.isEmployee()) {
            return new Rejected(user, MessageKeys.ERROR_ROLE_NOT_ALLOWED);
        }
        return new Accepted(user);
    }

    record Accepted(UserIdentity user) implements LoginOutcome {
    }

    /**
     * @param reasonKey i18n key of the user-facing explanation
     */
    record Rejected(UserIdentity user, String reasonKey) implements LoginOutcome {
    }
}
