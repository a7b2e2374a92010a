package de.bsommerfeld.tachobridge.connection;

import de.bsommerfeld.tachobridge.core.domain.UserIdentity;

/**
 * The signed-in user holds a role that may not operate the bridge. This is a
 * business rule, not a transient failure: credentials are cleared and the
 * login is never retried.
 */
public class RoleNotAllowedException extends ConnectionException {

    private final transient UserIdentity user;

    public RoleNotAllowedException(UserIdentity user) {
        super(MessageKeys.ERROR_ROLE_NOT_ALLOWED, "Role '" + user.currentRole() + "' of user " + user.id()
                + " is not allowed to use the bridge");
        this.user = user;
    }

    public UserIdentity user() {
        return user;
    }
}
