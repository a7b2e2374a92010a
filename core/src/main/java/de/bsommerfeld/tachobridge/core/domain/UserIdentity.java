package de.bsommerfeld.tachobridge.core.domain;

/**
 * Read-only snapshot of the signed-in Hub user, fetched after every session
 * creation. Never persisted.
 *
 * @param id               Hub user id
 * @param email            login e-mail address
 * @param firstName        given name, may be {@code null}
 * @param lastName         family name, may be {@code null}
 * @param currentRole      role within the current organization (e.g.
 *                         {@code "owner"}, {@code "employee"})
 * @param organizationName name of the organization the session is scoped to
 */
public record UserIdentity(
        String id,
        String email,
        String firstName,
        String lastName,
        String currentRole,
        String organizationName) {

    /** Role that may never operate the card bridge. */
    public static final String EMPLOYEE_ROLE = "employee";

    public boolean isEmployee() {
        return EMPLOYEE_ROLE.equals(currentRole);
    }

    /** Full name when known, the e-mail address otherwise. */
    public String displayName() {
        String full = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        return full.isEmpty() ? email : full;
    }
}
