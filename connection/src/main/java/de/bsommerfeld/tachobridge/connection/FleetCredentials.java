package de.bsommerfeld.tachobridge.connection;

/**
 * A Fleet bearer token together with the company it is scoped to. The two
 * are minted and persisted together; one without the other is useless.
 */
public record FleetCredentials(String token, String companyId) {
}
