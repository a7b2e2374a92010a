package de.bsommerfeld.tachobridge.connection;

import java.net.URI;

/**
 * A started device authorization: the token to poll with and the page where
 * the user approves it.
 */
public record AuthorizationTicket(String token, URI approvalUrl) {
}
