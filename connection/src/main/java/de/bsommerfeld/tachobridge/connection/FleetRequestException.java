package de.bsommerfeld.tachobridge.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * A Fleet call failed after the single permitted token refresh. Carries the
 * status and body so callers can give 404 and 409 their own meaning.
 */
public class FleetRequestException extends ConnectionException {

    private final int statusCode;
    private final transient JsonNode body;

    public FleetRequestException(String messageKey, String message, int statusCode, JsonNode body,
            Throwable cause) {
        super(messageKey, message, cause);
        this.statusCode = statusCode;
        this.body = body == null ? MissingNode.getInstance() : body;
    }

    /** HTTP status, {@code -1} for transport failures and malformed responses. */
    public int statusCode() {
        return statusCode;
    }

    public JsonNode body() {
        return body;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }
}
