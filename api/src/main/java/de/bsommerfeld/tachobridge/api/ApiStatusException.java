package de.bsommerfeld.tachobridge.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;

/**
 * A backend answered with a non-2xx status. The request helpers never decide
 * whether a status is meaningful; they raise this and let the calling flow
 * interpret it (404 while polling, 401 for a token refresh, 409 while
 * registering the bridge client).
 */
public class ApiStatusException extends IOException {

    private final int statusCode;
    private final transient JsonNode body;

    public ApiStatusException(int statusCode, URI uri, JsonNode body) {
        super("HTTP " + statusCode + " for " + redact(uri));
        this.statusCode = statusCode;
        this.body = body;
    }

    public int statusCode() {
        return statusCode;
    }

    /** Parsed response body; a missing node when the body was empty or not JSON. */
    public JsonNode body() {
        return body;
    }

    public boolean isUnauthorized() {
        return statusCode == 401;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }

    /** The backend refuses this client version ({@code 426 Upgrade Required}). */
    public boolean isUpgradeRequired() {
        return statusCode == 426;
    }

    // Authorization tokens travel as query parameters on the polling endpoint.
    private static String redact(URI uri) {
        String text = uri.toString();
        int query = text.indexOf('?');
        return query < 0 ? text : text.substring(0, query) + "?…";
    }
}
