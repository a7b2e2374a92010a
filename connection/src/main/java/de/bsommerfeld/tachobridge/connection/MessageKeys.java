package de.bsommerfeld.tachobridge.connection;

/**
 * Keys into {@code i18n/messages*.properties} for every user-facing status
 * and error text of the connection layer.
 */
public final class MessageKeys {

    public static final String STATUS_CHECKING = "status.checking";
    public static final String STATUS_VALIDATING = "status.validating";
    public static final String STATUS_SIGN_IN = "status.sign-in";
    public static final String STATUS_REQUESTING = "status.requesting";
    public static final String STATUS_COMPLETE_IN_BROWSER = "status.complete-in-browser";
    public static final String STATUS_RESUMING = "status.resuming";
    public static final String STATUS_CONFIRMED = "status.confirmed";
    public static final String STATUS_CONNECTED = "status.connected";
    public static final String STATUS_DISCONNECTING = "status.disconnecting";
    public static final String STATUS_NOT_CONNECTED = "status.not-connected";
    public static final String STATUS_EXPIRED = "status.expired";

    public static final String ERROR_NETWORK = "error.network";
    public static final String ERROR_OUTDATED = "error.outdated";
    public static final String ERROR_AUTHORIZATION_START = "error.authorization-start";
    public static final String ERROR_AUTHORIZATION_RESPONSE = "error.authorization-response";
    public static final String ERROR_VERIFICATION = "error.verification";
    public static final String ERROR_NOT_AUTHENTICATED = "error.not-authenticated";
    public static final String ERROR_DEVICE_REGISTRATION = "error.device-registration";
    public static final String ERROR_SESSION = "error.session";
    public static final String ERROR_HUB_REQUEST = "error.hub-request";
    public static final String ERROR_HUB_RESPONSE = "error.hub-response";
    public static final String ERROR_ROLE_NOT_ALLOWED = "error.role-not-allowed";
    public static final String ERROR_FLEET_TOKEN = "error.fleet-token";
    public static final String ERROR_FLEET_REQUEST = "error.fleet-request";
    public static final String ERROR_BRIDGE_VERIFY = "error.bridge-verify";
    public static final String ERROR_BRIDGE_CREATE = "error.bridge-create";
    public static final String ERROR_BRIDGE_RESOLVE = "error.bridge-resolve";
    public static final String ERROR_BRIDGE_REMOVE = "error.bridge-remove";
    public static final String ERROR_CARD_SYNC = "error.card-sync";
    public static final String ERROR_UNEXPECTED = "error.unexpected";

    private MessageKeys() {
    }
}
