package de.bsommerfeld.tachobridge.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.api.ApiStatusException;
import de.bsommerfeld.tachobridge.api.HubClient;
import de.bsommerfeld.tachobridge.api.JsonFields;
import de.bsommerfeld.tachobridge.connection.ConnectionEvents.AuthorizationStateChanged;
import de.bsommerfeld.tachobridge.core.config.AuthorizationConfig;
import de.bsommerfeld.tachobridge.core.config.GlobalConfig;
import de.bsommerfeld.tachobridge.core.domain.UserIdentity;
import de.bsommerfeld.tachobridge.core.event.ApplicationEventBus;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Browser-based device authorization: request a token, let the user approve
 * it in the browser, poll until approved, exchange it for device and session
 * tokens.
 *
 * <h3>Polling</h3>
 * One fixed-rate loop per pending token on the connection executor. The
 * ceiling is measured from poll start; the first tick at or past it stops
 * the loop, discards the pending token and reports {@code EXPIRED}. A poll
 * answered with 404 is still pending, a transport failure is retried on the
 * next tick, anything else aborts the flow.
 *
 * <h3>Resumption</h3>
 * The pending token is persisted as soon as the authorization starts, so a
 * restart resumes polling instead of asking the user to approve again.
 *
 * <p>
 * HTTP calls run outside the monitor. A result is only applied when the
 * pending token is still the one that was checked; anything else means the
 * flow was cancelled or restarted meanwhile and the result is dropped.
 */
@Singleton
public class DeviceAuthorizationFlow {

    private static final Logger LOG = LoggerFactory.getLogger(DeviceAuthorizationFlow.class);

    private final HubClient hub;
    private final TokenChainManager tokenChain;
    private final BrowserLauncher browser;
    private final ScheduledExecutorService executor;
    private final Clock clock;
    private final ApplicationEventBus eventBus;
    private final AuthorizationConfig config;

    private AuthorizationState state = AuthorizationState.IDLE;
    private String pendingToken;
    private URI approvalUrl;
    private Instant pollStart;
    private ScheduledFuture<?> pollTask;
    private ConnectionException lastFailure;
    private UserIdentity user;

    @Inject
    public DeviceAuthorizationFlow(HubClient hub, TokenChainManager tokenChain, BrowserLauncher browser,
            @Named("connection") ScheduledExecutorService executor, Clock clock, ApplicationEventBus eventBus,
            GlobalConfig config) {
        this.hub = hub;
        this.tokenChain = tokenChain;
        this.browser = browser;
        this.executor = executor;
        this.clock = clock;
        this.eventBus = eventBus;
        this.config = config.getAuthorization();
    }

    // =====================================================================
    // Commands
    // =====================================================================

    /**
     * Starts a new authorization, or returns the running one while its poll
     * loop is still active. A paused or resumed-but-stopped authorization is
     * replaced by a fresh one.
     *
     * @throws AuthorizationStartException   if the Hub refused or answered malformed
     * @throws ApplicationOutdatedException  if the Hub requires a newer version
     */
    public AuthorizationTicket start() throws ConnectionException {
        synchronized (this) {
            if (state == AuthorizationState.AWAITING_USER_CONFIRMATION && pendingToken != null
                    && approvalUrl != null && isPolling()) {
                LOG.debug("Authorization already awaiting confirmation");
                return new AuthorizationTicket(pendingToken, approvalUrl);
            }
        }

        AuthorizationTicket ticket = requestDeviceAuthorization();
        tokenChain.rememberPendingAuthorization(ticket.token());
        synchronized (this) {
            stopPolling();
            lastFailure = null;
            user = null;
            pollStart = null;
            approvalUrl = ticket.approvalUrl();
            transition(AuthorizationState.AWAITING_USER_CONFIRMATION);
            beginPolling(ticket.token());
        }

        try {
            browser.open(ticket.approvalUrl());
        } catch (IOException | UnsupportedOperationException e) {
            LOG.warn("Could not open the browser, approval URL has to be opened manually: {}",
                    ticket.approvalUrl(), e);
        }
        return ticket;
    }

    /**
     * Asks the Hub for a fresh authorization token. Persists nothing; a
     * failure leaves the credential store exactly as it was.
     */
    public AuthorizationTicket requestDeviceAuthorization() throws ConnectionException {
        JsonNode response;
        try {
            response = JsonFields.unwrap(hub.requestAuthenticationToken());
        } catch (ApiStatusException e) {
            TokenChainManager.checkOutdated(e);
            throw new AuthorizationStartException(MessageKeys.ERROR_AUTHORIZATION_START,
                    "Hub refused the authorization request with HTTP " + e.statusCode(), e);
        } catch (IOException e) {
            throw new AuthorizationStartException(MessageKeys.ERROR_NETWORK, "Authorization request failed", e);
        }

        String token = JsonFields.text(response, "token");
        String url = JsonFields.text(response, "url");
        if (token == null || url == null) {
            throw new AuthorizationStartException(MessageKeys.ERROR_AUTHORIZATION_RESPONSE,
                    "Authorization response lacks " + (token == null ? "token" : "url"));
        }

        try {
            return new AuthorizationTicket(token, URI.create(withRedirect(url)));
        } catch (IllegalArgumentException e) {
            throw new AuthorizationStartException(MessageKeys.ERROR_AUTHORIZATION_RESPONSE,
                    "Authorization response carries an invalid url", e);
        }
    }

    /**
     * One status check.
     *
     * @return {@code true} once the user approved, {@code false} while pending
     * @throws VerificationException for any status other than 200 and 404;
     *                               status {@code -1} if no answer arrived
     */
    public boolean checkAuthorizationStatus(String token) throws ConnectionException {
        try {
            JsonNode response = JsonFields.unwrap(hub.checkAuthenticationToken(token));
            return response.path("success").asBoolean(false);
        } catch (ApiStatusException e) {
            if (e.isNotFound()) {
                return false;
            }
            TokenChainManager.checkOutdated(e);
            throw new VerificationException(MessageKeys.ERROR_VERIFICATION,
                    "Authorization check answered HTTP " + e.statusCode(), e.statusCode(), e);
        } catch (IOException e) {
            throw new VerificationException(MessageKeys.ERROR_NETWORK, "Authorization check failed", -1, e);
        }
    }

    /**
     * Resumes polling for a token persisted by an earlier run or paused
     * earlier in this one.
     *
     * @return {@code true} if a poll loop is running afterwards
     */
    public synchronized boolean resume() {
        String token = tokenChain.credentials().pendingAuthorizationToken();
        if (token == null) {
            return false;
        }
        if (isPolling() && token.equals(pendingToken)) {
            return true;
        }
        LOG.info("Resuming pending device authorization");
        if (state != AuthorizationState.AWAITING_USER_CONFIRMATION) {
            transition(AuthorizationState.AWAITING_USER_CONFIRMATION);
        }
        beginPolling(token);
        return true;
    }

    /**
     * Starts the poll loop for {@code token}. A loop for the same token is
     * never started twice; a loop for another token is replaced.
     *
     * @return {@code false} if a loop for this token is already running
     */
    synchronized boolean beginPolling(String token) {
        if (isPolling()) {
            if (token.equals(pendingToken)) {
                return false;
            }
            stopPolling();
        }
        if (!token.equals(pendingToken) || pollStart == null) {
            pollStart = clock.instant();
        }
        pendingToken = token;
        long interval = config.getPollIntervalSeconds();
        pollTask = executor.scheduleAtFixedRate(this::pollOnce, interval, interval, TimeUnit.SECONDS);
        LOG.debug("Polling authorization every {}s", interval);
        return true;
    }

    /** Stops polling and forgets the pending token. */
    public synchronized void cancel() {
        stopPolling();
        pendingToken = null;
        approvalUrl = null;
        pollStart = null;
        tokenChain.forgetPendingAuthorization();
        if (state != AuthorizationState.IDLE) {
            transition(AuthorizationState.IDLE);
        }
    }

    /** Stops the timer but keeps the pending token for {@link #resume()}. */
    public synchronized void pause() {
        if (isPolling()) {
            LOG.debug("Pausing authorization polling");
            stopPolling();
        }
    }

    // =====================================================================
    // Poll loop
    // =====================================================================

    void pollOnce() {
        try {
            poll();
        } catch (RuntimeException e) {
            LOG.error("Authorization poll failed unexpectedly", e);
            String token;
            synchronized (this) {
                token = pendingToken;
            }
            fail(token, new VerificationException(MessageKeys.ERROR_VERIFICATION, e.getMessage(), -1, e));
        }
    }

    private void poll() {
        String token;
        synchronized (this) {
            if (state != AuthorizationState.AWAITING_USER_CONFIRMATION || pendingToken == null) {
                stopPolling();
                return;
            }
            Duration timeout = Duration.ofMinutes(config.getPollTimeoutMinutes());
            if (!clock.instant().isBefore(pollStart.plus(timeout))) {
                expire();
                return;
            }
            token = pendingToken;
        }

        boolean confirmed;
        try {
            confirmed = checkAuthorizationStatus(token);
        } catch (VerificationException e) {
            if (e.isTransportFailure()) {
                LOG.warn("Authorization check did not reach the Hub, retrying next tick: {}", e.getMessage());
                return;
            }
            fail(token, e);
            return;
        } catch (ConnectionException e) {
            fail(token, e);
            return;
        }
        if (!confirmed) {
            return;
        }

        synchronized (this) {
            if (!token.equals(pendingToken) || state != AuthorizationState.AWAITING_USER_CONFIRMATION) {
                LOG.debug("Discarding confirmation for a superseded authorization");
                return;
            }
            stopPolling();
            transition(AuthorizationState.VERIFYING);
        }
        LOG.info("Device authorization confirmed by the user");
        finalizeAuthorization(token);
    }

    /**
     * Exchanges the approved token for credentials and applies the role
     * gate. A rejected role clears every credential and fails the flow; it
     * is never retried.
     */
    void finalizeAuthorization(String token) {
        synchronized (this) {
            transition(AuthorizationState.FINALIZING);
        }
        try {
            tokenChain.registerDevice(token);
            tokenChain.forgetPendingAuthorization();
            tokenChain.createSession();
            LoginOutcome outcome = LoginOutcome.evaluate(tokenChain.fetchCurrentUser());

            if (outcome instanceof LoginOutcome.Rejected rejected) {
                LOG.warn("Role '{}' may not use the bridge, discarding credentials", rejected.user().currentRole());
                tokenChain.clearCredentials();
                fail(token, new RoleNotAllowedException(rejected.user()));
                return;
            }

            synchronized (this) {
                if (state != AuthorizationState.FINALIZING) {
                    LOG.debug("Authorization was cancelled while finalizing");
                    return;
                }
                user = outcome.user();
                pendingToken = null;
                pollStart = null;
                transition(AuthorizationState.READY);
            }
            LOG.info("Signed in as user {}", outcome.user().id());
        } catch (ConnectionException e) {
            fail(token, e);
        }
    }

    private void expire() {
        LOG.info("Device authorization was not confirmed in time");
        stopPolling();
        pendingToken = null;
        pollStart = null;
        tokenChain.forgetPendingAuthorization();
        transition(AuthorizationState.EXPIRED);
    }

    private synchronized void fail(String token, ConnectionException failure) {
        if (token != null && pendingToken != null && !token.equals(pendingToken)) {
            LOG.debug("Discarding failure of a superseded authorization: {}", failure.getMessage());
            return;
        }
        LOG.error("Device authorization failed: {}", failure.getMessage(), failure);
        stopPolling();
        pendingToken = null;
        pollStart = null;
        lastFailure = failure;
        tokenChain.forgetPendingAuthorization();
        transition(AuthorizationState.FAILED);
    }

    // =====================================================================
    // State
    // =====================================================================

    public synchronized AuthorizationState state() {
        return state;
    }

    /** Failure that moved the flow to {@code FAILED}, {@code null} otherwise. */
    public synchronized ConnectionException lastFailure() {
        return lastFailure;
    }

    /** User accepted by the last finalization, {@code null} before that. */
    public synchronized UserIdentity user() {
        return user;
    }

    public synchronized URI approvalUrl() {
        return approvalUrl;
    }

    synchronized boolean isPolling() {
        return pollTask != null && !pollTask.isDone();
    }

    private void stopPolling() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
    }

    private void transition(AuthorizationState next) {
        AuthorizationState previous = state;
        state = next;
        LOG.debug("Authorization {} -> {}", previous, next);
        eventBus.post(new AuthorizationStateChanged(previous, next));
    }

    private String withRedirect(String url) {
        String redirect = config.getRedirectUri();
        if (redirect == null || redirect.isBlank()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + "redirect="
                + URLEncoder.encode(redirect, StandardCharsets.UTF_8);
    }
}
