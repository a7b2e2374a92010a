package de.bsommerfeld.tachobridge.connection;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.connection.ConnectionEvents.AuthorizationStateChanged;
import de.bsommerfeld.tachobridge.connection.ConnectionEvents.ConnectionStatusChanged;
import de.bsommerfeld.tachobridge.connection.card.CardSyncService;
import de.bsommerfeld.tachobridge.core.domain.CredentialSet;
import de.bsommerfeld.tachobridge.core.domain.UserIdentity;
import de.bsommerfeld.tachobridge.core.event.ApplicationEventBus;
import de.bsommerfeld.tachobridge.core.i18n.I18nService;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * The connection session: the one place that knows whether this device is
 * signed in, what to tell the user about it, and which command comes next.
 *
 * <p>
 * Every command runs on the connection executor and returns a future that
 * completes once the command settled. Status changes are published as
 * {@link ConnectionStatusChanged}; the getters return the latest state for
 * late subscribers.
 *
 * <p>
 * Once signed in, the controller makes sure the bridge client is registered
 * and triggers a card synchronization.
 */
@Singleton
public class ConnectionController {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionController.class);

    private final TokenChainManager tokenChain;
    private final DeviceAuthorizationFlow flow;
    private final BridgeClientRegistrar registrar;
    private final CardSyncService cardSync;
    private final ApplicationEventBus eventBus;
    private final I18nService i18n;
    private final ScheduledExecutorService executor;

    private volatile ConnectionStatus status = ConnectionStatus.LOADING;
    private volatile String statusMessage;
    private volatile UserIdentity currentUser;
    private volatile boolean outdated;

    private CompletableFuture<Void> focusCheck;

    @Inject
    public ConnectionController(TokenChainManager tokenChain, DeviceAuthorizationFlow flow,
            BridgeClientRegistrar registrar, CardSyncService cardSync, ApplicationEventBus eventBus,
            I18nService i18n, @Named("connection") ScheduledExecutorService executor) {
        this.tokenChain = tokenChain;
        this.flow = flow;
        this.registrar = registrar;
        this.cardSync = cardSync;
        this.eventBus = eventBus;
        this.i18n = i18n;
        this.executor = executor;
        this.statusMessage = i18n.get(MessageKeys.STATUS_CHECKING);
        eventBus.register(this);
    }

    // -- Read interface --

    public ConnectionStatus status() {
        return status;
    }

    public String statusMessage() {
        return statusMessage;
    }

    /** Signed-in user, {@code null} unless {@link #status()} is {@code READY}. */
    public UserIdentity currentUser() {
        return currentUser;
    }

    /** The backends refused this application version. */
    public boolean isOutdated() {
        return outdated;
    }

    // -- Commands --

    /** Resumes a pending authorization or validates the stored session. */
    public CompletableFuture<Void> initialize() {
        return submit(() -> {
            updateStatus(ConnectionStatus.LOADING, i18n.get(MessageKeys.STATUS_CHECKING));
            if (flow.resume()) {
                updateStatus(ConnectionStatus.LOADING, i18n.get(MessageKeys.STATUS_RESUMING));
                return;
            }
            refreshSessionNow();
        });
    }

    /** Starts the browser login. */
    public CompletableFuture<Void> connect() {
        return submit(() -> {
            updateStatus(ConnectionStatus.LOADING, i18n.get(MessageKeys.STATUS_REQUESTING));
            try {
                flow.start();
                updateStatus(ConnectionStatus.LOADING, i18n.get(MessageKeys.STATUS_COMPLETE_IN_BROWSER));
            } catch (ApplicationOutdatedException e) {
                markOutdated(e);
            } catch (ConnectionException e) {
                LOG.error("Could not start the login: {}", e.getMessage(), e);
                updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(e.messageKey()));
            } catch (RuntimeException e) {
                failUnexpectedly("Starting the login", e);
            }
        });
    }

    /**
     * Stops any pending login, removes the bridge registration and signs
     * out. Local credentials are cleared even when the removal fails.
     */
    public CompletableFuture<Void> disconnect() {
        return submit(() -> {
            flow.cancel();
            currentUser = null;
            try {
                if (tokenChain.credentials().bridgeDeviceId() != null) {
                    updateStatus(ConnectionStatus.LOADING, i18n.get(MessageKeys.STATUS_DISCONNECTING));
                    registrar.unregister();
                }
            } catch (ConnectionException e) {
                LOG.error("Could not remove the bridge client: {}", e.getMessage(), e);
            } finally {
                tokenChain.clearCredentials();
                updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(MessageKeys.STATUS_NOT_CONNECTED));
            }
        });
    }

    /** Validates the stored session and completes the connection if it holds. */
    public CompletableFuture<Void> refreshSession() {
        return submit(this::refreshSessionNow);
    }

    /**
     * Called when the application regains focus, typically after the user
     * approved the login in the browser. Polls a pending authorization right
     * away, otherwise revalidates the session. Concurrent calls share one
     * check.
     */
    public synchronized CompletableFuture<Void> checkStatusOnFocus() {
        if (focusCheck != null) {
            return focusCheck;
        }
        CompletableFuture<Void> check = submit(() -> {
            if (flow.resume()) {
                flow.pollOnce();
                return;
            }
            refreshSessionNow();
        });
        focusCheck = check;
        check.whenComplete((ignored, error) -> releaseFocusCheck(check));
        return check;
    }

    public void pausePolling() {
        flow.pause();
    }

    public boolean resumePollingIfPending() {
        return flow.resume();
    }

    // -- Flow events --

    @Subscribe
    public void onAuthorizationStateChanged(AuthorizationStateChanged event) {
        switch (event.current()) {
            case VERIFYING -> updateStatus(ConnectionStatus.LOADING, i18n.get(MessageKeys.STATUS_CONFIRMED));
            case READY -> {
                UserIdentity user = flow.user();
                executor.execute(() -> completeConnection(user));
            }
            case EXPIRED -> updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(MessageKeys.STATUS_EXPIRED));
            case FAILED -> {
                ConnectionException failure = flow.lastFailure();
                if (failure instanceof ApplicationOutdatedException outdatedFailure) {
                    markOutdated(outdatedFailure);
                } else {
                    updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(
                            failure != null ? failure.messageKey() : MessageKeys.ERROR_VERIFICATION));
                }
            }
            default -> {
                // IDLE and the in-progress states carry no new information for the user.
            }
        }
    }

    // -- Internals --

    private void refreshSessionNow() {
        CredentialSet credentials = tokenChain.credentials();
        if (!credentials.hasDeviceToken() && !credentials.hasSessionToken()) {
            currentUser = null;
            updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(MessageKeys.STATUS_SIGN_IN));
            return;
        }

        updateStatus(ConnectionStatus.LOADING, i18n.get(MessageKeys.STATUS_VALIDATING));
        try {
            LoginOutcome outcome = tokenChain.ensureSession();
            if (outcome instanceof LoginOutcome.Rejected rejected) {
                currentUser = null;
                updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(rejected.reasonKey()));
                return;
            }
            completeConnection(outcome.user());
        } catch (ApplicationOutdatedException e) {
            markOutdated(e);
        } catch (ConnectionException e) {
            LOG.warn("Stored session is not usable: {}", e.getMessage());
            currentUser = null;
            updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(e.messageKey()));
        } catch (RuntimeException e) {
            failUnexpectedly("Validating the session", e);
        }
    }

    private void completeConnection(UserIdentity user) {
        try {
            registrar.ensureRegistered();
        } catch (ApplicationOutdatedException e) {
            markOutdated(e);
            return;
        } catch (ConnectionException e) {
            LOG.error("Bridge registration failed: {}", e.getMessage(), e);
            currentUser = null;
            updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(e.messageKey()));
            return;
        } catch (RuntimeException e) {
            failUnexpectedly("Bridge registration", e);
            return;
        }

        currentUser = user;
        updateStatus(ConnectionStatus.READY, i18n.get(MessageKeys.STATUS_CONNECTED, user.displayName()));
        cardSync.synchronize().whenComplete((plan, error) -> {
            if (error != null) {
                LOG.warn("Card synchronization after connecting failed: {}", error.getMessage());
            }
        });
    }

    /** Failures outside the connection error model, e.g. a credential store that cannot write. */
    private void failUnexpectedly(String step, RuntimeException e) {
        LOG.error("{} failed unexpectedly", step, e);
        currentUser = null;
        updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(MessageKeys.ERROR_UNEXPECTED));
    }

    private void markOutdated(ApplicationOutdatedException e) {
        LOG.error("Application version is outdated: {}", e.getMessage());
        outdated = true;
        flow.pause();
        currentUser = null;
        updateStatus(ConnectionStatus.NEEDS_LOGIN, i18n.get(MessageKeys.ERROR_OUTDATED));
    }

    private void updateStatus(ConnectionStatus next, String message) {
        status = next;
        statusMessage = message;
        LOG.debug("Connection status {}: {}", next, message);
        eventBus.post(new ConnectionStatusChanged(next, message));
    }

    private synchronized void releaseFocusCheck(CompletableFuture<Void> check) {
        if (focusCheck == check) {
            focusCheck = null;
        }
    }

    private CompletableFuture<Void> submit(Runnable command) {
        return CompletableFuture.runAsync(command, executor);
    }
}
