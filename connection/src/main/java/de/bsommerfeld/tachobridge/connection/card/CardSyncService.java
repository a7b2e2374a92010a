package de.bsommerfeld.tachobridge.connection.card;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.api.FleetClient;
import de.bsommerfeld.tachobridge.api.JsonFields;
import de.bsommerfeld.tachobridge.connection.ConnectionEvents.CardsSynchronized;
import de.bsommerfeld.tachobridge.connection.ConnectionException;
import de.bsommerfeld.tachobridge.connection.FleetRequestException;
import de.bsommerfeld.tachobridge.connection.TokenChainManager;
import de.bsommerfeld.tachobridge.core.domain.LocalCard;
import de.bsommerfeld.tachobridge.core.domain.RemoteCard;
import de.bsommerfeld.tachobridge.core.event.ApplicationEventBus;
import de.bsommerfeld.tachobridge.store.CardRegistry;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Keeps the local card registry and the Fleet card directory aligned.
 *
 * <p>
 * {@link #synchronize()} pulls the directory and applies the reconciliation
 * to the local registry only. Only one pass runs at a time; a caller arriving
 * during a pass receives the future of the running one.
 *
 * <p>
 * User edits go the other way: {@link #createCard}, {@link #updateCard} and
 * {@link #deleteCard} write to Fleet first, mirror the result locally and
 * then start a pass in the background to pick up server-side changes.
 */
@Singleton
public class CardSyncService {

    private static final Logger LOG = LoggerFactory.getLogger(CardSyncService.class);

    private final TokenChainManager tokenChain;
    private final FleetClient fleet;
    private final CardRegistry registry;
    private final ApplicationEventBus eventBus;
    private final Executor executor;

    private CompletableFuture<ReconciliationPlan> inFlight;

    @Inject
    public CardSyncService(TokenChainManager tokenChain, FleetClient fleet, CardRegistry registry,
            ApplicationEventBus eventBus, @Named("connection") Executor executor) {
        this.tokenChain = tokenChain;
        this.fleet = fleet;
        this.registry = registry;
        this.eventBus = eventBus;
        this.executor = executor;
    }

    /**
     * Runs a reconciliation pass, or joins the one already running.
     *
     * @return the applied plan; fails with the {@link ConnectionException}
     *         that aborted the pass
     */
    public synchronized CompletableFuture<ReconciliationPlan> synchronize() {
        if (inFlight != null) {
            LOG.debug("Card synchronization already running, joining it");
            return inFlight;
        }

        CompletableFuture<ReconciliationPlan> pass = new CompletableFuture<>();
        inFlight = pass;
        executor.execute(() -> {
            try {
                ReconciliationPlan plan = runPass();
                release(pass);
                pass.complete(plan);
            } catch (ConnectionException | RuntimeException e) {
                LOG.error("Card synchronization failed", e);
                release(pass);
                pass.completeExceptionally(e);
            }
        });
        return pass;
    }

    private synchronized void release(CompletableFuture<ReconciliationPlan> pass) {
        if (inFlight == pass) {
            inFlight = null;
        }
    }

    private ReconciliationPlan runPass() throws ConnectionException {
        Map<String, RemoteCard> remote = fetchRemoteCards();
        Map<String, LocalCard> local = registry.loadAll();
        ReconciliationPlan plan = CardReconciliationEngine.reconcile(local, remote);

        plan.missingLocalCards().values().forEach(registry::upsert);
        plan.updatedLocalCards().values().forEach(registry::upsert);

        LOG.info("Cards synchronized: {} imported, {} updated ({} remote, {} local)",
                plan.missingLocalCards().size(), plan.updatedLocalCards().size(), remote.size(), local.size());
        eventBus.post(new CardsSynchronized(plan));
        return plan;
    }

    /** The Fleet card directory keyed by card number. Malformed entries are skipped. */
    public Map<String, RemoteCard> fetchRemoteCards() throws ConnectionException {
        JsonNode response = JsonFields.unwrap(tokenChain.callFleet("GET", FleetClient::cardsPath, null));
        Map<String, RemoteCard> cards = new LinkedHashMap<>();
        if (response == null || !response.isArray()) {
            LOG.warn("Card directory response is not a list, treating it as empty");
            return cards;
        }
        for (JsonNode node : response) {
            String cardNumber = JsonFields.text(node, "card_number");
            if (!LocalCard.isValidCardNumber(cardNumber)) {
                LOG.warn("Skipping remote card with invalid number '{}'", cardNumber);
                continue;
            }
            cards.put(cardNumber, new RemoteCard(cardNumber, JsonFields.text(node, "name"),
                    JsonFields.text(node, "iccid"), JsonFields.text(node, "id")));
        }
        return cards;
    }

    // =====================================================================
    // User edits
    // =====================================================================

    /** Creates the card in Fleet and stores it locally with its remote id. */
    public LocalCard createCard(LocalCard card) throws ConnectionException {
        requireValidNumber(card.cardNumber());
        LocalCard stored = create(card);
        synchronizeAfterEdit();
        return stored;
    }

    private LocalCard create(LocalCard card) throws ConnectionException {
        JsonNode response = JsonFields.unwrap(tokenChain.callFleet("POST", FleetClient::cardsPath, toJson(card)));
        LocalCard stored = card.withRemoteId(JsonFields.text(response, "id"));
        registry.upsert(stored);
        LOG.info("Card {} created remotely as {}", stored.cardNumber(), stored.remoteId());
        return stored;
    }

    /**
     * Pushes a changed card to Fleet. A card that was never propagated is
     * created instead.
     */
    public LocalCard updateCard(LocalCard card) throws ConnectionException {
        requireValidNumber(card.cardNumber());
        String remoteId = card.remoteId() != null ? card.remoteId()
                : registry.find(card.cardNumber()).map(LocalCard::remoteId).orElse(null);
        LocalCard stored;
        if (remoteId == null) {
            stored = create(card);
        } else {
            tokenChain.callFleet("PUT", companyId -> FleetClient.cardPath(companyId, remoteId), toJson(card));
            stored = card.withRemoteId(remoteId);
            registry.upsert(stored);
            LOG.info("Card {} updated", stored.cardNumber());
        }
        synchronizeAfterEdit();
        return stored;
    }

    /**
     * Deletes the card from Fleet and from the local registry. A remote
     * record that is already gone counts as deleted.
     *
     * @return {@code true} if the card was known locally
     */
    public boolean deleteCard(String cardNumber) throws ConnectionException {
        requireValidNumber(cardNumber);
        Optional<LocalCard> local = registry.find(cardNumber);
        String remoteId = local.map(LocalCard::remoteId).orElse(null);
        if (remoteId != null) {
            try {
                tokenChain.callFleet("DELETE", companyId -> FleetClient.cardPath(companyId, remoteId), null);
            } catch (FleetRequestException e) {
                if (!e.isNotFound()) {
                    throw e;
                }
                LOG.debug("Card {} was already gone remotely", cardNumber);
            }
        }
        boolean removed = registry.remove(cardNumber);
        LOG.info("Card {} deleted", cardNumber);
        synchronizeAfterEdit();
        return removed;
    }

    private void synchronizeAfterEdit() {
        synchronize().whenComplete((plan, error) -> {
            if (error != null) {
                LOG.warn("Card synchronization after a local edit failed: {}", error.getMessage());
            }
        });
    }

    private ObjectNode toJson(LocalCard card) {
        ObjectNode body = fleet.newObject();
        body.put("card_number", card.cardNumber());
        if (card.displayName() != null) {
            body.put("name", card.displayName());
        }
        if (card.iccid() != null) {
            body.put("iccid", card.iccid());
        }
        return body;
    }

    private static void requireValidNumber(String cardNumber) {
        if (!LocalCard.isValidCardNumber(cardNumber)) {
            throw new IllegalArgumentException("Card number must be 16 alphanumeric characters: " + cardNumber);
        }
    }
}
