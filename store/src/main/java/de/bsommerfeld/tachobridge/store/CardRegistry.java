package de.bsommerfeld.tachobridge.store;

import de.bsommerfeld.tachobridge.core.domain.LocalCard;

import java.util.Map;
import java.util.Optional;

/**
 * Local registry of company cards, keyed by card number. This is the
 * device's own record; keeping it aligned with the Fleet directory is the
 * job of the card sync service, never of the registry.
 */
public interface CardRegistry {

    /** Snapshot of all cards, keyed by card number. */
    Map<String, LocalCard> loadAll();

    Optional<LocalCard> find(String cardNumber);

    /** Inserts the card or replaces the one with the same card number. */
    void upsert(LocalCard card);

    /** @return {@code true} if a card with that number existed */
    boolean remove(String cardNumber);
}
