package de.bsommerfeld.tachobridge.connection.card;

import de.bsommerfeld.tachobridge.core.domain.LocalCard;

import java.util.Map;

/**
 * Changes needed to align the local registry with the Fleet directory, both
 * keyed by card number. Applying it never writes back to Fleet.
 *
 * @param missingLocalCards cards known remotely but absent locally
 * @param updatedLocalCards local cards whose remote metadata changed, in their updated form
 */
public record ReconciliationPlan(Map<String, LocalCard> missingLocalCards, Map<String, LocalCard> updatedLocalCards) {

    public ReconciliationPlan {
        missingLocalCards = Map.copyOf(missingLocalCards);
        updatedLocalCards = Map.copyOf(updatedLocalCards);
    }

    public boolean isEmpty() {
        return missingLocalCards.isEmpty() && updatedLocalCards.isEmpty();
    }

    public int size() {
        return missingLocalCards.size() + updatedLocalCards.size();
    }
}
