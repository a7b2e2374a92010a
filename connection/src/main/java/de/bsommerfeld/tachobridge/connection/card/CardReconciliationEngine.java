package de.bsommerfeld.tachobridge.connection.card;

import de.bsommerfeld.tachobridge.core.domain.LocalCard;
import de.bsommerfeld.tachobridge.core.domain.RemoteCard;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Diffs the local card registry against the Fleet directory.
 *
 * <p>
 * Remote is authoritative for identity metadata: name and remote id follow
 * the remote record whenever it has them. The iccid is observed by a
 * physical reader, so a local value survives unless the remote record
 * carries its own. Cards that exist only locally are left alone; pushing
 * them is the job of the explicit create and update operations.
 *
 * <p>
 * Pure: no I/O, no state. Applying a plan and reconciling the same inputs
 * again yields an empty plan.
 */
public final class CardReconciliationEngine {

    private CardReconciliationEngine() {
    }

    public static ReconciliationPlan reconcile(Map<String, LocalCard> localCards,
            Map<String, RemoteCard> remoteCards) {
        Map<String, LocalCard> missing = new LinkedHashMap<>();
        Map<String, LocalCard> updated = new LinkedHashMap<>();

        remoteCards.forEach((cardNumber, remote) -> {
            LocalCard local = localCards.get(cardNumber);
            if (local == null) {
                missing.put(cardNumber, remote.toLocalCard());
                return;
            }
            LocalCard merged = merge(local, remote);
            if (!merged.equals(local)) {
                updated.put(cardNumber, merged);
            }
        });

        return new ReconciliationPlan(missing, updated);
    }

    static LocalCard merge(LocalCard local, RemoteCard remote) {
        return new LocalCard(
                local.cardNumber(),
                remote.displayName() != null ? remote.displayName() : local.displayName(),
                remote.iccid() != null ? remote.iccid() : local.iccid(),
                remote.remoteId() != null ? remote.remoteId() : local.remoteId());
    }
}
