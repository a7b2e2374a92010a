package de.bsommerfeld.tachobridge.connection.card;

import de.bsommerfeld.tachobridge.core.domain.LocalCard;
import de.bsommerfeld.tachobridge.core.domain.RemoteCard;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CardReconciliationEngineTest {

    private static final String A = "AAAAAAAAAAAAAAAA";
    private static final String B = "BBBBBBBBBBBBBBBB";
    private static final String C = "CCCCCCCCCCCCCCCC";

    @Test
    void reconcile_shouldImportMissingAndUpdateRenamedCards() {
        Map<String, LocalCard> local = Map.of(A, new LocalCard(A, "old", null, "r-a"));
        Map<String, RemoteCard> remote = Map.of(
                A, new RemoteCard(A, "new", null, "r-a"),
                B, new RemoteCard(B, "B", "8931", "r-b"));

        ReconciliationPlan plan = CardReconciliationEngine.reconcile(local, remote);

        assertEquals(Map.of(B, new LocalCard(B, "B", "8931", "r-b")), plan.missingLocalCards());
        assertEquals(Map.of(A, new LocalCard(A, "new", null, "r-a")), plan.updatedLocalCards());
        assertEquals(2, plan.size());
    }

    @Test
    void reconcile_shouldLeaveLocalOnlyCardsAlone() {
        Map<String, LocalCard> local = Map.of(C, new LocalCard(C, "only here", null, null));

        ReconciliationPlan plan = CardReconciliationEngine.reconcile(local, Map.of());

        assertTrue(plan.isEmpty());
    }

    @Test
    void reconcile_shouldKeepLocalIccidWhenRemoteHasNone() {
        Map<String, LocalCard> local = Map.of(A, new LocalCard(A, "A", "8931-local", null));
        Map<String, RemoteCard> remote = Map.of(A, new RemoteCard(A, "A", null, "r-a"));

        LocalCard updated = CardReconciliationEngine.reconcile(local, remote).updatedLocalCards().get(A);

        assertEquals("8931-local", updated.iccid());
        assertEquals("r-a", updated.remoteId());
    }

    @Test
    void reconcile_shouldPreferRemoteIccidWhenPresent() {
        Map<String, LocalCard> local = Map.of(A, new LocalCard(A, "A", "8931-local", "r-a"));
        Map<String, RemoteCard> remote = Map.of(A, new RemoteCard(A, "A", "8931-remote", "r-a"));

        assertEquals("8931-remote",
                CardReconciliationEngine.reconcile(local, remote).updatedLocalCards().get(A).iccid());
    }

    @Test
    void reconcile_shouldYieldEmptyPlanOnceApplied() {
        Map<String, LocalCard> local = new HashMap<>();
        local.put(A, new LocalCard(A, "old", "8931", null));
        Map<String, RemoteCard> remote = Map.of(
                A, new RemoteCard(A, "new", null, "r-a"),
                B, new RemoteCard(B, "B", null, "r-b"));

        ReconciliationPlan plan = CardReconciliationEngine.reconcile(local, remote);
        local.putAll(plan.missingLocalCards());
        local.putAll(plan.updatedLocalCards());

        assertTrue(CardReconciliationEngine.reconcile(local, remote).isEmpty());
    }

    @Test
    void reconcile_shouldNotTouchInputs() {
        Map<String, LocalCard> local = new HashMap<>(Map.of(A, new LocalCard(A, "old", null, null)));
        Map<String, LocalCard> snapshot = Map.copyOf(local);

        CardReconciliationEngine.reconcile(local, Map.of(A, new RemoteCard(A, "new", null, "r-a")));

        assertEquals(snapshot, local);
    }
}
