package de.bsommerfeld.tachobridge.core.domain;

/**
 * The Fleet directory's view of a company card. Authoritative for existence
 * and identity metadata, not for reader-observed state.
 */
public record RemoteCard(String cardNumber, String displayName, String iccid, String remoteId) {

    public LocalCard toLocalCard() {
        return new LocalCard(cardNumber, displayName, iccid, remoteId);
    }
}
