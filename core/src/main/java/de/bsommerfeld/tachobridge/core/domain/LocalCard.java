package de.bsommerfeld.tachobridge.core.domain;

import java.util.regex.Pattern;

/**
 * A company card as known to this device.
 *
 * @param cardNumber  16-character alphanumeric card number, the unique key
 * @param displayName user-chosen label
 * @param iccid       chip id observed by a reader, {@code null} until the card
 *                    was inserted once
 * @param remoteId    id of the matching Fleet card record, {@code null} if the
 *                    card was never propagated
 */
public record LocalCard(String cardNumber, String displayName, String iccid, String remoteId) {

    private static final Pattern CARD_NUMBER = Pattern.compile("^[A-Za-z0-9]{16}$");

    public static boolean isValidCardNumber(String cardNumber) {
        return cardNumber != null && CARD_NUMBER.matcher(cardNumber).matches();
    }

    public LocalCard withIccid(String iccid) {
        return new LocalCard(cardNumber, displayName, iccid, remoteId);
    }

    public LocalCard withRemoteId(String remoteId) {
        return new LocalCard(cardNumber, displayName, iccid, remoteId);
    }
}
