package de.bsommerfeld.tachobridge.store;

import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.core.domain.LocalCard;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CardRegistry} for TEST mode.
 */
@Singleton
public class InMemoryCardRegistry implements CardRegistry {

    private final Map<String, LocalCard> cards = new LinkedHashMap<>();

    @Override
    public synchronized Map<String, LocalCard> loadAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(cards));
    }

    @Override
    public synchronized Optional<LocalCard> find(String cardNumber) {
        return Optional.ofNullable(cards.get(cardNumber));
    }

    @Override
    public synchronized void upsert(LocalCard card) {
        cards.put(card.cardNumber(), card);
    }

    @Override
    public synchronized boolean remove(String cardNumber) {
        return cards.remove(cardNumber) != null;
    }
}
