package de.bsommerfeld.tachobridge.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.tachobridge.core.domain.LocalCard;
import de.bsommerfeld.tachobridge.core.util.StorageUtils;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CardRegistry} persisted as a JSON array in {@code cards.json}.
 * The whole file is rewritten on every change; a company rarely has more
 * than a handful of cards.
 */
@Singleton
public class FileCardRegistry implements CardRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FileCardRegistry.class);
    private static final TypeReference<List<StoredCard>> CARD_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper();
    private Map<String, LocalCard> cards;

    @Inject
    public FileCardRegistry() {
        this(StorageUtils.getCardsFile());
    }

    public FileCardRegistry(Path file) {
        this.file = file;
    }

    @Override
    public synchronized Map<String, LocalCard> loadAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(cards()));
    }

    @Override
    public synchronized Optional<LocalCard> find(String cardNumber) {
        return Optional.ofNullable(cards().get(cardNumber));
    }

    @Override
    public synchronized void upsert(LocalCard card) {
        LocalCard previous = cards().put(card.cardNumber(), card);
        if (!card.equals(previous)) {
            write();
            LOG.debug("Stored card {}", card.cardNumber());
        }
    }

    @Override
    public synchronized boolean remove(String cardNumber) {
        if (cards().remove(cardNumber) == null) {
            LOG.warn("Card {} not found in registry", cardNumber);
            return false;
        }
        write();
        LOG.debug("Removed card {}", cardNumber);
        return true;
    }

    private Map<String, LocalCard> cards() {
        if (cards == null) {
            cards = read();
        }
        return cards;
    }

    private Map<String, LocalCard> read() {
        Map<String, LocalCard> loaded = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return loaded;
        }
        try {
            for (StoredCard stored : mapper.readValue(file.toFile(), CARD_LIST)) {
                if (LocalCard.isValidCardNumber(stored.cardNumber())) {
                    loaded.put(stored.cardNumber(), stored.toLocalCard());
                } else {
                    LOG.warn("Skipping stored card with invalid number '{}'", stored.cardNumber());
                }
            }
            LOG.info("Loaded {} cards from {}", loaded.size(), file);
        } catch (IOException e) {
            LOG.error("Card file {} is unreadable, moving it aside", file, e);
            try {
                JsonFiles.quarantine(file);
            } catch (IOException moveFailure) {
                throw new StoreException("Cannot move unreadable card file " + file, moveFailure);
            }
        }
        return loaded;
    }

    private void write() {
        List<StoredCard> stored = new ArrayList<>(cards.size());
        for (LocalCard card : cards.values()) {
            stored.add(StoredCard.of(card));
        }
        try {
            JsonFiles.writeAtomically(mapper, file, stored);
        } catch (IOException e) {
            throw new StoreException("Failed to write cards to " + file, e);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredCard(
            @JsonProperty("card_number") String cardNumber,
            @JsonProperty("name") String name,
            @JsonProperty("iccid") String iccid,
            @JsonProperty("remote_id") String remoteId) {

        static StoredCard of(LocalCard card) {
            return new StoredCard(card.cardNumber(), card.displayName(), card.iccid(), card.remoteId());
        }

        LocalCard toLocalCard() {
            return new LocalCard(cardNumber, name, iccid, remoteId);
        }
    }
}
