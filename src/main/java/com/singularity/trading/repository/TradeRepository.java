package com.singularity.trading.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.singularity.trading.model.Timestamps;
import com.singularity.trading.model.Trade;
import com.singularity.trading.store.DocumentStore;
import com.singularity.trading.store.StoreUnavailableException;
import com.singularity.trading.store.VersionedDocument;
import com.singularity.trading.store.WriteResult;

import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Loads and conditionally saves the completed-trades document.
 */
public class TradeRepository {

    private static final TypeReference<List<Trade>> TRADES = new TypeReference<List<Trade>>() {};

    private final DocumentStore store;
    private final String documentKey;
    private final ObjectMapper objectMapper;

    public TradeRepository(DocumentStore store, String documentKey, ObjectMapper objectMapper) {
        this.store = store;
        this.documentKey = documentKey;
        this.objectMapper = objectMapper;
    }

    public Snapshot<TradeCollection> load() {
        VersionedDocument document = store.read(documentKey);
        if (!document.exists()) {
            return new Snapshot<>(TradeCollection.empty(), null);
        }
        try {
            List<Trade> trades = objectMapper.readValue(document.getBody(), TRADES);
            if (trades == null) {
                throw new StoreUnavailableException("Trades document " + documentKey + " is not a list");
            }
            for (int i = 0; i < trades.size(); i++) {
                checkEntry(trades.get(i), i);
            }
            return new Snapshot<>(new TradeCollection(trades), document.getVersionToken());
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Trades document " + documentKey + " is not valid", e);
        }
    }

    private void checkEntry(Trade trade, int index) {
        String problem = null;
        if (trade == null) {
            problem = "null entry";
        } else if (trade.getTradeId() == null || trade.getListingId() == null) {
            problem = "missing trade_id or listing_id";
        } else {
            try {
                Timestamps.parse(trade.getCompletedAt());
            } catch (DateTimeParseException e) {
                problem = "unreadable completed_at " + trade.getCompletedAt();
            }
        }
        if (problem != null) {
            throw new StoreUnavailableException(
                    "Trades document " + documentKey + " has an invalid entry at index " + index + ": " + problem);
        }
    }

    public WriteResult save(TradeCollection trades, String expectedVersionToken) {
        try {
            String body = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(trades.all());
            return store.writeIfVersion(documentKey, body, expectedVersionToken);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode trades", e);
        }
    }
}
