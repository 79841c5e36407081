package com.singularity.trading.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.singularity.trading.model.Listing;
import com.singularity.trading.model.Timestamps;
import com.singularity.trading.store.DocumentStore;
import com.singularity.trading.store.StoreUnavailableException;
import com.singularity.trading.store.VersionedDocument;
import com.singularity.trading.store.WriteResult;

import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Loads and conditionally saves the listings document.
 */
public class ListingRepository {

    private static final TypeReference<List<Listing>> LISTINGS = new TypeReference<List<Listing>>() {};

    private final DocumentStore store;
    private final String documentKey;
    private final ObjectMapper objectMapper;

    public ListingRepository(DocumentStore store, String documentKey, ObjectMapper objectMapper) {
        this.store = store;
        this.documentKey = documentKey;
        this.objectMapper = objectMapper;
    }

    /**
     * Reads the current listings and their version token. A missing document is an empty collection.
     *
     * @throws StoreUnavailableException if the store fails or the document cannot be decoded.
     */
    public Snapshot<ListingCollection> load() {
        VersionedDocument document = store.read(documentKey);
        if (!document.exists()) {
            return new Snapshot<>(ListingCollection.empty(), null);
        }
        try {
            List<Listing> listings = objectMapper.readValue(document.getBody(), LISTINGS);
            if (listings == null) {
                throw new StoreUnavailableException("Listings document " + documentKey + " is not a list");
            }
            for (int i = 0; i < listings.size(); i++) {
                checkEntry(listings.get(i), i);
            }
            return new Snapshot<>(new ListingCollection(listings), document.getVersionToken());
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Listings document " + documentKey + " is not valid", e);
        }
    }

    private void checkEntry(Listing listing, int index) {
        String problem = null;
        if (listing == null) {
            problem = "null entry";
        } else if (listing.getListingId() == null || listing.getSellerId() == null
                || listing.getItemType() == null || listing.getStatus() == null) {
            problem = "missing listing_id, seller_id, item_type or status";
        } else {
            try {
                Timestamps.parse(listing.getCreatedAt());
            } catch (DateTimeParseException e) {
                problem = "unreadable created_at " + listing.getCreatedAt();
            }
        }
        if (problem != null) {
            throw new StoreUnavailableException(
                    "Listings document " + documentKey + " has an invalid entry at index " + index + ": " + problem);
        }
    }

    /**
     * Writes the collection only if the document is still at {@code expectedVersionToken}.
     */
    public WriteResult save(ListingCollection listings, String expectedVersionToken) {
        return store.writeIfVersion(documentKey, encode(listings), expectedVersionToken);
    }

    private String encode(ListingCollection listings) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(listings.all());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode listings", e);
        }
    }
}
