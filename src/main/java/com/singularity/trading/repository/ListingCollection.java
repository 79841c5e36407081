package com.singularity.trading.repository;

import com.singularity.trading.model.Listing;
import com.singularity.trading.model.ListingStatus;
import com.singularity.trading.model.Timestamps;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Immutable view over every listing in the listings document.
 * Mutators return a new collection and leave this one, and the listings it handed out, unchanged.
 */
public final class ListingCollection {

    private static final Comparator<Listing> NEWEST_FIRST =
            Comparator.comparing(Listing::createdInstant).reversed();

    private final List<Listing> listings;

    public ListingCollection(List<Listing> listings) {
        this.listings = Collections.unmodifiableList(new ArrayList<>(listings));
    }

    public static ListingCollection empty() {
        return new ListingCollection(Collections.emptyList());
    }

    /**
     * @return Every listing in document order, whatever its status.
     */
    public List<Listing> all() {
        return listings;
    }

    /**
     * @return Active listings, newest first.
     */
    public List<Listing> active() {
        return listings.stream()
                .filter(Listing::isActive)
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    public Optional<Listing> find(String listingId) {
        return listings.stream()
                .filter(listing -> listing.getListingId().equals(listingId))
                .findFirst();
    }

    public Optional<Listing> findActive(String listingId) {
        return find(listingId).filter(Listing::isActive);
    }

    /**
     * Units the seller currently offers for one item type across all of their active listings,
     * saturating at {@link Integer#MAX_VALUE}.
     */
    public int activeQuantity(String sellerId, String itemType) {
        long total = listings.stream()
                .filter(Listing::isActive)
                .filter(listing -> listing.getSellerId().equals(sellerId))
                .filter(listing -> listing.getItemType().equals(itemType))
                .mapToLong(Listing::getQuantity)
                .sum();
        return (int) Math.min(total, Integer.MAX_VALUE);
    }

    public ListingCollection append(Listing listing) {
        if (find(listing.getListingId()).isPresent()) {
            throw new IllegalStateException("Listing " + listing.getListingId() + " already exists");
        }
        List<Listing> next = new ArrayList<>(listings);
        next.add(listing);
        return new ListingCollection(next);
    }

    public ListingCollection markSold(String listingId, String buyerId, String buyerName,
                                      Instant now, String transitionId) {
        return transition(listingId, listing -> {
            listing.setStatus(ListingStatus.SOLD);
            listing.setBuyerId(buyerId);
            listing.setBuyerName(buyerName);
            listing.setSoldAt(Timestamps.format(now));
            listing.setTransitionId(transitionId);
        });
    }

    public ListingCollection markRemoved(String listingId, Instant now, String transitionId) {
        return transition(listingId, listing -> {
            listing.setStatus(ListingStatus.REMOVED);
            listing.setRemovedAt(Timestamps.format(now));
            listing.setTransitionId(transitionId);
        });
    }

    // Only active listings may change, and each changes once.
    private ListingCollection transition(String listingId, Consumer<Listing> change) {
        List<Listing> next = new ArrayList<>(listings.size());
        boolean changed = false;
        for (Listing listing : listings) {
            if (!changed && listing.getListingId().equals(listingId)) {
                if (!listing.isActive()) {
                    throw new IllegalStateException("Listing " + listingId + " is already " + listing.getStatus().getValue());
                }
                Listing copy = new Listing(listing);
                change.accept(copy);
                next.add(copy);
                changed = true;
            } else {
                next.add(listing);
            }
        }
        if (!changed) {
            throw new IllegalStateException("Listing " + listingId + " does not exist");
        }
        return new ListingCollection(next);
    }
}
