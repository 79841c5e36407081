package com.singularity.trading.ledger;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.singularity.trading.model.CreateListingRequest;
import com.singularity.trading.model.Listing;
import com.singularity.trading.model.ListingStatus;
import com.singularity.trading.model.Timestamps;
import com.singularity.trading.model.Trade;
import com.singularity.trading.repository.ListingCollection;
import com.singularity.trading.repository.ListingRepository;
import com.singularity.trading.repository.Snapshot;
import com.singularity.trading.repository.TradeCollection;
import com.singularity.trading.repository.TradeRepository;
import com.singularity.trading.store.StoreUnavailableException;
import com.singularity.trading.store.WriteResult;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Owns every listing and trade state transition.
 *
 * <p>There are no process-local locks. Each mutating operation reads the listings document with its
 * version token, computes the next document and writes it back conditionally on that token. A lost
 * race means re-reading and recomputing from scratch, up to {@link LedgerSettings#getMaxAttempts()}
 * times; running out of attempts yields {@link LedgerError#CONFLICT}.
 *
 * <p>Each invocation stamps its own token on the listing it changes (the fresh listing id for a
 * create, a {@code transition_id} for buy and cancel). Before every attempt, and after a write whose
 * outcome is unknown, the ledger looks for that token to avoid applying the same change twice.
 */
public class MarketplaceLedger {

    static final String STORE_UNAVAILABLE_MESSAGE = "Marketplace storage is temporarily unavailable";

    private final ListingRepository listingRepository;
    private final TradeRepository tradeRepository;
    private final LedgerSettings settings;
    private final Clock clock;
    private final LambdaLogger logger;

    /**
     * @param listingRepository Access to the listings document.
     * @param tradeRepository   Access to the completed-trades document.
     * @param settings          Attempt ceilings and the quantity cap.
     * @param clock             Source of transition timestamps.
     * @param logger            Function log.
     */
    public MarketplaceLedger(ListingRepository listingRepository, TradeRepository tradeRepository,
                             LedgerSettings settings, Clock clock, LambdaLogger logger) {
        this.listingRepository = listingRepository;
        this.tradeRepository = tradeRepository;
        this.settings = settings;
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * Lists active listings, newest first. A single read; nothing is written.
     */
    public LedgerResult<List<Listing>> listActiveListings() {
        try {
            return LedgerResult.ok(listingRepository.load().getValue().active());
        } catch (StoreUnavailableException e) {
            return unavailable("list listings", e);
        }
    }

    /**
     * Returns the trades in which the player was seller or buyer, most recent first.
     */
    public LedgerResult<List<Trade>> tradeHistory(String playerId) {
        if (isBlank(playerId)) {
            return LedgerResult.failure(LedgerError.VALIDATION, "Missing player ID");
        }
        try {
            return LedgerResult.ok(tradeRepository.load().getValue().forPlayer(playerId));
        } catch (StoreUnavailableException e) {
            return unavailable("read trade history", e);
        }
    }

    /**
     * Creates an active listing.
     *
     * <p>The per-seller quantity cap is checked against the snapshot read in the same attempt. Two
     * concurrent creates by one seller can both pass it; the cap limits spam, it is not a ledger
     * constraint.
     */
    public LedgerResult<Listing> createListing(CreateListingRequest request) {
        String validationError = validateListing(request);
        if (validationError != null) {
            return LedgerResult.failure(LedgerError.VALIDATION, validationError);
        }

        int quantity = request.getQuantity();
        int cap = settings.getQuantityCap();
        if (quantity > cap) {
            return LedgerResult.failure(LedgerError.VALIDATION, "quantity must not exceed " + cap,
                    Map.of("requested_quantity", quantity, "max_quantity", cap));
        }

        String listingId = UUID.randomUUID().toString();

        return commitWithRetry("create", listingId, listing -> true, (current, now) -> {
            int existing = current.activeQuantity(request.getSellerId(), request.getItemType());
            // Written as a difference so a huge request cannot wrap around.
            if (quantity > cap - existing) {
                return Step.reject(LedgerResult.failure(LedgerError.CAPACITY_EXCEEDED,
                        "Listing would exceed the maximum of " + cap + " active units of " + request.getItemType(),
                        Map.of("item_type", request.getItemType(),
                                "existing_quantity", existing,
                                "requested_quantity", quantity,
                                "max_quantity", cap)));
            }

            Listing listing = new Listing();
            listing.setListingId(listingId);
            listing.setSellerId(request.getSellerId());
            listing.setSellerName(request.getSellerName());
            listing.setItemType(request.getItemType());
            listing.setItemName(request.getItemName());
            listing.setQuantity(quantity);
            listing.setAskingPrice(request.getAskingPrice());
            listing.setDescription(request.getDescription() != null ? request.getDescription() : "");
            listing.setStatus(ListingStatus.ACTIVE);
            listing.setCreatedAt(Timestamps.format(now));
            return Step.commit(current.append(listing), listing);
        }, "The marketplace was busy; please try listing again");
    }

    /**
     * Sells an active listing to the buyer. At most one caller ever succeeds for a listing; the
     * others see {@link LedgerError#NOT_FOUND} (they read after the sale) or
     * {@link LedgerError#CONFLICT} (they lost every write race).
     *
     * <p>The trade record is appended afterwards with its own short retry loop. If that fails the
     * sale still stands and the receipt says the trade was not recorded.
     *
     * @param expectedPrice The price the buyer was shown, or {@code null} to accept the asking price.
     */
    public LedgerResult<PurchaseReceipt> buyListing(String listingId, String buyerId, String buyerName,
                                                    Integer expectedPrice) {
        if (isBlank(listingId)) {
            return LedgerResult.failure(LedgerError.VALIDATION, "Missing listing ID");
        }
        if (isBlank(buyerId) || isBlank(buyerName)) {
            return LedgerResult.failure(LedgerError.VALIDATION, "Missing buyer_id or buyer_name");
        }
        if (expectedPrice != null && expectedPrice <= 0) {
            return LedgerResult.failure(LedgerError.VALIDATION, "expected_price must be greater than zero");
        }

        String transitionId = UUID.randomUUID().toString();
        LedgerResult<Listing> sale = commitWithRetry("purchase", listingId, appliedBy(transitionId), (current, now) -> {
            Optional<Listing> found = current.findActive(listingId);
            if (found.isEmpty()) {
                return Step.reject(LedgerResult.failure(LedgerError.NOT_FOUND,
                        "Listing not found or already sold", Map.of("listing_id", listingId)));
            }
            Listing listing = found.get();
            if (listing.getSellerId().equals(buyerId)) {
                return Step.reject(LedgerResult.failure(LedgerError.SELF_TRADE,
                        "Cannot buy your own listing", Map.of("listing_id", listingId)));
            }
            if (expectedPrice != null && expectedPrice.intValue() != listing.getAskingPrice()) {
                return Step.reject(LedgerResult.failure(LedgerError.PRICE_CHANGED,
                        "Listing price has changed",
                        Map.of("listing_id", listingId,
                                "current_price", listing.getAskingPrice(),
                                "expected_price", expectedPrice)));
            }
            ListingCollection next = current.markSold(listingId, buyerId, buyerName, now, transitionId);
            return Step.commit(next, next.find(listingId).orElseThrow());
        }, "Item was purchased by another player");

        if (!sale.isSuccess()) {
            return sale.failureAs();
        }

        Listing sold = sale.getValue();
        Trade trade = Trade.fromSoldListing(UUID.randomUUID().toString(), sold, Timestamps.parse(sold.getSoldAt()));
        boolean recorded = recordTrade(trade);
        logger.log(String.format("Completed trade %s: %s bought %s from %s for %d",
                trade.getTradeId(), trade.getBuyerName(), trade.getItemName(), trade.getSellerName(), trade.getFinalPrice()));
        return LedgerResult.ok(new PurchaseReceipt(sold, trade, recorded));
    }

    /**
     * Withdraws an active listing. Only its seller may do so.
     */
    public LedgerResult<Listing> cancelListing(String listingId, String sellerId) {
        if (isBlank(listingId)) {
            return LedgerResult.failure(LedgerError.VALIDATION, "Missing listing ID");
        }
        if (isBlank(sellerId)) {
            return LedgerResult.failure(LedgerError.VALIDATION, "Missing seller_id");
        }

        String transitionId = UUID.randomUUID().toString();
        return commitWithRetry("cancellation", listingId, appliedBy(transitionId), (current, now) -> {
            Optional<Listing> found = current.findActive(listingId);
            if (found.isEmpty()) {
                return Step.reject(LedgerResult.failure(LedgerError.NOT_FOUND,
                        "Listing not found or no longer active", Map.of("listing_id", listingId)));
            }
            if (!found.get().getSellerId().equals(sellerId)) {
                return Step.reject(LedgerResult.failure(LedgerError.FORBIDDEN,
                        "Only the seller can cancel this listing", Map.of("listing_id", listingId)));
            }
            ListingCollection next = current.markRemoved(listingId, now, transitionId);
            return Step.commit(next, next.find(listingId).orElseThrow());
        }, "The listing changed while it was being cancelled; please try again");
    }

    private LedgerResult<Listing> commitWithRetry(String operation, String listingId,
                                                  Predicate<Listing> isOwnChange, Transition transition,
                                                  String conflictMessage) {
        try {
            boolean lastOutcomeUnknown = false;
            for (int attempt = 1; attempt <= settings.getMaxAttempts(); attempt++) {
                Snapshot<ListingCollection> snapshot = listingRepository.load();
                Optional<Listing> alreadyApplied = snapshot.getValue().find(listingId).filter(isOwnChange);
                if (alreadyApplied.isPresent()) {
                    logger.log(String.format("%s of listing %s is already stored; not writing again", operation, listingId));
                    return LedgerResult.ok(alreadyApplied.get());
                }

                Step step = transition.apply(snapshot.getValue(), clock.instant());
                if (step.rejection != null) {
                    return step.rejection;
                }

                WriteResult write = listingRepository.save(step.next, snapshot.getVersionToken());
                switch (write.getStatus()) {
                    case COMMITTED:
                        logger.log(String.format("Committed %s of listing %s on attempt %d", operation, listingId, attempt));
                        return LedgerResult.ok(step.listing);
                    case VERSION_CONFLICT:
                        lastOutcomeUnknown = false;
                        logger.log(String.format("Version conflict on %s of listing %s, attempt %d of %d",
                                operation, listingId, attempt, settings.getMaxAttempts()));
                        break;
                    default:
                        lastOutcomeUnknown = true;
                        logger.log(String.format("Unknown write outcome on %s of listing %s, attempt %d of %d: %s",
                                operation, listingId, attempt, settings.getMaxAttempts(), write.getCause()));
                        break;
                }
            }

            if (lastOutcomeUnknown) {
                Optional<Listing> applied = listingRepository.load().getValue().find(listingId).filter(isOwnChange);
                if (applied.isPresent()) {
                    logger.log(String.format("%s of listing %s was applied by the last write", operation, listingId));
                    return LedgerResult.ok(applied.get());
                }
            }

            logger.log(String.format("Giving up on %s of listing %s after %d attempts", operation, listingId,
                    settings.getMaxAttempts()));
            return LedgerResult.failure(LedgerError.CONFLICT, conflictMessage,
                    Map.of("listing_id", listingId, "attempts", settings.getMaxAttempts()));
        } catch (StoreUnavailableException e) {
            return unavailable(operation + " of listing " + listingId, e);
        }
    }

    private boolean recordTrade(Trade trade) {
        try {
            boolean lastOutcomeUnknown = false;
            for (int attempt = 1; attempt <= settings.getTradeLogMaxAttempts(); attempt++) {
                Snapshot<TradeCollection> snapshot = tradeRepository.load();
                if (snapshot.getValue().contains(trade.getTradeId())) {
                    return true;
                }
                WriteResult write = tradeRepository.save(snapshot.getValue().append(trade), snapshot.getVersionToken());
                if (write.isCommitted()) {
                    return true;
                }
                lastOutcomeUnknown = write.getStatus() == WriteResult.Status.OUTCOME_UNKNOWN;
            }
            if (lastOutcomeUnknown && tradeRepository.load().getValue().contains(trade.getTradeId())) {
                return true;
            }
            logger.log(String.format("ERROR: could not record trade %s for listing %s after %d attempts; the sale stands",
                    trade.getTradeId(), trade.getListingId(), settings.getTradeLogMaxAttempts()));
        } catch (StoreUnavailableException e) {
            logger.log(String.format("ERROR: could not record trade %s for listing %s: %s; the sale stands",
                    trade.getTradeId(), trade.getListingId(), e.getMessage()));
        }
        return false;
    }

    private <T> LedgerResult<T> unavailable(String action, StoreUnavailableException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        logger.log("ERROR: could not " + action + ": " + e.getMessage() + " (" + cause + ")");
        return LedgerResult.failure(LedgerError.STORE_UNAVAILABLE, STORE_UNAVAILABLE_MESSAGE);
    }

    private static Predicate<Listing> appliedBy(String transitionId) {
        return listing -> transitionId.equals(listing.getTransitionId());
    }

    private static String validateListing(CreateListingRequest request) {
        if (request == null) {
            return "Request body is required";
        }
        if (isBlank(request.getSellerId())) {
            return "Missing required field: seller_id";
        }
        if (isBlank(request.getSellerName())) {
            return "Missing required field: seller_name";
        }
        if (isBlank(request.getItemType())) {
            return "Missing required field: item_type";
        }
        if (isBlank(request.getItemName())) {
            return "Missing required field: item_name";
        }
        if (request.getQuantity() == null) {
            return "Missing required field: quantity";
        }
        if (request.getAskingPrice() == null) {
            return "Missing required field: asking_price";
        }
        if (request.getQuantity() <= 0) {
            return "quantity must be greater than zero";
        }
        if (request.getAskingPrice() <= 0) {
            return "asking_price must be greater than zero";
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Computes the next listings document from a freshly read one.
     */
    @FunctionalInterface
    private interface Transition {
        Step apply(ListingCollection current, Instant now);
    }

    /**
     * Either a rejection or the document to write together with the listing it changes.
     */
    private static final class Step {
        private final LedgerResult<Listing> rejection;
        private final ListingCollection next;
        private final Listing listing;

        private Step(LedgerResult<Listing> rejection, ListingCollection next, Listing listing) {
            this.rejection = rejection;
            this.next = next;
            this.listing = listing;
        }

        static Step reject(LedgerResult<Listing> rejection) {
            return new Step(rejection, null, null);
        }

        static Step commit(ListingCollection next, Listing listing) {
            return new Step(null, next, listing);
        }
    }
}
