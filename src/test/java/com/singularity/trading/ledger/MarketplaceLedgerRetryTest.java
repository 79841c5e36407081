package com.singularity.trading.ledger;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.singularity.trading.model.Listing;
import com.singularity.trading.model.ListingStatus;
import com.singularity.trading.store.InMemoryDocumentStore;
import com.singularity.trading.store.StoreUnavailableException;
import com.singularity.trading.store.WriteResult;
import com.singularity.trading.testutil.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;

import java.time.Instant;

import static com.singularity.trading.testutil.TestData.listingRequest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for how MarketplaceLedger handles lost races, ambiguous writes and store failures.
 */
public class MarketplaceLedgerRetryTest {

    private static final String LISTINGS = LedgerSettings.DEFAULT_LISTINGS_KEY;
    private static final String TRADES = LedgerSettings.DEFAULT_TRADES_KEY;

    private InMemoryDocumentStore store;
    private LambdaLogger logger;
    private MarketplaceLedger ledger;

    @BeforeEach
    public void setUp() {
        store = spy(new InMemoryDocumentStore());
        logger = mock(LambdaLogger.class);
        ledger = MarketplaceLedgerFactory.create(store, LedgerSettings.defaults(),
                new TestClock(Instant.parse("2026-03-01T12:00:00Z")), logger);
    }

    /**
     * Tests that a lost race is retried against a fresh read.
     */
    @Test
    public void shouldRetryAfterVersionConflict() {
        // Given
        doReturn(WriteResult.conflict()).doCallRealMethod()
                .when(store).writeIfVersion(eq(LISTINGS), anyString(), any());

        // When
        LedgerResult<Listing> result = ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100));

        // Then
        assertThat(result.isSuccess()).isTrue();
        verify(store, times(2)).writeIfVersion(eq(LISTINGS), anyString(), any());
        assertThat(ledger.listActiveListings().getValue()).hasSize(1);
    }

    /**
     * Tests that running out of attempts reports a conflict and leaves the document unchanged.
     */
    @Test
    public void shouldReportConflictWhenAttemptsAreExhausted() {
        // Given
        doReturn(WriteResult.conflict()).when(store).writeIfVersion(eq(LISTINGS), anyString(), any());

        // When
        LedgerResult<Listing> result = ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100));

        // Then
        assertThat(result.getError()).isEqualTo(LedgerError.CONFLICT);
        assertThat(result.getDetails()).containsEntry("attempts", 3);
        verify(store, times(3)).writeIfVersion(eq(LISTINGS), anyString(), any());
        assertThat(store.read(LISTINGS).exists()).isFalse();
    }

    /**
     * Tests that a purchase whose write timed out after being applied is not applied a second time.
     */
    @Test
    public void shouldDetectPurchaseAppliedDespiteUnknownOutcome() {
        // Given
        Listing listing = ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100)).getValue();
        doAnswer(appliedButTimedOut()).doCallRealMethod()
                .when(store).writeIfVersion(eq(LISTINGS), anyString(), any());

        // When
        LedgerResult<PurchaseReceipt> result = ledger.buyListing(listing.getListingId(), "buyer-1", "Buyer One", null);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().getListing().getBuyerId()).isEqualTo("buyer-1");
        verify(store, times(2)).writeIfVersion(eq(LISTINGS), anyString(), any());
        assertThat(ledger.tradeHistory("buyer-1").getValue()).hasSize(1);
    }

    /**
     * Tests that an ambiguous final attempt is resolved by re-reading the document.
     */
    @Test
    public void shouldResolveUnknownOutcomeOnLastAttempt() {
        // Given
        Listing listing = ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100)).getValue();
        doReturn(WriteResult.conflict()).doReturn(WriteResult.conflict()).doAnswer(appliedButTimedOut())
                .when(store).writeIfVersion(eq(LISTINGS), anyString(), any());

        // When
        LedgerResult<Listing> result = ledger.cancelListing(listing.getListingId(), "seller-1");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().getStatus()).isEqualTo(ListingStatus.REMOVED);
    }

    /**
     * Tests that ambiguous writes that never landed end as a conflict.
     */
    @Test
    public void shouldReportConflictWhenUnknownWritesNeverLanded() {
        Listing listing = ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100)).getValue();
        doReturn(WriteResult.unknown(ApiCallTimeoutException.create(5000)))
                .when(store).writeIfVersion(eq(LISTINGS), anyString(), any());

        LedgerResult<PurchaseReceipt> result = ledger.buyListing(listing.getListingId(), "buyer-1", "Buyer One", null);

        assertThat(result.getError()).isEqualTo(LedgerError.CONFLICT);
        assertThat(ledger.listActiveListings().getValue()).hasSize(1);
    }

    /**
     * Tests that a sale stands when the trade log cannot be appended to.
     */
    @Test
    public void shouldKeepSaleWhenTradeLogAppendFails() {
        // Given
        Listing listing = ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100)).getValue();
        doReturn(WriteResult.conflict()).when(store).writeIfVersion(eq(TRADES), anyString(), any());

        // When
        LedgerResult<PurchaseReceipt> result = ledger.buyListing(listing.getListingId(), "buyer-1", "Buyer One", null);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().isTradeRecorded()).isFalse();
        assertThat(ledger.listActiveListings().getValue()).isEmpty();
        assertThat(ledger.tradeHistory("buyer-1").getValue()).isEmpty();
        verify(logger).log(contains("ERROR: could not record trade"));
    }

    /**
     * Tests that a trade append whose outcome was unknown is recorded exactly once.
     */
    @Test
    public void shouldRecordTradeOnceAfterUnknownAppend() {
        Listing listing = ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100)).getValue();
        doAnswer(appliedButTimedOut()).doCallRealMethod()
                .when(store).writeIfVersion(eq(TRADES), anyString(), any());

        LedgerResult<PurchaseReceipt> result = ledger.buyListing(listing.getListingId(), "buyer-1", "Buyer One", null);

        assertThat(result.getValue().isTradeRecorded()).isTrue();
        assertThat(ledger.tradeHistory("seller-1").getValue()).hasSize(1);
        verify(store, times(1)).writeIfVersion(eq(TRADES), anyString(), any());
    }

    /**
     * Tests that an unreadable store is reported as unavailable.
     */
    @Test
    public void shouldReportStoreUnavailable() {
        doThrow(new StoreUnavailableException("Could not read document")).when(store).read(LISTINGS);

        assertThat(ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100)).getError())
                .isEqualTo(LedgerError.STORE_UNAVAILABLE);
        LedgerResult<?> list = ledger.listActiveListings();
        assertThat(list.getError()).isEqualTo(LedgerError.STORE_UNAVAILABLE);
        assertThat(list.getMessage()).isEqualTo(MarketplaceLedger.STORE_UNAVAILABLE_MESSAGE);
    }

    /**
     * Tests that a corrupt listings document is never treated as empty.
     */
    @Test
    public void shouldNotOverwriteCorruptDocument() {
        store.writeUnconditionally(LISTINGS, "<html>oops</html>");

        LedgerResult<Listing> result = ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100));

        assertThat(result.getError()).isEqualTo(LedgerError.STORE_UNAVAILABLE);
        assertThat(store.read(LISTINGS).getBody()).isEqualTo("<html>oops</html>");
    }

    /**
     * Tests that a listings document holding a null entry is reported as unavailable, not as a 500.
     */
    @Test
    public void shouldReportUnavailableForNullEntry() {
        store.writeUnconditionally(LISTINGS, "[null]");

        LedgerResult<Listing> created = ledger.createListing(listingRequest("seller-1", "hull_plate", 5, 100));
        LedgerResult<?> listed = ledger.listActiveListings();

        assertThat(created.getError()).isEqualTo(LedgerError.STORE_UNAVAILABLE);
        assertThat(listed.getError()).isEqualTo(LedgerError.STORE_UNAVAILABLE);
        assertThat(store.read(LISTINGS).getBody()).isEqualTo("[null]");
    }

    /**
     * Tests that an unreadable trade timestamp makes history unavailable instead of failing the request.
     */
    @Test
    public void shouldReportUnavailableForUnreadableTradeTimestamp() {
        store.writeUnconditionally(TRADES, "[{\"trade_id\":\"t-1\",\"listing_id\":\"l-1\","
                + "\"seller_id\":\"s\",\"buyer_id\":\"b\",\"completed_at\":\"yesterday\"}]");

        assertThat(ledger.tradeHistory("s").getError()).isEqualTo(LedgerError.STORE_UNAVAILABLE);
    }

    private static Answer<WriteResult> appliedButTimedOut() {
        return invocation -> {
            invocation.callRealMethod();
            return WriteResult.unknown(ApiCallTimeoutException.create(5000));
        };
    }
}
