package com.singularity.trading.listings;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.singularity.trading.ledger.LedgerSettings;
import com.singularity.trading.ledger.MarketplaceLedger;
import com.singularity.trading.ledger.MarketplaceLedgerFactory;
import com.singularity.trading.model.Listing;
import com.singularity.trading.store.InMemoryDocumentStore;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static com.singularity.trading.testutil.Requests.request;
import static com.singularity.trading.testutil.Requests.withPath;
import static com.singularity.trading.testutil.TestData.listingRequest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;

/**
 * Unit tests for BuyListingHandler.
 */
@ExtendWith(MockitoExtension.class)
public class BuyListingHandlerTest {

    @Mock
    private Context context;

    @Mock
    private LambdaLogger logger;

    private MarketplaceLedger ledger;
    private BuyListingHandler handler;
    private Listing listing;

    @BeforeEach
    public void setUp() {
        lenient().when(context.getLogger()).thenReturn(logger);
        ledger = MarketplaceLedgerFactory.create(new InMemoryDocumentStore(), LedgerSettings.defaults(), logger);
        handler = new BuyListingHandler(ledger);
        listing = ledger.createListing(listingRequest("seller-1", "hull_plate", 3, 200)).getValue();
    }

    /**
     * Tests a successful purchase returns the trade and the purchased item.
     */
    @Test
    public void shouldBuyListingSuccessfully() {
        // When
        APIGatewayProxyResponseEvent response = handler.handleRequest(withPath(
                request("POST", "/listings/" + listing.getListingId() + "/buy",
                        "{\"buyer_id\": \"buyer-1\", \"buyer_name\": \"Buyer One\", \"expected_price\": 200}"),
                "id", listing.getListingId()), context);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(200);
        JSONObject body = new JSONObject(response.getBody());
        assertThat(body.getBoolean("success")).isTrue();
        assertThat(body.getBoolean("trade_recorded")).isTrue();
        assertThat(body.getJSONObject("item").getInt("price_paid")).isEqualTo(200);
        assertThat(body.getJSONObject("item").getInt("quantity")).isEqualTo(3);
        assertThat(body.getJSONObject("trade").getString("buyer_id")).isEqualTo("buyer-1");
        assertThat(body.getJSONObject("listing").getString("status")).isEqualTo("sold");
    }

    /**
     * Tests that the legacy {@code listing_id} path parameter is accepted.
     */
    @Test
    public void shouldAcceptLegacyPathParameter() {
        APIGatewayProxyResponseEvent response = handler.handleRequest(withPath(
                request("POST", "/buy/" + listing.getListingId(),
                        "{\"buyer_id\": \"buyer-1\", \"buyer_name\": \"Buyer One\"}"),
                "listing_id", listing.getListingId()), context);

        assertThat(response.getStatusCode()).isEqualTo(200);
    }

    /**
     * Tests that 412 is returned with both prices when the asking price differs from what the buyer saw.
     */
    @Test
    public void shouldReturn412WhenPriceChanged() {
        APIGatewayProxyResponseEvent response = handler.handleRequest(withPath(
                request("POST", "/listings/" + listing.getListingId() + "/buy",
                        "{\"buyer_id\": \"buyer-1\", \"buyer_name\": \"Buyer One\", \"expected_price\": 150}"),
                "id", listing.getListingId()), context);

        assertThat(response.getStatusCode()).isEqualTo(412);
        JSONObject body = new JSONObject(response.getBody());
        assertThat(body.getInt("current_price")).isEqualTo(200);
        assertThat(body.getInt("expected_price")).isEqualTo(150);
    }

    /**
     * Tests that buying one's own listing returns 422.
     */
    @Test
    public void shouldReturn422OnSelfTrade() {
        APIGatewayProxyResponseEvent response = handler.handleRequest(withPath(
                request("POST", "/listings/" + listing.getListingId() + "/buy",
                        "{\"buyer_id\": \"seller-1\", \"buyer_name\": \"Captain seller-1\"}"),
                "id", listing.getListingId()), context);

        assertThat(response.getStatusCode()).isEqualTo(422);
        assertThat(response.getBody()).contains("Cannot buy your own listing");
    }

    /**
     * Tests that a second purchase of the same listing returns 404.
     */
    @Test
    public void shouldReturn404WhenAlreadySold() {
        String body = "{\"buyer_id\": \"buyer-1\", \"buyer_name\": \"Buyer One\"}";
        handler.handleRequest(withPath(request("POST", "/", body), "id", listing.getListingId()), context);

        APIGatewayProxyResponseEvent response = handler.handleRequest(
                withPath(request("POST", "/", body), "id", listing.getListingId()), context);

        assertThat(response.getStatusCode()).isEqualTo(404);
        assertThat(response.getBody()).contains("Listing not found or already sold");
    }

    /**
     * Tests that a request without a buyer returns 400.
     */
    @Test
    public void shouldReturn400WhenBuyerIsMissing() {
        APIGatewayProxyResponseEvent response = handler.handleRequest(
                request("POST", "/", null).withPathParameters(Map.of("id", listing.getListingId())), context);

        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getBody()).contains("Missing buyer_id or buyer_name");
    }
}
