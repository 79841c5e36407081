package com.singularity.trading.api;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.singularity.trading.ledger.LedgerSettings;
import com.singularity.trading.ledger.MarketplaceLedgerFactory;
import com.singularity.trading.store.InMemoryDocumentStore;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.singularity.trading.testutil.Requests.createListingBody;
import static com.singularity.trading.testutil.Requests.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;

/**
 * Routes requests through the single-function API handler.
 */
@ExtendWith(MockitoExtension.class)
public class TradingApiHandlerTest {

    @Mock
    private Context context;

    @Mock
    private LambdaLogger logger;

    private TradingApiHandler handler;

    @BeforeEach
    public void setUp() {
        lenient().when(context.getLogger()).thenReturn(logger);
        handler = new TradingApiHandler(MarketplaceLedgerFactory.create(new InMemoryDocumentStore(),
                LedgerSettings.defaults(), logger));
    }

    /**
     * Tests a full create, browse, buy and history flow through the router.
     */
    @Test
    public void shouldRouteMarketplaceFlow() {
        // Given
        APIGatewayProxyResponseEvent created = handler.handleRequest(
                request("POST", "/listings", createListingBody("seller-1", "hull_plate", 2, 75)), context);
        String listingId = new JSONObject(created.getBody()).getJSONObject("listing").getString("listing_id");

        // When
        APIGatewayProxyResponseEvent listed = handler.handleRequest(request("GET", "/listings/", null), context);
        APIGatewayProxyResponseEvent bought = handler.handleRequest(request("POST", "/listings/" + listingId + "/buy",
                "{\"buyer_id\": \"buyer-1\", \"buyer_name\": \"Buyer One\"}"), context);
        APIGatewayProxyResponseEvent history = handler.handleRequest(request("GET", "/history/buyer-1", null), context);

        // Then
        assertThat(created.getStatusCode()).isEqualTo(201);
        assertThat(new JSONObject(listed.getBody()).getInt("total")).isEqualTo(1);
        assertThat(bought.getStatusCode()).isEqualTo(200);
        assertThat(new JSONObject(history.getBody()).getInt("total")).isEqualTo(1);
    }

    /**
     * Tests that the legacy buy route still works.
     */
    @Test
    public void shouldRouteLegacyBuyPath() {
        APIGatewayProxyResponseEvent created = handler.handleRequest(
                request("POST", "/listings", createListingBody("seller-1", "hull_plate", 2, 75)), context);
        String listingId = new JSONObject(created.getBody()).getJSONObject("listing").getString("listing_id");

        APIGatewayProxyResponseEvent bought = handler.handleRequest(request("POST", "/buy/" + listingId,
                "{\"buyer_id\": \"buyer-1\", \"buyer_name\": \"Buyer One\"}"), context);

        assertThat(bought.getStatusCode()).isEqualTo(200);
    }

    /**
     * Tests that DELETE on a listing routes to cancellation.
     */
    @Test
    public void shouldRouteCancellation() {
        APIGatewayProxyResponseEvent created = handler.handleRequest(
                request("POST", "/listings", createListingBody("seller-1", "hull_plate", 2, 75)), context);
        String listingId = new JSONObject(created.getBody()).getJSONObject("listing").getString("listing_id");

        APIGatewayProxyResponseEvent cancelled = handler.handleRequest(
                request("DELETE", "/listings/" + listingId, "{\"seller_id\": \"seller-1\"}"), context);

        assertThat(cancelled.getStatusCode()).isEqualTo(200);
    }

    /**
     * Tests that CORS preflight requests are answered directly.
     */
    @Test
    public void shouldAnswerPreflight() {
        APIGatewayProxyResponseEvent response = handler.handleRequest(request("OPTIONS", "/listings", null), context);

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getHeaders()).containsKey("Access-Control-Allow-Methods");
    }

    /**
     * Tests that unknown routes return 404.
     */
    @Test
    public void shouldReturn404ForUnknownRoute() {
        APIGatewayProxyResponseEvent response = handler.handleRequest(request("PUT", "/listings", "{}"), context);

        assertThat(response.getStatusCode()).isEqualTo(404);
        assertThat(response.getBody()).contains("Endpoint not found");
    }
}
