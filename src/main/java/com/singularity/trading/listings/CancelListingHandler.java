package com.singularity.trading.listings;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.singularity.trading.api.ApiResponses;
import com.singularity.trading.ledger.LedgerResult;
import com.singularity.trading.ledger.MarketplaceLedger;
import com.singularity.trading.ledger.MarketplaceLedgerFactory;
import com.singularity.trading.model.CancelListingRequest;
import com.singularity.trading.model.Listing;
import com.singularity.trading.utils.JsonUtils;
import com.singularity.trading.utils.ResponseUtils;

import java.util.Map;

/**
 * Lambda handler for a seller withdrawing their own listing.
 */
public class CancelListingHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final MarketplaceLedger ledger;
    private final ObjectMapper objectMapper;

    /**
     * Initializes the ledger from the function environment.
     */
    public CancelListingHandler() {
        this(null);
    }

    /**
     * Constructor for dependency injection, used by the router and in tests.
     *
     * @param ledger The marketplace ledger.
     */
    public CancelListingHandler(MarketplaceLedger ledger) {
        this.ledger = ledger != null ? ledger : MarketplaceLedgerFactory.fromEnvironment();
        this.objectMapper = JsonUtils.newObjectMapper();
    }

    /**
     * Handles {@code DELETE /listings/{id}}. The seller id comes from the body, or from the
     * {@code seller_id} query parameter for clients that cannot send a DELETE body.
     *
     * @param input   The API Gateway proxy request event with the path parameter 'id'.
     * @param context The Lambda execution context.
     * @return The removed listing, or the reason the cancellation was refused.
     */
    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            Map<String, String> pathParameters = input.getPathParameters();
            String listingId = pathParameters != null ? pathParameters.get("id") : null;

            String sellerId = null;
            if (input.getBody() != null && !input.getBody().isBlank()) {
                sellerId = objectMapper.readValue(input.getBody(), CancelListingRequest.class).getSellerId();
            }
            if (sellerId == null && input.getQueryStringParameters() != null) {
                sellerId = input.getQueryStringParameters().get("seller_id");
            }

            LedgerResult<Listing> result = ledger.cancelListing(listingId, sellerId);
            if (!result.isSuccess()) {
                context.getLogger().log("Cancellation of listing " + listingId + " refused: " + result);
                return ApiResponses.failure(result);
            }

            context.getLogger().log("Removed listing " + listingId);
            return ApiResponses.success(200, Map.of("listing", result.getValue()));

        } catch (JsonProcessingException e) {
            context.getLogger().log("Malformed cancellation request: " + e.getOriginalMessage());
            return ResponseUtils.errorResponse(400, "Malformed request body");
        } catch (Exception e) {
            context.getLogger().log("Error cancelling listing: " + e);
            return ResponseUtils.errorResponse(500, "Failed to cancel listing");
        }
    }
}
