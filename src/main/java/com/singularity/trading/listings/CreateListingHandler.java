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
import com.singularity.trading.model.CreateListingRequest;
import com.singularity.trading.model.Listing;
import com.singularity.trading.utils.JsonUtils;
import com.singularity.trading.utils.ResponseUtils;

import java.util.Map;

/**
 * Lambda handler for putting salvage up for sale.
 */
public class CreateListingHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final MarketplaceLedger ledger;
    private final ObjectMapper objectMapper;

    /**
     * Initializes the ledger from the function environment.
     */
    public CreateListingHandler() {
        this(null);
    }

    /**
     * Constructor for dependency injection, used by the router and in tests.
     *
     * @param ledger The marketplace ledger.
     */
    public CreateListingHandler(MarketplaceLedger ledger) {
        this.ledger = ledger != null ? ledger : MarketplaceLedgerFactory.fromEnvironment();
        this.objectMapper = JsonUtils.newObjectMapper();
    }

    /**
     * Handles {@code POST /listings}.
     *
     * @param input   The API Gateway proxy request event.
     * @param context The Lambda execution context.
     * @return 201 with the created listing, or the reason it was refused.
     */
    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            if (input.getBody() == null || input.getBody().isBlank()) {
                return ResponseUtils.errorResponse(400, "Request body is required");
            }
            CreateListingRequest request = objectMapper.readValue(input.getBody(), CreateListingRequest.class);

            LedgerResult<Listing> result = ledger.createListing(request);
            if (!result.isSuccess()) {
                context.getLogger().log("Listing rejected: " + result);
                return ApiResponses.failure(result);
            }

            Listing listing = result.getValue();
            context.getLogger().log("Created listing " + listing.getListingId() + " for " + listing.getItemName());
            return ApiResponses.success(201, Map.of("listing", listing));

        } catch (JsonProcessingException e) {
            context.getLogger().log("Malformed listing request: " + e.getOriginalMessage());
            return ResponseUtils.errorResponse(400, "Malformed request body");
        } catch (Exception e) {
            context.getLogger().log("Error creating listing: " + e);
            return ResponseUtils.errorResponse(500, "Failed to create listing");
        }
    }
}
