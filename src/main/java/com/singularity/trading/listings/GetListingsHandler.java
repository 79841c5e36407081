package com.singularity.trading.listings;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.singularity.trading.api.ApiResponses;
import com.singularity.trading.ledger.LedgerResult;
import com.singularity.trading.ledger.MarketplaceLedger;
import com.singularity.trading.ledger.MarketplaceLedgerFactory;
import com.singularity.trading.model.Listing;
import com.singularity.trading.utils.ResponseUtils;

import java.util.List;
import java.util.Map;

/**
 * Lambda handler for browsing the active marketplace listings.
 */
public class GetListingsHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final MarketplaceLedger ledger;

    /**
     * Initializes the ledger from the function environment.
     */
    public GetListingsHandler() {
        this(null);
    }

    /**
     * Constructor for dependency injection, used by the router and in tests.
     *
     * @param ledger The marketplace ledger.
     */
    public GetListingsHandler(MarketplaceLedger ledger) {
        this.ledger = ledger != null ? ledger : MarketplaceLedgerFactory.fromEnvironment();
    }

    /**
     * Handles {@code GET /listings}.
     *
     * @param input   The API Gateway proxy request event.
     * @param context The Lambda execution context.
     * @return Active listings, newest first, with their count.
     */
    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            LedgerResult<List<Listing>> result = ledger.listActiveListings();
            if (!result.isSuccess()) {
                return ApiResponses.failure(result);
            }
            List<Listing> listings = result.getValue();
            context.getLogger().log("Retrieved " + listings.size() + " active listings");
            return ApiResponses.success(200, Map.of("listings", listings, "total", listings.size()));
        } catch (Exception e) {
            context.getLogger().log("Error getting listings: " + e);
            return ResponseUtils.errorResponse(500, "Failed to get listings");
        }
    }
}
