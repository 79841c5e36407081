package com.singularity.trading.trades;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.singularity.trading.api.ApiResponses;
import com.singularity.trading.ledger.LedgerResult;
import com.singularity.trading.ledger.MarketplaceLedger;
import com.singularity.trading.ledger.MarketplaceLedgerFactory;
import com.singularity.trading.model.Trade;
import com.singularity.trading.utils.ResponseUtils;

import java.util.List;
import java.util.Map;

/**
 * Lambda handler for retrieving the trades a player took part in.
 */
public class GetTradeHistoryHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final MarketplaceLedger ledger;

    /**
     * Initializes the ledger from the function environment.
     */
    public GetTradeHistoryHandler() {
        this(null);
    }

    /**
     * Constructor for dependency injection, used by the router and in tests.
     *
     * @param ledger The marketplace ledger.
     */
    public GetTradeHistoryHandler(MarketplaceLedger ledger) {
        this.ledger = ledger != null ? ledger : MarketplaceLedgerFactory.fromEnvironment();
    }

    /**
     * Handles {@code GET /history/{player_id}}.
     *
     * @param input   The API Gateway proxy request event with the path parameter 'player_id'.
     * @param context The Lambda execution context.
     * @return The player's trades as seller or buyer, most recent first.
     */
    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            Map<String, String> pathParameters = input.getPathParameters();
            String playerId = pathParameters != null ? pathParameters.get("player_id") : null;

            LedgerResult<List<Trade>> result = ledger.tradeHistory(playerId);
            if (!result.isSuccess()) {
                return ApiResponses.failure(result);
            }

            List<Trade> trades = result.getValue();
            context.getLogger().log("Retrieved " + trades.size() + " trades for player " + playerId);
            return ApiResponses.success(200, Map.of("trades", trades, "total", trades.size()));
        } catch (Exception e) {
            context.getLogger().log("Error getting trade history: " + e);
            return ResponseUtils.errorResponse(500, "Failed to get trade history");
        }
    }
}
