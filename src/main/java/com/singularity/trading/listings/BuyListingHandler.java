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
import com.singularity.trading.ledger.PurchaseReceipt;
import com.singularity.trading.model.BuyListingRequest;
import com.singularity.trading.model.Trade;
import com.singularity.trading.utils.JsonUtils;
import com.singularity.trading.utils.ResponseUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lambda handler for buying a listing. The ledger guarantees a listing is sold to at most one buyer.
 */
public class BuyListingHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private final MarketplaceLedger ledger;
    private final ObjectMapper objectMapper;

    /**
     * Initializes the ledger from the function environment.
     */
    public BuyListingHandler() {
        this(null);
    }

    /**
     * Constructor for dependency injection, used by the router and in tests.
     *
     * @param ledger The marketplace ledger.
     */
    public BuyListingHandler(MarketplaceLedger ledger) {
        this.ledger = ledger != null ? ledger : MarketplaceLedgerFactory.fromEnvironment();
        this.objectMapper = JsonUtils.newObjectMapper();
    }

    /**
     * Handles {@code POST /listings/{id}/buy}.
     *
     * @param input   The API Gateway proxy request event with the path parameter 'id'.
     * @param context The Lambda execution context.
     * @return The trade and the purchased item, or the reason the purchase was refused.
     */
    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        try {
            String listingId = listingId(input);
            BuyListingRequest request = (input.getBody() == null || input.getBody().isBlank())
                    ? new BuyListingRequest()
                    : objectMapper.readValue(input.getBody(), BuyListingRequest.class);

            LedgerResult<PurchaseReceipt> result = ledger.buyListing(
                    listingId, request.getBuyerId(), request.getBuyerName(), request.getExpectedPrice());
            if (!result.isSuccess()) {
                context.getLogger().log("Purchase of listing " + listingId + " refused: " + result);
                return ApiResponses.failure(result);
            }

            PurchaseReceipt receipt = result.getValue();
            Trade trade = receipt.getTrade();
            if (!receipt.isTradeRecorded()) {
                context.getLogger().log("Listing " + listingId + " sold but trade " + trade.getTradeId() + " is missing from the log");
            }

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("item_type", trade.getItemType());
            item.put("item_name", trade.getItemName());
            item.put("quantity", trade.getQuantity());
            item.put("price_paid", trade.getFinalPrice());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("trade", trade);
            payload.put("listing", receipt.getListing());
            payload.put("item", item);
            payload.put("trade_recorded", receipt.isTradeRecorded());
            return ApiResponses.success(200, payload);

        } catch (JsonProcessingException e) {
            context.getLogger().log("Malformed purchase request: " + e.getOriginalMessage());
            return ResponseUtils.errorResponse(400, "Malformed request body");
        } catch (Exception e) {
            context.getLogger().log("Error buying listing: " + e);
            return ResponseUtils.errorResponse(500, "Failed to complete purchase");
        }
    }

    private static String listingId(APIGatewayProxyRequestEvent input) {
        Map<String, String> pathParameters = input.getPathParameters();
        if (pathParameters == null) {
            return null;
        }
        String listingId = pathParameters.get("id");
        return listingId != null ? listingId : pathParameters.get("listing_id");
    }
}
