package com.singularity.trading.api;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.singularity.trading.ledger.MarketplaceLedger;
import com.singularity.trading.ledger.MarketplaceLedgerFactory;
import com.singularity.trading.listings.BuyListingHandler;
import com.singularity.trading.listings.CancelListingHandler;
import com.singularity.trading.listings.CreateListingHandler;
import com.singularity.trading.listings.GetListingsHandler;
import com.singularity.trading.trades.GetTradeHistoryHandler;
import com.singularity.trading.utils.ResponseUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single Lambda serving every trading route, for deployments that put the whole API behind one
 * function. All routes share one ledger instance.
 */
public class TradingApiHandler implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

    private static final Pattern LISTING = Pattern.compile("^/listings/([^/]+)$");
    private static final Pattern BUY = Pattern.compile("^/listings/([^/]+)/buy$");
    private static final Pattern LEGACY_BUY = Pattern.compile("^/buy/([^/]+)$");
    private static final Pattern HISTORY = Pattern.compile("^/history/([^/]+)$");

    private final GetListingsHandler getListingsHandler;
    private final CreateListingHandler createListingHandler;
    private final BuyListingHandler buyListingHandler;
    private final CancelListingHandler cancelListingHandler;
    private final GetTradeHistoryHandler getTradeHistoryHandler;

    /**
     * Initializes the ledger from the function environment.
     */
    public TradingApiHandler() {
        this(null);
    }

    /**
     * Constructor for dependency injection, used primarily for testing.
     *
     * @param ledger The marketplace ledger.
     */
    public TradingApiHandler(MarketplaceLedger ledger) {
        MarketplaceLedger shared = ledger != null ? ledger : MarketplaceLedgerFactory.fromEnvironment();
        this.getListingsHandler = new GetListingsHandler(shared);
        this.createListingHandler = new CreateListingHandler(shared);
        this.buyListingHandler = new BuyListingHandler(shared);
        this.cancelListingHandler = new CancelListingHandler(shared);
        this.getTradeHistoryHandler = new GetTradeHistoryHandler(shared);
    }

    @Override
    public APIGatewayProxyResponseEvent handleRequest(APIGatewayProxyRequestEvent input, Context context) {
        String method = input.getHttpMethod() != null ? input.getHttpMethod() : "";
        String path = normalize(input.getPath());
        context.getLogger().log("Processing " + method + " " + path);

        if ("OPTIONS".equals(method)) {
            return ResponseUtils.createResponse(200, "{}");
        }
        if ("/listings".equals(path)) {
            if ("GET".equals(method)) {
                return getListingsHandler.handleRequest(input, context);
            }
            if ("POST".equals(method)) {
                return createListingHandler.handleRequest(input, context);
            }
        }

        String listingId = pathVariable(BUY, path);
        if (listingId == null) {
            listingId = pathVariable(LEGACY_BUY, path);
        }
        if ("POST".equals(method) && listingId != null) {
            return buyListingHandler.handleRequest(withPathParameter(input, "id", listingId), context);
        }
        listingId = pathVariable(LISTING, path);
        if ("DELETE".equals(method) && listingId != null) {
            return cancelListingHandler.handleRequest(withPathParameter(input, "id", listingId), context);
        }
        String playerId = pathVariable(HISTORY, path);
        if ("GET".equals(method) && playerId != null) {
            return getTradeHistoryHandler.handleRequest(withPathParameter(input, "player_id", playerId), context);
        }

        return ResponseUtils.errorResponse(404, "Endpoint not found");
    }

    private static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private static String pathVariable(Pattern pattern, String path) {
        Matcher matcher = pattern.matcher(path);
        return matcher.matches() ? matcher.group(1) : null;
    }

    private static APIGatewayProxyRequestEvent withPathParameter(APIGatewayProxyRequestEvent input,
                                                                 String name, String value) {
        Map<String, String> pathParameters = new HashMap<>();
        if (input.getPathParameters() != null) {
            pathParameters.putAll(input.getPathParameters());
        }
        pathParameters.put(name, value);
        return input.withPathParameters(pathParameters);
    }
}
