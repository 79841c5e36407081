package com.singularity.trading.api;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.singularity.trading.ledger.LedgerError;
import com.singularity.trading.ledger.LedgerResult;
import com.singularity.trading.utils.JsonUtils;
import com.singularity.trading.utils.ResponseUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns ledger results into API Gateway responses.
 *
 * <p>Every body has a {@code success} flag. Failures add {@code error}, {@code error_code} and the
 * result's details at the top level, e.g. {@code current_price} next to {@code expected_price}.
 */
public final class ApiResponses {

    private static final ObjectMapper OBJECT_MAPPER = JsonUtils.newObjectMapper();

    private ApiResponses() {}

    public static APIGatewayProxyResponseEvent success(int statusCode, Map<String, Object> payload)
            throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.putAll(payload);
        return ResponseUtils.createResponse(statusCode, OBJECT_MAPPER.writeValueAsString(body));
    }

    public static APIGatewayProxyResponseEvent failure(LedgerResult<?> result) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", result.getMessage());
        body.put("error_code", result.getError().name());
        body.putAll(result.getDetails());
        return ResponseUtils.createResponse(statusFor(result.getError()), OBJECT_MAPPER.writeValueAsString(body));
    }

    /**
     * HTTP status for each refusal. Business refusals are 4xx and are not retried by the boundary;
     * {@link LedgerError#CONFLICT} has already been retried inside the ledger.
     */
    public static int statusFor(LedgerError error) {
        switch (error) {
            case VALIDATION:
                return 400;
            case FORBIDDEN:
                return 403;
            case NOT_FOUND:
                return 404;
            case CONFLICT:
                return 409;
            case PRICE_CHANGED:
                return 412;
            case SELF_TRADE:
                return 422;
            case CAPACITY_EXCEEDED:
                return 429;
            case STORE_UNAVAILABLE:
                return 503;
            default:
                return 500;
        }
    }
}
