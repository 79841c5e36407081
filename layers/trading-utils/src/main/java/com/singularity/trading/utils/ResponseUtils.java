package com.singularity.trading.utils;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;

import java.util.HashMap;
import java.util.Map;

/**
 * Builds API Gateway proxy responses with the JSON and CORS headers every trading endpoint returns.
 */
public class ResponseUtils {

    private ResponseUtils() {}

    /**
     * Creates a response with the given status and an already serialized JSON body.
     *
     * @param statusCode The HTTP status code.
     * @param body       The JSON body.
     * @return The API Gateway proxy response event.
     */
    public static APIGatewayProxyResponseEvent createResponse(int statusCode, String body) {
        Map<String, String> headers = new HashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Access-Control-Allow-Origin", "*");
        headers.put("Access-Control-Allow-Headers",
                "Content-Type,X-Amz-Date,Authorization,X-Api-Key,X-Amz-Security-Token");
        headers.put("Access-Control-Allow-Methods", "GET,POST,PUT,DELETE,OPTIONS");
        return new APIGatewayProxyResponseEvent()
                .withStatusCode(statusCode)
                .withHeaders(headers)
                .withBody(body);
    }

    /**
     * Creates a failure response whose body is {@code {"success": false, "error": message}}.
     * Used for errors raised before a ledger result exists.
     *
     * @param statusCode The HTTP status code.
     * @param message    A message safe to show to the client.
     * @return The API Gateway proxy response event.
     */
    public static APIGatewayProxyResponseEvent errorResponse(int statusCode, String message) {
        String escaped = message.replace("\\", "\\\\").replace("\"", "\\\"");
        return createResponse(statusCode, "{\"success\": false, \"error\": \"" + escaped + "\"}");
    }
}
