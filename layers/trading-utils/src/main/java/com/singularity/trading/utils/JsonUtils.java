package com.singularity.trading.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared Jackson setup for stored documents and API payloads.
 */
public class JsonUtils {

    private JsonUtils() {}

    /**
     * Creates an ObjectMapper that skips null fields, tolerates unknown fields
     * and refuses to truncate fractional numbers into integer fields.
     *
     * @return A new, configured ObjectMapper.
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }
}
