package com.singularity.trading.model;

import java.time.Instant;
import java.time.OffsetDateTime;

/**
 * ISO-8601 helpers for the timestamps stored in trading documents.
 */
public final class Timestamps {

    private Timestamps() {}

    public static String format(Instant instant) {
        return instant.toString();
    }

    /**
     * Parses a stored timestamp. Accepts both {@code Z} and numeric offsets, since older documents
     * were written with {@code +00:00}. Missing values sort as the epoch.
     */
    public static Instant parse(String value) {
        if (value == null || value.isEmpty()) {
            return Instant.EPOCH;
        }
        return OffsetDateTime.parse(value).toInstant();
    }
}
