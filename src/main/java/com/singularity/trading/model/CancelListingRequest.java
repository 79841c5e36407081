package com.singularity.trading.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code DELETE /listings/{id}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CancelListingRequest {
    private String sellerId;

    public CancelListingRequest() {}

    @JsonProperty("seller_id")
    public String getSellerId() { return sellerId; }
    public void setSellerId(String sellerId) { this.sellerId = sellerId; }
}
