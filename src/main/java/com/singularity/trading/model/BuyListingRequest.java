package com.singularity.trading.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /listings/{id}/buy}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BuyListingRequest {
    private String buyerId;
    private String buyerName;
    private Integer expectedPrice;

    public BuyListingRequest() {}

    @JsonProperty("buyer_id")
    public String getBuyerId() { return buyerId; }
    public void setBuyerId(String buyerId) { this.buyerId = buyerId; }

    @JsonProperty("buyer_name")
    public String getBuyerName() { return buyerName; }
    public void setBuyerName(String buyerName) { this.buyerName = buyerName; }

    /**
     * Price the buyer saw when deciding to buy; optional.
     */
    @JsonProperty("expected_price")
    public Integer getExpectedPrice() { return expectedPrice; }
    public void setExpectedPrice(Integer expectedPrice) { this.expectedPrice = expectedPrice; }
}
