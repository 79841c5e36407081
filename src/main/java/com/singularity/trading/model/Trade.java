package com.singularity.trading.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable record of one completed sale. Item fields are copied from the listing at sale time.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Trade {
    private String tradeId;
    private String listingId;
    private String sellerId;
    private String sellerName;
    private String buyerId;
    private String buyerName;
    private String itemType;
    private String itemName;
    private int quantity;
    private int finalPrice;
    private String completedAt;

    /**
     * Default constructor for Jackson deserialization.
     */
    public Trade() {}

    /**
     * Builds the trade record for a listing that has just been sold.
     *
     * @param tradeId     The unique identifier for the trade.
     * @param sold        The listing in its sold state.
     * @param completedAt The time the sale was committed.
     * @return The trade record.
     */
    public static Trade fromSoldListing(String tradeId, Listing sold, Instant completedAt) {
        Trade trade = new Trade();
        trade.tradeId = tradeId;
        trade.listingId = sold.getListingId();
        trade.sellerId = sold.getSellerId();
        trade.sellerName = sold.getSellerName();
        trade.buyerId = sold.getBuyerId();
        trade.buyerName = sold.getBuyerName();
        trade.itemType = sold.getItemType();
        trade.itemName = sold.getItemName();
        trade.quantity = sold.getQuantity();
        trade.finalPrice = sold.getAskingPrice();
        trade.completedAt = Timestamps.format(completedAt);
        return trade;
    }

    @JsonProperty("trade_id")
    public String getTradeId() { return tradeId; }
    public void setTradeId(String tradeId) { this.tradeId = tradeId; }

    @JsonProperty("listing_id")
    public String getListingId() { return listingId; }
    public void setListingId(String listingId) { this.listingId = listingId; }

    @JsonProperty("seller_id")
    public String getSellerId() { return sellerId; }
    public void setSellerId(String sellerId) { this.sellerId = sellerId; }

    @JsonProperty("seller_name")
    public String getSellerName() { return sellerName; }
    public void setSellerName(String sellerName) { this.sellerName = sellerName; }

    @JsonProperty("buyer_id")
    public String getBuyerId() { return buyerId; }
    public void setBuyerId(String buyerId) { this.buyerId = buyerId; }

    @JsonProperty("buyer_name")
    public String getBuyerName() { return buyerName; }
    public void setBuyerName(String buyerName) { this.buyerName = buyerName; }

    @JsonProperty("item_type")
    public String getItemType() { return itemType; }
    public void setItemType(String itemType) { this.itemType = itemType; }

    @JsonProperty("item_name")
    public String getItemName() { return itemName; }
    public void setItemName(String itemName) { this.itemName = itemName; }

    @JsonProperty("quantity")
    public int getQuantity() { return quantity; }
    public void setQuantity(int quantity) { this.quantity = quantity; }

    @JsonProperty("final_price")
    public int getFinalPrice() { return finalPrice; }
    public void setFinalPrice(int finalPrice) { this.finalPrice = finalPrice; }

    @JsonProperty("completed_at")
    public String getCompletedAt() { return completedAt; }
    public void setCompletedAt(String completedAt) { this.completedAt = completedAt; }

    @JsonIgnore
    public boolean involves(String playerId) {
        return playerId.equals(sellerId) || playerId.equals(buyerId);
    }

    @JsonIgnore
    public Instant completedInstant() {
        return Timestamps.parse(completedAt);
    }
}
