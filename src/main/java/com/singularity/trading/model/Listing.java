package com.singularity.trading.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A single sell offer in the marketplace.
 * Quantity and asking price never change after creation; only the status and the
 * fields attached by the sold/removed transitions do.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Listing {
    private String listingId;
    private String sellerId;
    private String sellerName;
    private String itemType;
    private String itemName;
    private int quantity;
    private int askingPrice;
    private String description;
    private ListingStatus status;
    private String createdAt;
    private String buyerId;
    private String buyerName;
    private String soldAt;
    private String removedAt;
    private String transitionId;

    /**
     * Default constructor for Jackson deserialization.
     */
    public Listing() {}

    /**
     * Copy constructor. Collections copy a listing before changing it so that
     * previously handed out snapshots stay untouched.
     *
     * @param other The listing to copy.
     */
    public Listing(Listing other) {
        this.listingId = other.listingId;
        this.sellerId = other.sellerId;
        this.sellerName = other.sellerName;
        this.itemType = other.itemType;
        this.itemName = other.itemName;
        this.quantity = other.quantity;
        this.askingPrice = other.askingPrice;
        this.description = other.description;
        this.status = other.status;
        this.createdAt = other.createdAt;
        this.buyerId = other.buyerId;
        this.buyerName = other.buyerName;
        this.soldAt = other.soldAt;
        this.removedAt = other.removedAt;
        this.transitionId = other.transitionId;
    }

    @JsonProperty("listing_id")
    public String getListingId() { return listingId; }
    public void setListingId(String listingId) { this.listingId = listingId; }

    @JsonProperty("seller_id")
    public String getSellerId() { return sellerId; }
    public void setSellerId(String sellerId) { this.sellerId = sellerId; }

    @JsonProperty("seller_name")
    public String getSellerName() { return sellerName; }
    public void setSellerName(String sellerName) { this.sellerName = sellerName; }

    @JsonProperty("item_type")
    public String getItemType() { return itemType; }
    public void setItemType(String itemType) { this.itemType = itemType; }

    @JsonProperty("item_name")
    public String getItemName() { return itemName; }
    public void setItemName(String itemName) { this.itemName = itemName; }

    @JsonProperty("quantity")
    public int getQuantity() { return quantity; }
    public void setQuantity(int quantity) { this.quantity = quantity; }

    @JsonProperty("asking_price")
    public int getAskingPrice() { return askingPrice; }
    public void setAskingPrice(int askingPrice) { this.askingPrice = askingPrice; }

    @JsonProperty("description")
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    @JsonProperty("status")
    public ListingStatus getStatus() { return status; }
    public void setStatus(ListingStatus status) { this.status = status; }

    @JsonProperty("created_at")
    public String getCreatedAt() { return createdAt; }
    public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }

    @JsonProperty("buyer_id")
    public String getBuyerId() { return buyerId; }
    public void setBuyerId(String buyerId) { this.buyerId = buyerId; }

    @JsonProperty("buyer_name")
    public String getBuyerName() { return buyerName; }
    public void setBuyerName(String buyerName) { this.buyerName = buyerName; }

    @JsonProperty("sold_at")
    public String getSoldAt() { return soldAt; }
    public void setSoldAt(String soldAt) { this.soldAt = soldAt; }

    @JsonProperty("removed_at")
    public String getRemovedAt() { return removedAt; }
    public void setRemovedAt(String removedAt) { this.removedAt = removedAt; }

    /**
     * Token of the ledger call that last changed this listing. A caller whose write outcome
     * was unknown recognises its own transition by it.
     */
    @JsonProperty("transition_id")
    public String getTransitionId() { return transitionId; }
    public void setTransitionId(String transitionId) { this.transitionId = transitionId; }

    @JsonIgnore
    public boolean isActive() {
        return status == ListingStatus.ACTIVE;
    }

    @JsonIgnore
    public Instant createdInstant() {
        return Timestamps.parse(createdAt);
    }
}
