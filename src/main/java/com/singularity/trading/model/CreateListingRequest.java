package com.singularity.trading.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /listings}. Numbers are boxed so a missing field can be told apart from zero.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateListingRequest {
    private String sellerId;
    private String sellerName;
    private String itemType;
    private String itemName;
    private Integer quantity;
    private Integer askingPrice;
    private String description;

    public CreateListingRequest() {}

    public CreateListingRequest(String sellerId, String sellerName, String itemType, String itemName,
                                Integer quantity, Integer askingPrice, String description) {
        this.sellerId = sellerId;
        this.sellerName = sellerName;
        this.itemType = itemType;
        this.itemName = itemName;
        this.quantity = quantity;
        this.askingPrice = askingPrice;
        this.description = description;
    }

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
    public Integer getQuantity() { return quantity; }
    public void setQuantity(Integer quantity) { this.quantity = quantity; }

    @JsonProperty("asking_price")
    public Integer getAskingPrice() { return askingPrice; }
    public void setAskingPrice(Integer askingPrice) { this.askingPrice = askingPrice; }

    @JsonProperty("description")
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
