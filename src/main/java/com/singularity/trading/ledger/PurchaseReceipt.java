package com.singularity.trading.ledger;

import com.singularity.trading.model.Listing;
import com.singularity.trading.model.Trade;

/**
 * Result of a committed purchase.
 */
public final class PurchaseReceipt {

    private final Listing listing;
    private final Trade trade;
    private final boolean tradeRecorded;

    public PurchaseReceipt(Listing listing, Trade trade, boolean tradeRecorded) {
        this.listing = listing;
        this.trade = trade;
        this.tradeRecorded = tradeRecorded;
    }

    /** The listing in its sold state. */
    public Listing getListing() { return listing; }

    public Trade getTrade() { return trade; }

    /**
     * Whether the trade made it into the trade log. The sale stands either way.
     */
    public boolean isTradeRecorded() { return tradeRecorded; }
}
