package com.singularity.trading.ledger;

import com.singularity.trading.utils.EnvUtils;

import java.util.Map;

/**
 * Tunables of the ledger, read from the function environment.
 */
public final class LedgerSettings {

    public static final String DEFAULT_LISTINGS_KEY = "trading/listings.json";
    public static final String DEFAULT_TRADES_KEY = "trading/completed_trades.json";
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_QUANTITY_CAP = 50;

    private final String listingsKey;
    private final String tradesKey;
    private final int maxAttempts;
    private final int tradeLogMaxAttempts;
    private final int quantityCap;

    public LedgerSettings(String listingsKey, String tradesKey, int maxAttempts,
                          int tradeLogMaxAttempts, int quantityCap) {
        this.listingsKey = listingsKey;
        this.tradesKey = tradesKey;
        this.maxAttempts = maxAttempts;
        this.tradeLogMaxAttempts = tradeLogMaxAttempts;
        this.quantityCap = quantityCap;
    }

    public static LedgerSettings defaults() {
        return new LedgerSettings(DEFAULT_LISTINGS_KEY, DEFAULT_TRADES_KEY,
                DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS, DEFAULT_QUANTITY_CAP);
    }

    /**
     * @throws IllegalArgumentException if a numeric setting is not a positive integer.
     */
    public static LedgerSettings fromEnvironment(Map<String, String> env) {
        return new LedgerSettings(
                EnvUtils.get(env, "LISTINGS_KEY", DEFAULT_LISTINGS_KEY),
                EnvUtils.get(env, "TRADES_KEY", DEFAULT_TRADES_KEY),
                EnvUtils.positiveInt(env, "LEDGER_MAX_ATTEMPTS", DEFAULT_MAX_ATTEMPTS),
                EnvUtils.positiveInt(env, "TRADE_LOG_MAX_ATTEMPTS", DEFAULT_MAX_ATTEMPTS),
                EnvUtils.positiveInt(env, "LISTING_QUANTITY_CAP", DEFAULT_QUANTITY_CAP));
    }

    public String getListingsKey() { return listingsKey; }

    public String getTradesKey() { return tradesKey; }

    /** Conditional write attempts for create, buy and cancel. */
    public int getMaxAttempts() { return maxAttempts; }

    /** Conditional write attempts for appending to the trade log. */
    public int getTradeLogMaxAttempts() { return tradeLogMaxAttempts; }

    /** Most units one seller may offer at once for a single item type. */
    public int getQuantityCap() { return quantityCap; }
}
