package com.singularity.trading.ledger;

/**
 * Why a ledger operation did not succeed.
 */
public enum LedgerError {
    /** Malformed or out-of-range input. */
    VALIDATION,

    /** The seller already offers too many units of this item type. */
    CAPACITY_EXCEEDED,

    /** The listing does not exist or is no longer active. */
    NOT_FOUND,

    /** The buyer is the seller. */
    SELF_TRADE,

    /** The caller does not own the listing. */
    FORBIDDEN,

    /** The buyer's expected price does not match the asking price. */
    PRICE_CHANGED,

    /** Every conditional write attempt lost to a concurrent writer. Safe to retry from a fresh view. */
    CONFLICT,

    /** The document store could not serve the request. */
    STORE_UNAVAILABLE
}
