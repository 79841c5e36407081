package com.singularity.trading.ledger;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.singularity.trading.repository.ListingRepository;
import com.singularity.trading.repository.TradeRepository;
import com.singularity.trading.store.DocumentStore;
import com.singularity.trading.store.DocumentStores;
import com.singularity.trading.utils.JsonUtils;

import java.time.Clock;
import java.util.Map;

/**
 * Wires a {@link MarketplaceLedger} from the function environment.
 */
public final class MarketplaceLedgerFactory {

    private MarketplaceLedgerFactory() {}

    /**
     * Builds a ledger from {@link System#getenv()}. Called once per handler instance.
     */
    public static MarketplaceLedger fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static MarketplaceLedger fromEnvironment(Map<String, String> env) {
        LambdaLogger logger = LambdaRuntime.getLogger();
        return create(DocumentStores.fromEnvironment(env, logger), LedgerSettings.fromEnvironment(env), logger);
    }

    /**
     * Builds a ledger over an already chosen store, with the system UTC clock.
     */
    public static MarketplaceLedger create(DocumentStore store, LedgerSettings settings, LambdaLogger logger) {
        return create(store, settings, Clock.systemUTC(), logger);
    }

    public static MarketplaceLedger create(DocumentStore store, LedgerSettings settings, Clock clock,
                                           LambdaLogger logger) {
        ObjectMapper objectMapper = JsonUtils.newObjectMapper();
        return new MarketplaceLedger(
                new ListingRepository(store, settings.getListingsKey(), objectMapper),
                new TradeRepository(store, settings.getTradesKey(), objectMapper),
                settings,
                clock,
                logger);
    }
}
