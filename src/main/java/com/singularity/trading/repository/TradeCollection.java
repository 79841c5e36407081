package com.singularity.trading.repository;

import com.singularity.trading.model.Trade;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable view over the append-only trade log.
 */
public final class TradeCollection {

    private final List<Trade> trades;

    public TradeCollection(List<Trade> trades) {
        this.trades = Collections.unmodifiableList(new ArrayList<>(trades));
    }

    public static TradeCollection empty() {
        return new TradeCollection(Collections.emptyList());
    }

    public List<Trade> all() {
        return trades;
    }

    public boolean contains(String tradeId) {
        return trades.stream().anyMatch(trade -> trade.getTradeId().equals(tradeId));
    }

    public TradeCollection append(Trade trade) {
        if (contains(trade.getTradeId())) {
            throw new IllegalStateException("Trade " + trade.getTradeId() + " is already recorded");
        }
        List<Trade> next = new ArrayList<>(trades);
        next.add(trade);
        return new TradeCollection(next);
    }

    /**
     * @return Trades where the player is seller or buyer, most recent first.
     */
    public List<Trade> forPlayer(String playerId) {
        return trades.stream()
                .filter(trade -> trade.involves(playerId))
                .sorted(Comparator.comparing(Trade::completedInstant).reversed())
                .collect(Collectors.toList());
    }
}
