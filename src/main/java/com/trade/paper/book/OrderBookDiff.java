package com.trade.paper.book;

import com.trade.paper.core.Symbol;

import java.util.List;

/**
 * 深度增量（depthUpdate）
 */
public class OrderBookDiff {
    private final Symbol symbol;
    private final long firstUpdateId;            // U
    private final long finalUpdateId;            // u
    private final Long previousFinalUpdateId;    // pu，现货流没有该字段
    private final List<PriceLevel> bidChanges;
    private final List<PriceLevel> askChanges;

    public OrderBookDiff(Symbol symbol, long firstUpdateId, long finalUpdateId, Long previousFinalUpdateId,
                         List<PriceLevel> bidChanges, List<PriceLevel> askChanges) {
        if (finalUpdateId < firstUpdateId) {
            throw new IllegalArgumentException(
                    String.format("增量序号无效: U=%d > u=%d", firstUpdateId, finalUpdateId));
        }
        this.symbol = symbol;
        this.firstUpdateId = firstUpdateId;
        this.finalUpdateId = finalUpdateId;
        this.previousFinalUpdateId = previousFinalUpdateId;
        this.bidChanges = List.copyOf(bidChanges);
        this.askChanges = List.copyOf(askChanges);
    }

    public Symbol getSymbol() { return symbol; }
    public long getFirstUpdateId() { return firstUpdateId; }
    public long getFinalUpdateId() { return finalUpdateId; }
    public Long getPreviousFinalUpdateId() { return previousFinalUpdateId; }
    public List<PriceLevel> getBidChanges() { return bidChanges; }
    public List<PriceLevel> getAskChanges() { return askChanges; }

    @Override
    public String toString() {
        return String.format("OrderBookDiff{%s U=%d u=%d pu=%s bids=%d asks=%d}",
                symbol, firstUpdateId, finalUpdateId, previousFinalUpdateId,
                bidChanges.size(), askChanges.size());
    }
}
