package com.trade.paper.book;

import com.trade.paper.core.Symbol;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 盘口快照（不可变）
 * 买盘价格降序，卖盘价格升序；同价位只出现一次，数量为0的价位不保留
 */
public class OrderBookSnapshot {
    private final Symbol symbol;
    private final long lastUpdateId;
    private final List<PriceLevel> bids;
    private final List<PriceLevel> asks;

    public OrderBookSnapshot(Symbol symbol, long lastUpdateId, List<PriceLevel> bids, List<PriceLevel> asks) {
        this.symbol = symbol;
        this.lastUpdateId = lastUpdateId;
        this.bids = normalize(bids, Comparator.reverseOrder());
        this.asks = normalize(asks, Comparator.naturalOrder());
    }

    /**
     * 排序并去重，后出现的同价位覆盖先出现的
     */
    private static List<PriceLevel> normalize(List<PriceLevel> levels, Comparator<BigDecimal> order) {
        Map<BigDecimal, PriceLevel> byPrice = new TreeMap<>(order);
        for (PriceLevel level : levels) {
            BigDecimal key = level.price();
            if (level.isRemoval()) {
                byPrice.remove(key);
            } else {
                byPrice.put(key, level);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(byPrice.values()));
    }

    public Symbol getSymbol() { return symbol; }
    public long getLastUpdateId() { return lastUpdateId; }
    public List<PriceLevel> getBids() { return bids; }
    public List<PriceLevel> getAsks() { return asks; }

    @Override
    public String toString() {
        return String.format("OrderBookSnapshot{%s lastUpdateId=%d bids=%d asks=%d}",
                symbol, lastUpdateId, bids.size(), asks.size());
    }
}
