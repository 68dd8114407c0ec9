package com.trade.paper.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 24小时滚动行情
 */
public class Ticker {
    private final Symbol symbol;
    private final BigDecimal lastPrice;            // 最新成交价 c
    private final BigDecimal priceChange;          // 24h价格变化 p
    private final BigDecimal priceChangePercent;   // 24h涨跌幅 P
    private final BigDecimal high24h;              // 24h最高价 h
    private final BigDecimal low24h;               // 24h最低价 l
    private final BigDecimal volume24h;            // 24h成交量 v
    private final BigDecimal quoteVolume24h;       // 24h成交额 q
    private final Instant timestamp;               // 事件时间

    public Ticker(Symbol symbol, BigDecimal lastPrice, BigDecimal priceChange,
                  BigDecimal priceChangePercent, BigDecimal high24h, BigDecimal low24h,
                  BigDecimal volume24h, BigDecimal quoteVolume24h, Instant timestamp) {
        this.symbol = symbol;
        this.lastPrice = lastPrice;
        this.priceChange = priceChange;
        this.priceChangePercent = priceChangePercent;
        this.high24h = high24h;
        this.low24h = low24h;
        this.volume24h = volume24h;
        this.quoteVolume24h = quoteVolume24h;
        this.timestamp = timestamp;
    }

    public Symbol getSymbol() { return symbol; }
    public BigDecimal getLastPrice() { return lastPrice; }
    public BigDecimal getPriceChange() { return priceChange; }
    public BigDecimal getPriceChangePercent() { return priceChangePercent; }
    public BigDecimal getHigh24h() { return high24h; }
    public BigDecimal getLow24h() { return low24h; }
    public BigDecimal getVolume24h() { return volume24h; }
    public BigDecimal getQuoteVolume24h() { return quoteVolume24h; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("Ticker{symbol=%s, last=%s, change=%s%%}",
                symbol, lastPrice, priceChangePercent);
    }
}
