package com.trade.paper.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * K线数据
 * 行情层只负责解析，图表展示由外部处理
 */
public class KLine {
    private final Symbol symbol;
    private final Interval interval;         // 周期
    private final Instant openTime;          // 开盘时间
    private final Instant closeTime;         // 收盘时间
    private final BigDecimal open;           // 开盘价
    private final BigDecimal high;           // 最高价
    private final BigDecimal low;            // 最低价
    private final BigDecimal close;          // 收盘价
    private final BigDecimal volume;         // 成交量
    private final boolean closed;            // 是否已收盘（x 字段）

    public KLine(Symbol symbol, Interval interval, Instant openTime, Instant closeTime,
                 BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                 BigDecimal volume, boolean closed) {
        this.symbol = symbol;
        this.interval = interval;
        this.openTime = openTime;
        this.closeTime = closeTime;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
        this.closed = closed;
    }

    public Symbol getSymbol() { return symbol; }
    public Interval getInterval() { return interval; }
    public Instant getOpenTime() { return openTime; }
    public Instant getCloseTime() { return closeTime; }
    public BigDecimal getOpen() { return open; }
    public BigDecimal getHigh() { return high; }
    public BigDecimal getLow() { return low; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getVolume() { return volume; }
    public boolean isClosed() { return closed; }

    @Override
    public String toString() {
        return String.format("KLine{%s %s open=%s o=%s h=%s l=%s c=%s v=%s final=%s}",
                symbol, interval.getCode(), openTime, open, high, low, close, volume, closed);
    }
}
