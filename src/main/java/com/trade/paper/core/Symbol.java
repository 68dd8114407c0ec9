package com.trade.paper.core;

import java.util.Objects;

/**
 * 交易对
 * 严格遵守：仅支持 USDT 本位合约
 */
public class Symbol {
    private static final String QUOTE = "USDT";

    private final String base;      // 基础货币，如 BTC
    private final String quote;     // 报价货币，仅支持 USDT

    public Symbol(String base, String quote) {
        if (base == null || base.isBlank()) {
            throw new IllegalArgumentException("基础货币不能为空");
        }
        if (!QUOTE.equalsIgnoreCase(quote)) {
            throw new IllegalArgumentException("仅支持 USDT 本位合约，当前报价货币: " + quote);
        }
        this.base = base.trim().toUpperCase();
        this.quote = QUOTE;
    }

    /**
     * 支持 BTC-USDT、BTC_USDT、BTCUSDT 三种写法
     */
    public static Symbol of(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("交易对不能为空");
        }
        String value = symbol.trim().toUpperCase();
        String[] parts = value.split("[-_]");
        if (parts.length == 2) {
            return new Symbol(parts[0], parts[1]);
        }
        if (parts.length == 1 && value.endsWith(QUOTE) && value.length() > QUOTE.length()) {
            return new Symbol(value.substring(0, value.length() - QUOTE.length()), QUOTE);
        }
        throw new IllegalArgumentException("无效的交易对格式: " + symbol);
    }

    public String getBase() {
        return base;
    }

    public String getQuote() {
        return quote;
    }

    public String toPairString() {
        return base + quote;
    }

    /**
     * WebSocket 流名称使用小写
     */
    public String toStreamName() {
        return toPairString().toLowerCase();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return Objects.equals(base, symbol.base) && Objects.equals(quote, symbol.quote);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, quote);
    }

    @Override
    public String toString() {
        return base + quote;
    }
}
