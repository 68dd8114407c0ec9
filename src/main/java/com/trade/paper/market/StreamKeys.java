package com.trade.paper.market;

import com.trade.paper.core.Interval;
import com.trade.paper.core.Symbol;

/**
 * 组合流名称
 */
public final class StreamKeys {

    private StreamKeys() {}

    public static String ticker(Symbol symbol) {
        return symbol.toStreamName() + "@ticker";
    }

    public static String depth(Symbol symbol, String speed) {
        return symbol.toStreamName() + "@depth@" + speed;
    }

    public static String kline(Symbol symbol, Interval interval) {
        return symbol.toStreamName() + "@kline_" + interval.getCode();
    }

    public static String aggTrade(Symbol symbol) {
        return symbol.toStreamName() + "@aggTrade";
    }

    public static String markPrice(Symbol symbol) {
        return symbol.toStreamName() + "@markPrice";
    }

    public static String normalize(String streamKey) {
        if (streamKey == null || streamKey.isBlank()) {
            throw new IllegalArgumentException("流名称不能为空");
        }
        return streamKey.trim().toLowerCase();
    }
}
