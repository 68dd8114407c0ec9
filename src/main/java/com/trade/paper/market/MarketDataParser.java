package com.trade.paper.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.paper.book.OrderBookDiff;
import com.trade.paper.book.OrderBookSnapshot;
import com.trade.paper.book.PriceLevel;
import com.trade.paper.core.Interval;
import com.trade.paper.core.KLine;
import com.trade.paper.core.Symbol;
import com.trade.paper.core.Ticker;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Binance 合约行情报文解析
 * 数值字段统一按字符串读入 BigDecimal，不经过 double
 */
public final class MarketDataParser {

    private MarketDataParser() {}

    /**
     * 深度增量 depthUpdate
     */
    public static OrderBookDiff parseDepthDiff(JsonNode data) {
        Symbol symbol = Symbol.of(requiredText(data, "s"));
        long firstUpdateId = requiredLong(data, "U");
        long finalUpdateId = requiredLong(data, "u");
        Long previousFinalUpdateId = data.hasNonNull("pu") ? data.get("pu").asLong() : null;
        return new OrderBookDiff(symbol, firstUpdateId, finalUpdateId, previousFinalUpdateId,
                parseLevels(data.get("b")), parseLevels(data.get("a")));
    }

    /**
     * REST 深度快照 /fapi/v1/depth
     */
    public static OrderBookSnapshot parseDepthSnapshot(Symbol symbol, JsonNode json) {
        long lastUpdateId = requiredLong(json, "lastUpdateId");
        return new OrderBookSnapshot(symbol, lastUpdateId,
                parseLevels(json.get("bids")), parseLevels(json.get("asks")));
    }

    /**
     * 24小时行情推送 24hrTicker
     */
    public static Ticker parseTicker(JsonNode data) {
        Symbol symbol = Symbol.of(requiredText(data, "s"));
        Instant eventTime = data.hasNonNull("E") ? Instant.ofEpochMilli(data.get("E").asLong()) : Instant.now();
        return new Ticker(symbol,
                requiredDecimal(data, "c"),
                optionalDecimal(data, "p"),
                optionalDecimal(data, "P"),
                optionalDecimal(data, "h"),
                optionalDecimal(data, "l"),
                optionalDecimal(data, "v"),
                optionalDecimal(data, "q"),
                eventTime);
    }

    /**
     * REST 24小时行情 /fapi/v1/ticker/24hr
     */
    public static Ticker parseRestTicker(Symbol symbol, JsonNode json) {
        Instant closeTime = json.hasNonNull("closeTime") ? Instant.ofEpochMilli(json.get("closeTime").asLong()) : Instant.now();
        return new Ticker(symbol,
                requiredDecimal(json, "lastPrice"),
                optionalDecimal(json, "priceChange"),
                optionalDecimal(json, "priceChangePercent"),
                optionalDecimal(json, "highPrice"),
                optionalDecimal(json, "lowPrice"),
                optionalDecimal(json, "volume"),
                optionalDecimal(json, "quoteVolume"),
                closeTime);
    }

    /**
     * K线推送 kline
     */
    public static KLine parseKLine(JsonNode data) {
        JsonNode k = data.get("k");
        if (k == null || k.isNull()) {
            throw new IllegalArgumentException("K线报文缺少字段: k");
        }
        Symbol symbol = Symbol.of(data.hasNonNull("s") ? data.get("s").asText() : requiredText(k, "s"));
        return new KLine(symbol,
                Interval.fromCode(requiredText(k, "i")),
                Instant.ofEpochMilli(requiredLong(k, "t")),
                Instant.ofEpochMilli(requiredLong(k, "T")),
                requiredDecimal(k, "o"),
                requiredDecimal(k, "h"),
                requiredDecimal(k, "l"),
                requiredDecimal(k, "c"),
                requiredDecimal(k, "v"),
                k.path("x").asBoolean(false));
    }

    /**
     * REST K线 /fapi/v1/klines，收盘时间早于 now 的视为已收盘
     */
    public static List<KLine> parseRestKLines(Symbol symbol, Interval interval, JsonNode jsonArray, Instant now) {
        List<KLine> kLines = new ArrayList<>();
        for (JsonNode node : jsonArray) {
            Instant closeTime = Instant.ofEpochMilli(node.get(6).asLong());
            kLines.add(new KLine(symbol, interval,
                    Instant.ofEpochMilli(node.get(0).asLong()),
                    closeTime,
                    new BigDecimal(node.get(1).asText()),
                    new BigDecimal(node.get(2).asText()),
                    new BigDecimal(node.get(3).asText()),
                    new BigDecimal(node.get(4).asText()),
                    new BigDecimal(node.get(5).asText()),
                    closeTime.isBefore(now)));
        }
        return kLines;
    }

    private static List<PriceLevel> parseLevels(JsonNode array) {
        List<PriceLevel> levels = new ArrayList<>();
        if (array == null || array.isNull()) {
            return levels;
        }
        for (JsonNode entry : array) {
            levels.add(new PriceLevel(new BigDecimal(entry.get(0).asText()), new BigDecimal(entry.get(1).asText())));
        }
        return levels;
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("报文缺少字段: " + field);
        }
        return value.asText();
    }

    private static long requiredLong(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("报文缺少字段: " + field);
        }
        return value.asLong();
    }

    private static BigDecimal requiredDecimal(JsonNode node, String field) {
        return new BigDecimal(requiredText(node, field));
    }

    private static BigDecimal optionalDecimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? BigDecimal.ZERO : new BigDecimal(value.asText());
    }
}
