package com.trade.paper.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.paper.book.OrderBookSnapshot;
import com.trade.paper.core.ConfigManager;
import com.trade.paper.core.Interval;
import com.trade.paper.core.KLine;
import com.trade.paper.core.Symbol;
import com.trade.paper.core.Ticker;
import com.trade.paper.market.MarketDataParser;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Binance USDT 本位合约公开行情接口
 *
 * 每次请求都有显式的调用超时；网络错误、超时、429 和 5xx 按固定间隔有限次重试，
 * 418（IP 封禁）及其余错误直接抛给调用方。
 */
public class BinanceMarketDataSource implements MarketDataSource {

    private static final Logger logger = LoggerFactory.getLogger(BinanceMarketDataSource.class);

    public static final String DEFAULT_BASE_URL = "https://fapi.binance.com";

    private static final int MAX_DEPTH_LIMIT = 1000;
    private static final int MAX_KLINE_LIMIT = 1500;
    private static final int INVALID_SYMBOL_CODE = -1121;
    private static final Set<Integer> DEPTH_LIMITS = Set.of(5, 10, 20, 50, 100, 500, 1000);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int maxRetries;
    private final long retryDelayMillis;

    public BinanceMarketDataSource(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                                   int maxRetries, long retryDelayMillis) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("重试次数不能为负数");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.maxRetries = maxRetries;
        this.retryDelayMillis = retryDelayMillis;
    }

    /**
     * 按配置创建，调用超时取 rest.timeout-ms
     */
    public static BinanceMarketDataSource create(ConfigManager config) {
        long timeoutMs = config.getLongProperty("rest.timeout-ms", 5000);
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build();
        return new BinanceMarketDataSource(httpClient, new ObjectMapper(),
                config.getProperty("binance.rest.base-url", DEFAULT_BASE_URL),
                config.getIntProperty("rest.max-retries", 3),
                config.getLongProperty("rest.retry-delay-ms", 500));
    }

    @Override
    public String getName() {
        return "Binance";
    }

    @Override
    public OrderBookSnapshot getDepthSnapshot(Symbol symbol, int limit) throws ExchangeException {
        String endpoint = "/fapi/v1/depth?symbol=" + symbol.toPairString() + "&limit=" + depthLimit(limit);
        JsonNode json = publicRequest(endpoint);
        try {
            return MarketDataParser.parseDepthSnapshot(symbol, json);
        } catch (IllegalArgumentException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "深度快照格式错误: " + e.getMessage(), e);
        }
    }

    @Override
    public Ticker getTicker(Symbol symbol) throws ExchangeException {
        JsonNode json = publicRequest("/fapi/v1/ticker/24hr?symbol=" + symbol.toPairString());
        try {
            return MarketDataParser.parseRestTicker(symbol, json);
        } catch (IllegalArgumentException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "行情格式错误: " + e.getMessage(), e);
        }
    }

    @Override
    public List<KLine> getKLines(Symbol symbol, Interval interval, int limit, Long endTime) throws ExchangeException {
        StringBuilder url = new StringBuilder("/fapi/v1/klines?")
                .append("symbol=").append(symbol.toPairString())
                .append("&interval=").append(interval.getCode())
                .append("&limit=").append(Math.max(1, Math.min(limit, MAX_KLINE_LIMIT)));
        if (endTime != null) {
            url.append("&endTime=").append(endTime);
        }

        JsonNode jsonArray = publicRequest(url.toString());
        if (!jsonArray.isArray()) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR, "K线响应不是数组");
        }
        return MarketDataParser.parseRestKLines(symbol, interval, jsonArray, Instant.now());
    }

    // ==================== 私有方法 ====================

    /**
     * 取不小于请求值的合法档位
     */
    static int depthLimit(int requested) {
        int capped = Math.min(Math.max(requested, 5), MAX_DEPTH_LIMIT);
        return DEPTH_LIMITS.stream()
                .filter(l -> l >= capped)
                .min(Integer::compare)
                .orElse(MAX_DEPTH_LIMIT);
    }

    private JsonNode publicRequest(String endpoint) throws ExchangeException {
        ExchangeException lastError = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                logger.warn("请求失败，{} ms 后第 {} 次重试: {} ({})",
                        retryDelayMillis, attempt, endpoint, lastError.getMessage());
                sleepBeforeRetry();
            }
            try {
                return executeOnce(endpoint);
            } catch (ExchangeException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastError = e;
            }
        }
        logger.error("请求重试 {} 次后仍失败: {}", maxRetries, endpoint);
        throw lastError;
    }

    private JsonNode executeOnce(String endpoint) throws ExchangeException {
        Request request = new Request.Builder()
                .url(baseUrl + endpoint)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw toException(response.code(), text);
            }
            return objectMapper.readTree(text);
        } catch (InterruptedIOException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.TIMEOUT, "请求超时: " + endpoint, e);
        } catch (IOException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR, "网络错误: " + e.getMessage(), e);
        }
    }

    private ExchangeException toException(int httpCode, String body) {
        if (httpCode == 418) {
            // 封禁期间不重试
            return new ExchangeException(ExchangeException.ErrorCode.IP_BANNED, "IP 已被封禁: HTTP 418");
        }
        if (httpCode == 429) {
            return new ExchangeException(ExchangeException.ErrorCode.RATE_LIMIT, "请求频率超限: HTTP 429");
        }
        if (httpCode >= 500) {
            return new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR, "服务端错误: HTTP " + httpCode);
        }

        int code = 0;
        String msg = body;
        try {
            JsonNode json = objectMapper.readTree(body);
            code = json.path("code").asInt(0);
            msg = json.path("msg").asText(body);
        } catch (IOException e) {
            logger.debug("错误响应不是JSON: {}", body);
        }
        if (code == INVALID_SYMBOL_CODE) {
            return new ExchangeException(ExchangeException.ErrorCode.INVALID_SYMBOL, "无效交易对: " + msg);
        }
        return new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                String.format("HTTP %d, code=%d, msg=%s", httpCode, code, msg));
    }

    private void sleepBeforeRetry() throws ExchangeException {
        try {
            Thread.sleep(retryDelayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR, "重试等待被中断", e);
        }
    }
}
