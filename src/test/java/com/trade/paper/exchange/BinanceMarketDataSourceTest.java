package com.trade.paper.exchange;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.paper.book.OrderBookSnapshot;
import com.trade.paper.core.Interval;
import com.trade.paper.core.KLine;
import com.trade.paper.core.Symbol;
import com.trade.paper.core.Ticker;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binance 公开行情接口测试
 */
class BinanceMarketDataSourceTest {

    private static final Symbol BTC = Symbol.of("BTCUSDT");

    private MockWebServer server;
    private BinanceMarketDataSource dataSource;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .callTimeout(2, TimeUnit.SECONDS)
                .build();
        dataSource = new BinanceMarketDataSource(httpClient, new ObjectMapper(),
                server.url("/").toString(), 2, 10);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void getDepthSnapshot_shouldParseLevels() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
                {
                  "lastUpdateId": 1027024,
                  "E": 1589436922972,
                  "T": 1589436922959,
                  "bids": [["95999.10", "1.500"], ["95998.00", "0.250"]],
                  "asks": [["96001.00", "2.000"]]
                }
                """));

        OrderBookSnapshot snapshot = dataSource.getDepthSnapshot(BTC, 1000);

        assertEquals(1027024, snapshot.getLastUpdateId());
        assertEquals(2, snapshot.getBids().size());
        assertEquals(new BigDecimal("95999.10"), snapshot.getBids().get(0).price());
        assertEquals(0, new BigDecimal("1.5").compareTo(snapshot.getBids().get(0).quantity()));
        assertEquals(new BigDecimal("96001.00"), snapshot.getAsks().get(0).price());

        RecordedRequest request = server.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/fapi/v1/depth?symbol=BTCUSDT&limit=1000", request.getPath());
    }

    @Test
    void getDepthSnapshot_shouldRetryServerErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody("{\"lastUpdateId\":7,\"bids\":[],\"asks\":[]}"));

        OrderBookSnapshot snapshot = dataSource.getDepthSnapshot(BTC, 100);

        assertEquals(7, snapshot.getLastUpdateId());
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void retriesExhausted_shouldThrowLastError() {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(500));
        }

        ExchangeException e = assertThrows(ExchangeException.class, () -> dataSource.getDepthSnapshot(BTC, 100));

        assertEquals(ExchangeException.ErrorCode.NETWORK_ERROR, e.getErrorCode());
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void invalidSymbol_shouldNotRetry() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}"));

        ExchangeException e = assertThrows(ExchangeException.class, () -> dataSource.getDepthSnapshot(BTC, 100));

        assertEquals(ExchangeException.ErrorCode.INVALID_SYMBOL, e.getErrorCode());
        assertFalse(e.isRetryable());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void ipBanned_shouldNotRetry() {
        server.enqueue(new MockResponse().setResponseCode(418));
        server.enqueue(new MockResponse().setResponseCode(418));
        server.enqueue(new MockResponse().setResponseCode(418));

        ExchangeException e = assertThrows(ExchangeException.class, () -> dataSource.getDepthSnapshot(BTC, 1000));

        assertEquals(ExchangeException.ErrorCode.IP_BANNED, e.getErrorCode());
        assertFalse(e.isRetryable());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void otherClientError_shouldMapToApiError() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"code\":-1100,\"msg\":\"Illegal characters found.\"}"));

        ExchangeException e = assertThrows(ExchangeException.class, () -> dataSource.getTicker(BTC));

        assertEquals(ExchangeException.ErrorCode.API_ERROR, e.getErrorCode());
        assertTrue(e.getMessage().contains("-1100"));
    }

    @Test
    void getTicker_shouldParseRestTicker() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
                {
                  "symbol": "BTCUSDT",
                  "priceChange": "-94.99999800",
                  "priceChangePercent": "-95.960",
                  "lastPrice": "95000.10",
                  "highPrice": "96500.00",
                  "lowPrice": "94000.00",
                  "volume": "8913.30000000",
                  "quoteVolume": "15.30000000",
                  "closeTime": 1499869899040
                }
                """));

        Ticker ticker = dataSource.getTicker(BTC);

        assertEquals(new BigDecimal("95000.10"), ticker.getLastPrice());
        assertEquals(new BigDecimal("96500.00"), ticker.getHigh24h());
        assertEquals(1499869899040L, ticker.getTimestamp().toEpochMilli());
        assertEquals("/fapi/v1/ticker/24hr?symbol=BTCUSDT", server.takeRequest().getPath());
    }

    @Test
    void getKLines_shouldParseArrays() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("""
                [
                  [1499040000000, "95000.0", "95100.0", "94900.0", "95050.0", "12.5", 1499040059999,
                   "1187500.0", 308, "6.2", "590000.0", "0"]
                ]
                """));

        List<KLine> kLines = dataSource.getKLines(BTC, Interval.ONE_MINUTE, 1, 1499040059999L);

        assertEquals(1, kLines.size());
        assertEquals(new BigDecimal("95050.0"), kLines.get(0).getClose());
        assertTrue(kLines.get(0).isClosed());
        assertEquals("/fapi/v1/klines?symbol=BTCUSDT&interval=1m&limit=1&endTime=1499040059999",
                server.takeRequest().getPath());
    }

    @Test
    void depthLimit_shouldRoundUpToSupportedValue() {
        assertEquals(5, BinanceMarketDataSource.depthLimit(1));
        assertEquals(20, BinanceMarketDataSource.depthLimit(11));
        assertEquals(500, BinanceMarketDataSource.depthLimit(101));
        assertEquals(1000, BinanceMarketDataSource.depthLimit(5000));
    }
}
