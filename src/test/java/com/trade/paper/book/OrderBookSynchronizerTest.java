package com.trade.paper.book;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.paper.core.Interval;
import com.trade.paper.core.KLine;
import com.trade.paper.core.Symbol;
import com.trade.paper.core.Ticker;
import com.trade.paper.exchange.ExchangeException;
import com.trade.paper.exchange.MarketDataSource;
import com.trade.paper.market.FakeWebSocketFactory;
import com.trade.paper.market.ManualScheduler;
import com.trade.paper.market.ReconnectBackoff;
import com.trade.paper.market.StreamConfig;
import com.trade.paper.market.StreamConnectionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 盘口同步器测试
 * 快照请求在调用线程上同步执行
 */
class OrderBookSynchronizerTest {

    private static final Symbol BTC = Symbol.of("BTCUSDT");

    private FakeDataSource dataSource;
    private OrderBookSynchronizer synchronizer;
    private RecordingListener listener;
    private FakeWebSocketFactory factory;
    private ManualScheduler scheduler;
    private StreamConnectionManager connection;
    private long now = 1_000_000L;

    @BeforeEach
    void setUp() {
        dataSource = new FakeDataSource();
        synchronizer = new OrderBookSynchronizer(dataSource, 1000, 100, Runnable::run);
        listener = new RecordingListener();
        synchronizer.addListener(listener);

        factory = new FakeWebSocketFactory();
        scheduler = new ManualScheduler();
        connection = new StreamConnectionManager(factory, new ObjectMapper(),
                StreamConfig.builder().baseUrl("wss://stream.test").build(), scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void loadSnapshot_shouldInstallBook() throws ExchangeException {
        dataSource.snapshots.add(snapshot(1027024));

        OrderBookSnapshot state = synchronizer.loadSnapshot(BTC);

        assertEquals(1027024, state.getLastUpdateId());
        assertEquals(1000, dataSource.lastLimit);
        assertTrue(synchronizer.getOrderBook(BTC).orElseThrow().isSynced());
        assertEquals(1, listener.snapshotsLoaded);
    }

    @Test
    void applyDiff_gapShouldBeReportedAndRecoveredBySnapshot() throws ExchangeException {
        dataSource.snapshots.add(snapshot(1000));
        synchronizer.loadSnapshot(BTC);

        DiffOutcome outcome = synchronizer.applyDiff(BTC, diff(1005, 1010, 1004, "95990"));

        assertEquals(DiffOutcome.GAP, outcome);
        assertEquals(1, listener.gaps);
        OrderBook book = synchronizer.getOrderBook(BTC).orElseThrow();
        assertEquals(1000, book.getLastUpdateId());
        assertFalse(book.isSynced());

        dataSource.snapshots.add(snapshot(1007));
        OrderBookSnapshot state = synchronizer.loadSnapshot(BTC);

        assertTrue(book.isSynced());
        assertEquals(1010, state.getLastUpdateId());
        assertEquals(3, state.getBids().size());
    }

    @Test
    void track_shouldLoadSnapshotAndApplyStreamedDiffs() {
        dataSource.snapshots.add(snapshot(100));

        synchronizer.track(connection, BTC, "100ms");

        assertEquals(List.of(BTC), synchronizer.getTrackedSymbols());
        assertEquals("btcusdt@depth@100ms", factory.last().streams());
        OrderBook book = synchronizer.getOrderBook(BTC).orElseThrow();
        assertTrue(book.isSynced());

        factory.last().open();
        factory.last().receive(depthMessage(101, 103, 100, "95999", "3"));

        assertEquals(103, book.getLastUpdateId());
        assertEquals(0, new BigDecimal("3").compareTo(book.getBestBid().orElseThrow().quantity()));
        assertEquals(1, listener.bookUpdates);
    }

    @Test
    void streamedGap_shouldTriggerResync() {
        dataSource.snapshots.add(snapshot(100));
        synchronizer.track(connection, BTC, "100ms");
        factory.last().open();

        dataSource.snapshots.add(snapshot(204));
        factory.last().receive(depthMessage(200, 205, 150, "95997", "1"));

        assertEquals(2, dataSource.snapshotCalls);
        OrderBook book = synchronizer.getOrderBook(BTC).orElseThrow();
        assertTrue(book.isSynced());
        assertEquals(205, book.getLastUpdateId());
    }

    @Test
    void resyncFailure_shouldBeReportedToListeners() {
        dataSource.failure = new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR, "connection reset");

        synchronizer.track(connection, BTC, "100ms");

        assertEquals(1, listener.resyncFailures);
        assertFalse(synchronizer.getOrderBook(BTC).orElseThrow().isSynced());
    }

    @Test
    void failedResync_shouldBackOffBeforeFetchingAgain() {
        OrderBookSynchronizer gated = new OrderBookSynchronizer(dataSource, 1000, 100, Runnable::run,
                () -> new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(8), 2.0), () -> now);
        gated.addListener(listener);
        dataSource.failure = new ExchangeException(ExchangeException.ErrorCode.RATE_LIMIT, "HTTP 429");

        gated.track(connection, BTC, "100ms");
        factory.last().open();
        for (int i = 0; i < 20; i++) {
            factory.last().receive(depthMessage(101, 103, 100, "95999", "3"));
        }
        assertEquals(1, dataSource.snapshotCalls);

        // 第一个退避窗口 1s
        now += 1000;
        for (int i = 0; i < 20; i++) {
            factory.last().receive(depthMessage(101, 103, 100, "95999", "3"));
        }
        assertEquals(2, dataSource.snapshotCalls);

        // 第二个退避窗口 2s
        now += 1999;
        factory.last().receive(depthMessage(101, 103, 100, "95999", "3"));
        assertEquals(2, dataSource.snapshotCalls);
        now += 1;
        factory.last().receive(depthMessage(101, 103, 100, "95999", "3"));
        assertEquals(3, dataSource.snapshotCalls);
        assertEquals(3, listener.resyncFailures);
    }

    @Test
    void successfulResync_shouldResetBackoff() {
        OrderBookSynchronizer gated = new OrderBookSynchronizer(dataSource, 1000, 100, Runnable::run,
                () -> new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(8), 2.0), () -> now);
        dataSource.failure = new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR, "connection reset");
        gated.track(connection, BTC, "100ms");
        factory.last().open();
        factory.last().receive(depthMessage(101, 103, 100, "95999", "3"));

        dataSource.failure = null;
        dataSource.snapshots.add(snapshot(102));
        now += 1000;
        factory.last().receive(depthMessage(101, 103, 100, "95999", "3"));

        OrderBook book = gated.getOrderBook(BTC).orElseThrow();
        assertEquals(2, dataSource.snapshotCalls);
        assertTrue(book.isSynced());
        assertEquals(103, book.getLastUpdateId());

        // 恢复后再次断档立即重新加载
        dataSource.snapshots.add(snapshot(204));
        factory.last().receive(depthMessage(200, 205, 150, "95997", "1"));

        assertEquals(3, dataSource.snapshotCalls);
        assertTrue(book.isSynced());
        assertEquals(205, book.getLastUpdateId());
    }

    @Test
    void untrack_shouldStopDepthUpdates() {
        dataSource.snapshots.add(snapshot(100));
        synchronizer.track(connection, BTC, "100ms");
        FakeWebSocketFactory.FakeSocket socket = factory.last();
        socket.open();

        synchronizer.untrack(BTC);
        socket.receive(depthMessage(101, 103, 100, "95999", "3"));

        assertTrue(synchronizer.getTrackedSymbols().isEmpty());
        assertTrue(socket.closed);
        assertEquals(100, synchronizer.getOrderBook(BTC).orElseThrow().getLastUpdateId());
    }

    @Test
    void malformedDepthMessage_shouldBeIgnored() {
        dataSource.snapshots.add(snapshot(100));
        synchronizer.track(connection, BTC, "100ms");
        factory.last().open();

        factory.last().receive("{\"stream\":\"btcusdt@depth@100ms\",\"data\":{\"e\":\"depthUpdate\"}}");

        assertEquals(100, synchronizer.getOrderBook(BTC).orElseThrow().getLastUpdateId());
        assertTrue(connection.isConnected());
    }

    // ==================== 辅助方法 ====================

    private static OrderBookSnapshot snapshot(long lastUpdateId) {
        return new OrderBookSnapshot(BTC, lastUpdateId,
                List.of(new PriceLevel(new BigDecimal("95999"), new BigDecimal("1")),
                        new PriceLevel(new BigDecimal("95998"), new BigDecimal("2"))),
                List.of(new PriceLevel(new BigDecimal("96001"), new BigDecimal("1")),
                        new PriceLevel(new BigDecimal("96002"), new BigDecimal("2"))));
    }

    private static OrderBookDiff diff(long first, long last, long previous, String bidPrice) {
        return new OrderBookDiff(BTC, first, last, previous,
                List.of(new PriceLevel(new BigDecimal(bidPrice), new BigDecimal("1"))), List.of());
    }

    private static String depthMessage(long first, long last, long previous, String price, String qty) {
        return String.format("{\"stream\":\"btcusdt@depth@100ms\",\"data\":{\"e\":\"depthUpdate\",\"s\":\"BTCUSDT\","
                + "\"U\":%d,\"u\":%d,\"pu\":%d,\"b\":[[\"%s\",\"%s\"]],\"a\":[]}}", first, last, previous, price, qty);
    }

    static class FakeDataSource implements MarketDataSource {
        final Deque<OrderBookSnapshot> snapshots = new ArrayDeque<>();
        ExchangeException failure;
        int snapshotCalls;
        int lastLimit;

        @Override
        public String getName() {
            return "fake";
        }

        @Override
        public OrderBookSnapshot getDepthSnapshot(Symbol symbol, int limit) throws ExchangeException {
            snapshotCalls++;
            lastLimit = limit;
            if (failure != null) {
                throw failure;
            }
            OrderBookSnapshot snapshot = snapshots.pollFirst();
            if (snapshot == null) {
                throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN, "no snapshot queued");
            }
            return snapshot;
        }

        @Override
        public Ticker getTicker(Symbol symbol) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<KLine> getKLines(Symbol symbol, Interval interval, int limit, Long endTime) {
            return new ArrayList<>();
        }
    }

    static class RecordingListener implements OrderBookListener {
        int snapshotsLoaded;
        int bookUpdates;
        int gaps;
        int resyncFailures;

        @Override
        public void onSnapshotLoaded(Symbol symbol, OrderBook book, boolean synced) {
            snapshotsLoaded++;
        }

        @Override
        public void onBookUpdated(Symbol symbol, OrderBook book) {
            bookUpdates++;
        }

        @Override
        public void onGap(Symbol symbol, OrderBookDiff diff) {
            gaps++;
        }

        @Override
        public void onResyncFailed(Symbol symbol, ExchangeException error) {
            resyncFailures++;
        }
    }
}
