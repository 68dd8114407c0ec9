package com.trade.paper.book;

import com.trade.paper.core.Symbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrderBook 单元测试
 */
class OrderBookTest {

    private static final Symbol SYMBOL = Symbol.of("BTCUSDT");

    private OrderBook book;

    @BeforeEach
    void setUp() {
        book = new OrderBook(SYMBOL, 100);
    }

    @Test
    void apply_shouldAdvanceLastUpdateIdForContinuousDiff() {
        book.install(snapshot(1027024));

        DiffOutcome outcome = book.apply(diff(1027025, 1027029, null,
                List.of(level("96000", "2")), List.of()));

        assertEquals(DiffOutcome.APPLIED, outcome);
        assertEquals(1027029, book.getLastUpdateId());
        assertEquals(0, new BigDecimal("2").compareTo(book.getBestBid().orElseThrow().quantity()));
    }

    @Test
    void apply_firstDiffMayStraddleSnapshot() {
        book.install(snapshot(100));

        // U <= lastUpdateId+1 <= u
        assertEquals(DiffOutcome.APPLIED, book.apply(diff(95, 105, null, List.of(), List.of())));
        assertEquals(105, book.getLastUpdateId());
    }

    @Test
    void apply_shouldDiscardAlreadyAppliedDiffs() {
        book.install(snapshot(100));

        assertEquals(DiffOutcome.STALE, book.apply(diff(90, 100, null, List.of(level("95999", "9")), List.of())));
        assertEquals(100, book.getLastUpdateId());
        assertEquals(0, new BigDecimal("1").compareTo(book.getBestBid().orElseThrow().quantity()));
    }

    @Test
    void apply_gapShouldLeaveCommittedStateUnchanged() {
        book.install(snapshot(1000));
        OrderBookSnapshot before = book.snapshot();

        DiffOutcome outcome = book.apply(diff(1005, 1010, null,
                List.of(level("95999", "0"), level("95998", "7")), List.of(level("96001", "3"))));

        assertEquals(DiffOutcome.GAP, outcome);
        assertFalse(book.isSynced());
        assertEquals(1000, book.getLastUpdateId());
        assertEquals(before.getBids(), book.snapshot().getBids());
        assertEquals(before.getAsks(), book.snapshot().getAsks());
    }

    @Test
    void install_shouldRestoreConsistentBookAfterGap() {
        book.install(snapshot(1000));
        assertEquals(DiffOutcome.GAP, book.apply(diff(1005, 1010, null, List.of(), List.of())));

        // 断档后的增量进入缓冲区
        assertEquals(DiffOutcome.BUFFERED, book.apply(diff(1011, 1012, 1010L,
                List.of(level("95990", "4")), List.of())));

        OrderBookSnapshot fresh = new OrderBookSnapshot(SYMBOL, 1008,
                List.of(level("95995", "1")), List.of(level("96005", "1")));
        assertTrue(book.install(fresh));

        assertTrue(book.isSynced());
        assertEquals(1012, book.getLastUpdateId());
        assertEquals(0, book.getBufferedCount());
        assertEquals(2, book.getBidDepth());
    }

    @Test
    void apply_shouldUsePreviousFinalUpdateIdForContinuity() {
        book.install(snapshot(100));
        assertEquals(DiffOutcome.APPLIED, book.apply(diff(99, 105, 98L, List.of(), List.of())));

        assertEquals(DiffOutcome.APPLIED, book.apply(diff(110, 112, 105L, List.of(), List.of())));
        assertEquals(112, book.getLastUpdateId());

        assertEquals(DiffOutcome.GAP, book.apply(diff(113, 115, 111L, List.of(), List.of())));
        assertEquals(112, book.getLastUpdateId());
    }

    @Test
    void apply_shouldBufferUntilSnapshotInstalled() {
        assertEquals(DiffOutcome.BUFFERED, book.apply(diff(99, 101, null, List.of(level("95999", "5")), List.of())));
        assertEquals(DiffOutcome.BUFFERED, book.apply(diff(102, 104, 101L, List.of(), List.of(level("96001", "0")))));

        assertTrue(book.install(snapshot(100)));

        assertEquals(104, book.getLastUpdateId());
        assertEquals(0, new BigDecimal("5").compareTo(book.getBestBid().orElseThrow().quantity()));
        assertEquals(0, new BigDecimal("96002").compareTo(book.getBestAsk().orElseThrow().price()));
    }

    @Test
    void apply_shouldKeepSidesSortedAndDropZeroLevels() {
        book.install(snapshot(1));
        book.apply(diff(2, 2, null,
                List.of(level("95900", "1"), level("96000.5", "2"), level("95999", "0")),
                List.of(level("96000.7", "1"), level("96100", "1"))));

        List<PriceLevel> bids = book.getTopBids(10);
        List<PriceLevel> asks = book.getTopAsks(10);
        for (int i = 1; i < bids.size(); i++) {
            assertTrue(bids.get(i - 1).price().compareTo(bids.get(i).price()) > 0);
        }
        for (int i = 1; i < asks.size(); i++) {
            assertTrue(asks.get(i - 1).price().compareTo(asks.get(i).price()) < 0);
        }
        assertTrue(bids.stream().noneMatch(l -> l.price().compareTo(new BigDecimal("95999")) == 0));
        assertEquals(0, new BigDecimal("96000.5").compareTo(book.getBestBid().orElseThrow().price()));
    }

    @Test
    void apply_resultIsIndependentOfBuffering() {
        List<OrderBookDiff> chain = List.of(
                diff(101, 103, null, List.of(level("95999", "3")), List.of(level("96001", "2"))),
                diff(104, 106, 103L, List.of(level("95998", "1")), List.of(level("96001", "0"))),
                diff(107, 110, 106L, List.of(level("95999", "0.5")), List.of(level("96003", "4"))));

        OrderBook direct = new OrderBook(SYMBOL, 100);
        direct.install(snapshot(100));
        chain.forEach(direct::apply);

        OrderBook buffered = new OrderBook(SYMBOL, 100);
        chain.forEach(buffered::apply);
        buffered.install(snapshot(100));

        assertEquals(direct.getLastUpdateId(), buffered.getLastUpdateId());
        assertEquals(direct.snapshot().getBids(), buffered.snapshot().getBids());
        assertEquals(direct.snapshot().getAsks(), buffered.snapshot().getAsks());
    }

    @Test
    void readModel_shouldComputeSpreadAndMid() {
        book.install(snapshot(1));

        assertEquals(0, new BigDecimal("2").compareTo(book.getSpread().orElseThrow()));
        assertEquals(0, new BigDecimal("96000").compareTo(book.getMidPrice().orElseThrow()));
        assertEquals(0, new BigDecimal("0.0021").compareTo(book.getSpreadPercent().orElseThrow()));
        assertEquals(0, new BigDecimal("3").compareTo(book.getTotalBidVolume()));
    }

    @Test
    void emptyBook_hasNoPrices() {
        assertTrue(book.getBestBid().isEmpty());
        assertTrue(book.getMidPrice().isEmpty());
        assertTrue(book.getSpread().isEmpty());
    }

    @Test
    void buffer_shouldDropOldestWhenFull() {
        OrderBook small = new OrderBook(SYMBOL, 2);
        small.apply(diff(1, 1, null, List.of(), List.of()));
        small.apply(diff(2, 2, 1L, List.of(), List.of()));
        small.apply(diff(3, 3, 2L, List.of(), List.of()));

        assertEquals(2, small.getBufferedCount());
    }

    private static OrderBookSnapshot snapshot(long lastUpdateId) {
        return new OrderBookSnapshot(SYMBOL, lastUpdateId,
                List.of(level("95999", "1"), level("95998", "2")),
                List.of(level("96001", "1"), level("96002", "2")));
    }

    private static OrderBookDiff diff(long first, long last, Long previous,
                                      List<PriceLevel> bids, List<PriceLevel> asks) {
        return new OrderBookDiff(SYMBOL, first, last, previous, bids, asks);
    }

    private static PriceLevel level(String price, String quantity) {
        return new PriceLevel(new BigDecimal(price), new BigDecimal(quantity));
    }
}
