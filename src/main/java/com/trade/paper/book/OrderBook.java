package com.trade.paper.book;

import com.trade.paper.core.Decimal;
import com.trade.paper.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 单个交易对的本地盘口
 *
 * 写入（快照安装、增量合并）在对象锁内串行执行；
 * 读取最优买卖价直接读跳表头部，不加锁。
 *
 * 断档时不合并该增量，已提交的价位和 lastUpdateId 保持不变，
 * 盘口标记为未同步，之后的增量进入缓冲区，等待新快照安装后按序回放。
 */
public class OrderBook {

    private static final Logger logger = LoggerFactory.getLogger(OrderBook.class);

    private final Symbol symbol;
    private final int maxBuffered;
    private final ConcurrentNavigableMap<BigDecimal, BigDecimal> bids =
            new ConcurrentSkipListMap<>(Comparator.reverseOrder());
    private final ConcurrentNavigableMap<BigDecimal, BigDecimal> asks = new ConcurrentSkipListMap<>();
    private final Deque<OrderBookDiff> buffer = new ArrayDeque<>();

    private volatile long lastUpdateId;
    private volatile boolean synced;
    private boolean awaitingFirstDiff;

    public OrderBook(Symbol symbol, int maxBuffered) {
        if (maxBuffered <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须为正数");
        }
        this.symbol = symbol;
        this.maxBuffered = maxBuffered;
    }

    /**
     * 安装快照并回放缓冲的增量
     * @return 回放结束后盘口是否处于同步状态
     */
    public synchronized boolean install(OrderBookSnapshot snapshot) {
        if (!symbol.equals(snapshot.getSymbol())) {
            throw new IllegalArgumentException("快照交易对不匹配: " + snapshot.getSymbol());
        }
        bids.clear();
        asks.clear();
        snapshot.getBids().forEach(level -> bids.put(level.price(), level.quantity()));
        snapshot.getAsks().forEach(level -> asks.put(level.price(), level.quantity()));
        lastUpdateId = snapshot.getLastUpdateId();
        synced = true;
        awaitingFirstDiff = true;

        int replayed = 0;
        while (!buffer.isEmpty()) {
            OrderBookDiff diff = buffer.peekFirst();
            DiffOutcome outcome = applySynced(diff);
            if (outcome == DiffOutcome.GAP) {
                // 断档的增量及之后的增量留在缓冲区，等下一次快照
                break;
            }
            buffer.pollFirst();
            if (outcome == DiffOutcome.APPLIED) {
                replayed++;
            }
        }
        if (replayed > 0) {
            logger.debug("{} 快照安装后回放 {} 条增量，lastUpdateId={}", symbol, replayed, lastUpdateId);
        }
        return synced;
    }

    /**
     * 合并一条增量
     */
    public synchronized DiffOutcome apply(OrderBookDiff diff) {
        if (!symbol.equals(diff.getSymbol())) {
            throw new IllegalArgumentException("增量交易对不匹配: " + diff.getSymbol());
        }
        if (!synced) {
            bufferDiff(diff);
            return DiffOutcome.BUFFERED;
        }
        DiffOutcome outcome = applySynced(diff);
        if (outcome == DiffOutcome.GAP) {
            bufferDiff(diff);
        }
        return outcome;
    }

    private DiffOutcome applySynced(OrderBookDiff diff) {
        long last = lastUpdateId;
        if (diff.getFinalUpdateId() <= last) {
            return DiffOutcome.STALE;
        }

        boolean gap;
        if (awaitingFirstDiff) {
            // 快照后的第一条增量必须满足 U <= lastUpdateId+1 <= u
            gap = diff.getFirstUpdateId() > last + 1;
        } else if (diff.getPreviousFinalUpdateId() != null) {
            gap = diff.getPreviousFinalUpdateId() != last;
        } else {
            gap = diff.getFirstUpdateId() > last + 1;
        }

        if (gap) {
            synced = false;
            logger.warn("{} 盘口序号断档: lastUpdateId={}, U={}, u={}, pu={}",
                    symbol, last, diff.getFirstUpdateId(), diff.getFinalUpdateId(),
                    diff.getPreviousFinalUpdateId());
            return DiffOutcome.GAP;
        }

        mergeSide(bids, diff.getBidChanges());
        mergeSide(asks, diff.getAskChanges());
        lastUpdateId = diff.getFinalUpdateId();
        awaitingFirstDiff = false;
        return DiffOutcome.APPLIED;
    }

    private static void mergeSide(Map<BigDecimal, BigDecimal> side, List<PriceLevel> changes) {
        for (PriceLevel change : changes) {
            if (change.isRemoval()) {
                side.remove(change.price());
            } else {
                side.put(change.price(), change.quantity());
            }
        }
    }

    private void bufferDiff(OrderBookDiff diff) {
        if (buffer.size() >= maxBuffered) {
            // 丢弃最旧的增量，回放时由序号校验发现缺口
            buffer.pollFirst();
            logger.warn("{} 增量缓冲区已满({})，丢弃最旧增量", symbol, maxBuffered);
        }
        buffer.addLast(diff);
    }

    /**
     * 标记为未同步（例如订阅重建），已提交的价位保留可读
     */
    public synchronized void invalidate() {
        synced = false;
    }

    /**
     * 清空盘口与缓冲区
     */
    public synchronized void clear() {
        bids.clear();
        asks.clear();
        buffer.clear();
        lastUpdateId = 0;
        synced = false;
        awaitingFirstDiff = false;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public long getLastUpdateId() {
        return lastUpdateId;
    }

    public boolean isSynced() {
        return synced;
    }

    public synchronized int getBufferedCount() {
        return buffer.size();
    }

    public Optional<PriceLevel> getBestBid() {
        return toLevel(bids.firstEntry());
    }

    public Optional<PriceLevel> getBestAsk() {
        return toLevel(asks.firstEntry());
    }

    private static Optional<PriceLevel> toLevel(Map.Entry<BigDecimal, BigDecimal> entry) {
        return entry == null ? Optional.empty() : Optional.of(new PriceLevel(entry.getKey(), entry.getValue()));
    }

    /**
     * 中间价，任一侧为空时返回 empty
     */
    public Optional<BigDecimal> getMidPrice() {
        Optional<PriceLevel> bid = getBestBid();
        Optional<PriceLevel> ask = getBestAsk();
        if (bid.isEmpty() || ask.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Decimal.divide(bid.get().price().add(ask.get().price()), Decimal.of(2)));
    }

    /**
     * 买卖价差
     */
    public Optional<BigDecimal> getSpread() {
        Optional<PriceLevel> bid = getBestBid();
        Optional<PriceLevel> ask = getBestAsk();
        if (bid.isEmpty() || ask.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ask.get().price().subtract(bid.get().price()));
    }

    /**
     * 价差占卖一价的百分比（4位小数）
     */
    public Optional<BigDecimal> getSpreadPercent() {
        Optional<PriceLevel> ask = getBestAsk();
        return getSpread().flatMap(spread -> ask.map(a -> spread
                .multiply(BigDecimal.valueOf(100))
                .divide(a.price(), 4, RoundingMode.HALF_UP)));
    }

    public List<PriceLevel> getTopBids(int depth) {
        return top(bids, depth);
    }

    public List<PriceLevel> getTopAsks(int depth) {
        return top(asks, depth);
    }

    private static List<PriceLevel> top(Map<BigDecimal, BigDecimal> side, int depth) {
        List<PriceLevel> levels = new ArrayList<>(Math.min(depth, 64));
        for (Map.Entry<BigDecimal, BigDecimal> entry : side.entrySet()) {
            if (levels.size() >= depth) {
                break;
            }
            levels.add(new PriceLevel(entry.getKey(), entry.getValue()));
        }
        return levels;
    }

    public BigDecimal getTotalBidVolume() {
        return bids.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalAskVolume() {
        return asks.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public int getBidDepth() {
        return bids.size();
    }

    public int getAskDepth() {
        return asks.size();
    }

    /**
     * 当前已提交状态的不可变视图
     */
    public synchronized OrderBookSnapshot snapshot() {
        return new OrderBookSnapshot(symbol, lastUpdateId,
                top(bids, Integer.MAX_VALUE), top(asks, Integer.MAX_VALUE));
    }
}
