package com.trade.paper.book;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.paper.core.Symbol;
import com.trade.paper.exchange.ExchangeException;
import com.trade.paper.exchange.MarketDataSource;
import com.trade.paper.market.MarketDataParser;
import com.trade.paper.market.ReconnectBackoff;
import com.trade.paper.market.StreamConnectionManager;
import com.trade.paper.market.StreamKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * 盘口同步器
 *
 * 职责：
 * 1. 为每个交易对维护一个本地盘口
 * 2. REST 快照 + 深度增量合成一致的盘口
 * 3. 断档时以结果值上报，并在后台重新加载快照，不中断行情订阅
 * 4. 快照加载失败后按指数退避限制重试频率，成功后恢复
 */
public class OrderBookSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(OrderBookSynchronizer.class);

    private final MarketDataSource dataSource;
    private final int snapshotLimit;
    private final int maxBuffered;
    private final Executor resyncExecutor;
    private final Supplier<ReconnectBackoff> backoffFactory;
    private final LongSupplier clock;

    private final Map<Symbol, OrderBook> books = new ConcurrentHashMap<>();
    private final Map<Symbol, Runnable> depthSubscriptions = new ConcurrentHashMap<>();
    private final Set<Symbol> resyncInFlight = ConcurrentHashMap.newKeySet();
    private final Map<Symbol, ReconnectBackoff> resyncBackoffs = new ConcurrentHashMap<>();
    private final Map<Symbol, Long> nextResyncAt = new ConcurrentHashMap<>();
    private final List<OrderBookListener> listeners = new CopyOnWriteArrayList<>();

    public OrderBookSynchronizer(MarketDataSource dataSource, int snapshotLimit, int maxBuffered,
                                 Executor resyncExecutor) {
        this(dataSource, snapshotLimit, maxBuffered, resyncExecutor,
                () -> new ReconnectBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0),
                System::currentTimeMillis);
    }

    /**
     * @param backoffFactory 为每个交易对创建快照重试退避
     * @param clock 毫秒时钟
     */
    public OrderBookSynchronizer(MarketDataSource dataSource, int snapshotLimit, int maxBuffered,
                                 Executor resyncExecutor, Supplier<ReconnectBackoff> backoffFactory,
                                 LongSupplier clock) {
        this.dataSource = dataSource;
        this.snapshotLimit = snapshotLimit;
        this.maxBuffered = maxBuffered;
        this.resyncExecutor = resyncExecutor;
        this.backoffFactory = backoffFactory;
        this.clock = clock;
    }

    /**
     * 拉取 REST 快照并安装，随后回放缓冲中的增量
     * @return 安装并回放后的盘口状态
     */
    public OrderBookSnapshot loadSnapshot(Symbol symbol) throws ExchangeException {
        OrderBookSnapshot snapshot = dataSource.getDepthSnapshot(symbol, snapshotLimit);
        OrderBook book = getOrCreateBook(symbol);
        boolean synced = book.install(snapshot);
        if (synced) {
            logger.info("{} 盘口快照已安装: lastUpdateId={}", symbol, book.getLastUpdateId());
            resetResyncGate(symbol);
        } else {
            Duration delay = deferResync(symbol);
            logger.warn("{} 快照回放遇到断档，{}ms 后再次加载快照", symbol, delay.toMillis());
        }
        notifyListeners(l -> l.onSnapshotLoaded(symbol, book, synced));
        return book.snapshot();
    }

    /**
     * 合并一条深度增量
     * 断档以 {@link DiffOutcome#GAP} 返回，已提交的盘口不变
     */
    public DiffOutcome applyDiff(Symbol symbol, OrderBookDiff diff) {
        OrderBook book = getOrCreateBook(symbol);
        DiffOutcome outcome = book.apply(diff);
        if (outcome == DiffOutcome.APPLIED) {
            notifyListeners(l -> l.onBookUpdated(symbol, book));
        } else if (outcome == DiffOutcome.GAP) {
            notifyListeners(l -> l.onGap(symbol, diff));
        }
        return outcome;
    }

    /**
     * 订阅深度流并保持盘口同步
     */
    public void track(StreamConnectionManager connection, Symbol symbol, String depthSpeed) {
        if (depthSubscriptions.containsKey(symbol)) {
            return;
        }
        OrderBook book = getOrCreateBook(symbol);
        book.invalidate();
        Runnable token = connection.subscribe(StreamKeys.depth(symbol, depthSpeed),
                data -> onDepthMessage(symbol, data));
        depthSubscriptions.put(symbol, token);
        resetResyncGate(symbol);
        logger.info("开始同步 {} 盘口", symbol);
        requestResync(symbol);
    }

    /**
     * 取消深度订阅，已合并的盘口保留可读
     */
    public void untrack(Symbol symbol) {
        Runnable token = depthSubscriptions.remove(symbol);
        if (token == null) {
            return;
        }
        token.run();
        resetResyncGate(symbol);
        OrderBook book = books.get(symbol);
        if (book != null) {
            book.invalidate();
        }
        logger.info("停止同步 {} 盘口", symbol);
    }

    public Optional<OrderBook> getOrderBook(Symbol symbol) {
        return Optional.ofNullable(books.get(symbol));
    }

    public List<Symbol> getTrackedSymbols() {
        return new ArrayList<>(depthSubscriptions.keySet());
    }

    public Runnable addListener(OrderBookListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ==================== 私有方法 ====================

    private OrderBook getOrCreateBook(Symbol symbol) {
        return books.computeIfAbsent(symbol, s -> new OrderBook(s, maxBuffered));
    }

    private void onDepthMessage(Symbol symbol, JsonNode data) {
        OrderBookDiff diff;
        try {
            diff = MarketDataParser.parseDepthDiff(data);
        } catch (IllegalArgumentException e) {
            logger.warn("{} 深度消息解析失败: {}", symbol, e.getMessage());
            return;
        }
        if (!symbol.equals(diff.getSymbol())) {
            logger.debug("忽略其他交易对的深度消息: {}", diff.getSymbol());
            return;
        }

        DiffOutcome outcome = applyDiff(symbol, diff);
        if (outcome == DiffOutcome.GAP || outcome == DiffOutcome.BUFFERED) {
            requestResync(symbol);
        }
    }

    /**
     * 同一交易对同时只有一个快照请求在途，退避期内的请求直接忽略
     */
    private void requestResync(Symbol symbol) {
        if (!depthSubscriptions.containsKey(symbol)) {
            return;
        }
        Long allowedAt = nextResyncAt.get(symbol);
        if (allowedAt != null && clock.getAsLong() < allowedAt) {
            return;
        }
        if (!resyncInFlight.add(symbol)) {
            return;
        }
        resyncExecutor.execute(() -> {
            try {
                loadSnapshot(symbol);
            } catch (ExchangeException e) {
                Duration delay = deferResync(symbol);
                logger.error("{} 加载盘口快照失败: [{}] {}，{}ms 内不再重试",
                        symbol, e.getErrorCode(), e.getMessage(), delay.toMillis());
                notifyListeners(l -> l.onResyncFailed(symbol, e));
            } finally {
                resyncInFlight.remove(symbol);
            }
        });
    }

    /**
     * 推迟下一次快照请求，间隔按失败次数增长
     */
    private Duration deferResync(Symbol symbol) {
        Duration delay = resyncBackoffs.computeIfAbsent(symbol, s -> backoffFactory.get()).nextDelay();
        nextResyncAt.put(symbol, clock.getAsLong() + delay.toMillis());
        return delay;
    }

    private void resetResyncGate(Symbol symbol) {
        nextResyncAt.remove(symbol);
        ReconnectBackoff backoff = resyncBackoffs.get(symbol);
        if (backoff != null) {
            backoff.reset();
        }
    }

    private void notifyListeners(Consumer<OrderBookListener> action) {
        for (OrderBookListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                logger.error("盘口监听器回调失败: {}", e.getMessage(), e);
            }
        }
    }
}
