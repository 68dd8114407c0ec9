package com.trade.paper.execution;

import com.trade.paper.book.OrderBook;
import com.trade.paper.book.OrderBookSynchronizer;
import com.trade.paper.core.Symbol;
import com.trade.paper.core.Ticker;
import com.trade.paper.market.MarketDataParser;
import com.trade.paper.market.StreamConnectionManager;
import com.trade.paper.market.StreamKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 标记价格簿
 * 优先使用行情推送的最新成交价，没有时回退到已同步盘口的中间价
 */
public class MarketPriceBook implements MarkPriceProvider {

    private static final Logger logger = LoggerFactory.getLogger(MarketPriceBook.class);

    private final OrderBookSynchronizer synchronizer;
    private final Map<Symbol, BigDecimal> lastPrices = new ConcurrentHashMap<>();
    private final Map<Symbol, Ticker> tickers = new ConcurrentHashMap<>();
    private final List<PriceListener> priceListeners = new CopyOnWriteArrayList<>();

    public MarketPriceBook() {
        this(null);
    }

    /**
     * @param synchronizer 盘口同步器，可为 null（不使用中间价回退）
     */
    public MarketPriceBook(OrderBookSynchronizer synchronizer) {
        this.synchronizer = synchronizer;
    }

    @Override
    public Optional<BigDecimal> getMarkPrice(Symbol symbol) {
        BigDecimal last = lastPrices.get(symbol);
        if (last != null) {
            return Optional.of(last);
        }
        if (synchronizer == null) {
            return Optional.empty();
        }
        return synchronizer.getOrderBook(symbol)
                .filter(OrderBook::isSynced)
                .flatMap(OrderBook::getMidPrice);
    }

    public void onTicker(Ticker ticker) {
        tickers.put(ticker.getSymbol(), ticker);
        updatePrice(ticker.getSymbol(), ticker.getLastPrice());
    }

    public void updatePrice(Symbol symbol, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            logger.warn("忽略无效价格: {} {}", symbol, price);
            return;
        }
        lastPrices.put(symbol, price);
        for (PriceListener listener : priceListeners) {
            try {
                listener.onPrice(symbol, price);
            } catch (Exception e) {
                logger.error("价格监听器回调失败: {}", e.getMessage(), e);
            }
        }
    }

    public Optional<Ticker> getTicker(Symbol symbol) {
        return Optional.ofNullable(tickers.get(symbol));
    }

    /**
     * 订阅 24 小时行情流
     * @return 取消订阅句柄
     */
    public Runnable track(StreamConnectionManager connection, Symbol symbol) {
        return connection.subscribe(StreamKeys.ticker(symbol), data -> {
            try {
                onTicker(MarketDataParser.parseTicker(data));
            } catch (IllegalArgumentException e) {
                logger.warn("{} 行情消息解析失败: {}", symbol, e.getMessage());
            }
        });
    }

    public Runnable addPriceListener(PriceListener listener) {
        priceListeners.add(listener);
        return () -> priceListeners.remove(listener);
    }

    /**
     * 价格更新监听器
     */
    @FunctionalInterface
    public interface PriceListener {
        void onPrice(Symbol symbol, BigDecimal price);
    }
}
