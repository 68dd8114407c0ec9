package com.trade.paper.book;

import com.trade.paper.core.Symbol;
import com.trade.paper.exchange.ExchangeException;

/**
 * 盘口同步事件监听器
 */
public interface OrderBookListener {

    /**
     * 快照安装完成
     * @param synced 回放缓冲增量后是否已同步
     */
    default void onSnapshotLoaded(Symbol symbol, OrderBook book, boolean synced) {}

    /**
     * 增量已合并
     */
    default void onBookUpdated(Symbol symbol, OrderBook book) {}

    /**
     * 检测到序号断档，盘口需要重新加载快照
     */
    default void onGap(Symbol symbol, OrderBookDiff diff) {}

    /**
     * 重新加载快照失败
     */
    default void onResyncFailed(Symbol symbol, ExchangeException error) {}
}
