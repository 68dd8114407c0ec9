package com.trade.paper.execution;

/**
 * 账本事件监听器
 * 回调收到的都是快照副本，在账本锁内同步调用
 */
public interface LedgerListener {

    default void onOrderCreated(Order order) {}

    default void onOrderFilled(Order order) {}

    default void onOrderCancelled(Order order) {}

    default void onOrderRejected(Order order, String reason) {}

    default void onStopTriggered(Order order) {}

    default void onPositionOpened(Position position) {}

    default void onPositionUpdated(Position position) {}

    default void onPositionClosed(Position position) {}

    /**
     * 持仓被强平
     */
    default void onLiquidation(Position position, Trade trade) {}

    default void onTrade(Trade trade) {}

    default void onWalletChanged(Wallet wallet) {}
}
