package com.trade.paper.market;

/**
 * 连接事件监听器
 */
public interface ConnectionListener {
    default void onConnect() {}
    default void onDisconnect() {}
    default void onError(Throwable error) {}
    default void onStatusChange(ConnectionStatus status) {}
}
