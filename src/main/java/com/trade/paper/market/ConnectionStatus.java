package com.trade.paper.market;

/**
 * 行情连接状态
 */
public enum ConnectionStatus {
    DISCONNECTED,  // 未连接或已主动断开
    CONNECTING,    // 首次建立连接中
    CONNECTED,     // 已连接
    RECONNECTING   // 异常断开后等待重连
}
