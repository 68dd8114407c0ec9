package com.trade.paper.core;

/**
 * 订单状态
 * FILLED、CANCELLED、REJECTED 为终态
 */
public enum OrderStatus {
    PENDING,           // 已创建，尚未生效
    OPEN,              // 挂单中
    PARTIALLY_FILLED,  // 部分成交
    FILLED,            // 完全成交
    CANCELLED,         // 已取消
    REJECTED;          // 被拒绝

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    public boolean isCancellable() {
        return this == PENDING || this == OPEN || this == PARTIALLY_FILLED;
    }
}
