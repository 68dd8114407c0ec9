package com.trade.paper.core;

/**
 * 订单类型
 */
public enum OrderType {
    MARKET,       // 市价单，立即成交
    LIMIT,        // 限价单，挂单等待
    STOP_MARKET,  // 止损市价单，触发后按触发价成交
    STOP_LIMIT;   // 止损限价单，触发后转为限价挂单

    public boolean requiresPrice() {
        return this == LIMIT || this == STOP_LIMIT;
    }

    public boolean requiresStopPrice() {
        return this == STOP_MARKET || this == STOP_LIMIT;
    }

    public boolean isStop() {
        return requiresStopPrice();
    }
}
