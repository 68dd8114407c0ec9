package com.trade.paper.core;

/**
 * 持仓方向
 */
public enum PositionSide {
    LONG,   // 多头持仓
    SHORT;  // 空头持仓

    /**
     * 平掉该方向持仓所需的订单方向
     */
    public Side closingSide() {
        return this == LONG ? Side.SELL : Side.BUY;
    }
}
