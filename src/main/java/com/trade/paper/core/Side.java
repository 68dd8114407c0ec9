package com.trade.paper.core;

/**
 * 订单方向
 */
public enum Side {
    BUY("买入"),
    SELL("卖出");

    private final String chineseName;

    Side(String chineseName) {
        this.chineseName = chineseName;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * 该方向成交后开出的持仓方向
     */
    public PositionSide toPositionSide() {
        return this == BUY ? PositionSide.LONG : PositionSide.SHORT;
    }

    public String getChineseName() {
        return chineseName;
    }
}
