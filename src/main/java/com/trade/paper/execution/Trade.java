package com.trade.paper.execution;

import com.trade.paper.core.Side;
import com.trade.paper.core.Symbol;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 成交记录（不可变）
 */
public class Trade {
    private final String tradeId;           // 成交ID
    private final String orderId;           // 来源订单ID，直接平仓时为 null
    private final String positionId;        // 关联持仓ID
    private final Symbol symbol;
    private final Side side;                // 成交方向
    private final BigDecimal price;         // 成交价
    private final BigDecimal quantity;      // 成交数量
    private final BigDecimal commission;    // 手续费
    private final BigDecimal realizedPnl;   // 扣除手续费后的已实现盈亏，开仓成交为 −手续费
    private final boolean liquidation;      // 是否强平成交
    private final Instant executedAt;

    Trade(String tradeId, String orderId, String positionId, Symbol symbol, Side side,
          BigDecimal price, BigDecimal quantity, BigDecimal commission, BigDecimal realizedPnl,
          boolean liquidation, Instant executedAt) {
        this.tradeId = tradeId;
        this.orderId = orderId;
        this.positionId = positionId;
        this.symbol = symbol;
        this.side = side;
        this.price = price;
        this.quantity = quantity;
        this.commission = commission;
        this.realizedPnl = realizedPnl;
        this.liquidation = liquidation;
        this.executedAt = executedAt;
    }

    public String getTradeId() { return tradeId; }
    public String getOrderId() { return orderId; }
    public String getPositionId() { return positionId; }
    public Symbol getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getCommission() { return commission; }
    public BigDecimal getRealizedPnl() { return realizedPnl; }
    public boolean isLiquidation() { return liquidation; }
    public Instant getExecutedAt() { return executedAt; }

    /**
     * 手续费前盈亏
     */
    public BigDecimal getGrossPnl() {
        return realizedPnl.add(commission);
    }

    @Override
    public String toString() {
        return String.format("Trade{id=%s, symbol=%s, side=%s, price=%s, qty=%s, fee=%s, pnl=%s%s}",
                tradeId, symbol, side, price.toPlainString(), quantity.toPlainString(),
                commission.toPlainString(), realizedPnl.toPlainString(), liquidation ? ", 强平" : "");
    }
}
