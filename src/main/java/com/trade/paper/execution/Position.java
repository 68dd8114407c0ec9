package com.trade.paper.execution;

import com.trade.paper.core.MarginMode;
import com.trade.paper.core.PositionSide;
import com.trade.paper.core.Symbol;
import com.trade.paper.risk.LiquidationRiskLevel;
import com.trade.paper.risk.RiskCalculator;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 持仓
 * 数量归零时标记为已平仓，不删除
 */
public class Position {
    private final String positionId;
    private final Symbol symbol;
    private final PositionSide side;
    private final int leverage;             // 杠杆倍数
    private final MarginMode marginMode;
    private final Instant createdAt;
    private BigDecimal quantity;            // 持仓数量
    private BigDecimal entryPrice;          // 开仓均价
    private BigDecimal costBasis;           // 持仓名义价值（数量 × 成交价累加），均价由此推出
    private BigDecimal margin;              // 持仓保证金
    private BigDecimal liquidationPrice;    // 强平价
    private BigDecimal takeProfit;          // 止盈价（可选）
    private BigDecimal stopLoss;            // 止损价（可选）
    private BigDecimal realizedPnl;         // 已实现盈亏（扣除平仓手续费）
    private boolean open;
    private Instant updatedAt;
    private Instant closedAt;

    Position(String positionId, Symbol symbol, PositionSide side, int leverage, MarginMode marginMode,
             BigDecimal quantity, BigDecimal entryPrice, BigDecimal costBasis, BigDecimal margin,
             BigDecimal liquidationPrice, Instant createdAt) {
        this.positionId = positionId;
        this.symbol = symbol;
        this.side = side;
        this.leverage = leverage;
        this.marginMode = marginMode;
        this.quantity = quantity;
        this.entryPrice = entryPrice;
        this.costBasis = costBasis;
        this.margin = margin;
        this.liquidationPrice = liquidationPrice;
        this.realizedPnl = BigDecimal.ZERO;
        this.open = true;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    private Position(Position other) {
        this.positionId = other.positionId;
        this.symbol = other.symbol;
        this.side = other.side;
        this.leverage = other.leverage;
        this.marginMode = other.marginMode;
        this.createdAt = other.createdAt;
        this.quantity = other.quantity;
        this.entryPrice = other.entryPrice;
        this.costBasis = other.costBasis;
        this.margin = other.margin;
        this.liquidationPrice = other.liquidationPrice;
        this.takeProfit = other.takeProfit;
        this.stopLoss = other.stopLoss;
        this.realizedPnl = other.realizedPnl;
        this.open = other.open;
        this.updatedAt = other.updatedAt;
        this.closedAt = other.closedAt;
    }

    public String getPositionId() { return positionId; }
    public Symbol getSymbol() { return symbol; }
    public PositionSide getSide() { return side; }
    public int getLeverage() { return leverage; }
    public MarginMode getMarginMode() { return marginMode; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getCostBasis() { return costBasis; }
    public BigDecimal getMargin() { return margin; }
    public BigDecimal getLiquidationPrice() { return liquidationPrice; }
    public BigDecimal getTakeProfit() { return takeProfit; }
    public BigDecimal getStopLoss() { return stopLoss; }
    public BigDecimal getRealizedPnl() { return realizedPnl; }
    public boolean isOpen() { return open; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getClosedAt() { return closedAt; }

    /**
     * 按标记价格计算未实现盈亏
     */
    public BigDecimal getUnrealizedPnl(BigDecimal markPrice) {
        return RiskCalculator.unrealizedPnl(side, quantity, entryPrice, markPrice);
    }

    public BigDecimal getRoe(BigDecimal markPrice) {
        return RiskCalculator.roe(getUnrealizedPnl(markPrice), margin);
    }

    public LiquidationRiskLevel getRiskLevel(BigDecimal markPrice) {
        return RiskCalculator.riskLevel(side, quantity, entryPrice, margin, markPrice);
    }

    /**
     * 加仓后的状态
     */
    void increase(BigDecimal newQuantity, BigDecimal newEntryPrice, BigDecimal newCostBasis,
                  BigDecimal newMargin, BigDecimal newLiquidationPrice) {
        this.quantity = newQuantity;
        this.entryPrice = newEntryPrice;
        this.costBasis = newCostBasis;
        this.margin = newMargin;
        this.liquidationPrice = newLiquidationPrice;
        touch();
    }

    /**
     * 减仓，均价和强平价不变
     */
    void reduce(BigDecimal closedQuantity, BigDecimal releasedMargin, BigDecimal netPnl) {
        this.quantity = quantity.subtract(closedQuantity);
        this.margin = margin.subtract(releasedMargin);
        this.realizedPnl = realizedPnl.add(netPnl);
        this.costBasis = quantity.multiply(entryPrice);
        touch();
        if (quantity.signum() == 0) {
            open = false;
            margin = BigDecimal.ZERO;
            costBasis = BigDecimal.ZERO;
            closedAt = updatedAt;
        }
    }

    void updateTpSl(BigDecimal takeProfit, BigDecimal stopLoss) {
        this.takeProfit = takeProfit;
        this.stopLoss = stopLoss;
        touch();
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    Position copy() {
        return new Position(this);
    }

    @Override
    public String toString() {
        return String.format("Position{id=%s, symbol=%s, side=%s, qty=%s, entry=%s, margin=%s, liq=%s, open=%s}",
                positionId, symbol, side, quantity.toPlainString(), entryPrice.toPlainString(),
                margin.toPlainString(), liquidationPrice.toPlainString(), open);
    }
}
