package com.trade.paper.execution;

import com.trade.paper.core.MarginMode;
import com.trade.paper.core.OrderStatus;
import com.trade.paper.core.OrderType;
import com.trade.paper.core.Side;
import com.trade.paper.core.Symbol;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 模拟订单
 * 只由 {@link TradingLedger} 修改，终态订单保留用于查询历史
 */
public class Order {
    private final String orderId;           // 订单ID（UUID）
    private final Symbol symbol;            // 交易对
    private final Side side;                // 方向
    private final OrderType type;           // 订单类型
    private final BigDecimal price;         // 限价（限价单、止损限价单）
    private final BigDecimal stopPrice;     // 触发价（止损单）
    private final BigDecimal quantity;      // 数量
    private final int leverage;             // 杠杆倍数
    private final MarginMode marginMode;    // 保证金模式
    private final Instant createdAt;        // 创建时间
    private OrderStatus status;             // 状态
    private BigDecimal filledQuantity;      // 已成交数量
    private BigDecimal marginReserved;      // 占用保证金
    private BigDecimal averagePrice;        // 成交均价
    private BigDecimal commission;          // 手续费
    private boolean triggered;              // 止损限价单是否已触发
    private Instant updatedAt;
    private Instant filledAt;
    private Instant cancelledAt;

    Order(String orderId, OrderRequest request, BigDecimal marginReserved, Instant createdAt) {
        this.orderId = orderId;
        this.symbol = request.getSymbol();
        this.side = request.getSide();
        this.type = request.getType();
        this.price = request.getType().requiresPrice() ? request.getPrice() : null;
        this.stopPrice = request.getType().requiresStopPrice() ? request.getStopPrice() : null;
        this.quantity = request.getQuantity();
        this.leverage = request.getLeverage();
        this.marginMode = request.getMarginMode();
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.status = OrderStatus.PENDING;
        this.filledQuantity = BigDecimal.ZERO;
        this.marginReserved = marginReserved;
        this.commission = BigDecimal.ZERO;
    }

    private Order(Order other) {
        this.orderId = other.orderId;
        this.symbol = other.symbol;
        this.side = other.side;
        this.type = other.type;
        this.price = other.price;
        this.stopPrice = other.stopPrice;
        this.quantity = other.quantity;
        this.leverage = other.leverage;
        this.marginMode = other.marginMode;
        this.createdAt = other.createdAt;
        this.status = other.status;
        this.filledQuantity = other.filledQuantity;
        this.marginReserved = other.marginReserved;
        this.averagePrice = other.averagePrice;
        this.commission = other.commission;
        this.triggered = other.triggered;
        this.updatedAt = other.updatedAt;
        this.filledAt = other.filledAt;
        this.cancelledAt = other.cancelledAt;
    }

    public String getOrderId() { return orderId; }
    public Symbol getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public OrderType getType() { return type; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getStopPrice() { return stopPrice; }
    public BigDecimal getQuantity() { return quantity; }
    public int getLeverage() { return leverage; }
    public MarginMode getMarginMode() { return marginMode; }
    public OrderStatus getStatus() { return status; }
    public BigDecimal getFilledQuantity() { return filledQuantity; }
    public BigDecimal getMarginReserved() { return marginReserved; }
    public BigDecimal getAveragePrice() { return averagePrice; }
    public BigDecimal getCommission() { return commission; }
    public boolean isTriggered() { return triggered; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getFilledAt() { return filledAt; }
    public Instant getCancelledAt() { return cancelledAt; }

    /**
     * 是否作为限价单挂在盘口上（限价单，或已触发的止损限价单）
     */
    public boolean isResting() {
        return type == OrderType.LIMIT || (type == OrderType.STOP_LIMIT && triggered);
    }

    public BigDecimal getRemainingQuantity() {
        return quantity.subtract(filledQuantity);
    }

    void open() {
        status = OrderStatus.OPEN;
        touch();
    }

    void markTriggered() {
        triggered = true;
        touch();
    }

    /**
     * 释放全部占用保证金
     * @return 释放的金额
     */
    BigDecimal releaseMargin() {
        BigDecimal released = marginReserved;
        marginReserved = BigDecimal.ZERO;
        return released;
    }

    void fill(BigDecimal fillPrice, BigDecimal fee) {
        filledQuantity = quantity;
        averagePrice = fillPrice;
        commission = commission.add(fee);
        status = OrderStatus.FILLED;
        touch();
        filledAt = updatedAt;
    }

    void cancel() {
        status = OrderStatus.CANCELLED;
        touch();
        cancelledAt = updatedAt;
    }

    void reject() {
        status = OrderStatus.REJECTED;
        touch();
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    Order copy() {
        return new Order(this);
    }

    @Override
    public String toString() {
        return String.format("Order{id=%s, symbol=%s, side=%s, type=%s, qty=%s, price=%s, stop=%s, lev=%d, status=%s}",
                orderId, symbol, side, type, quantity.toPlainString(), price, stopPrice, leverage, status);
    }
}
