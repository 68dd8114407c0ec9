package com.trade.paper.execution;

import com.trade.paper.core.MarginMode;
import com.trade.paper.core.OrderType;
import com.trade.paper.core.Side;
import com.trade.paper.core.Symbol;

import java.math.BigDecimal;

/**
 * 下单参数
 * 构建时不做校验，由账本统一校验并以 {@link ValidationException} 拒绝
 */
public class OrderRequest {
    private final Symbol symbol;
    private final Side side;
    private final OrderType type;
    private final BigDecimal quantity;
    private final BigDecimal price;         // 限价单、止损限价单必填
    private final BigDecimal stopPrice;     // 止损单必填
    private final int leverage;
    private final MarginMode marginMode;

    private OrderRequest(Builder builder) {
        this.symbol = builder.symbol;
        this.side = builder.side;
        this.type = builder.type;
        this.quantity = builder.quantity;
        this.price = builder.price;
        this.stopPrice = builder.stopPrice;
        this.leverage = builder.leverage;
        this.marginMode = builder.marginMode;
    }

    public Symbol getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public OrderType getType() { return type; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getStopPrice() { return stopPrice; }
    public int getLeverage() { return leverage; }
    public MarginMode getMarginMode() { return marginMode; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Symbol symbol;
        private Side side;
        private OrderType type = OrderType.MARKET;
        private BigDecimal quantity;
        private BigDecimal price;
        private BigDecimal stopPrice;
        private int leverage = 1;
        private MarginMode marginMode = MarginMode.CROSS;

        public Builder symbol(Symbol symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder type(OrderType type) {
            this.type = type;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder quantity(String quantity) {
            this.quantity = new BigDecimal(quantity);
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder price(String price) {
            this.price = new BigDecimal(price);
            return this;
        }

        public Builder stopPrice(BigDecimal stopPrice) {
            this.stopPrice = stopPrice;
            return this;
        }

        public Builder stopPrice(String stopPrice) {
            this.stopPrice = new BigDecimal(stopPrice);
            return this;
        }

        public Builder leverage(int leverage) {
            this.leverage = leverage;
            return this;
        }

        public Builder marginMode(MarginMode marginMode) {
            this.marginMode = marginMode;
            return this;
        }

        public OrderRequest build() {
            return new OrderRequest(this);
        }
    }

    @Override
    public String toString() {
        return String.format("OrderRequest{symbol=%s, side=%s, type=%s, qty=%s, price=%s, stop=%s, lev=%d, mode=%s}",
                symbol, side, type, quantity, price, stopPrice, leverage, marginMode);
    }
}
