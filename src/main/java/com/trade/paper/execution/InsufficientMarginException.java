package com.trade.paper.execution;

import java.math.BigDecimal;

/**
 * 可用保证金不足
 */
public class InsufficientMarginException extends LedgerException {

    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientMarginException(BigDecimal required, BigDecimal available) {
        super(String.format("保证金不足: 需要 %s, 可用 %s", required.toPlainString(), available.toPlainString()));
        this.required = required;
        this.available = available;
    }

    public BigDecimal getRequired() {
        return required;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
