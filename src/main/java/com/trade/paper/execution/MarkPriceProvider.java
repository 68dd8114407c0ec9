package com.trade.paper.execution;

import com.trade.paper.core.Symbol;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 标记价格来源
 * 账本只在下市价单、平仓和触发检查时读取
 */
@FunctionalInterface
public interface MarkPriceProvider {

    Optional<BigDecimal> getMarkPrice(Symbol symbol);
}
