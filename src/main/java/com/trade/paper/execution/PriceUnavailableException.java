package com.trade.paper.execution;

import com.trade.paper.core.Symbol;

/**
 * 没有可用的标记价格（既无最新成交价，也无盘口中间价）
 */
public class PriceUnavailableException extends LedgerException {

    public PriceUnavailableException(Symbol symbol) {
        super("暂无 " + symbol + " 的标记价格");
    }
}
