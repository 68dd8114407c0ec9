package com.trade.paper.exchange;

import com.trade.paper.book.OrderBookSnapshot;
import com.trade.paper.core.Interval;
import com.trade.paper.core.KLine;
import com.trade.paper.core.Symbol;
import com.trade.paper.core.Ticker;

import java.util.List;

/**
 * 行情数据源抽象接口
 * 盘口同步和账本只通过此接口读取 REST 行情，不直接依赖某个交易所
 */
public interface MarketDataSource {

    /**
     * 获取数据源名称
     */
    String getName();

    /**
     * 获取深度快照
     * @param limit 档位数量
     */
    OrderBookSnapshot getDepthSnapshot(Symbol symbol, int limit) throws ExchangeException;

    /**
     * 获取24小时行情
     */
    Ticker getTicker(Symbol symbol) throws ExchangeException;

    /**
     * 获取历史K线数据
     * @param symbol 交易对
     * @param interval 周期
     * @param limit 数量限制（最大1500）
     * @param endTime 结束时间（毫秒），null表示最新
     */
    List<KLine> getKLines(Symbol symbol, Interval interval, int limit, Long endTime) throws ExchangeException;
}
