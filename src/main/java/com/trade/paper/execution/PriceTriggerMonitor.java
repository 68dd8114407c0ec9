package com.trade.paper.execution;

import com.trade.paper.core.OrderType;
import com.trade.paper.core.PositionSide;
import com.trade.paper.core.Side;
import com.trade.paper.core.Symbol;
import com.trade.paper.risk.LiquidationRiskLevel;
import com.trade.paper.risk.RiskCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 价格触发监控
 * 每次价格更新时检查：限价单成交、止损单触发、止盈止损平仓、强平
 */
public class PriceTriggerMonitor implements MarketPriceBook.PriceListener {

    private static final Logger logger = LoggerFactory.getLogger(PriceTriggerMonitor.class);

    private final TradingLedger ledger;
    private final Map<String, LiquidationRiskLevel> riskLevels = new ConcurrentHashMap<>();
    private volatile boolean running;

    public PriceTriggerMonitor(TradingLedger ledger) {
        this.ledger = ledger;
        this.running = false;
    }

    @Override
    public void onPrice(Symbol symbol, BigDecimal price) {
        if (!running) {
            return;
        }
        checkOrders(symbol, price);
        checkPosition(symbol, price);
    }

    /**
     * 检查挂单
     */
    private void checkOrders(Symbol symbol, BigDecimal price) {
        for (Order order : ledger.getActiveOrders(symbol)) {
            try {
                if (order.isResting()) {
                    if (isLimitCrossed(order, price)) {
                        logger.info("限价单成交: {} {} @ {}", symbol, order.getSide(), order.getPrice());
                        ledger.executeOrder(order.getOrderId(), order.getPrice(), true);
                    }
                } else if (order.getType().isStop() && isStopReached(order, price)) {
                    ledger.triggerStopOrder(order.getOrderId(), stopFillPrice(order, price));
                    // 触发时已越过限价的止损限价单立即成交
                    if (order.getType() == OrderType.STOP_LIMIT && isLimitCrossed(order, price)) {
                        ledger.executeOrder(order.getOrderId(), order.getPrice(), false);
                    }
                }
            } catch (LedgerException e) {
                logger.warn("订单 {} 触发处理失败: {}", order.getOrderId(), e.getMessage());
            }
        }
    }

    /**
     * 检查持仓：强平优先于止盈止损
     */
    private void checkPosition(Symbol symbol, BigDecimal price) {
        Position position = ledger.getPosition(symbol);
        if (position == null) {
            return;
        }
        String positionId = position.getPositionId();
        try {
            if (RiskCalculator.isLiquidated(position.getSide(), position.getLiquidationPrice(), price)) {
                riskLevels.remove(positionId);
                ledger.liquidate(positionId);
                return;
            }
            if (isTakeProfitReached(position, price)) {
                logger.info("止盈触发! {} 当前价格: {}, 止盈价格: {}", symbol, price, position.getTakeProfit());
                riskLevels.remove(positionId);
                ledger.closePositionAt(positionId, null, price);
                return;
            }
            if (isStopLossReached(position, price)) {
                logger.warn("止损触发! {} 当前价格: {}, 止损价格: {}", symbol, price, position.getStopLoss());
                riskLevels.remove(positionId);
                ledger.closePositionAt(positionId, null, price);
                return;
            }
        } catch (LedgerException e) {
            logger.warn("持仓 {} 触发处理失败: {}", positionId, e.getMessage());
            return;
        }

        LiquidationRiskLevel level = position.getRiskLevel(price);
        LiquidationRiskLevel previous = riskLevels.put(positionId, level);
        if (level != previous && level != LiquidationRiskLevel.SAFE) {
            logger.warn("{} 持仓强平风险: {}, 当前价格 {}, 强平价 {}",
                    symbol, level, price, position.getLiquidationPrice());
        }
    }

    static boolean isLimitCrossed(Order order, BigDecimal price) {
        return order.getSide() == Side.BUY
                ? price.compareTo(order.getPrice()) <= 0
                : price.compareTo(order.getPrice()) >= 0;
    }

    static boolean isStopReached(Order order, BigDecimal price) {
        return order.getSide() == Side.BUY
                ? price.compareTo(order.getStopPrice()) >= 0
                : price.compareTo(order.getStopPrice()) <= 0;
    }

    /**
     * 止损市价单成交价：价格跳空越过止损价时按当前价成交
     */
    static BigDecimal stopFillPrice(Order order, BigDecimal price) {
        return order.getSide() == Side.BUY
                ? order.getStopPrice().max(price)
                : order.getStopPrice().min(price);
    }

    private static boolean isTakeProfitReached(Position position, BigDecimal price) {
        BigDecimal takeProfit = position.getTakeProfit();
        if (takeProfit == null) return false;
        return position.getSide() == PositionSide.LONG
                ? price.compareTo(takeProfit) >= 0
                : price.compareTo(takeProfit) <= 0;
    }

    private static boolean isStopLossReached(Position position, BigDecimal price) {
        BigDecimal stopLoss = position.getStopLoss();
        if (stopLoss == null) return false;
        return position.getSide() == PositionSide.LONG
                ? price.compareTo(stopLoss) <= 0
                : price.compareTo(stopLoss) >= 0;
    }

    /**
     * 启动监控
     */
    public void start() {
        running = true;
        logger.info("价格触发监控已启动");
    }

    /**
     * 停止监控
     */
    public void stop() {
        running = false;
        logger.info("价格触发监控已停止");
    }

    public boolean isRunning() {
        return running;
    }
}
