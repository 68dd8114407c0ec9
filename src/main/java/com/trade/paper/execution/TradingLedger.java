package com.trade.paper.execution;

import com.trade.paper.core.Decimal;
import com.trade.paper.core.OrderType;
import com.trade.paper.core.PositionSide;
import com.trade.paper.core.Symbol;
import com.trade.paper.risk.RiskCalculator;
import com.trade.paper.risk.RiskConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 模拟交易账本
 *
 * 职责：
 * 1. 订单生命周期：创建、成交、撤单、触发
 * 2. 持仓生命周期：开仓、加仓（加权均价）、减仓、平仓、反手、强平
 * 3. 钱包记账：占用/释放保证金、手续费、已实现盈亏
 *
 * 所有写操作在对象锁内串行执行（单写者）。
 * 余额不足时在任何修改之前拒绝，不做事后回滚。
 * 对外返回的订单、持仓、钱包都是快照副本。
 *
 * 单向持仓模式：每个交易对同时最多一个未平仓持仓。
 */
public class TradingLedger {

    private static final Logger logger = LoggerFactory.getLogger(TradingLedger.class);

    private final RiskConfig config;
    private final MarkPriceProvider priceProvider;
    private final Wallet wallet;

    private final Map<String, Order> orders = new LinkedHashMap<>();
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final Map<Symbol, Position> openPositions = new HashMap<>();
    private final List<Trade> trades = new ArrayList<>();
    private final List<LedgerListener> listeners = new CopyOnWriteArrayList<>();

    public TradingLedger(RiskConfig config, MarkPriceProvider priceProvider) {
        this.config = config;
        this.priceProvider = priceProvider;
        this.wallet = new Wallet(config.getInitialBalance());
    }

    // ==================== 订单 ====================

    /**
     * 创建订单
     * 市价单按标记价格立即成交；限价单、止损单挂单等待
     *
     * @throws ValidationException 参数不合法
     * @throws InsufficientMarginException 可用余额不足，未占用任何保证金
     * @throws PriceUnavailableException 市价单没有标记价格
     */
    public synchronized Order createOrder(OrderRequest request) throws LedgerException {
        validate(request);

        BigDecimal referencePrice = referencePrice(request);
        BigDecimal margin = RiskCalculator.marginRequired(request.getQuantity(), referencePrice, request.getLeverage(),
                config.getMoneyScale());
        BigDecimal required = margin;
        if (request.getType() == OrderType.MARKET) {
            required = required.add(commission(request.getQuantity(), referencePrice, config.getTakerFee()));
        }
        if (required.compareTo(wallet.getAvailableBalance()) > 0) {
            logger.warn("保证金不足，拒绝下单: 需要 {}, 可用 {}, {}",
                    required.toPlainString(), wallet.getAvailableBalance().toPlainString(), request);
            throw new InsufficientMarginException(required, wallet.getAvailableBalance());
        }

        Order order = new Order(UUID.randomUUID().toString(), request, margin, Instant.now());
        orders.put(order.getOrderId(), order);
        wallet.reserve(margin);
        logger.info("订单已创建: {}, 占用保证金 {}", order, margin.toPlainString());
        notifyListeners(l -> l.onOrderCreated(order.copy()));

        if (order.getType() == OrderType.MARKET) {
            fill(order, referencePrice, config.getTakerFee());
        } else {
            order.open();
        }
        notifyWalletChanged();
        return order.copy();
    }

    /**
     * 按指定价格成交订单（吃单费率）
     */
    public synchronized Order executeOrder(String orderId, BigDecimal executionPrice) throws LedgerException {
        return executeOrder(orderId, executionPrice, false);
    }

    /**
     * 按指定价格成交订单
     * @param maker true 时按挂单费率收取手续费
     */
    public synchronized Order executeOrder(String orderId, BigDecimal executionPrice, boolean maker)
            throws LedgerException {
        Order order = requireActiveOrder(orderId, "成交");
        if (executionPrice == null || executionPrice.signum() <= 0) {
            throw new ValidationException("成交价必须为正数");
        }
        fill(order, executionPrice, maker ? config.getMakerFee() : config.getTakerFee());
        notifyWalletChanged();
        return order.copy();
    }

    /**
     * 撤单，释放占用的保证金
     */
    public synchronized Order cancelOrder(String orderId) throws LedgerException {
        Order order = requireActiveOrder(orderId, "撤销");
        BigDecimal released = order.releaseMargin();
        wallet.release(released);
        order.cancel();
        logger.info("订单已撤销: {}, 释放保证金 {}", order.getOrderId(), released.toPlainString());
        notifyListeners(l -> l.onOrderCancelled(order.copy()));
        notifyWalletChanged();
        return order.copy();
    }

    /**
     * 撤销全部活动订单
     * @param symbol 为 null 时撤销所有交易对
     * @return 撤销数量
     */
    public synchronized int cancelAllOrders(Symbol symbol) {
        int count = 0;
        for (Order order : orders.values()) {
            if (!order.getStatus().isCancellable()) {
                continue;
            }
            if (symbol != null && !symbol.equals(order.getSymbol())) {
                continue;
            }
            wallet.release(order.releaseMargin());
            order.cancel();
            notifyListeners(l -> l.onOrderCancelled(order.copy()));
            count++;
        }
        if (count > 0) {
            logger.info("已撤销 {} 个订单{}", count, symbol == null ? "" : " (" + symbol + ")");
            notifyWalletChanged();
        }
        return count;
    }

    // ==================== 持仓 ====================

    /**
     * 按标记价格平仓
     * @param quantity 平仓数量，null 表示全部平仓
     */
    public synchronized Trade closePosition(String positionId, BigDecimal quantity) throws LedgerException {
        Position position = requireOpenPosition(positionId);
        BigDecimal price = priceProvider.getMarkPrice(position.getSymbol())
                .orElseThrow(() -> new PriceUnavailableException(position.getSymbol()));
        return closeAt(position, quantity, price);
    }

    /**
     * 设置止盈止损，传 null 清除
     */
    public synchronized Position updatePositionTpSl(String positionId, BigDecimal takeProfit, BigDecimal stopLoss)
            throws LedgerException {
        Position position = requireOpenPosition(positionId);
        List<String> errors = new ArrayList<>();
        if (takeProfit != null && takeProfit.signum() <= 0) {
            errors.add("止盈价必须为正数");
        }
        if (stopLoss != null && stopLoss.signum() <= 0) {
            errors.add("止损价必须为正数");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        position.updateTpSl(takeProfit, stopLoss);
        logger.info("{} 持仓止盈止损已更新: TP={}, SL={}", position.getSymbol(), takeProfit, stopLoss);
        notifyListeners(l -> l.onPositionUpdated(position.copy()));
        return position.copy();
    }

    /**
     * 重置账户：撤销活动订单，清空持仓，恢复初始资金
     * 订单和成交记录保留
     */
    public synchronized void resetWallet() {
        for (Order order : orders.values()) {
            if (!order.getStatus().isCancellable()) {
                continue;
            }
            wallet.release(order.releaseMargin());
            order.cancel();
            notifyListeners(l -> l.onOrderCancelled(order.copy()));
        }
        positions.clear();
        openPositions.clear();
        wallet.reset(config.getInitialBalance());
        logger.info("账户已重置，初始资金 {}", config.getInitialBalance().toPlainString());
        notifyWalletChanged();
    }

    // ==================== 查询 ====================

    /**
     * 当前未平仓持仓，无持仓返回 null
     */
    public synchronized Position getPosition(Symbol symbol) {
        Position position = openPositions.get(symbol);
        return position == null ? null : position.copy();
    }

    public synchronized Order getOrder(String orderId) {
        Order order = orders.get(orderId);
        return order == null ? null : order.copy();
    }

    public synchronized List<Order> getActiveOrders() {
        return getActiveOrders(null);
    }

    public synchronized List<Order> getActiveOrders(Symbol symbol) {
        List<Order> result = new ArrayList<>();
        for (Order order : orders.values()) {
            if (order.getStatus().isCancellable() && (symbol == null || symbol.equals(order.getSymbol()))) {
                result.add(order.copy());
            }
        }
        return result;
    }

    public synchronized List<Order> getOrderHistory() {
        List<Order> result = new ArrayList<>();
        orders.values().forEach(o -> result.add(o.copy()));
        return result;
    }

    public synchronized List<Position> getOpenPositions() {
        return getOpenPositions(null);
    }

    public synchronized List<Position> getOpenPositions(Symbol symbol) {
        List<Position> result = new ArrayList<>();
        for (Position position : positions.values()) {
            if (position.isOpen() && (symbol == null || symbol.equals(position.getSymbol()))) {
                result.add(position.copy());
            }
        }
        return result;
    }

    public synchronized List<Position> getPositionHistory() {
        List<Position> result = new ArrayList<>();
        positions.values().forEach(p -> result.add(p.copy()));
        return result;
    }

    public synchronized List<Trade> getTrades() {
        return new ArrayList<>(trades);
    }

    public synchronized Wallet getWallet() {
        return wallet.copy();
    }

    public RiskConfig getConfig() {
        return config;
    }

    public Runnable addListener(LedgerListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ==================== 触发（供 PriceTriggerMonitor 调用） ====================

    /**
     * 止损单触发：止损市价单按给定成交价成交，止损限价单转为限价挂单
     */
    synchronized void triggerStopOrder(String orderId, BigDecimal triggerPrice) throws LedgerException {
        Order order = requireActiveOrder(orderId, "触发");
        if (!order.getType().isStop() || order.isTriggered()) {
            throw new InvalidStateTransitionException("订单不是待触发的止损单: " + orderId);
        }
        logger.info("止损单触发: {} @ {}", order.getOrderId(), triggerPrice.toPlainString());
        order.markTriggered();
        notifyListeners(l -> l.onStopTriggered(order.copy()));
        if (order.getType() == OrderType.STOP_MARKET) {
            fill(order, triggerPrice, config.getTakerFee());
            notifyWalletChanged();
        }
    }

    /**
     * 按指定价格平仓（止盈止损）
     */
    synchronized Trade closePositionAt(String positionId, BigDecimal quantity, BigDecimal price)
            throws LedgerException {
        return closeAt(requireOpenPosition(positionId), quantity, price);
    }

    /**
     * 强平：按强平价全部平仓
     */
    synchronized Trade liquidate(String positionId) throws LedgerException {
        Position position = requireOpenPosition(positionId);
        BigDecimal price = position.getLiquidationPrice();
        logger.warn("{} 持仓触发强平: {} @ {}", position.getSymbol(), position, price.toPlainString());
        CloseCalc calc = planClose(position, position.getQuantity(), price, config.getTakerFee());
        Trade trade = applyClose(position, position.getQuantity(), price, calc, null, true);
        notifyListeners(l -> l.onLiquidation(position.copy(), trade));
        notifyWalletChanged();
        return trade;
    }

    // ==================== 私有方法 ====================

    private void validate(OrderRequest request) throws ValidationException {
        List<String> errors = new ArrayList<>();
        if (request.getSymbol() == null) {
            errors.add("交易对不能为空");
        }
        if (request.getSide() == null) {
            errors.add("订单方向不能为空");
        }
        if (request.getType() == null) {
            errors.add("订单类型不能为空");
        }
        if (request.getMarginMode() == null) {
            errors.add("保证金模式不能为空");
        }
        if (request.getLeverage() < RiskConfig.MIN_LEVERAGE || request.getLeverage() > config.getMaxLeverage()) {
            errors.add(String.format("杠杆必须在 %d~%d 之间", RiskConfig.MIN_LEVERAGE, config.getMaxLeverage()));
        }
        BigDecimal quantity = request.getQuantity();
        if (quantity == null || quantity.signum() <= 0) {
            errors.add("数量必须为正数");
        } else if (Decimal.decimalPlaces(quantity) > config.getQuantityScale()) {
            errors.add("数量精度不能超过 " + config.getQuantityScale() + " 位小数");
        }
        if (request.getType() != null) {
            if (request.getType().requiresPrice() && !Decimal.isPositive(request.getPrice())) {
                errors.add("限价单必须设置价格");
            }
            if (request.getType().requiresStopPrice() && !Decimal.isPositive(request.getStopPrice())) {
                errors.add("止损单必须设置触发价");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * 计算保证金用的参考价：限价类取订单价格，止损市价取触发价，市价取标记价格
     */
    private BigDecimal referencePrice(OrderRequest request) throws PriceUnavailableException {
        switch (request.getType()) {
            case LIMIT:
            case STOP_LIMIT:
                return request.getPrice();
            case STOP_MARKET:
                return request.getStopPrice();
            default:
                return priceProvider.getMarkPrice(request.getSymbol())
                        .orElseThrow(() -> new PriceUnavailableException(request.getSymbol()));
        }
    }

    /**
     * 成交：先规划平仓和开仓两段，校验资金后再统一修改状态
     */
    private void fill(Order order, BigDecimal price, BigDecimal feeRate) throws InsufficientMarginException {
        Symbol symbol = order.getSymbol();
        PositionSide direction = order.getSide().toPositionSide();
        BigDecimal remaining = order.getRemainingQuantity();
        Position current = openPositions.get(symbol);

        boolean reducing = current != null && current.getSide() != direction;
        BigDecimal closeQty = reducing ? remaining.min(current.getQuantity()) : BigDecimal.ZERO;
        BigDecimal openQty = remaining.subtract(closeQty);

        CloseCalc close = reducing ? planClose(current, closeQty, price, feeRate) : null;
        OpenCalc open = openQty.signum() > 0
                ? planOpen(reducing ? null : current, order.getLeverage(), openQty, price, direction, feeRate)
                : null;

        if (open != null) {
            BigDecimal projected = wallet.getAvailableBalance().add(order.getMarginReserved());
            if (close != null) {
                projected = projected.add(close.released()).add(close.netPnl()).max(BigDecimal.ZERO);
            }
            BigDecimal needed = open.marginDelta().add(open.fee());
            if (needed.compareTo(projected) > 0) {
                wallet.release(order.releaseMargin());
                order.reject();
                String reason = String.format("成交时保证金不足: 需要 %s, 可用 %s",
                        needed.toPlainString(), projected.toPlainString());
                logger.warn("订单被拒绝: {}, {}", order.getOrderId(), reason);
                notifyListeners(l -> l.onOrderRejected(order.copy(), reason));
                notifyWalletChanged();
                throw new InsufficientMarginException(needed, projected);
            }
        }

        wallet.release(order.releaseMargin());
        BigDecimal fee = BigDecimal.ZERO;
        if (close != null) {
            applyClose(current, closeQty, price, close, order.getOrderId(), false);
            fee = fee.add(close.fee());
        }
        if (open != null) {
            applyOpen(order, symbol, openQty, price, open);
            fee = fee.add(open.fee());
        }
        order.fill(price, fee);
        logger.info("订单已成交: {} @ {}, 手续费 {}", order.getOrderId(), price.toPlainString(), fee.toPlainString());
        notifyListeners(l -> l.onOrderFilled(order.copy()));
    }

    private CloseCalc planClose(Position position, BigDecimal quantity, BigDecimal price, BigDecimal feeRate) {
        BigDecimal grossPnl = RiskCalculator.unrealizedPnl(position.getSide(), quantity, position.getEntryPrice(), price);
        BigDecimal fee = commission(quantity, price, feeRate);
        BigDecimal released = quantity.compareTo(position.getQuantity()) == 0
                ? position.getMargin()
                : Decimal.round(position.getMargin().multiply(quantity)
                        .divide(position.getQuantity(), config.getMoneyScale() + 4, RoundingMode.HALF_UP),
                        config.getMoneyScale());
        return new CloseCalc(grossPnl, fee, released);
    }

    /**
     * 开仓或加仓后的数值；均价由累计名义价值推出，重复加仓不产生误差累积
     */
    private OpenCalc planOpen(Position current, int orderLeverage, BigDecimal quantity, BigDecimal price,
                              PositionSide direction, BigDecimal feeRate) {
        int leverage = current == null ? orderLeverage : current.getLeverage();
        BigDecimal oldQuantity = current == null ? BigDecimal.ZERO : current.getQuantity();
        BigDecimal oldCost = current == null ? BigDecimal.ZERO : current.getCostBasis();
        BigDecimal oldMargin = current == null ? BigDecimal.ZERO : current.getMargin();

        BigDecimal newQuantity = oldQuantity.add(quantity);
        BigDecimal newCost = oldCost.add(Decimal.multiply(quantity, price));
        BigDecimal newEntry = Decimal.divide(newCost, newQuantity, config.getMoneyScale());
        BigDecimal newMargin = Decimal.divide(newCost, Decimal.of(leverage), config.getMoneyScale());
        BigDecimal liquidation = RiskCalculator.liquidationPrice(direction, newEntry, leverage,
                config.getLiquidationBuffer(), config.getMoneyScale());
        return new OpenCalc(newQuantity, newCost, newEntry, newMargin, newMargin.subtract(oldMargin),
                liquidation, commission(quantity, price, feeRate));
    }

    private void applyOpen(Order order, Symbol symbol, BigDecimal quantity, BigDecimal price, OpenCalc calc) {
        Position current = openPositions.get(symbol);
        Position position;
        if (current == null) {
            position = new Position(UUID.randomUUID().toString(), symbol, order.getSide().toPositionSide(),
                    order.getLeverage(), order.getMarginMode(), calc.quantity(), calc.entryPrice(), calc.costBasis(),
                    calc.margin(), calc.liquidationPrice(), Instant.now());
            positions.put(position.getPositionId(), position);
            openPositions.put(symbol, position);
            logger.info("开仓: {}", position);
            notifyListeners(l -> l.onPositionOpened(position.copy()));
        } else {
            position = current;
            position.increase(calc.quantity(), calc.entryPrice(), calc.costBasis(), calc.margin(), calc.liquidationPrice());
            logger.info("加仓: {}", position);
            notifyListeners(l -> l.onPositionUpdated(position.copy()));
        }

        wallet.reserve(calc.marginDelta());
        wallet.settle(calc.fee().negate());
        recordTrade(new Trade(UUID.randomUUID().toString(), order.getOrderId(), position.getPositionId(), symbol,
                order.getSide(), price, quantity, calc.fee(), calc.fee().negate(), false, Instant.now()));
    }

    /**
     * 减仓或平仓；亏损超出可用余额时按穿仓处理，差额记为保险基金承担
     */
    private Trade applyClose(Position position, BigDecimal quantity, BigDecimal price, CloseCalc calc,
                             String orderId, boolean liquidation) {
        BigDecimal netPnl = calc.netPnl();
        BigDecimal availableAfter = wallet.getAvailableBalance().add(calc.released()).add(netPnl);
        if (availableAfter.signum() < 0) {
            BigDecimal shortfall = availableAfter.negate();
            netPnl = netPnl.add(shortfall);
            logger.warn("{} 穿仓，亏损超出可用余额 {}，差额由保险基金承担", position.getSymbol(), shortfall.toPlainString());
        }

        wallet.release(calc.released());
        wallet.settle(netPnl);
        position.reduce(quantity, calc.released(), netPnl);

        Trade trade = new Trade(UUID.randomUUID().toString(), orderId, position.getPositionId(),
                position.getSymbol(), position.getSide().closingSide(), price, quantity, calc.fee(), netPnl,
                liquidation, Instant.now());
        recordTrade(trade);

        if (position.isOpen()) {
            logger.info("减仓: {}, 已实现盈亏 {}", position, netPnl.toPlainString());
            notifyListeners(l -> l.onPositionUpdated(position.copy()));
        } else {
            openPositions.remove(position.getSymbol());
            logger.info("平仓: {}, 已实现盈亏 {}", position, position.getRealizedPnl().toPlainString());
            notifyListeners(l -> l.onPositionClosed(position.copy()));
        }
        return trade;
    }

    private Trade closeAt(Position position, BigDecimal quantity, BigDecimal price) throws LedgerException {
        BigDecimal closeQty = quantity == null ? position.getQuantity() : quantity;
        if (closeQty.signum() <= 0 || closeQty.compareTo(position.getQuantity()) > 0) {
            throw new ValidationException(String.format("平仓数量必须在 (0, %s] 之间",
                    position.getQuantity().toPlainString()));
        }
        CloseCalc calc = planClose(position, closeQty, price, config.getTakerFee());
        Trade trade = applyClose(position, closeQty, price, calc, null, false);
        notifyWalletChanged();
        return trade;
    }

    private void recordTrade(Trade trade) {
        trades.add(trade);
        notifyListeners(l -> l.onTrade(trade));
    }

    private BigDecimal commission(BigDecimal quantity, BigDecimal price, BigDecimal feeRate) {
        return RiskCalculator.commission(quantity, price, feeRate, config.getMoneyScale());
    }

    private Order requireActiveOrder(String orderId, String action) throws LedgerException {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new NotFoundException("订单", orderId);
        }
        if (!order.getStatus().isCancellable()) {
            throw new InvalidStateTransitionException(
                    String.format("订单 %s 状态为 %s，不能%s", orderId, order.getStatus(), action));
        }
        return order;
    }

    private Position requireOpenPosition(String positionId) throws LedgerException {
        Position position = positions.get(positionId);
        if (position == null) {
            throw new NotFoundException("持仓", positionId);
        }
        if (!position.isOpen()) {
            throw new InvalidStateTransitionException("持仓已平仓: " + positionId);
        }
        return position;
    }

    private void notifyWalletChanged() {
        Wallet snapshot = wallet.copy();
        notifyListeners(l -> l.onWalletChanged(snapshot));
    }

    private void notifyListeners(Consumer<LedgerListener> action) {
        for (LedgerListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                logger.error("账本监听器回调失败: {}", e.getMessage(), e);
            }
        }
    }

    private record CloseCalc(BigDecimal grossPnl, BigDecimal fee, BigDecimal released) {
        BigDecimal netPnl() {
            return grossPnl.subtract(fee);
        }
    }

    private record OpenCalc(BigDecimal quantity, BigDecimal costBasis, BigDecimal entryPrice, BigDecimal margin,
                            BigDecimal marginDelta, BigDecimal liquidationPrice, BigDecimal fee) {
    }
}
