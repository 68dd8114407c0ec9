package com.trade.paper.risk;

import com.trade.paper.core.Decimal;
import com.trade.paper.core.PositionSide;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * 风险计算
 * 纯函数，无状态；保证金、强平价、盈亏、手续费全部使用 BigDecimal 精确计算
 */
public final class RiskCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal DANGER_PERCENT = BigDecimal.valueOf(25);
    private static final BigDecimal WARNING_PERCENT = BigDecimal.valueOf(50);

    private RiskCalculator() {}

    /**
     * 所需保证金 = 数量 × 价格 / 杠杆
     */
    public static BigDecimal marginRequired(BigDecimal quantity, BigDecimal price, int leverage, int scale) {
        requireLeverage(leverage);
        return Decimal.divide(Decimal.multiply(quantity, price), Decimal.of(leverage), scale);
    }

    public static BigDecimal marginRequired(BigDecimal quantity, BigDecimal price, int leverage) {
        return marginRequired(quantity, price, leverage, Decimal.PRICE_SCALE);
    }

    /**
     * 强平价
     * 多头：entry × (1 − (1/leverage) × buffer)
     * 空头：entry × (1 + (1/leverage) × buffer)
     */
    public static BigDecimal liquidationPrice(PositionSide side, BigDecimal entryPrice, int leverage,
                                              BigDecimal bufferRatio, int scale) {
        requireLeverage(leverage);
        // buffer / leverage 不一定能整除，先乘后除保证精度
        BigDecimal offset = Decimal.multiply(entryPrice, bufferRatio)
                .divide(Decimal.of(leverage), MathContext.DECIMAL128);
        BigDecimal price = side == PositionSide.LONG
                ? entryPrice.subtract(offset)
                : entryPrice.add(offset);
        return Decimal.round(price, scale);
    }

    public static BigDecimal liquidationPrice(PositionSide side, BigDecimal entryPrice, int leverage,
                                              BigDecimal bufferRatio) {
        return liquidationPrice(side, entryPrice, leverage, bufferRatio, Decimal.PRICE_SCALE);
    }

    /**
     * 未实现盈亏
     */
    public static BigDecimal unrealizedPnl(PositionSide side, BigDecimal quantity,
                                           BigDecimal entryPrice, BigDecimal markPrice) {
        BigDecimal diff = side == PositionSide.LONG
                ? markPrice.subtract(entryPrice)
                : entryPrice.subtract(markPrice);
        return diff.multiply(quantity);
    }

    /**
     * 收益率（%），保证金为0时返回0
     */
    public static BigDecimal roe(BigDecimal pnl, BigDecimal margin) {
        if (Decimal.isZero(margin)) {
            return BigDecimal.ZERO;
        }
        return pnl.multiply(HUNDRED).divide(margin, Decimal.PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 手续费 = 数量 × 价格 × 费率，向下舍入，不向上取整
     */
    public static BigDecimal commission(BigDecimal quantity, BigDecimal price, BigDecimal feeRate, int scale) {
        return Decimal.roundDown(quantity.multiply(price).multiply(feeRate), scale);
    }

    public static BigDecimal commission(BigDecimal quantity, BigDecimal price, BigDecimal feeRate) {
        return commission(quantity, price, feeRate, Decimal.PRICE_SCALE);
    }

    /**
     * 保证金是否已被浮亏耗尽
     */
    public static boolean isLiquidationRisk(PositionSide side, BigDecimal quantity, BigDecimal entryPrice,
                                            BigDecimal margin, BigDecimal markPrice) {
        BigDecimal remaining = margin.add(unrealizedPnl(side, quantity, entryPrice, markPrice));
        return remaining.signum() <= 0;
    }

    /**
     * 按剩余保证金占比评估风险等级
     */
    public static LiquidationRiskLevel riskLevel(PositionSide side, BigDecimal quantity, BigDecimal entryPrice,
                                                 BigDecimal margin, BigDecimal markPrice) {
        if (Decimal.isZero(margin)) {
            return LiquidationRiskLevel.DANGER;
        }
        BigDecimal remaining = margin.add(unrealizedPnl(side, quantity, entryPrice, markPrice));
        BigDecimal percent = remaining.multiply(HUNDRED).divide(margin, MathContext.DECIMAL64);
        if (percent.compareTo(DANGER_PERCENT) < 0) {
            return LiquidationRiskLevel.DANGER;
        }
        if (percent.compareTo(WARNING_PERCENT) < 0) {
            return LiquidationRiskLevel.WARNING;
        }
        return LiquidationRiskLevel.SAFE;
    }

    /**
     * 是否已触及强平价
     */
    public static boolean isLiquidated(PositionSide side, BigDecimal liquidationPrice, BigDecimal markPrice) {
        return side == PositionSide.LONG
                ? markPrice.compareTo(liquidationPrice) <= 0
                : markPrice.compareTo(liquidationPrice) >= 0;
    }

    private static void requireLeverage(int leverage) {
        if (leverage <= 0) {
            throw new IllegalArgumentException("杠杆必须为正数: " + leverage);
        }
    }
}
