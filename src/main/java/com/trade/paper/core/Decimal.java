package com.trade.paper.core;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * BigDecimal 工具类
 * 所有金额、价格、数量计算必须使用此类，禁止 double
 */
public final class Decimal {

    private Decimal() {}

    /**
     * 价格、金额精度：8位小数
     */
    public static final int PRICE_SCALE = 8;

    /**
     * 数量精度：8位小数
     */
    public static final int QUANTITY_SCALE = 8;

    /**
     * 百分比精度：2位小数
     */
    public static final int PERCENT_SCALE = 2;

    public static BigDecimal of(String value) {
        return new BigDecimal(value);
    }

    public static BigDecimal of(long value) {
        return BigDecimal.valueOf(value);
    }

    /**
     * 乘法不做舍入，结果精确
     */
    public static BigDecimal multiply(BigDecimal a, BigDecimal b) {
        return a.multiply(b);
    }

    /**
     * 按指定精度向下舍入，用于手续费
     */
    public static BigDecimal roundDown(BigDecimal value, int scale) {
        return value.setScale(scale, RoundingMode.DOWN);
    }

    public static BigDecimal round(BigDecimal value, int scale) {
        return value.setScale(scale, RoundingMode.HALF_UP);
    }

    /**
     * 安全除法，避免除零
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return divide(dividend, divisor, PRICE_SCALE);
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor, int scale) {
        if (divisor.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, scale, RoundingMode.HALF_UP);
    }

    /**
     * 实际小数位数（去掉末尾的0）
     */
    public static int decimalPlaces(BigDecimal value) {
        return Math.max(0, value.stripTrailingZeros().scale());
    }

    /**
     * 判断是否为正值
     */
    public static boolean isPositive(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) > 0;
    }

    /**
     * 判断是否为零
     */
    public static boolean isZero(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) == 0;
    }
}
