package com.trade.paper.risk;

import com.trade.paper.core.ConfigManager;
import com.trade.paper.core.Decimal;

import java.math.BigDecimal;

/**
 * 模拟账本风控参数
 */
public class RiskConfig {

    public static final int MIN_LEVERAGE = 1;
    public static final int MAX_LEVERAGE = 125;

    private BigDecimal initialBalance = BigDecimal.valueOf(10000);         // 初始资金
    private BigDecimal takerFee = Decimal.of("0.0004");                    // 吃单费率
    private BigDecimal makerFee = Decimal.of("0.0002");                    // 挂单费率
    private BigDecimal liquidationBuffer = Decimal.of("0.9");              // 强平缓冲系数
    private int maxLeverage = MAX_LEVERAGE;                                // 最大杠杆
    private int quantityScale = Decimal.QUANTITY_SCALE;                    // 数量最大小数位
    private int moneyScale = Decimal.PRICE_SCALE;                          // 金额精度

    /**
     * 从配置文件读取，缺省项使用默认值
     */
    public static RiskConfig from(ConfigManager config) {
        RiskConfig riskConfig = new RiskConfig();
        riskConfig.setInitialBalance(config.getDecimalProperty("ledger.initial-balance", riskConfig.initialBalance));
        riskConfig.setTakerFee(config.getDecimalProperty("ledger.taker-fee", riskConfig.takerFee));
        riskConfig.setMakerFee(config.getDecimalProperty("ledger.maker-fee", riskConfig.makerFee));
        riskConfig.setLiquidationBuffer(config.getDecimalProperty("ledger.liquidation-buffer", riskConfig.liquidationBuffer));
        riskConfig.setMaxLeverage(config.getIntProperty("ledger.max-leverage", riskConfig.maxLeverage));
        riskConfig.setQuantityScale(config.getIntProperty("ledger.quantity-scale", riskConfig.quantityScale));
        riskConfig.setMoneyScale(config.getIntProperty("ledger.money-scale", riskConfig.moneyScale));
        return riskConfig;
    }

    public BigDecimal getInitialBalance() {
        return initialBalance;
    }

    public void setInitialBalance(BigDecimal initialBalance) {
        if (initialBalance.signum() < 0) {
            throw new IllegalArgumentException("初始资金不能为负数");
        }
        this.initialBalance = initialBalance;
    }

    public BigDecimal getTakerFee() {
        return takerFee;
    }

    public void setTakerFee(BigDecimal takerFee) {
        requireFeeRate(takerFee);
        this.takerFee = takerFee;
    }

    public BigDecimal getMakerFee() {
        return makerFee;
    }

    public void setMakerFee(BigDecimal makerFee) {
        requireFeeRate(makerFee);
        this.makerFee = makerFee;
    }

    public BigDecimal getLiquidationBuffer() {
        return liquidationBuffer;
    }

    public void setLiquidationBuffer(BigDecimal liquidationBuffer) {
        if (liquidationBuffer.signum() <= 0 || liquidationBuffer.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("强平缓冲系数必须在 (0, 1] 之间");
        }
        this.liquidationBuffer = liquidationBuffer;
    }

    public int getMaxLeverage() {
        return maxLeverage;
    }

    public void setMaxLeverage(int maxLeverage) {
        if (maxLeverage < MIN_LEVERAGE || maxLeverage > MAX_LEVERAGE) {
            throw new IllegalArgumentException("最大杠杆必须在 1~125 之间");
        }
        this.maxLeverage = maxLeverage;
    }

    public int getQuantityScale() {
        return quantityScale;
    }

    public void setQuantityScale(int quantityScale) {
        if (quantityScale < 0) {
            throw new IllegalArgumentException("数量精度不能为负数");
        }
        this.quantityScale = quantityScale;
    }

    public int getMoneyScale() {
        return moneyScale;
    }

    public void setMoneyScale(int moneyScale) {
        if (moneyScale < 0) {
            throw new IllegalArgumentException("金额精度不能为负数");
        }
        this.moneyScale = moneyScale;
    }

    private static void requireFeeRate(BigDecimal rate) {
        if (rate.signum() < 0 || rate.compareTo(Decimal.of("0.01")) > 0) {
            throw new IllegalArgumentException("手续费率必须在 0~1% 之间");
        }
    }
}
