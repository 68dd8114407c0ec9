package com.trade.paper.risk;

/**
 * 强平风险等级，按剩余保证金占比划分
 */
public enum LiquidationRiskLevel {
    SAFE,       // 剩余保证金 >= 50%
    WARNING,    // 剩余保证金 < 50%
    DANGER      // 剩余保证金 < 25%
}
