package com.trade.paper.core;

/**
 * 保证金模式
 */
public enum MarginMode {
    CROSS,     // 全仓
    ISOLATED   // 逐仓
}
