package com.trade.paper.execution;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 钱包
 * availableBalance = balance − 挂单占用保证金 − 持仓保证金，始终 >= 0
 */
public class Wallet {
    private BigDecimal balance;             // 账户余额
    private BigDecimal availableBalance;    // 可用余额
    private Instant updatedAt;              // 更新时间

    Wallet(BigDecimal initialBalance) {
        this.balance = initialBalance;
        this.availableBalance = initialBalance;
        this.updatedAt = Instant.now();
    }

    private Wallet(Wallet other) {
        this.balance = other.balance;
        this.availableBalance = other.availableBalance;
        this.updatedAt = other.updatedAt;
    }

    public BigDecimal getBalance() { return balance; }
    public BigDecimal getAvailableBalance() { return availableBalance; }
    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * 已占用的保证金（挂单 + 持仓）
     */
    public BigDecimal getUsedMargin() {
        return balance.subtract(availableBalance);
    }

    /**
     * 占用保证金，调用方负责事先校验余额
     */
    void reserve(BigDecimal amount) {
        availableBalance = availableBalance.subtract(amount);
        touch();
    }

    void release(BigDecimal amount) {
        availableBalance = availableBalance.add(amount);
        touch();
    }

    /**
     * 余额变动（手续费、已实现盈亏），可用余额同步变动
     */
    void settle(BigDecimal amount) {
        balance = balance.add(amount);
        availableBalance = availableBalance.add(amount);
        touch();
    }

    void reset(BigDecimal initialBalance) {
        balance = initialBalance;
        availableBalance = initialBalance;
        touch();
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    Wallet copy() {
        return new Wallet(this);
    }

    @Override
    public String toString() {
        return String.format("Wallet{balance=%s, available=%s}",
                balance.toPlainString(), availableBalance.toPlainString());
    }
}
