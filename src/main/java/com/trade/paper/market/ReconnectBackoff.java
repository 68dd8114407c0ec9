package com.trade.paper.market;

import java.time.Duration;

/**
 * 指数退避重连间隔
 * 每次失败按倍数增长直至上限，连接成功后恢复初始值
 */
public class ReconnectBackoff {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private Duration currentDelay;
    private int attemptCount;

    public ReconnectBackoff(Duration baseDelay, Duration maxDelay, double multiplier) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("初始重连间隔必须为正数");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("最大重连间隔不能小于初始间隔");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("退避倍数不能小于1");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.currentDelay = baseDelay;
    }

    /**
     * 取本次等待时间，并把下次等待时间推进一级
     */
    public synchronized Duration nextDelay() {
        Duration delay = currentDelay;
        attemptCount++;
        long grown = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
        return delay;
    }

    /**
     * 下次重连将等待的时间（不推进）
     */
    public synchronized Duration peekDelay() {
        return currentDelay;
    }

    public synchronized void reset() {
        currentDelay = baseDelay;
        attemptCount = 0;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }
}
