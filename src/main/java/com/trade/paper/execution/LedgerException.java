package com.trade.paper.execution;

/**
 * 账本操作被拒绝
 * 业务拒绝，不是瞬时故障，调用方不应自动重试
 */
public class LedgerException extends Exception {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
