package com.trade.paper.exchange;

/**
 * 行情接口异常
 */
public class ExchangeException extends Exception {

    private final ErrorCode errorCode;

    public ExchangeException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ExchangeException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 是否属于可重试的瞬时故障
     */
    public boolean isRetryable() {
        return errorCode == ErrorCode.NETWORK_ERROR
                || errorCode == ErrorCode.TIMEOUT
                || errorCode == ErrorCode.RATE_LIMIT;
    }

    public enum ErrorCode {
        NETWORK_ERROR,          // 网络错误
        API_ERROR,              // API错误
        INVALID_SYMBOL,         // 无效交易对
        RATE_LIMIT,             // 频率限制
        IP_BANNED,              // IP 被封禁（HTTP 418）
        TIMEOUT,                // 超时
        UNKNOWN                 // 未知错误
    }
}
