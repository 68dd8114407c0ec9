package com.trade.paper.execution;

/**
 * 对终态订单或已平仓持仓执行了非法操作
 */
public class InvalidStateTransitionException extends LedgerException {

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
