package com.trade.paper.execution;

import java.util.List;

/**
 * 下单参数校验失败
 */
public class ValidationException extends LedgerException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super("订单校验失败: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}
