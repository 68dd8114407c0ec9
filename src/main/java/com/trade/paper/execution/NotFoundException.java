package com.trade.paper.execution;

public class NotFoundException extends LedgerException {

    public NotFoundException(String kind, String id) {
        super(kind + "不存在: " + id);
    }
}
