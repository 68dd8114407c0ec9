package com.trade.paper.book;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 盘口价位（价格, 数量）
 * 增量数据中数量为0表示删除该价位
 */
public record PriceLevel(BigDecimal price, BigDecimal quantity) {

    public PriceLevel {
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(quantity, "quantity");
        if (price.signum() <= 0) {
            throw new IllegalArgumentException("价格必须为正数: " + price);
        }
        if (quantity.signum() < 0) {
            throw new IllegalArgumentException("数量不能为负数: " + quantity);
        }
    }

    public boolean isRemoval() {
        return quantity.signum() == 0;
    }
}
