package com.receiptdesigner.core.order;

import java.math.BigDecimal;

public record ItemPromotion(String promotionName, BigDecimal discountAmount) {

    public ItemPromotion {
        promotionName = promotionName == null ? "" : promotionName;
        discountAmount = discountAmount == null ? BigDecimal.ZERO : discountAmount;
    }
}
