package com.receiptdesigner.core.order;

import java.math.BigDecimal;

public record OrderPromotion(String promotionName, BigDecimal discountAmount, PromotionType promotionType) {

    public OrderPromotion {
        promotionName = promotionName == null ? "" : promotionName;
        discountAmount = discountAmount == null ? BigDecimal.ZERO : discountAmount;
        promotionType = promotionType == null ? PromotionType.FIXED_AMOUNT : promotionType;
    }
}
