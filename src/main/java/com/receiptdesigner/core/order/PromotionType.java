package com.receiptdesigner.core.order;

import java.util.Locale;

public enum PromotionType {
    PERCENTAGE,
    FIXED_AMOUNT;

    /**
     * Only {@code PERCENTAGE} is significant to rendering; everything else is a fixed amount.
     */
    public static PromotionType fromName(String raw) {
        if (raw != null && "PERCENTAGE".equals(raw.trim().toUpperCase(Locale.ROOT))) {
            return PERCENTAGE;
        }
        return FIXED_AMOUNT;
    }
}
