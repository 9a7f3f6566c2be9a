package com.receiptdesigner.core.render;

import java.util.Optional;

/**
 * Order-level fields available to {@code dynamic} elements and {@code {{FIELD}}} placeholders.
 */
public enum DynamicField {
    STORE_NAME,
    STORE_NUMBER,
    ORDER_ID,
    TIMESTAMP,
    SUBTOTAL,
    TAX_RATE,
    TAX,
    TOTAL,
    PAYMENT_METHOD,
    ITEM_COUNT,
    TOTAL_QUANTITY,
    CUSTOMER_ID,
    CUSTOMER_NAME,
    MEMBER_STATUS,
    LOYALTY_POINTS,
    MEMBER_SINCE,
    TABLE_NUMBER,
    SERVER_NAME,
    GUEST_COUNT,
    SERVICE_RATING,
    // not backed by any order field yet
    CASHIER_NAME;

    /**
     * Case-sensitive lookup by constant name.
     */
    public static Optional<DynamicField> fromName(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        for (DynamicField field : values()) {
            if (field.name().equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
