package com.receiptdesigner.core.order;

import java.math.BigDecimal;
import java.util.List;

/**
 * One purchased product within an order.
 *
 * @param sku      optional stock keeping unit; blank counts as absent
 * @param category optional product category; blank counts as absent
 */
public record LineItem(String name,
                       int quantity,
                       BigDecimal unitPrice,
                       BigDecimal totalPrice,
                       String sku,
                       String category,
                       List<String> modifiers) {

    public LineItem {
        name = name == null ? "" : name;
        unitPrice = unitPrice == null ? BigDecimal.ZERO : unitPrice;
        totalPrice = totalPrice == null ? BigDecimal.ZERO : totalPrice;
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    }

    public LineItem(String name, int quantity, BigDecimal unitPrice, BigDecimal totalPrice) {
        this(name, quantity, unitPrice, totalPrice, null, null, List.of());
    }

    public boolean hasSku() {
        return sku != null && !sku.isBlank();
    }

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }
}
