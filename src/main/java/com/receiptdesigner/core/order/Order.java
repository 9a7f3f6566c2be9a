package com.receiptdesigner.core.order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only snapshot of the order being printed. Collections are unmodifiable so rendering can
 * never alter the caller's data. String fields may be {@code null}; the value resolver supplies
 * defaults for them.
 */
public record Order(String storeName,
                    String storeNumber,
                    String orderId,
                    Instant timestamp,
                    BigDecimal subtotal,
                    BigDecimal taxRate,
                    BigDecimal taxAmount,
                    BigDecimal totalAmount,
                    String paymentMethod,
                    CustomerInfo customerInfo,
                    TableInfo tableInfo,
                    List<LineItem> items,
                    List<ItemPromotion> itemPromotions,
                    List<OrderPromotion> orderPromotions) {

    public Order {
        subtotal = subtotal == null ? BigDecimal.ZERO : subtotal;
        taxRate = taxRate == null ? BigDecimal.ZERO : taxRate;
        taxAmount = taxAmount == null ? BigDecimal.ZERO : taxAmount;
        totalAmount = totalAmount == null ? BigDecimal.ZERO : totalAmount;
        items = items == null ? List.of() : List.copyOf(items);
        itemPromotions = itemPromotions == null ? List.of() : List.copyOf(itemPromotions);
        orderPromotions = orderPromotions == null ? List.of() : List.copyOf(orderPromotions);
    }

    /**
     * @throws ArithmeticException if the sum does not fit an {@code int}
     */
    public int totalQuantity() {
        int total = 0;
        for (LineItem item : items) {
            total = Math.addExact(total, item.quantity());
        }
        return total;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String storeName;
        private String storeNumber;
        private String orderId;
        private Instant timestamp;
        private BigDecimal subtotal;
        private BigDecimal taxRate;
        private BigDecimal taxAmount;
        private BigDecimal totalAmount;
        private String paymentMethod;
        private CustomerInfo customerInfo;
        private TableInfo tableInfo;
        private final List<LineItem> items = new ArrayList<>();
        private final List<ItemPromotion> itemPromotions = new ArrayList<>();
        private final List<OrderPromotion> orderPromotions = new ArrayList<>();

        private Builder() {
        }

        public Builder storeName(String storeName) {
            this.storeName = storeName;
            return this;
        }

        public Builder storeNumber(String storeNumber) {
            this.storeNumber = storeNumber;
            return this;
        }

        public Builder orderId(String orderId) {
            this.orderId = orderId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder subtotal(BigDecimal subtotal) {
            this.subtotal = subtotal;
            return this;
        }

        public Builder taxRate(BigDecimal taxRate) {
            this.taxRate = taxRate;
            return this;
        }

        public Builder taxAmount(BigDecimal taxAmount) {
            this.taxAmount = taxAmount;
            return this;
        }

        public Builder totalAmount(BigDecimal totalAmount) {
            this.totalAmount = totalAmount;
            return this;
        }

        public Builder paymentMethod(String paymentMethod) {
            this.paymentMethod = paymentMethod;
            return this;
        }

        public Builder customerInfo(CustomerInfo customerInfo) {
            this.customerInfo = customerInfo;
            return this;
        }

        public Builder tableInfo(TableInfo tableInfo) {
            this.tableInfo = tableInfo;
            return this;
        }

        public Builder addItem(LineItem item) {
            this.items.add(item);
            return this;
        }

        public Builder items(List<LineItem> items) {
            this.items.clear();
            this.items.addAll(items);
            return this;
        }

        public Builder addItemPromotion(ItemPromotion promotion) {
            this.itemPromotions.add(promotion);
            return this;
        }

        public Builder addOrderPromotion(OrderPromotion promotion) {
            this.orderPromotions.add(promotion);
            return this;
        }

        public Order build() {
            return new Order(storeName, storeNumber, orderId, timestamp, subtotal, taxRate, taxAmount,
                totalAmount, paymentMethod, customerInfo, tableInfo, items, itemPromotions, orderPromotions);
        }
    }
}
