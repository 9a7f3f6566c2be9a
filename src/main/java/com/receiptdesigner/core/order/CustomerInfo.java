package com.receiptdesigner.core.order;

/**
 * Loyalty / member details attached to an order. {@code memberStatus} and {@code memberSince} are optional.
 */
public record CustomerInfo(String customerId,
                           String name,
                           String memberStatus,
                           int loyaltyPoints,
                           String memberSince) {
}
