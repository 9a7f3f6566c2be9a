package com.receiptdesigner.core.order;

import java.math.BigDecimal;

/**
 * Dine-in table details. {@code serviceRating} is optional and may be fractional.
 */
public record TableInfo(String tableNumber,
                        String serverName,
                        int guestCount,
                        BigDecimal serviceRating) {
}
