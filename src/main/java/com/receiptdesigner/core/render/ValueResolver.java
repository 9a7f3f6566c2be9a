package com.receiptdesigner.core.render;

import com.receiptdesigner.config.RenderSettings;
import com.receiptdesigner.core.order.CustomerInfo;
import com.receiptdesigner.core.order.LineItem;
import com.receiptdesigner.core.order.Order;
import com.receiptdesigner.core.order.TableInfo;
import com.receiptdesigner.logging.AppLogger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps field names to printable strings. Stateless apart from its {@link RenderSettings}; never
 * returns {@code null} for a known field and never throws for missing order data.
 */
public final class ValueResolver {
    private static final Logger LOGGER = AppLogger.get();

    static final String CASHIER_PLACEHOLDER = "Cashier";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Za-z_]+)}}");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RenderSettings settings;

    public ValueResolver(RenderSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Resolves one dynamic field. Unknown names are returned unchanged.
     *
     * @param order may be {@code null}, in which case every field yields its default
     */
    public String resolveField(String name, Order order) {
        return DynamicField.fromName(name)
            .map(field -> resolve(field, order))
            .orElseGet(() -> {
                LOGGER.fine(() -> "Unknown dynamic field '" + name + "', printing it literally");
                return name == null ? "" : name;
            });
    }

    public String resolve(DynamicField field, Order order) {
        CustomerInfo customer = order == null ? null : order.customerInfo();
        TableInfo table = order == null ? null : order.tableInfo();
        return switch (field) {
            case STORE_NAME -> order == null ? "Store Name" : orDefault(order.storeName(), "Store Name");
            case STORE_NUMBER -> order == null ? "001" : orDefault(order.storeNumber(), "001");
            case ORDER_ID -> order == null ? "ORD123456" : orDefault(order.orderId(), "ORD123456");
            case TIMESTAMP -> formatTimestamp(order == null ? null : order.timestamp());
            case SUBTOTAL -> formatMoney(order == null ? BigDecimal.ZERO : order.subtotal());
            case TAX_RATE -> formatPercent(order == null ? BigDecimal.ZERO : order.taxRate().multiply(HUNDRED));
            case TAX -> formatMoney(order == null ? BigDecimal.ZERO : order.taxAmount());
            case TOTAL -> formatMoney(order == null ? BigDecimal.ZERO : order.totalAmount());
            case PAYMENT_METHOD -> order == null ? "Cash" : orDefault(order.paymentMethod(), "Cash");
            case ITEM_COUNT -> order == null ? "0" : Integer.toString(order.items().size());
            case TOTAL_QUANTITY -> order == null ? "0" : Integer.toString(order.totalQuantity());
            case CUSTOMER_ID -> customer == null ? "GUEST001" : orDefault(customer.customerId(), "GUEST001");
            case CUSTOMER_NAME -> customer == null ? "Guest" : orDefault(customer.name(), "Guest");
            case MEMBER_STATUS -> customer == null ? "Regular" : orDefault(customer.memberStatus(), "Regular");
            case LOYALTY_POINTS -> customer == null ? "0" : Integer.toString(customer.loyaltyPoints());
            case MEMBER_SINCE -> customer == null ? "N/A" : orDefault(customer.memberSince(), "N/A");
            case TABLE_NUMBER -> table == null ? "N/A" : orDefault(table.tableNumber(), "N/A");
            case SERVER_NAME -> table == null ? "Server" : orDefault(table.serverName(), "Server");
            case GUEST_COUNT -> table == null ? "1" : Integer.toString(table.guestCount());
            case SERVICE_RATING -> table == null || table.serviceRating() == null
                ? "N/A"
                : table.serviceRating().toPlainString();
            case CASHIER_NAME -> CASHIER_PLACEHOLDER;
        };
    }

    /**
     * Replaces every {@code {{FIELD}}} token naming a {@link DynamicField} in one left-to-right pass.
     * Other {@code {{...}}} tokens are left for the directive parser. Substituted values are not rescanned.
     */
    public String substitutePlaceholders(String text, Order order) {
        return substitute(text, name -> DynamicField.fromName(name)
            .map(field -> resolve(field, order))
            .orElse(null));
    }

    /**
     * Item-template counterpart of {@link #substitutePlaceholders}: expands {@code name}, {@code quantity},
     * {@code unitPrice}, {@code totalPrice}, {@code sku}, {@code category} and {@code modifiers}.
     */
    public String substituteItemPlaceholders(String template, LineItem item) {
        Objects.requireNonNull(item, "item");
        return substitute(template, name -> resolveItemField(name, item));
    }

    /**
     * @return the formatted item value, or {@code null} when {@code name} is not an item field
     */
    public String resolveItemField(String name, LineItem item) {
        return switch (name) {
            case "name" -> item.name();
            case "quantity" -> Integer.toString(item.quantity());
            case "unitPrice" -> formatAmount(item.unitPrice());
            case "totalPrice" -> formatAmount(item.totalPrice());
            case "sku" -> item.sku() == null ? "" : item.sku();
            case "category" -> item.category() == null ? "" : item.category();
            case "modifiers" -> String.join(", ", item.modifiers());
            default -> null;
        };
    }

    /**
     * Currency symbol followed by the amount with two decimals, e.g. {@code $4.00}.
     */
    public String formatMoney(BigDecimal amount) {
        return settings.currencySymbol() + formatAmount(amount);
    }

    /**
     * Two decimals, no currency symbol.
     */
    public String formatAmount(BigDecimal amount) {
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * One decimal followed by {@code %}; the argument is already in percent.
     */
    public String formatPercent(BigDecimal percent) {
        BigDecimal value = percent == null ? BigDecimal.ZERO : percent;
        return value.setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
    }

    private String formatTimestamp(Instant timestamp) {
        Instant instant = timestamp == null ? settings.clock().instant() : timestamp;
        return settings.timestampFormatter().format(instant);
    }

    private static String substitute(String text, Function<String, String> lookup) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (matcher.find()) {
            String value = lookup.apply(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
