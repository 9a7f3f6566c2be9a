package com.receiptdesigner.core.json;

import com.receiptdesigner.core.order.CustomerInfo;
import com.receiptdesigner.core.order.ItemPromotion;
import com.receiptdesigner.core.order.LineItem;
import com.receiptdesigner.core.order.Order;
import com.receiptdesigner.core.order.OrderPromotion;
import com.receiptdesigner.core.order.PromotionType;
import com.receiptdesigner.core.order.TableInfo;
import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds an {@link Order} from its JSON form. Absent strings stay {@code null} so the value
 * resolver's defaults apply; absent amounts read as zero.
 */
public final class OrderJsonReader {
    private OrderJsonReader() {
    }

    public static Order read(JSONObject root) {
        Objects.requireNonNull(root, "root");
        Order.Builder builder = Order.builder()
            .storeName(optText(root, "storeName"))
            .storeNumber(optText(root, "storeNumber"))
            .orderId(optText(root, "orderId"))
            .timestamp(optInstant(root, "timestamp"))
            .subtotal(optAmount(root, "subtotal"))
            .taxRate(optAmount(root, "taxRate"))
            .taxAmount(optAmount(root, "taxAmount"))
            .totalAmount(optAmount(root, "totalAmount"))
            .paymentMethod(optText(root, "paymentMethod"))
            .customerInfo(readCustomer(root.optJSONObject("customerInfo")))
            .tableInfo(readTable(root.optJSONObject("tableInfo")))
            .items(readItems(root.optJSONArray("items")));

        JSONArray itemPromotions = root.optJSONArray("itemPromotions");
        if (itemPromotions != null) {
            for (int i = 0; i < itemPromotions.length(); i++) {
                JSONObject promo = itemPromotions.optJSONObject(i);
                if (promo != null) {
                    builder.addItemPromotion(new ItemPromotion(
                        promo.optString("promotionName", ""),
                        optAmount(promo, "discountAmount")));
                }
            }
        }
        JSONArray orderPromotions = root.optJSONArray("orderPromotions");
        if (orderPromotions != null) {
            for (int i = 0; i < orderPromotions.length(); i++) {
                JSONObject promo = orderPromotions.optJSONObject(i);
                if (promo != null) {
                    builder.addOrderPromotion(new OrderPromotion(
                        promo.optString("promotionName", ""),
                        optAmount(promo, "discountAmount"),
                        PromotionType.fromName(promo.optString("promotionType", null))));
                }
            }
        }
        return builder.build();
    }

    private static CustomerInfo readCustomer(JSONObject json) {
        if (json == null) {
            return null;
        }
        return new CustomerInfo(
            optText(json, "customerId"),
            optText(json, "name"),
            optText(json, "memberStatus"),
            json.optInt("loyaltyPoints", 0),
            optText(json, "memberSince"));
    }

    private static TableInfo readTable(JSONObject json) {
        if (json == null) {
            return null;
        }
        return new TableInfo(
            optText(json, "tableNumber"),
            optText(json, "serverName"),
            json.optInt("guestCount", 1),
            json.optBigDecimal("serviceRating", null));
    }

    private static List<LineItem> readItems(JSONArray array) {
        List<LineItem> items = new ArrayList<>();
        if (array == null) {
            return items;
        }
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null) {
                throw new IllegalArgumentException("Item #" + i + " is not an object");
            }
            List<String> modifiers = new ArrayList<>();
            JSONArray rawModifiers = item.optJSONArray("modifiers");
            if (rawModifiers != null) {
                for (int j = 0; j < rawModifiers.length(); j++) {
                    String modifier = rawModifiers.optString(j, "");
                    if (!modifier.isEmpty()) {
                        modifiers.add(modifier);
                    }
                }
            }
            items.add(new LineItem(
                item.optString("name", ""),
                item.optInt("quantity", 1),
                optAmount(item, "unitPrice"),
                optAmount(item, "totalPrice"),
                optText(item, "sku"),
                optText(item, "category"),
                modifiers));
        }
        return items;
    }

    private static String optText(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        return json.optString(key, null);
    }

    private static BigDecimal optAmount(JSONObject json, String key) {
        return json.optBigDecimal(key, BigDecimal.ZERO);
    }

    private static Instant optInstant(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        long millis = json.optLong(key, Long.MIN_VALUE);
        if (millis == Long.MIN_VALUE) {
            throw new IllegalArgumentException("'" + key + "' must be epoch milliseconds");
        }
        return Instant.ofEpochMilli(millis);
    }
}
