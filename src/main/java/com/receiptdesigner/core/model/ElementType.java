package com.receiptdesigner.core.model;

/**
 * Element tags as they appear in the {@code type} field of a design document.
 */
public enum ElementType {
    TEXT("text"),
    ALIGN("align"),
    FEED_LINE("feedLine"),
    BARCODE("barcode"),
    QRCODE("qrcode"),
    DIVIDER("divider"),
    DYNAMIC("dynamic"),
    ITEMS_LIST("items_list"),
    SPLIT_PAYMENTS("split_payments"),
    CUT_PAPER("cutPaper"),
    UNKNOWN("");

    private final String wireName;

    ElementType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Exact, case-sensitive match on the wire name. Unmatched names map to {@link #UNKNOWN}.
     */
    public static ElementType fromWireName(String name) {
        if (name == null || name.isEmpty()) {
            return UNKNOWN;
        }
        for (ElementType type : values()) {
            if (type != UNKNOWN && type.wireName.equals(name)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
