package com.receiptdesigner.core.model;

import java.util.Locale;

/**
 * Barcode symbologies accepted by {@code barcode} elements.
 */
public enum BarcodeType {
    UPC_A,
    UPC_E,
    EAN13,
    JAN13,
    EAN8,
    JAN8,
    CODE39,
    ITF,
    CODABAR,
    CODE93,
    CODE128,
    GS1_128,
    GS1_DATABAR_OMNIDIRECTIONAL,
    GS1_DATABAR_TRUNCATED,
    GS1_DATABAR_LIMITED,
    GS1_DATABAR_EXPANDED;

    /**
     * Strict lookup. Blank input maps to {@link #CODE128}; any other unknown name is rejected.
     *
     * @throws IllegalArgumentException if the name is not a supported symbology
     */
    public static BarcodeType fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return CODE128;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (BarcodeType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported barcode type: " + raw);
    }
}
