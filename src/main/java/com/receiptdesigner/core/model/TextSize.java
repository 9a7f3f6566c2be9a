package com.receiptdesigner.core.model;

import java.util.Locale;

public enum TextSize {
    SMALL,
    NORMAL,
    LARGE,
    XLARGE;

    public static TextSize fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return NORMAL;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "SMALL" -> SMALL;
            case "LARGE" -> LARGE;
            case "XLARGE" -> XLARGE;
            default -> NORMAL;
        };
    }
}
