package com.receiptdesigner.core.model;

import java.util.Locale;

/**
 * Horizontal text alignment understood by receipt printers.
 */
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT;

    /**
     * Lenient lookup used by the element decoder; anything unrecognised is {@link #LEFT}.
     */
    public static Alignment fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            return LEFT;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "CENTER" -> CENTER;
            case "RIGHT" -> RIGHT;
            default -> LEFT;
        };
    }
}
