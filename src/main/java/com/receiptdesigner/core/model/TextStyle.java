package com.receiptdesigner.core.model;

import java.util.Objects;

/**
 * Character styling attached to a text element or text command.
 */
public record TextStyle(boolean bold, boolean underline, TextSize size) {

    public static final TextStyle PLAIN = new TextStyle(false, false, TextSize.NORMAL);
    public static final TextStyle BOLD = new TextStyle(true, false, TextSize.NORMAL);
    public static final TextStyle SMALL = new TextStyle(false, false, TextSize.SMALL);

    public TextStyle {
        Objects.requireNonNull(size, "size");
    }
}
