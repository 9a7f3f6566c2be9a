package com.receiptdesigner.core.model;

/**
 * Separator line, always printed centered.
 */
public record DividerElement(String content) implements ReceiptElement {

    public static final String DEFAULT_CONTENT = "=".repeat(32);

    public DividerElement {
        content = content == null ? DEFAULT_CONTENT : content;
    }

    public DividerElement() {
        this(DEFAULT_CONTENT);
    }

    @Override
    public ElementType type() {
        return ElementType.DIVIDER;
    }
}
