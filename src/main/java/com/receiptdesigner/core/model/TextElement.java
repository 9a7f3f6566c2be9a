package com.receiptdesigner.core.model;

/**
 * Literal text that may contain {@code {{FIELD}}} placeholders.
 */
public record TextElement(String content, TextStyle style) implements ReceiptElement {

    public TextElement {
        content = content == null ? "" : content;
        style = style == null ? TextStyle.PLAIN : style;
    }

    public TextElement(String content) {
        this(content, TextStyle.PLAIN);
    }

    @Override
    public ElementType type() {
        return ElementType.TEXT;
    }
}
