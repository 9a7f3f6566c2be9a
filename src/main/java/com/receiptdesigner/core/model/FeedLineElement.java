package com.receiptdesigner.core.model;

public record FeedLineElement(int lines) implements ReceiptElement {

    public FeedLineElement {
        lines = Math.max(1, lines);
    }

    @Override
    public ElementType type() {
        return ElementType.FEED_LINE;
    }
}
