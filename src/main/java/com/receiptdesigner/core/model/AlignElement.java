package com.receiptdesigner.core.model;

public record AlignElement(Alignment alignment) implements ReceiptElement {

    public AlignElement {
        alignment = alignment == null ? Alignment.LEFT : alignment;
    }

    @Override
    public ElementType type() {
        return ElementType.ALIGN;
    }
}
