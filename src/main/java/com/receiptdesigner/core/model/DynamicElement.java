package com.receiptdesigner.core.model;

public record DynamicElement(String field) implements ReceiptElement {

    public DynamicElement {
        field = field == null ? "" : field;
    }

    @Override
    public ElementType type() {
        return ElementType.DYNAMIC;
    }
}
