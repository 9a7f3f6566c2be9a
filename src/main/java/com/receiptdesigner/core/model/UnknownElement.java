package com.receiptdesigner.core.model;

/**
 * Placeholder for an element whose {@code type} is not recognised. Keeps the raw tag for diagnostics.
 */
public record UnknownElement(String rawType) implements ReceiptElement {

    public UnknownElement {
        rawType = rawType == null ? "" : rawType;
    }

    @Override
    public ElementType type() {
        return ElementType.UNKNOWN;
    }
}
