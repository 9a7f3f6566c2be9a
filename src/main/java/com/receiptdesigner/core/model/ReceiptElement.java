package com.receiptdesigner.core.model;

/**
 * One entry of a {@link DesignDocument}. Implementations are immutable records, one per {@link ElementType}.
 */
public interface ReceiptElement {

    ElementType type();
}
