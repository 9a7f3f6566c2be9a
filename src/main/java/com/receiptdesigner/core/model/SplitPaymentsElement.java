package com.receiptdesigner.core.model;

/**
 * Reserved slot for split-payment details. Currently renders nothing.
 */
public record SplitPaymentsElement() implements ReceiptElement {

    @Override
    public ElementType type() {
        return ElementType.SPLIT_PAYMENTS;
    }
}
