package com.receiptdesigner.core.model;

public record CutPaperElement() implements ReceiptElement {

    @Override
    public ElementType type() {
        return ElementType.CUT_PAPER;
    }
}
