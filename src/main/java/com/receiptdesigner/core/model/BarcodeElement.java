package com.receiptdesigner.core.model;

/**
 * Barcode whose data is printed verbatim; placeholders are not expanded.
 */
public record BarcodeElement(String data, BarcodeType barcodeType) implements ReceiptElement {

    public BarcodeElement {
        data = data == null ? "" : data;
        barcodeType = barcodeType == null ? BarcodeType.CODE128 : barcodeType;
    }

    @Override
    public ElementType type() {
        return ElementType.BARCODE;
    }
}
