package com.receiptdesigner.core.model;

/**
 * QR code whose data may contain {@code {{FIELD}}} placeholders, typically a receipt URL.
 */
public record QrCodeElement(String data, int size) implements ReceiptElement {

    public static final int DEFAULT_SIZE = 3;

    public QrCodeElement {
        data = data == null ? "" : data;
    }

    @Override
    public ElementType type() {
        return ElementType.QRCODE;
    }
}
