package com.receiptdesigner.core.command;

import com.receiptdesigner.core.model.BarcodeType;

import java.util.Objects;

public record BarcodeCommand(String data, BarcodeType barcodeType) implements PrinterCommand {

    public BarcodeCommand {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(barcodeType, "barcodeType");
    }

    @Override
    public String name() {
        return "barcode";
    }
}
