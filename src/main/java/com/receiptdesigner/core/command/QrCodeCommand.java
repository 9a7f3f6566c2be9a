package com.receiptdesigner.core.command;

import java.util.Objects;

public record QrCodeCommand(String data, int size) implements PrinterCommand {

    public QrCodeCommand {
        Objects.requireNonNull(data, "data");
    }

    @Override
    public String name() {
        return "qrcode";
    }
}
