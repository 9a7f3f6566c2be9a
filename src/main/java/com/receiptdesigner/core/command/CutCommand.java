package com.receiptdesigner.core.command;

public record CutCommand() implements PrinterCommand {

    @Override
    public String name() {
        return "cut";
    }
}
