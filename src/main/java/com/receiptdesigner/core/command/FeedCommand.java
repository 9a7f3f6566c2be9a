package com.receiptdesigner.core.command;

public record FeedCommand(int lines) implements PrinterCommand {

    @Override
    public String name() {
        return "feed";
    }
}
