package com.receiptdesigner.core.command;

import com.receiptdesigner.core.model.TextStyle;

import java.util.Objects;

public record TextCommand(String text, TextStyle style) implements PrinterCommand {

    public TextCommand {
        Objects.requireNonNull(text, "text");
        style = style == null ? TextStyle.PLAIN : style;
    }

    public TextCommand(String text) {
        this(text, TextStyle.PLAIN);
    }

    @Override
    public String name() {
        return "text";
    }
}
