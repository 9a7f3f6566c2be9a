package com.receiptdesigner.core.command;

import com.receiptdesigner.core.model.Alignment;

import java.util.Objects;

public record SetAlignmentCommand(Alignment alignment) implements PrinterCommand {

    public SetAlignmentCommand {
        Objects.requireNonNull(alignment, "alignment");
    }

    @Override
    public String name() {
        return "align";
    }
}
