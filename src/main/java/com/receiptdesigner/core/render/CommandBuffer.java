package com.receiptdesigner.core.render;

import com.receiptdesigner.core.command.BarcodeCommand;
import com.receiptdesigner.core.command.CutCommand;
import com.receiptdesigner.core.command.FeedCommand;
import com.receiptdesigner.core.command.PrinterCommand;
import com.receiptdesigner.core.command.QrCodeCommand;
import com.receiptdesigner.core.command.SetAlignmentCommand;
import com.receiptdesigner.core.command.TextCommand;
import com.receiptdesigner.core.model.Alignment;
import com.receiptdesigner.core.model.BarcodeType;
import com.receiptdesigner.core.model.TextStyle;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the commands of one render pass and remembers which alignment the printer was
 * last told to use (printers start out left-aligned).
 */
final class CommandBuffer {
    private final List<PrinterCommand> commands = new ArrayList<>();
    private Alignment printerAlignment = Alignment.LEFT;

    /**
     * Always emits, even when the printer is already at {@code alignment}.
     */
    void setAlignment(Alignment alignment) {
        commands.add(new SetAlignmentCommand(alignment));
        printerAlignment = alignment;
    }

    /**
     * Emits a {@link SetAlignmentCommand} only when the printer is not already at {@code alignment}.
     */
    void alignTo(Alignment alignment) {
        if (printerAlignment != alignment) {
            setAlignment(alignment);
        }
    }

    void text(String text, TextStyle style) {
        commands.add(new TextCommand(text, style));
    }

    void text(String text) {
        text(text, TextStyle.PLAIN);
    }

    void feed(int lines) {
        commands.add(new FeedCommand(lines));
    }

    void barcode(String data, BarcodeType type) {
        commands.add(new BarcodeCommand(data, type));
    }

    void qrCode(String data, int size) {
        commands.add(new QrCodeCommand(data, size));
    }

    void cut() {
        commands.add(new CutCommand());
    }

    List<PrinterCommand> toList() {
        return List.copyOf(commands);
    }
}
