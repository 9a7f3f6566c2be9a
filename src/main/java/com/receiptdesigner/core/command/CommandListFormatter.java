package com.receiptdesigner.core.command;

import com.receiptdesigner.core.model.TextSize;
import com.receiptdesigner.core.model.TextStyle;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Serialises a command list for the printer-driving side, either as a readable listing or as JSON.
 */
public final class CommandListFormatter {

    private CommandListFormatter() {
    }

    /**
     * One line per command, e.g. {@code TEXT [bold,LARGE] Welcome}.
     */
    public static String toText(List<PrinterCommand> commands) {
        Objects.requireNonNull(commands, "commands");
        StringBuilder builder = new StringBuilder();
        for (PrinterCommand command : commands) {
            builder.append(describe(command)).append(System.lineSeparator());
        }
        return builder.toString();
    }

    public static JSONArray toJson(List<PrinterCommand> commands) {
        Objects.requireNonNull(commands, "commands");
        JSONArray array = new JSONArray();
        for (PrinterCommand command : commands) {
            array.put(toJson(command));
        }
        return array;
    }

    static String describe(PrinterCommand command) {
        if (command instanceof SetAlignmentCommand align) {
            return "ALIGN " + align.alignment();
        }
        if (command instanceof FeedCommand feed) {
            return "FEED " + feed.lines();
        }
        if (command instanceof TextCommand text) {
            String flags = styleFlags(text.style());
            return flags.isEmpty() ? "TEXT " + text.text() : "TEXT [" + flags + "] " + text.text();
        }
        if (command instanceof BarcodeCommand barcode) {
            return "BARCODE " + barcode.barcodeType() + " " + barcode.data();
        }
        if (command instanceof QrCodeCommand qr) {
            return "QRCODE size=" + qr.size() + " " + qr.data();
        }
        if (command instanceof CutCommand) {
            return "CUT";
        }
        return command.name().toUpperCase(Locale.ROOT);
    }

    private static JSONObject toJson(PrinterCommand command) {
        JSONObject json = new JSONObject();
        json.put("command", command.name());
        if (command instanceof SetAlignmentCommand align) {
            json.put("alignment", align.alignment().name());
        } else if (command instanceof FeedCommand feed) {
            json.put("lines", feed.lines());
        } else if (command instanceof TextCommand text) {
            json.put("text", text.text());
            JSONObject style = new JSONObject();
            style.put("bold", text.style().bold());
            style.put("underline", text.style().underline());
            style.put("size", text.style().size().name());
            json.put("style", style);
        } else if (command instanceof BarcodeCommand barcode) {
            json.put("data", barcode.data());
            json.put("barcodeType", barcode.barcodeType().name());
        } else if (command instanceof QrCodeCommand qr) {
            json.put("data", qr.data());
            json.put("size", qr.size());
        }
        return json;
    }

    private static String styleFlags(TextStyle style) {
        List<String> flags = new ArrayList<>();
        if (style.bold()) {
            flags.add("bold");
        }
        if (style.underline()) {
            flags.add("underline");
        }
        if (style.size() != TextSize.NORMAL) {
            flags.add(style.size().name());
        }
        return String.join(",", flags);
    }
}
