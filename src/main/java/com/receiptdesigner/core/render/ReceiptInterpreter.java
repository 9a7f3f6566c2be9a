package com.receiptdesigner.core.render;

import com.receiptdesigner.config.ConfigService;
import com.receiptdesigner.config.RenderSettings;
import com.receiptdesigner.core.command.CutCommand;
import com.receiptdesigner.core.command.FeedCommand;
import com.receiptdesigner.core.command.PrinterCommand;
import com.receiptdesigner.core.command.TextCommand;
import com.receiptdesigner.core.json.DesignDocumentReader;
import com.receiptdesigner.core.model.AlignElement;
import com.receiptdesigner.core.model.Alignment;
import com.receiptdesigner.core.model.BarcodeElement;
import com.receiptdesigner.core.model.DesignDocument;
import com.receiptdesigner.core.model.DividerElement;
import com.receiptdesigner.core.model.DynamicElement;
import com.receiptdesigner.core.model.FeedLineElement;
import com.receiptdesigner.core.model.ItemsListElement;
import com.receiptdesigner.core.model.QrCodeElement;
import com.receiptdesigner.core.model.ReceiptElement;
import com.receiptdesigner.core.model.TextElement;
import com.receiptdesigner.core.model.TextStyle;
import com.receiptdesigner.core.model.UnknownElement;
import com.receiptdesigner.core.order.Order;
import com.receiptdesigner.logging.AppLogger;
import org.json.JSONObject;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Interprets a receipt design against an order and produces the printer commands.
 *
 * <p>Elements are processed once, in order, with a running ambient alignment that only
 * {@code align} elements change. Each call is independent; instances are immutable and may be
 * shared between threads.</p>
 *
 * <p>If anything fails while rendering, the partial output is discarded and the fixed error
 * receipt from {@link #errorReceipt()} is returned instead.</p>
 */
public final class ReceiptInterpreter {
    private static final Logger LOGGER = AppLogger.get();

    static final String ERROR_TEXT = "Error occurred";

    private final ValueResolver resolver;
    private final ItemListRenderer itemListRenderer;

    public ReceiptInterpreter() {
        this(ConfigService.getInstance().renderSettings());
    }

    public ReceiptInterpreter(RenderSettings settings) {
        this.resolver = new ValueResolver(settings);
        this.itemListRenderer = new ItemListRenderer(resolver);
    }

    /**
     * @param document the design to print
     * @param order    order data, or {@code null} to print with placeholder defaults and no items
     */
    public List<PrinterCommand> render(DesignDocument document, Order order) {
        try {
            return interpret(Objects.requireNonNull(document, "document"), order);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Receipt rendering failed, printing error receipt", ex);
            return errorReceipt();
        }
    }

    /**
     * Decodes a JSON-shaped design ({@code {"elements": [...]}}) and renders it. Decoding problems
     * are treated like any other render failure.
     */
    public List<PrinterCommand> render(JSONObject design, Order order) {
        try {
            DesignDocument document = DesignDocumentReader.read(Objects.requireNonNull(design, "design"));
            return interpret(document, order);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Receipt rendering failed, printing error receipt", ex);
            return errorReceipt();
        }
    }

    public static List<PrinterCommand> errorReceipt() {
        return List.of(
            new TextCommand(ERROR_TEXT, TextStyle.BOLD),
            new FeedCommand(1),
            new CutCommand()
        );
    }

    private List<PrinterCommand> interpret(DesignDocument document, Order order) {
        CommandBuffer out = new CommandBuffer();
        AlignmentState ambient = new AlignmentState();
        for (ReceiptElement element : document.elements()) {
            switch (element.type()) {
                case TEXT -> {
                    TextElement text = (TextElement) element;
                    out.alignTo(ambient.current());
                    out.text(resolver.substitutePlaceholders(text.content(), order), text.style());
                }
                case ALIGN -> {
                    Alignment alignment = ((AlignElement) element).alignment();
                    ambient.set(alignment);
                    out.setAlignment(alignment);
                }
                case FEED_LINE -> out.feed(((FeedLineElement) element).lines());
                case BARCODE -> {
                    BarcodeElement barcode = (BarcodeElement) element;
                    out.alignTo(ambient.current());
                    out.barcode(barcode.data(), barcode.barcodeType());
                }
                case QRCODE -> {
                    QrCodeElement qr = (QrCodeElement) element;
                    out.alignTo(ambient.current());
                    out.qrCode(resolver.substitutePlaceholders(qr.data(), order), qr.size());
                }
                case DIVIDER -> {
                    out.alignTo(Alignment.CENTER);
                    out.text(((DividerElement) element).content());
                }
                case DYNAMIC -> {
                    out.alignTo(ambient.current());
                    out.text(resolver.resolveField(((DynamicElement) element).field(), order));
                }
                case ITEMS_LIST -> {
                    if (order != null) {
                        itemListRenderer.render((ItemsListElement) element, order, out);
                    }
                }
                case SPLIT_PAYMENTS -> {
                    // nothing to print until split payments carry data
                }
                case CUT_PAPER -> out.cut();
                case UNKNOWN -> LOGGER.warning(
                    "Skipping unknown element type '" + ((UnknownElement) element).rawType() + "'");
            }
        }
        return out.toList();
    }
}
