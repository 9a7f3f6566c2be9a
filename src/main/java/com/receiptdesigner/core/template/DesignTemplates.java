package com.receiptdesigner.core.template;

import com.receiptdesigner.core.model.AlignElement;
import com.receiptdesigner.core.model.Alignment;
import com.receiptdesigner.core.model.CutPaperElement;
import com.receiptdesigner.core.model.DesignDocument;
import com.receiptdesigner.core.model.DividerElement;
import com.receiptdesigner.core.model.FeedLineElement;
import com.receiptdesigner.core.model.ItemsListElement;
import com.receiptdesigner.core.model.QrCodeElement;
import com.receiptdesigner.core.model.TextElement;
import com.receiptdesigner.core.model.TextSize;
import com.receiptdesigner.core.model.TextStyle;

import java.util.Locale;
import java.util.Optional;

/**
 * Starter designs offered by the receipt editor.
 */
public final class DesignTemplates {

    public static final String DEFAULT_ITEM_TEMPLATE =
        "{{align:left}}{{quantity}}x {{name}}\n{{align:right}}${{totalPrice}}\n{{feedLine}}";

    private static final TextStyle HEADLINE = new TextStyle(true, false, TextSize.LARGE);
    private static final TextStyle BANNER = new TextStyle(true, false, TextSize.XLARGE);

    private DesignTemplates() {
    }

    public static DesignDocument basic() {
        return DesignDocument.of(
            new AlignElement(Alignment.CENTER),
            new TextElement("Welcome to {{STORE_NAME}}", HEADLINE),
            new TextElement("Store #{{STORE_NUMBER}}"),
            new FeedLineElement(1),
            new AlignElement(Alignment.LEFT),
            new TextElement("Order ID: {{ORDER_ID}}"),
            new FeedLineElement(1),
            new DividerElement(),
            new FeedLineElement(1),
            new ItemsListElement(DEFAULT_ITEM_TEMPLATE),
            new FeedLineElement(1),
            new DividerElement(),
            new AlignElement(Alignment.CENTER),
            new TextElement("Thank you for your order!"),
            new FeedLineElement(3),
            new CutPaperElement()
        );
    }

    public static DesignDocument detailed() {
        return DesignDocument.of(
            new AlignElement(Alignment.CENTER),
            new TextElement("{{STORE_NAME}}", BANNER),
            new TextElement("Store Address Line 1"),
            new TextElement("Phone: (555) 123-4567"),
            new FeedLineElement(1),
            new DividerElement(),
            new AlignElement(Alignment.LEFT),
            new TextElement("Date: {{TIMESTAMP}}"),
            new TextElement("Order: {{ORDER_ID}}"),
            new TextElement("Cashier: {{CASHIER_NAME}}"),
            new FeedLineElement(1),
            new ItemsListElement(DEFAULT_ITEM_TEMPLATE),
            new FeedLineElement(1),
            new DividerElement(),
            new TextElement("Subtotal: {{SUBTOTAL}}"),
            new TextElement("Tax: {{TAX}}"),
            new TextElement("Total: {{TOTAL}}", HEADLINE),
            new FeedLineElement(1),
            new AlignElement(Alignment.CENTER),
            new QrCodeElement("https://{{STORE_NAME}}.com/receipt/{{ORDER_ID}}", QrCodeElement.DEFAULT_SIZE),
            new FeedLineElement(1),
            new TextElement("Thank you for your business!"),
            new FeedLineElement(2),
            new CutPaperElement()
        );
    }

    /**
     * Case-insensitive lookup of {@code basic} or {@code detailed}.
     */
    public static Optional<DesignDocument> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "basic" -> Optional.of(basic());
            case "detailed" -> Optional.of(detailed());
            default -> Optional.empty();
        };
    }
}
