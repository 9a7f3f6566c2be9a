package com.receiptdesigner.core.json;

import com.receiptdesigner.core.model.AlignElement;
import com.receiptdesigner.core.model.Alignment;
import com.receiptdesigner.core.model.BarcodeElement;
import com.receiptdesigner.core.model.BarcodeType;
import com.receiptdesigner.core.model.CutPaperElement;
import com.receiptdesigner.core.model.DividerElement;
import com.receiptdesigner.core.model.DynamicElement;
import com.receiptdesigner.core.model.ElementType;
import com.receiptdesigner.core.model.FeedLineElement;
import com.receiptdesigner.core.model.ItemsListElement;
import com.receiptdesigner.core.model.QrCodeElement;
import com.receiptdesigner.core.model.ReceiptElement;
import com.receiptdesigner.core.model.SplitPaymentsElement;
import com.receiptdesigner.core.model.TextElement;
import com.receiptdesigner.core.model.TextSize;
import com.receiptdesigner.core.model.TextStyle;
import com.receiptdesigner.core.model.UnknownElement;
import org.json.JSONObject;

import java.util.Objects;

/**
 * Turns one element record of a design document into its typed variant. Missing optional fields
 * take their defaults; only a present but unsupported {@code barcodeType} is rejected.
 */
public final class ElementDecoder {
    private ElementDecoder() {
    }

    public static ReceiptElement decode(JSONObject json) {
        Objects.requireNonNull(json, "json");
        String rawType = json.optString("type", "");
        return switch (ElementType.fromWireName(rawType)) {
            case TEXT -> new TextElement(json.optString("content", ""), readStyle(json.optJSONObject("style")));
            case ALIGN -> new AlignElement(Alignment.fromName(json.optString("alignment", "LEFT")));
            case FEED_LINE -> new FeedLineElement(json.optInt("lines", 1));
            case BARCODE -> new BarcodeElement(json.optString("data", ""), readBarcodeType(json));
            case QRCODE -> new QrCodeElement(json.optString("data", ""), readQrSize(json));
            case DIVIDER -> new DividerElement(json.optString("content", DividerElement.DEFAULT_CONTENT));
            case DYNAMIC -> new DynamicElement(json.optString("field", ""));
            case ITEMS_LIST -> new ItemsListElement(
                json.optString("itemTemplate", ""),
                json.optBoolean("showSku", false),
                json.optBoolean("showCategory", false),
                json.optBoolean("showModifiers", false),
                json.optBoolean("showUnitPrice", false)
            );
            case SPLIT_PAYMENTS -> new SplitPaymentsElement();
            case CUT_PAPER -> new CutPaperElement();
            case UNKNOWN -> new UnknownElement(rawType);
        };
    }

    private static TextStyle readStyle(JSONObject style) {
        if (style == null) {
            return TextStyle.PLAIN;
        }
        return new TextStyle(
            style.optBoolean("bold", false),
            style.optBoolean("underline", false),
            TextSize.fromName(style.optString("size", "NORMAL"))
        );
    }

    private static BarcodeType readBarcodeType(JSONObject json) {
        String raw = json.optString("barcodeType", "CODE128");
        try {
            return BarcodeType.fromName(raw);
        } catch (IllegalArgumentException ex) {
            throw new ElementDecodingException(ex.getMessage(), ex);
        }
    }

    private static int readQrSize(JSONObject json) {
        if (json.has("qrSize")) {
            return json.optInt("qrSize", QrCodeElement.DEFAULT_SIZE);
        }
        return json.optInt("size", QrCodeElement.DEFAULT_SIZE);
    }
}
