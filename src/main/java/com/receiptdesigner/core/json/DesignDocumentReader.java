package com.receiptdesigner.core.json;

import com.receiptdesigner.core.model.DesignDocument;
import com.receiptdesigner.core.model.ReceiptElement;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the {@code {"elements": [...]}} shape produced by the receipt designer into a {@link DesignDocument}.
 */
public final class DesignDocumentReader {
    private DesignDocumentReader() {
    }

    public static DesignDocument read(JSONObject root) {
        Objects.requireNonNull(root, "root");
        JSONArray elements = root.optJSONArray("elements");
        if (elements == null) {
            if (root.has("elements") && !root.isNull("elements")) {
                throw new ElementDecodingException("'elements' must be an array");
            }
            return new DesignDocument(List.of());
        }
        return read(elements);
    }

    public static DesignDocument read(JSONArray elements) {
        Objects.requireNonNull(elements, "elements");
        List<ReceiptElement> decoded = new ArrayList<>(elements.length());
        for (int i = 0; i < elements.length(); i++) {
            JSONObject node = elements.optJSONObject(i);
            if (node == null) {
                throw new ElementDecodingException("Element #" + i + " is not an object");
            }
            try {
                decoded.add(ElementDecoder.decode(node));
            } catch (ElementDecodingException ex) {
                throw new ElementDecodingException("Element #" + i + ": " + ex.getMessage(), ex);
            }
        }
        return new DesignDocument(decoded);
    }
}
