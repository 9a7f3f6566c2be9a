package com.receiptdesigner.core.model;

/**
 * Renders the order's line items through {@code itemTemplate}, the per-item mini-template.
 * An empty template selects the built-in two-line layout.
 */
public record ItemsListElement(String itemTemplate,
                               boolean showSku,
                               boolean showCategory,
                               boolean showModifiers,
                               boolean showUnitPrice) implements ReceiptElement {

    public ItemsListElement {
        itemTemplate = itemTemplate == null ? "" : itemTemplate;
    }

    public ItemsListElement(String itemTemplate) {
        this(itemTemplate, false, false, false, false);
    }

    @Override
    public ElementType type() {
        return ElementType.ITEMS_LIST;
    }
}
