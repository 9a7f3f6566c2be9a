package com.receiptdesigner.core.render;

import com.receiptdesigner.core.model.Alignment;
import com.receiptdesigner.core.model.ItemsListElement;
import com.receiptdesigner.core.model.TextStyle;
import com.receiptdesigner.core.order.ItemPromotion;
import com.receiptdesigner.core.order.LineItem;
import com.receiptdesigner.core.order.Order;
import com.receiptdesigner.core.order.OrderPromotion;
import com.receiptdesigner.core.order.PromotionType;
import com.receiptdesigner.core.render.LineInstruction.AlignInstruction;
import com.receiptdesigner.core.render.LineInstruction.FeedInstruction;
import com.receiptdesigner.core.render.LineInstruction.TextInstruction;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Renders the line items of an order followed by item and order discount summaries.
 */
final class ItemListRenderer {
    private static final String DETAIL_INDENT = "  ";

    private final ValueResolver resolver;

    ItemListRenderer(ValueResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    void render(ItemsListElement element, Order order, CommandBuffer out) {
        for (LineItem item : order.items()) {
            if (element.itemTemplate().isEmpty()) {
                renderDefaultLayout(item, out);
            } else {
                renderTemplate(element.itemTemplate(), item, out);
            }
            renderDetails(element, item, out);
            out.feed(1);
        }
        renderItemPromotions(order, out);
        renderOrderPromotions(order, out);
    }

    private void renderTemplate(String template, LineItem item, CommandBuffer out) {
        String expanded = resolver.substituteItemPlaceholders(template, item);
        AlignmentState lineAlignment = new AlignmentState();
        for (String line : DirectiveLineParser.splitLines(expanded)) {
            for (LineInstruction instruction : DirectiveLineParser.parseLine(line)) {
                if (instruction instanceof AlignInstruction align) {
                    lineAlignment.set(align.alignment());
                } else if (instruction instanceof FeedInstruction feed) {
                    out.feed(feed.lines());
                } else if (instruction instanceof TextInstruction text) {
                    out.alignTo(lineAlignment.current());
                    out.text(text.text());
                }
            }
        }
    }

    private void renderDefaultLayout(LineItem item, CommandBuffer out) {
        String label = item.quantity() > 1 ? item.quantity() + "x " + item.name() : item.name();
        out.alignTo(Alignment.LEFT);
        out.text(label);
        out.alignTo(Alignment.RIGHT);
        out.text(resolver.formatMoney(item.totalPrice()));
        out.alignTo(Alignment.LEFT);
    }

    private void renderDetails(ItemsListElement element, LineItem item, CommandBuffer out) {
        if (element.showSku() && item.hasSku()) {
            out.alignTo(Alignment.LEFT);
            out.text(DETAIL_INDENT + "SKU: " + item.sku(), TextStyle.SMALL);
        }
        if (element.showCategory() && item.hasCategory()) {
            out.alignTo(Alignment.LEFT);
            out.text(DETAIL_INDENT + "Category: " + item.category(), TextStyle.SMALL);
        }
        if (element.showModifiers()) {
            for (String modifier : item.modifiers()) {
                out.alignTo(Alignment.LEFT);
                out.text(DETAIL_INDENT + "+ " + modifier, TextStyle.SMALL);
            }
        }
        if (element.showUnitPrice() && item.quantity() > 1) {
            out.alignTo(Alignment.RIGHT);
            out.text(resolver.formatMoney(item.unitPrice()) + " ea", TextStyle.SMALL);
            out.alignTo(Alignment.LEFT);
        }
    }

    private void renderItemPromotions(Order order, CommandBuffer out) {
        if (order.itemPromotions().isEmpty()) {
            return;
        }
        out.feed(1);
        out.alignTo(Alignment.LEFT);
        out.text("ITEM DISCOUNTS:", TextStyle.BOLD);
        for (ItemPromotion promotion : order.itemPromotions()) {
            renderDiscountLine(promotion.promotionName(), promotion.discountAmount(), out);
        }
        out.feed(1);
    }

    private void renderOrderPromotions(Order order, CommandBuffer out) {
        if (order.orderPromotions().isEmpty()) {
            return;
        }
        out.alignTo(Alignment.LEFT);
        out.text("ORDER DISCOUNTS:", TextStyle.BOLD);
        for (OrderPromotion promotion : order.orderPromotions()) {
            String label = promotion.promotionType() == PromotionType.PERCENTAGE
                ? promotion.promotionName() + " (" + resolver.formatPercent(promotion.discountAmount()) + ")"
                : promotion.promotionName();
            renderDiscountLine(label, promotion.discountAmount(), out);
        }
        out.feed(1);
    }

    private void renderDiscountLine(String label, BigDecimal discount, CommandBuffer out) {
        out.alignTo(Alignment.LEFT);
        out.text(label);
        out.alignTo(Alignment.RIGHT);
        out.text("-" + resolver.formatMoney(discount));
        out.alignTo(Alignment.LEFT);
    }
}
