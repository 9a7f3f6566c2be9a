package com.receiptdesigner.core.render;

import com.receiptdesigner.config.RenderSettings;
import com.receiptdesigner.core.command.BarcodeCommand;
import com.receiptdesigner.core.command.CutCommand;
import com.receiptdesigner.core.command.FeedCommand;
import com.receiptdesigner.core.command.PrinterCommand;
import com.receiptdesigner.core.command.QrCodeCommand;
import com.receiptdesigner.core.command.SetAlignmentCommand;
import com.receiptdesigner.core.command.TextCommand;
import com.receiptdesigner.core.model.AlignElement;
import com.receiptdesigner.core.model.Alignment;
import com.receiptdesigner.core.model.BarcodeElement;
import com.receiptdesigner.core.model.BarcodeType;
import com.receiptdesigner.core.model.CutPaperElement;
import com.receiptdesigner.core.model.DesignDocument;
import com.receiptdesigner.core.model.DividerElement;
import com.receiptdesigner.core.model.DynamicElement;
import com.receiptdesigner.core.model.ElementType;
import com.receiptdesigner.core.model.FeedLineElement;
import com.receiptdesigner.core.model.ItemsListElement;
import com.receiptdesigner.core.model.QrCodeElement;
import com.receiptdesigner.core.model.SplitPaymentsElement;
import com.receiptdesigner.core.model.TextElement;
import com.receiptdesigner.core.model.TextSize;
import com.receiptdesigner.core.model.TextStyle;
import com.receiptdesigner.core.model.UnknownElement;
import com.receiptdesigner.core.order.ItemPromotion;
import com.receiptdesigner.core.order.LineItem;
import com.receiptdesigner.core.order.Order;
import com.receiptdesigner.core.order.OrderPromotion;
import com.receiptdesigner.core.order.PromotionType;
import com.receiptdesigner.core.template.DesignTemplates;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReceiptInterpreterTest {

    private static final String DIVIDER = "=".repeat(32);

    private final ReceiptInterpreter interpreter = new ReceiptInterpreter(RenderSettings.defaults()
        .withZone(ZoneOffset.UTC)
        .withClock(Clock.fixed(Instant.parse("2024-01-02T03:04:00Z"), ZoneOffset.UTC)));

    @Test
    void rendersWelcomeHeader() {
        DesignDocument design = DesignDocument.of(
            new AlignElement(Alignment.CENTER),
            new TextElement("Welcome {{STORE_NAME}}"),
            new FeedLineElement(1),
            new CutPaperElement());
        Order order = Order.builder().storeName("Acme").build();

        assertEquals(List.of(
            new SetAlignmentCommand(Alignment.CENTER),
            new TextCommand("Welcome Acme"),
            new FeedCommand(1),
            new CutCommand()
        ), interpreter.render(design, order));
    }

    @Test
    void emptyDocumentRendersNothing() {
        assertTrue(interpreter.render(DesignDocument.of(), null).isEmpty());
    }

    @Test
    void textKeepsItsStyle() {
        TextStyle headline = new TextStyle(true, true, TextSize.XLARGE);
        List<PrinterCommand> commands = interpreter.render(
            DesignDocument.of(new TextElement("Big", headline)), null);

        assertEquals(List.of(new TextCommand("Big", headline)), commands);
    }

    @Test
    void alignElementsAlwaysEmit() {
        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(
            new AlignElement(Alignment.LEFT),
            new AlignElement(Alignment.LEFT),
            new TextElement("x")), null);

        assertEquals(List.of(
            new SetAlignmentCommand(Alignment.LEFT),
            new SetAlignmentCommand(Alignment.LEFT),
            new TextCommand("x")
        ), commands);
    }

    @Test
    void dividerIsCenteredWithoutChangingAmbientAlignment() {
        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(
            new AlignElement(Alignment.RIGHT),
            new DividerElement(),
            new TextElement("after")), null);

        assertEquals(List.of(
            new SetAlignmentCommand(Alignment.RIGHT),
            new SetAlignmentCommand(Alignment.CENTER),
            new TextCommand(DIVIDER),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("after")
        ), commands);
    }

    @Test
    void leadingDividerCentersThenFeedNeedsNoRealignment() {
        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(
            new DividerElement("-----"),
            new FeedLineElement(2),
            new DynamicElement("ORDER_ID")), null);

        assertEquals(List.of(
            new SetAlignmentCommand(Alignment.CENTER),
            new TextCommand("-----"),
            new FeedCommand(2),
            new SetAlignmentCommand(Alignment.LEFT),
            new TextCommand("ORD123456")
        ), commands);
    }

    @Test
    void barcodeDataIsRawAndQrDataIsSubstituted() {
        Order order = Order.builder().storeName("acme").orderId("77").build();
        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(
            new AlignElement(Alignment.CENTER),
            new BarcodeElement("{{ORDER_ID}}", BarcodeType.EAN13),
            new QrCodeElement("https://{{STORE_NAME}}.com/r/{{ORDER_ID}}", 5)), order);

        assertEquals(List.of(
            new SetAlignmentCommand(Alignment.CENTER),
            new BarcodeCommand("{{ORDER_ID}}", BarcodeType.EAN13),
            new QrCodeCommand("https://acme.com/r/77", 5)
        ), commands);
    }

    @Test
    void dynamicElementResolvesFieldOrPrintsName() {
        Order order = Order.builder().paymentMethod("Visa").build();
        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(
            new DynamicElement("PAYMENT_METHOD"),
            new DynamicElement("LUCKY_NUMBER"),
            new DynamicElement("TIMESTAMP")), order);

        assertEquals(List.of(
            new TextCommand("Visa"),
            new TextCommand("LUCKY_NUMBER"),
            new TextCommand("01/02/2024 03:04")
        ), commands);
    }

    @Test
    void unknownAndSplitPaymentElementsAreSkipped() {
        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(
            new UnknownElement("hologram"),
            new SplitPaymentsElement(),
            new TextElement("still here")), null);

        assertEquals(List.of(new TextCommand("still here")), commands);
    }

    @Test
    void processingContinuesAfterCut() {
        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(
            new CutPaperElement(),
            new TextElement("second copy"),
            new CutPaperElement()), null);

        assertEquals(List.of(new CutCommand(), new TextCommand("second copy"), new CutCommand()), commands);
    }

    @Test
    void itemsListWithoutOrderRendersNothing() {
        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(
            new ItemsListElement(DesignTemplates.DEFAULT_ITEM_TEMPLATE),
            new TextElement("end")), null);

        assertEquals(List.of(new TextCommand("end")), commands);
    }

    @Test
    void fallbackItemLayout() {
        Order order = Order.builder()
            .addItem(new LineItem("Soda", 1, new BigDecimal("4.00"), new BigDecimal("4.00")))
            .build();

        assertEquals(List.of(
            new TextCommand("Soda"),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("$4.00"),
            new SetAlignmentCommand(Alignment.LEFT),
            new FeedCommand(1)
        ), interpreter.render(DesignDocument.of(new ItemsListElement("")), order));
    }

    @Test
    void fallbackItemLayoutPrefixesQuantityAboveOne() {
        Order order = Order.builder()
            .addItem(new LineItem("Fries", 3, new BigDecimal("1.5"), new BigDecimal("4.5")))
            .build();

        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(new ItemsListElement("")), order);

        assertEquals(new TextCommand("3x Fries"), commands.get(0));
        assertEquals(new TextCommand("$4.50"), commands.get(2));
    }

    @Test
    void templateDirectiveAlignsPrice() {
        Order order = Order.builder()
            .addItem(new LineItem("Cake", 1, new BigDecimal("12.5"), new BigDecimal("12.5")))
            .build();

        assertEquals(List.of(
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("$12.50"),
            new FeedCommand(1)
        ), interpreter.render(DesignDocument.of(new ItemsListElement("{{align:right}}${{totalPrice}}")), order));
    }

    @Test
    void defaultItemTemplateRestartsLeftForEachItem() {
        Order order = Order.builder()
            .addItem(new LineItem("Soda", 1, new BigDecimal("4"), new BigDecimal("4")))
            .addItem(new LineItem("Tea", 2, new BigDecimal("2"), new BigDecimal("4")))
            .build();

        List<PrinterCommand> commands = interpreter.render(
            DesignDocument.of(new ItemsListElement(DesignTemplates.DEFAULT_ITEM_TEMPLATE)), order);

        assertEquals(List.of(
            new TextCommand("1x Soda"),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("$4.00"),
            new FeedCommand(1),
            new FeedCommand(1),
            new SetAlignmentCommand(Alignment.LEFT),
            new TextCommand("2x Tea"),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("$4.00"),
            new FeedCommand(1),
            new FeedCommand(1)
        ), commands);
    }

    @Test
    void templateAlignmentDoesNotLeakIntoAmbient() {
        Order order = Order.builder()
            .addItem(new LineItem("Tea", 1, BigDecimal.ONE, BigDecimal.ONE))
            .build();
        List<PrinterCommand> commands = interpreter.render(DesignDocument.of(
            new AlignElement(Alignment.CENTER),
            new ItemsListElement("{{name}}\\n{{align:right}}{{totalPrice}}"),
            new TextElement("after")), order);

        assertEquals(List.of(
            new SetAlignmentCommand(Alignment.CENTER),
            new SetAlignmentCommand(Alignment.LEFT),
            new TextCommand("Tea"),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("1.00"),
            new FeedCommand(1),
            new SetAlignmentCommand(Alignment.CENTER),
            new TextCommand("after")
        ), commands);
    }

    @Test
    void itemDetailLines() {
        Order order = Order.builder()
            .addItem(new LineItem("Latte", 2, new BigDecimal("3.5"), new BigDecimal("7"),
                "L-1", "Drinks", List.of("oat milk")))
            .build();
        ItemsListElement element = new ItemsListElement("", true, true, true, true);

        assertEquals(List.of(
            new TextCommand("2x Latte"),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("$7.00"),
            new SetAlignmentCommand(Alignment.LEFT),
            new TextCommand("  SKU: L-1", TextStyle.SMALL),
            new TextCommand("  Category: Drinks", TextStyle.SMALL),
            new TextCommand("  + oat milk", TextStyle.SMALL),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("$3.50 ea", TextStyle.SMALL),
            new SetAlignmentCommand(Alignment.LEFT),
            new FeedCommand(1)
        ), interpreter.render(DesignDocument.of(element), order));
    }

    @Test
    void detailLinesRespectFlagsAndMissingValues() {
        Order order = Order.builder()
            .addItem(new LineItem("Water", 1, BigDecimal.ONE, BigDecimal.ONE, " ", null, List.of()))
            .build();
        ItemsListElement element = new ItemsListElement("{{name}}", true, true, true, true);

        assertEquals(List.of(
            new TextCommand("Water"),
            new FeedCommand(1)
        ), interpreter.render(DesignDocument.of(element), order));
    }

    @Test
    void promotionsFollowTheItems() {
        Order order = Order.builder()
            .addItem(new LineItem("Soda", 1, new BigDecimal("4"), new BigDecimal("4")))
            .addItemPromotion(new ItemPromotion("Combo", new BigDecimal("1")))
            .addOrderPromotion(new OrderPromotion(
                "Member", new BigDecimal("10"), PromotionType.PERCENTAGE))
            .addOrderPromotion(new OrderPromotion(
                "Coupon", new BigDecimal("2"), PromotionType.FIXED_AMOUNT))
            .build();

        assertEquals(List.of(
            new TextCommand("Soda"),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("$4.00"),
            new SetAlignmentCommand(Alignment.LEFT),
            new FeedCommand(1),
            new FeedCommand(1),
            new TextCommand("ITEM DISCOUNTS:", TextStyle.BOLD),
            new TextCommand("Combo"),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("-$1.00"),
            new SetAlignmentCommand(Alignment.LEFT),
            new FeedCommand(1),
            new TextCommand("ORDER DISCOUNTS:", TextStyle.BOLD),
            new TextCommand("Member (10.0%)"),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("-$10.00"),
            new SetAlignmentCommand(Alignment.LEFT),
            new TextCommand("Coupon"),
            new SetAlignmentCommand(Alignment.RIGHT),
            new TextCommand("-$2.00"),
            new SetAlignmentCommand(Alignment.LEFT),
            new FeedCommand(1)
        ), interpreter.render(DesignDocument.of(new ItemsListElement("")), order));
    }

    @Test
    void failureDiscardsPartialOutput() {
        // claims to be text but is not a TextElement, so the pass fails midway
        DesignDocument broken = DesignDocument.of(
            new TextElement("partial"),
            () -> ElementType.TEXT);

        assertEquals(ReceiptInterpreter.errorReceipt(), interpreter.render(broken, null));
        assertEquals(List.of(
            new TextCommand("Error occurred", TextStyle.BOLD),
            new FeedCommand(1),
            new CutCommand()
        ), ReceiptInterpreter.errorReceipt());
    }

    @Test
    void rendersJsonDesign() {
        JSONObject design = new JSONObject("""
            {"elements": [
              {"type": "align", "alignment": "center"},
              {"type": "text", "content": "Hi {{CUSTOMER_NAME}}", "style": {"bold": true}},
              {"type": "cutPaper"}
            ]}
            """);

        assertEquals(List.of(
            new SetAlignmentCommand(Alignment.CENTER),
            new TextCommand("Hi Guest", TextStyle.BOLD),
            new CutCommand()
        ), interpreter.render(design, null));
    }

    @Test
    void undecodableJsonDesignYieldsErrorReceipt() {
        JSONObject badBarcode = new JSONObject("""
            {"elements": [
              {"type": "text", "content": "before"},
              {"type": "barcode", "data": "123", "barcodeType": "HOLOGRAM"}
            ]}
            """);
        JSONObject notAnObject = new JSONObject("{\"elements\": [42]}");

        assertEquals(ReceiptInterpreter.errorReceipt(), interpreter.render(badBarcode, null));
        assertEquals(ReceiptInterpreter.errorReceipt(), interpreter.render(notAnObject, null));
    }

    @Test
    void quantityOverflowYieldsErrorReceipt() {
        Order order = Order.builder()
            .addItem(new LineItem("Bulk", Integer.MAX_VALUE, BigDecimal.ONE, BigDecimal.ONE))
            .addItem(new LineItem("Extra", 1, BigDecimal.ONE, BigDecimal.ONE))
            .build();

        assertEquals(ReceiptInterpreter.errorReceipt(),
            interpreter.render(DesignDocument.of(new DynamicElement("TOTAL_QUANTITY")), order));
    }

    @Test
    void equalInputsProduceEqualOutput() {
        Order order = Order.builder()
            .storeName("Acme")
            .orderId("A-9")
            .addItem(new LineItem("Soda", 2, new BigDecimal("2"), new BigDecimal("4")))
            .build();

        List<PrinterCommand> first = interpreter.render(DesignTemplates.detailed(), order);
        List<PrinterCommand> second = interpreter.render(DesignTemplates.detailed(), order);

        assertEquals(first, second);
        assertTrue(first.contains(new TextCommand("Date: 01/02/2024 03:04")));
    }
}
