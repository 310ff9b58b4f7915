package com.questrail.kitchen.print;

import com.questrail.kitchen.api.IngredientModification;
import com.questrail.kitchen.api.Modifier;
import com.questrail.kitchen.api.OrderContext;
import com.questrail.kitchen.api.OrderItem;
import com.questrail.kitchen.api.RoutingManifestEntry;
import com.questrail.kitchen.config.PrinterStationConfig;
import com.questrail.kitchen.config.PrinterType;
import com.questrail.kitchen.print.model.PrintInstruction;
import com.questrail.kitchen.print.model.PrintTicket;
import com.questrail.kitchen.print.model.TextStyle;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * PrintTemplateFactory
 * =============================================================================
 * Turns a printer-bound manifest entry into an abstract {@link PrintTicket}.
 *
 * <h2>Ticket structure</h2>
 * <ol>
 *   <li>Initialize</li>
 *   <li>Header: station name, resend indicator, order number and type,
 *       table or tab, server, timestamp, divider</li>
 *   <li>One block per item: position prefix, quantity and name, modifiers
 *       indented by depth with a glyph per depth, ingredient changes, notes</li>
 *   <li>Reference section, when the entry carries reference items</li>
 *   <li>Footer divider, feed, buzzer, cut</li>
 * </ol>
 *
 * <h2>Emphasis</h2>
 * Removed ingredients ("No Pickles", ingredient NO) and notes containing an
 * alert keyword are drawn bold with the destructive marker, plus inverse on
 * thermal printers or red on impact printers. Colour alone is never the only
 * cue.
 *
 * <h2>Purity</h2>
 * The factory performs no I/O and reads no clock; the header timestamp is the
 * order's creation time. Any layout or style problem raises
 * {@link TicketBuildException}.
 */
public final class PrintTemplateFactory
{
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public PrintTicket buildTicket(RoutingManifestEntry entry, OrderContext order, PrinterStationConfig config) {
        Objects.requireNonNull(entry, "entry");
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(config, "config");

        TicketLayout layout = config.layout();
        layout.validate();

        Writer w = new Writer(config.paperWidth().columns(), config.printerType());
        w.instructions.add(new PrintInstruction.Initialize());

        header(w, layout, entry, order, config);

        boolean alert = false;
        for (OrderItem item : entry.items()) {
            alert |= item(w, layout, item);
        }

        reference(w, layout, entry.referenceItems());

        w.line(layout.divider().line(w.columns), TextStyle.PLAIN);
        if (layout.feedLinesBeforeCut() > 0) {
            w.instructions.add(new PrintInstruction.Feed(layout.feedLinesBeforeCut()));
        }
        if (layout.buzzer() || alert) {
            w.instructions.add(new PrintInstruction.Buzzer(layout.buzzerTimes(), Duration.ofMillis(200)));
        }
        if (layout.cut()) {
            w.instructions.add(new PrintInstruction.Cut(layout.partialCut()));
        }
        return new PrintTicket(w.instructions);
    }

    private void header(Writer w, TicketLayout layout, RoutingManifestEntry entry, OrderContext order,
                        PrinterStationConfig config) {
        w.element(layout.stationName(), entry.stationName());

        int resends = 0;
        for (OrderItem item : entry.items()) {
            resends = Math.max(resends, item.resendCount());
        }
        if (resends > 0) {
            w.element(layout.resendIndicator(), resends > 1 ? "RESEND x" + resends : "RESEND");
        }

        String number = order.number().orElse(order.orderId());
        w.element(layout.orderNumber(), order.type().map(t -> number + " " + t).orElse(number));

        if (order.table().isPresent()) {
            w.element(layout.tableOrTab(), "Table: " + order.table().get());
        }
        else if (order.tab().isPresent()) {
            w.element(layout.tableOrTab(), "Tab: " + order.tab().get());
        }
        order.server().ifPresent(s -> w.element(layout.server(), s));
        w.element(layout.timestamp(), TIMESTAMP.format(order.createdAt().atZone(config.timeZone())));
        w.line(layout.divider().line(w.columns), TextStyle.PLAIN);
    }

    /**
     * @return true if the item's notes contain an alert keyword
     */
    private boolean item(Writer w, TicketLayout layout, OrderItem item) {
        String position = layout.showPositionPrefix() ? positionPrefix(item) : "";
        w.element(layout.itemLine(), position + layout.quantityFormat().format(item.quantity()) + item.name());

        for (Modifier m : item.modifiers()) {
            String text = (m.quantity() > 1 ? m.quantity() + "x " : "") + m.displayText();
            modifierLine(w, layout, m.depth(), text, m.destructive());
        }
        for (IngredientModification i : item.ingredientModifications()) {
            modifierLine(w, layout, 0, i.displayText(), i.destructive());
        }

        boolean alert = false;
        if (item.specialNotes().isPresent() && layout.notes().enabled()) {
            String note = item.specialNotes().get();
            alert = layout.isAlert(note);
            if (alert) {
                ElementStyle style = layout.notes().withStyle(w.emphasis(layout.notes().style()));
                w.element(style, layout.destructiveMarker() + " " + note);
            }
            else {
                w.element(layout.notes(), note);
            }
        }
        else if (item.specialNotes().isPresent()) {
            alert = layout.isAlert(item.specialNotes().get());
        }
        return alert;
    }

    private void modifierLine(Writer w, TicketLayout layout, int depth, String text, boolean destructive) {
        String indent = " ".repeat(layout.modifierIndent() * (depth + 1));
        String glyph = layout.glyphFor(depth) + " ";
        if (destructive) {
            ElementStyle base = layout.destructiveModifier();
            ElementStyle style = base.withStyle(w.emphasis(base.style()));
            w.indented(style, indent + glyph, layout.destructiveMarker() + " " + text);
        }
        else {
            w.indented(layout.modifierLine(), indent + glyph, text);
        }
    }

    private void reference(Writer w, TicketLayout layout, List<OrderItem> referenceItems) {
        if (referenceItems.isEmpty() || !layout.referenceItem().enabled()) {
            return;
        }
        w.line(layout.divider().line(w.columns), TextStyle.PLAIN);
        w.element(layout.referenceHeader(), "ALSO ON ORDER");
        for (OrderItem item : referenceItems) {
            w.element(layout.referenceItem(), item.quantity() + "x " + item.name());
        }
    }

    /**
     * Table and seat notation, e.g. {@code T4-S2: }.
     */
    static String positionPrefix(OrderItem item) {
        String table = item.sourceTable().orElse(null);
        if (table != null && item.seatNumber().isPresent()) {
            return table + "-S" + item.seatNumber().getAsInt() + ": ";
        }
        if (table != null) {
            return table + ": ";
        }
        if (item.seatNumber().isPresent()) {
            return "S" + item.seatNumber().getAsInt() + ": ";
        }
        return "";
    }

    /**
     * Accumulates instructions and wraps text to the paper width.
     */
    private static final class Writer
    {
        final List<PrintInstruction> instructions = new ArrayList<>();
        final int columns;
        final PrinterType printerType;

        Writer(int columns, PrinterType printerType) {
            this.columns = columns;
            this.printerType = printerType;
        }

        TextStyle emphasis(TextStyle base) {
            TextStyle bold = base.withBold(true);
            return printerType == PrinterType.THERMAL ? bold.withInverse(true) : bold.withRed(true);
        }

        void element(ElementStyle style, String content) {
            if (!style.enabled()) {
                return;
            }
            indented(style, "", content);
        }

        void indented(ElementStyle style, String lead, String content) {
            if (!style.enabled()) {
                return;
            }
            TextStyle text = check(style.style());
            String rendered = style.render(content);
            int width = text.size().doubleWidth() ? columns / 2 : columns;
            for (String l : wrap(lead, rendered, width)) {
                instructions.add(new PrintInstruction.TextLine(l, text));
            }
        }

        void line(String text, TextStyle style) {
            instructions.add(new PrintInstruction.TextLine(text, style));
        }

        private TextStyle check(TextStyle style) {
            if (printerType == PrinterType.IMPACT && style.inverse()) {
                throw new TicketBuildException("Inverse print is not available on impact printers");
            }
            if (printerType == PrinterType.THERMAL && style.red()) {
                // monochrome: red prints as black
                return style.withRed(false);
            }
            return style;
        }
    }

    /**
     * Word-wraps {@code text} to {@code width} columns. The first line starts
     * with {@code lead}; continuation lines are indented to the same column.
     * Line breaks in the text start a new continuation line, and blank lines
     * are dropped.
     */
    static List<String> wrap(String lead, String text, int width) {
        List<String> lines = new ArrayList<>();
        String pad = " ".repeat(lead.length());
        int room = Math.max(1, width - lead.length());

        String prefix = lead;
        for (String paragraph : text.split("\\R")) {
            String rest = paragraph.strip();
            while (!rest.isEmpty()) {
                if (rest.length() <= room) {
                    lines.add(prefix + rest);
                    prefix = pad;
                    break;
                }
                int cut = rest.lastIndexOf(' ', room);
                if (cut <= 0) {
                    cut = room;
                }
                lines.add(prefix + rest.substring(0, cut).stripTrailing());
                rest = rest.substring(cut).strip();
                prefix = pad;
            }
        }
        if (lines.isEmpty()) {
            lines.add(lead.stripTrailing());
        }
        return lines;
    }
}
