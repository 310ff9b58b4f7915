package com.questrail.kitchen.print;

import com.questrail.kitchen.print.model.Alignment;
import com.questrail.kitchen.print.model.TextSize;
import com.questrail.kitchen.print.model.TextStyle;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * TicketLayout
 * -----------------------------------------------------------------------------
 * Declarative description of how a station's tickets look.
 *
 * <p>Bar and kitchen stations need different emphasis, so formatting is data
 * rather than code. The layout names one {@link ElementStyle} per ticket
 * element plus a few ticket-wide settings:</p>
 * <ul>
 *   <li><b>modifierGlyphs</b>: leading glyph per modifier depth. The last
 *       glyph is reused for deeper levels.</li>
 *   <li><b>modifierIndent</b>: spaces per modifier depth level.</li>
 *   <li><b>alertKeywords</b>: words in special notes that force the buzzer and
 *       emphasis (e.g. "allergy").</li>
 *   <li><b>destructiveMarker</b>: text in front of a removed ingredient.</li>
 * </ul>
 *
 * <p>A layout is not validated on construction. {@link #validate()} runs when a
 * ticket is built, so a malformed layout fails that one ticket with a
 * {@link TicketBuildException} and nothing else.</p>
 */
public record TicketLayout(
        ElementStyle stationName,
        ElementStyle orderNumber,
        ElementStyle tableOrTab,
        ElementStyle server,
        ElementStyle timestamp,
        ElementStyle itemLine,
        ElementStyle modifierLine,
        ElementStyle destructiveModifier,
        ElementStyle notes,
        ElementStyle resendIndicator,
        ElementStyle referenceHeader,
        ElementStyle referenceItem,
        DividerStyle divider,
        List<String> modifierGlyphs,
        int modifierIndent,
        QuantityFormat quantityFormat,
        boolean showPositionPrefix,
        Set<String> alertKeywords,
        String destructiveMarker,
        int feedLinesBeforeCut,
        boolean cut,
        boolean partialCut,
        boolean buzzer,
        int buzzerTimes
) {
    public TicketLayout {
        modifierGlyphs = modifierGlyphs == null ? null : List.copyOf(modifierGlyphs);
        alertKeywords = alertKeywords == null ? Set.of() : Set.copyOf(alertKeywords);
    }

    /**
     * Checks the descriptor. Called once per ticket by the template factory.
     *
     * @throws TicketBuildException if any element is missing or a value is out of range
     */
    public void validate() {
        requireElement(stationName, "stationName");
        requireElement(orderNumber, "orderNumber");
        requireElement(tableOrTab, "tableOrTab");
        requireElement(server, "server");
        requireElement(timestamp, "timestamp");
        requireElement(itemLine, "itemLine");
        requireElement(modifierLine, "modifierLine");
        requireElement(destructiveModifier, "destructiveModifier");
        requireElement(notes, "notes");
        requireElement(resendIndicator, "resendIndicator");
        requireElement(referenceHeader, "referenceHeader");
        requireElement(referenceItem, "referenceItem");
        if (divider == null) {
            throw new TicketBuildException("Layout has no divider style");
        }
        if (quantityFormat == null) {
            throw new TicketBuildException("Layout has no quantity format");
        }
        if (modifierGlyphs == null || modifierGlyphs.isEmpty()) {
            throw new TicketBuildException("Layout must define at least one modifier glyph");
        }
        for (int depth = 0; depth < modifierGlyphs.size(); depth++) {
            String glyph = modifierGlyphs.get(depth);
            if (glyph == null || glyph.isBlank()) {
                throw new TicketBuildException("Modifier glyph for depth " + depth + " is empty");
            }
        }
        if (modifierIndent < 0) {
            throw new TicketBuildException("Modifier indent must be >= 0 (was " + modifierIndent + ")");
        }
        if (feedLinesBeforeCut < 0 || feedLinesBeforeCut > 255) {
            throw new TicketBuildException("Feed lines must be in [0,255] (was " + feedLinesBeforeCut + ")");
        }
        if (buzzerTimes < 1 || buzzerTimes > 9) {
            throw new TicketBuildException("Buzzer times must be in [1,9] (was " + buzzerTimes + ")");
        }
        if (destructiveMarker == null) {
            throw new TicketBuildException("Destructive marker must not be null");
        }
    }

    public String glyphFor(int depth) {
        return modifierGlyphs.get(Math.min(depth, modifierGlyphs.size() - 1));
    }

    /**
     * True if {@code text} contains one of the alert keywords, ignoring case.
     */
    public boolean isAlert(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : alertKeywords) {
            if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Food tickets: big bold item lines, reference items, full cut.
     */
    public static TicketLayout kitchen() {
        return builder().build();
    }

    /**
     * Drink tickets: compact item lines, no reference section, partial cut.
     */
    public static TicketLayout bar() {
        return builder()
                .stationName(ElementStyle.sized(TextSize.DOUBLE_HEIGHT, true, Alignment.CENTER).withCaps(true))
                .itemLine(ElementStyle.bold())
                .referenceHeader(ElementStyle.DISABLED)
                .referenceItem(ElementStyle.DISABLED)
                .quantityFormat(QuantityFormat.NUMBER_X_IF_MANY)
                .divider(DividerStyle.DOT)
                .partialCut(true)
                .build();
    }

    /**
     * Expediter tickets: every item with its table and seat position, buzzer on.
     */
    public static TicketLayout expo() {
        return builder()
                .itemLine(ElementStyle.bold())
                .referenceHeader(ElementStyle.DISABLED)
                .referenceItem(ElementStyle.DISABLED)
                .divider(DividerStyle.DOUBLE)
                .buzzer(true)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.stationName = stationName;
        b.orderNumber = orderNumber;
        b.tableOrTab = tableOrTab;
        b.server = server;
        b.timestamp = timestamp;
        b.itemLine = itemLine;
        b.modifierLine = modifierLine;
        b.destructiveModifier = destructiveModifier;
        b.notes = notes;
        b.resendIndicator = resendIndicator;
        b.referenceHeader = referenceHeader;
        b.referenceItem = referenceItem;
        b.divider = divider;
        b.modifierGlyphs = modifierGlyphs == null ? null : new ArrayList<>(modifierGlyphs);
        b.modifierIndent = modifierIndent;
        b.quantityFormat = quantityFormat;
        b.showPositionPrefix = showPositionPrefix;
        b.alertKeywords = new LinkedHashSet<>(alertKeywords);
        b.destructiveMarker = destructiveMarker;
        b.feedLinesBeforeCut = feedLinesBeforeCut;
        b.cut = cut;
        b.partialCut = partialCut;
        b.buzzer = buzzer;
        b.buzzerTimes = buzzerTimes;
        return b;
    }

    private static void requireElement(ElementStyle style, String name) {
        if (style == null) {
            throw new TicketBuildException("Layout element '" + name + "' is not defined");
        }
    }

    public static final class Builder {
        private ElementStyle stationName =
                ElementStyle.sized(TextSize.DOUBLE_SIZE, true, Alignment.CENTER).withCaps(true);
        private ElementStyle orderNumber =
                ElementStyle.sized(TextSize.DOUBLE_HEIGHT, true, Alignment.CENTER).withPrefix("#");
        private ElementStyle tableOrTab = ElementStyle.bold();
        private ElementStyle server = ElementStyle.PLAIN.withPrefix("Server: ");
        private ElementStyle timestamp = ElementStyle.PLAIN;
        private ElementStyle itemLine = ElementStyle.sized(TextSize.DOUBLE_HEIGHT, true, Alignment.LEFT);
        private ElementStyle modifierLine = ElementStyle.PLAIN;
        private ElementStyle destructiveModifier = ElementStyle.bold().withCaps(true);
        private ElementStyle notes = ElementStyle.bold().withPrefix("NOTE: ");
        private ElementStyle resendIndicator = ElementStyle.of(
                new TextStyle(true, TextSize.DOUBLE_HEIGHT, Alignment.CENTER, false, false)).withPrefix("** ").withSuffix(" **");
        private ElementStyle referenceHeader = ElementStyle.PLAIN.withPrefix("-- ").withSuffix(" --");
        private ElementStyle referenceItem = ElementStyle.PLAIN.withPrefix("  ");
        private DividerStyle divider = DividerStyle.DASH;
        private List<String> modifierGlyphs = new ArrayList<>(List.of("-", ">"));
        private int modifierIndent = 2;
        private QuantityFormat quantityFormat = QuantityFormat.NUMBER_X;
        private boolean showPositionPrefix = true;
        private Set<String> alertKeywords = new LinkedHashSet<>(List.of("allergy", "allergic"));
        private String destructiveMarker = "!!";
        private int feedLinesBeforeCut = 3;
        private boolean cut = true;
        private boolean partialCut = false;
        private boolean buzzer = false;
        private int buzzerTimes = 2;

        public Builder stationName(ElementStyle s) { this.stationName = s; return this; }
        public Builder orderNumber(ElementStyle s) { this.orderNumber = s; return this; }
        public Builder tableOrTab(ElementStyle s) { this.tableOrTab = s; return this; }
        public Builder server(ElementStyle s) { this.server = s; return this; }
        public Builder timestamp(ElementStyle s) { this.timestamp = s; return this; }
        public Builder itemLine(ElementStyle s) { this.itemLine = s; return this; }
        public Builder modifierLine(ElementStyle s) { this.modifierLine = s; return this; }
        public Builder destructiveModifier(ElementStyle s) { this.destructiveModifier = s; return this; }
        public Builder notes(ElementStyle s) { this.notes = s; return this; }
        public Builder resendIndicator(ElementStyle s) { this.resendIndicator = s; return this; }
        public Builder referenceHeader(ElementStyle s) { this.referenceHeader = s; return this; }
        public Builder referenceItem(ElementStyle s) { this.referenceItem = s; return this; }
        public Builder divider(DividerStyle d) { this.divider = d; return this; }

        public Builder modifierGlyphs(String... glyphs) {
            this.modifierGlyphs = glyphs == null ? null : new ArrayList<>(List.of(glyphs));
            return this;
        }

        public Builder modifierIndent(int indent) { this.modifierIndent = indent; return this; }
        public Builder quantityFormat(QuantityFormat f) { this.quantityFormat = f; return this; }
        public Builder showPositionPrefix(boolean show) { this.showPositionPrefix = show; return this; }

        public Builder alertKeywords(String... keywords) {
            this.alertKeywords = new LinkedHashSet<>(List.of(keywords));
            return this;
        }

        public Builder destructiveMarker(String marker) { this.destructiveMarker = marker; return this; }
        public Builder feedLinesBeforeCut(int lines) { this.feedLinesBeforeCut = lines; return this; }
        public Builder cut(boolean cut) { this.cut = cut; return this; }
        public Builder partialCut(boolean partial) { this.partialCut = partial; return this; }
        public Builder buzzer(boolean buzzer) { this.buzzer = buzzer; return this; }
        public Builder buzzerTimes(int times) { this.buzzerTimes = times; return this; }

        public TicketLayout build() {
            return new TicketLayout(
                    stationName, orderNumber, tableOrTab, server, timestamp,
                    itemLine, modifierLine, destructiveModifier, notes, resendIndicator,
                    referenceHeader, referenceItem, divider,
                    modifierGlyphs, modifierIndent, quantityFormat, showPositionPrefix,
                    alertKeywords, destructiveMarker, feedLinesBeforeCut,
                    cut, partialCut, buzzer, buzzerTimes);
        }
    }
}
