package com.questrail.kitchen.print;

import com.questrail.kitchen.print.model.Alignment;
import com.questrail.kitchen.print.model.TextSize;
import com.questrail.kitchen.print.model.TextStyle;

import java.util.Locale;
import java.util.Objects;

/**
 * Declarative formatting of one ticket element (a header field, an item line,
 * a modifier line, ...).
 *
 * <p>{@code prefix} and {@code suffix} wrap the element's content before
 * {@code caps} is applied. A disabled element is left off the ticket.</p>
 */
public record ElementStyle(boolean enabled, TextStyle style, String prefix, String suffix, boolean caps)
{
    public static final ElementStyle PLAIN = new ElementStyle(true, TextStyle.PLAIN, "", "", false);
    public static final ElementStyle DISABLED = new ElementStyle(false, TextStyle.PLAIN, "", "", false);

    public ElementStyle {
        Objects.requireNonNull(style, "style");
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    public static ElementStyle of(TextStyle style) {
        return new ElementStyle(true, style, "", "", false);
    }

    public static ElementStyle bold() {
        return of(TextStyle.PLAIN.withBold(true));
    }

    public static ElementStyle sized(TextSize size, boolean bold, Alignment alignment) {
        return of(new TextStyle(bold, size, alignment, false, false));
    }

    public ElementStyle withPrefix(String prefix) {
        return new ElementStyle(enabled, style, prefix, suffix, caps);
    }

    public ElementStyle withSuffix(String suffix) {
        return new ElementStyle(enabled, style, prefix, suffix, caps);
    }

    public ElementStyle withCaps(boolean caps) {
        return new ElementStyle(enabled, style, prefix, suffix, caps);
    }

    public ElementStyle withStyle(TextStyle style) {
        return new ElementStyle(enabled, style, prefix, suffix, caps);
    }

    public ElementStyle disabled() {
        return new ElementStyle(false, style, prefix, suffix, caps);
    }

    public String render(String content) {
        String text = prefix + content + suffix;
        return caps ? text.toUpperCase(Locale.ROOT) : text;
    }
}
