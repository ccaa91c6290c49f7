package info.isaksson.erland.vbform.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * A VB6 color as written in form files: {@code &HkkBBGGRR&}.
 *
 * <p>{@code kk == 00} is a literal RGB color (note the reversed digit order), {@code kk == 80}
 * is a system color whose index is in the low byte.</p>
 */
public final class Color {

    public enum Kind { RGB, SYSTEM }

    public static final Color BLACK = rgb(0x00, 0x00, 0x00);
    public static final Color WHITE = rgb(0xFF, 0xFF, 0xFF);
    public static final Color RED = rgb(0xFF, 0x00, 0x00);
    public static final Color GREEN = rgb(0x00, 0xFF, 0x00);
    public static final Color BLUE = rgb(0x00, 0x00, 0xFF);
    public static final Color SILVER = rgb(0xC0, 0xC0, 0xC0);

    public static final Color SCROLL_BARS = system(0x00);
    public static final Color DESKTOP = system(0x01);
    public static final Color ACTIVE_TITLE_BAR = system(0x02);
    public static final Color INACTIVE_TITLE_BAR = system(0x03);
    public static final Color MENU_BAR = system(0x04);
    public static final Color WINDOW_BACKGROUND = system(0x05);
    public static final Color WINDOW_FRAME = system(0x06);
    public static final Color MENU_TEXT = system(0x07);
    public static final Color WINDOW_TEXT = system(0x08);
    public static final Color TITLE_BAR_TEXT = system(0x09);
    public static final Color ACTIVE_BORDER = system(0x0A);
    public static final Color INACTIVE_BORDER = system(0x0B);
    public static final Color APPLICATION_WORKSPACE = system(0x0C);
    public static final Color HIGHLIGHT = system(0x0D);
    public static final Color HIGHLIGHT_TEXT = system(0x0E);
    public static final Color BUTTON_FACE = system(0x0F);
    public static final Color BUTTON_SHADOW = system(0x10);
    public static final Color GRAY_TEXT = system(0x11);
    public static final Color BUTTON_TEXT = system(0x12);
    public static final Color INACTIVE_CAPTION_TEXT = system(0x13);
    public static final Color BUTTON_HIGHLIGHT = system(0x14);
    public static final Color BUTTON_DARK_SHADOW = system(0x15);
    public static final Color BUTTON_LIGHT = system(0x16);
    public static final Color INFO_TEXT = system(0x17);
    public static final Color INFO_BACKGROUND = system(0x18);

    public final Kind kind;
    public final int red;
    public final int green;
    public final int blue;
    /** System color index; 0 for RGB colors. */
    public final int systemIndex;

    private Color(Kind kind, int red, int green, int blue, int systemIndex) {
        this.kind = kind;
        this.red = red;
        this.green = green;
        this.blue = blue;
        this.systemIndex = systemIndex;
    }

    public static Color rgb(int red, int green, int blue) {
        return new Color(Kind.RGB, red & 0xFF, green & 0xFF, blue & 0xFF, 0);
    }

    public static Color system(int index) {
        return new Color(Kind.SYSTEM, 0, 0, 0, index & 0xFF);
    }

    /**
     * Decodes {@code &HkkBBGGRR&}; the trailing {@code &} is optional.
     *
     * @throws IllegalArgumentException if the text is not a VB6 color literal
     */
    public static Color parse(String text) {
        if (text == null) throw new IllegalArgumentException("color must not be null");
        String s = text.trim();
        if (s.endsWith("&")) s = s.substring(0, s.length() - 1);
        if (s.length() != 10 || !(s.startsWith("&H") || s.startsWith("&h"))) {
            throw new IllegalArgumentException("Not a color literal: '" + text + "'");
        }
        int kind = hexByte(s, 2, text);
        if (kind == 0x80) {
            return system(hexByte(s, 8, text));
        }
        if (kind != 0x00) {
            throw new IllegalArgumentException("Unknown color kind 0x" + s.substring(2, 4) + " in '" + text + "'");
        }
        return rgb(hexByte(s, 8, text), hexByte(s, 6, text), hexByte(s, 4, text));
    }

    private static int hexByte(String s, int at, String original) {
        try {
            return Integer.parseInt(s.substring(at, at + 2), 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid hex digits in color '" + original + "'", e);
        }
    }

    /** Renders the color back in the form-file notation. */
    @JsonValue
    public String toVbString() {
        if (kind == Kind.SYSTEM) {
            return String.format(Locale.ROOT, "&H80%06X&", systemIndex);
        }
        return String.format(Locale.ROOT, "&H00%02X%02X%02X&", blue, green, red);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Color)) return false;
        Color that = (Color) o;
        return kind == that.kind && red == that.red && green == that.green
                && blue == that.blue && systemIndex == that.systemIndex;
    }

    @Override public int hashCode() {
        return Objects.hash(kind, red, green, blue, systemIndex);
    }

    @Override public String toString() {
        return toVbString();
    }
}
