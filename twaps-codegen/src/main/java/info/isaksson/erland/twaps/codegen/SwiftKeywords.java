package info.isaksson.erland.twaps.codegen;

import info.isaksson.erland.twaps.view.FontStyle;
import info.isaksson.erland.twaps.view.HorizontalAlignment;
import info.isaksson.erland.twaps.view.NamedColor;
import info.isaksson.erland.twaps.view.VerticalAlignment;

/**
 * Mapping tables from view-model enums to SwiftUI member names.
 */
public final class SwiftKeywords {

    private SwiftKeywords() {}

    public static String font(FontStyle font) {
        switch (font) {
            case LARGE_TITLE: return "largeTitle";
            case TITLE: return "title";
            case TITLE2: return "title2";
            case TITLE3: return "title3";
            case HEADLINE: return "headline";
            case SUBHEADLINE: return "subheadline";
            case BODY: return "body";
            case CALLOUT: return "callout";
            case FOOTNOTE: return "footnote";
            case CAPTION: return "caption";
            case CAPTION2: return "caption2";
            default: throw new IllegalArgumentException("unmapped font: " + font);
        }
    }

    public static String color(NamedColor color) {
        switch (color) {
            case PRIMARY: return "primary";
            case SECONDARY: return "secondary";
            case ACCENT: return "accentColor";
            case BLACK: return "black";
            case WHITE: return "white";
            case GRAY: return "gray";
            case RED: return "red";
            case ORANGE: return "orange";
            case YELLOW: return "yellow";
            case GREEN: return "green";
            case MINT: return "mint";
            case TEAL: return "teal";
            case CYAN: return "cyan";
            case BLUE: return "blue";
            case INDIGO: return "indigo";
            case PURPLE: return "purple";
            case PINK: return "pink";
            case BROWN: return "brown";
            case CLEAR: return "clear";
            default: throw new IllegalArgumentException("unmapped color: " + color);
        }
    }

    /** leading/trailing pass through; everything else is {@code center}. */
    public static String alignment(HorizontalAlignment alignment) {
        if (alignment == HorizontalAlignment.LEADING) return "leading";
        if (alignment == HorizontalAlignment.TRAILING) return "trailing";
        return "center";
    }

    /** top/bottom pass through; everything else is {@code center}. */
    public static String alignment(VerticalAlignment alignment) {
        if (alignment == VerticalAlignment.TOP) return "top";
        if (alignment == VerticalAlignment.BOTTOM) return "bottom";
        return "center";
    }
}
