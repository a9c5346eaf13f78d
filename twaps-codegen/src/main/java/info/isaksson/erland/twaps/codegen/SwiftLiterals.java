package info.isaksson.erland.twaps.codegen;

import info.isaksson.erland.twaps.view.ColorSpec;

import java.math.BigDecimal;

/**
 * Locale-independent rendering of Swift literals.
 */
public final class SwiftLiterals {

    /** Emitted in place of a lone UTF-16 surrogate. */
    public static final String UNPAIRED_SURROGATE = "\\u{fffd}";

    private SwiftLiterals() {}

    /**
     * A double-quoted Swift string literal with backslashes, quotes and control characters escaped.
     * Unpaired surrogates become an escaped U+FFFD, so the result always encodes as UTF-8.
     */
    public static String string(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append("\\u{").append(Integer.toHexString(c)).append('}');
                    } else if (Character.isHighSurrogate(c) && i + 1 < value.length()
                            && Character.isLowSurrogate(value.charAt(i + 1))) {
                        sb.append(c).append(value.charAt(++i));
                    } else if (Character.isSurrogate(c)) {
                        // Swift strings hold scalars only; an unpaired half cannot be encoded.
                        sb.append(UNPAIRED_SURROGATE);
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /** Replaces each unpaired UTF-16 surrogate in {@code value} with U+FFFD; valid pairs are kept. */
    public static String withoutUnpairedSurrogates(String value) {
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < value.length()
                    && Character.isLowSurrogate(value.charAt(i + 1))) {
                if (sb != null) sb.append(c).append(value.charAt(i + 1));
                i++;
            } else if (Character.isSurrogate(c)) {
                if (sb == null) sb = new StringBuilder(value.substring(0, i));
                sb.append((char) 0xFFFD);
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? value : sb.toString();
    }

    /** Integral values print without a fraction ({@code 8}, not {@code 8.0}). */
    public static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("not a finite number: " + value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String color(ColorSpec color) {
        if (color.hasName()) {
            return "." + SwiftKeywords.color(color.name);
        }
        String rgb = "Color(red: " + number(color.red)
                + ", green: " + number(color.green)
                + ", blue: " + number(color.blue);
        if (color.opacity != 1.0) {
            rgb += ", opacity: " + number(color.opacity);
        }
        return rgb + ")";
    }
}
