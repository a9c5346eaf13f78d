package info.isaksson.erland.twaps.view;

/** System colors that can be referenced by name. */
public enum NamedColor {
    PRIMARY,
    SECONDARY,
    ACCENT,
    BLACK,
    WHITE,
    GRAY,
    RED,
    ORANGE,
    YELLOW,
    GREEN,
    MINT,
    TEAL,
    CYAN,
    BLUE,
    INDIGO,
    PURPLE,
    PINK,
    BROWN,
    CLEAR
}
