package info.isaksson.erland.twaps.view;

/** Cross-axis alignment of a vertical stack. */
public enum HorizontalAlignment {
    LEADING,
    CENTER,
    TRAILING
}
