package info.isaksson.erland.twaps.view;

/** Cross-axis alignment of a horizontal stack. */
public enum VerticalAlignment {
    TOP,
    CENTER,
    BOTTOM
}
