package info.isaksson.erland.twaps.view;

/**
 * Semantic text styles, from largest to smallest.
 */
public enum FontStyle {
    LARGE_TITLE,
    TITLE,
    TITLE2,
    TITLE3,
    HEADLINE,
    SUBHEADLINE,
    BODY,
    CALLOUT,
    FOOTNOTE,
    CAPTION,
    CAPTION2
}
