package info.isaksson.erland.twaps.view;

/**
 * The closed set of view-tree node kinds.
 */
public enum ViewNodeKind {
    TEXT,
    BUTTON,
    VSTACK,
    HSTACK,
    TUPLE2,
    TUPLE3,
    EITHER,
    OPTIONAL,
    ARRAY,
    MODULE
}
