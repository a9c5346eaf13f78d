package info.isaksson.erland.twaps.view;

import info.isaksson.erland.twaps.view.builder.ViewBuilder;

/**
 * Static factories so trees read close to the declarative syntax:
 *
 * <pre>{@code
 * vstack(HorizontalAlignment.LEADING, 8.0,
 *         text("Title").font(FontStyle.TITLE).bold(),
 *         button(() -> save(), text("Save")))
 * }</pre>
 *
 * Stack children are combined with {@link ViewBuilder#block(ViewNode...)}.
 */
public final class Views {

    private Views() {}

    public static TextNode text(String content) {
        return new TextNode(content);
    }

    public static ButtonNode button(Runnable action, ViewNode label) {
        return new ButtonNode(action, label);
    }

    public static ButtonNode button(String title) {
        return new ButtonNode(text(title));
    }

    public static VStackNode vstack(ViewNode... children) {
        return new VStackNode(HorizontalAlignment.CENTER, null, ViewBuilder.block(children));
    }

    public static VStackNode vstack(HorizontalAlignment alignment, Double spacing, ViewNode... children) {
        return new VStackNode(alignment, spacing, ViewBuilder.block(children));
    }

    public static HStackNode hstack(ViewNode... children) {
        return new HStackNode(VerticalAlignment.CENTER, null, ViewBuilder.block(children));
    }

    public static HStackNode hstack(VerticalAlignment alignment, Double spacing, ViewNode... children) {
        return new HStackNode(alignment, spacing, ViewBuilder.block(children));
    }

    public static OptionalNode empty() {
        return OptionalNode.empty();
    }
}
