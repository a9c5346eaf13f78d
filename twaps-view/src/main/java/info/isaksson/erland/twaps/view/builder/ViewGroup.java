package info.isaksson.erland.twaps.view.builder;

import info.isaksson.erland.twaps.view.ViewNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Accumulates sibling content one statement at a time, then folds it with
 * {@link ViewBuilder#block(List)}.
 *
 * <p>Not thread-safe; a group is meant to be filled and built on one thread. The built node is
 * immutable and independent of the group.</p>
 */
public final class ViewGroup {

    private final List<ViewNode> children = new ArrayList<>();

    ViewGroup() {}

    public ViewGroup add(ViewNode child) {
        if (child == null) throw new IllegalArgumentException("child must not be null");
        children.add(child);
        return this;
    }

    public ViewGroup addIf(boolean condition, Supplier<? extends ViewNode> content) {
        return add(ViewBuilder.optional(condition, content));
    }

    public ViewGroup addEither(boolean condition,
                               Supplier<? extends ViewNode> whenTrue,
                               Supplier<? extends ViewNode> whenFalse) {
        return add(ViewBuilder.either(condition, whenTrue, whenFalse));
    }

    public ViewGroup addOptional(ViewNode contentOrNull) {
        return add(ViewBuilder.optional(contentOrNull));
    }

    public <T> ViewGroup addEach(Iterable<T> elements, Function<? super T, ? extends ViewNode> body) {
        return add(ViewBuilder.forEach(elements, body));
    }

    public int size() {
        return children.size();
    }

    /** @throws IllegalArgumentException if nothing was added */
    public ViewNode build() {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("group has no children");
        }
        return ViewBuilder.block(List.copyOf(children));
    }
}
