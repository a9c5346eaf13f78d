package info.isaksson.erland.twaps.view.builder;

import info.isaksson.erland.twaps.view.ArrayNode;
import info.isaksson.erland.twaps.view.EitherNode;
import info.isaksson.erland.twaps.view.OptionalNode;
import info.isaksson.erland.twaps.view.Tuple2Node;
import info.isaksson.erland.twaps.view.Tuple3Node;
import info.isaksson.erland.twaps.view.ViewNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Combinators that fold sibling, conditional, optional and repeated content into one node.
 *
 * <p>Declaration order is always preserved. Conditionals are short-circuit: only the supplier
 * for the taken side is invoked.</p>
 *
 * <p>At least one child is required by the block combinators; an empty block is a caller
 * error and is rejected with {@link IllegalArgumentException}.</p>
 */
public final class ViewBuilder {

    private ViewBuilder() {}

    public static ViewNode block(ViewNode content) {
        return requireChild(content, 0);
    }

    public static Tuple2Node block(ViewNode first, ViewNode second) {
        return new Tuple2Node(requireChild(first, 0), requireChild(second, 1));
    }

    public static Tuple3Node block(ViewNode first, ViewNode second, ViewNode third) {
        return new Tuple3Node(requireChild(first, 0), requireChild(second, 1), requireChild(third, 2));
    }

    /**
     * Any number of children (at least one). More than three are nested into the last slot of a
     * {@link Tuple3Node}, which generates the same lines as a flat sequence.
     */
    public static ViewNode block(ViewNode... children) {
        if (children == null || children.length == 0) {
            throw new IllegalArgumentException("a block needs at least one child");
        }
        return block(Arrays.asList(children));
    }

    public static ViewNode block(List<? extends ViewNode> children) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("a block needs at least one child");
        }
        for (int i = 0; i < children.size(); i++) {
            requireChild(children.get(i), i);
        }
        return fold(children, 0);
    }

    private static ViewNode fold(List<? extends ViewNode> children, int from) {
        int remaining = children.size() - from;
        switch (remaining) {
            case 1:
                return children.get(from);
            case 2:
                return new Tuple2Node(children.get(from), children.get(from + 1));
            case 3:
                return new Tuple3Node(children.get(from), children.get(from + 1), children.get(from + 2));
            default:
                return new Tuple3Node(children.get(from), children.get(from + 1), fold(children, from + 2));
        }
    }

    /** if/else: evaluates exactly one of the two suppliers. */
    public static EitherNode either(boolean condition,
                                    Supplier<? extends ViewNode> whenTrue,
                                    Supplier<? extends ViewNode> whenFalse) {
        if (whenTrue == null || whenFalse == null) {
            throw new IllegalArgumentException("both branches must be supplied");
        }
        if (condition) {
            return EitherNode.first(requireBuilt(whenTrue.get(), "first branch"));
        }
        return EitherNode.second(requireBuilt(whenFalse.get(), "second branch"));
    }

    /** if without else: the supplier runs only when {@code condition} holds. */
    public static OptionalNode optional(boolean condition, Supplier<? extends ViewNode> content) {
        if (content == null) throw new IllegalArgumentException("content must not be null");
        if (!condition) return OptionalNode.empty();
        return OptionalNode.of(requireBuilt(content.get(), "optional content"));
    }

    public static OptionalNode optional(ViewNode contentOrNull) {
        return OptionalNode.ofNullable(contentOrNull);
    }

    public static ArrayNode array(List<? extends ViewNode> items) {
        return ArrayNode.of(items == null ? List.of() : items);
    }

    /** for-in loop: one child per element, in iteration order. */
    public static <T> ArrayNode forEach(Iterable<T> elements, Function<? super T, ? extends ViewNode> body) {
        if (elements == null) throw new IllegalArgumentException("elements must not be null");
        if (body == null) throw new IllegalArgumentException("body must not be null");
        List<ViewNode> out = new ArrayList<>();
        for (T element : elements) {
            out.add(requireBuilt(body.apply(element), "item " + out.size()));
        }
        return new ArrayNode(out);
    }

    public static ViewGroup group() {
        return new ViewGroup();
    }

    private static ViewNode requireChild(ViewNode child, int index) {
        if (child == null) throw new IllegalArgumentException("child " + index + " must not be null");
        return child;
    }

    private static ViewNode requireBuilt(ViewNode node, String what) {
        if (node == null) throw new IllegalArgumentException(what + " produced null");
        return node;
    }
}
