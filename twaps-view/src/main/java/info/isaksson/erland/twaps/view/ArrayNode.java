package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Repeated content, kept in iteration order.
 *
 * <p>IMPORTANT: items are never sorted; position is the only identity an item has.</p>
 */
@JsonPropertyOrder({"items"})
public final class ArrayNode implements ViewNode {
    public final List<ViewNode> items;

    @JsonCreator
    public ArrayNode(@JsonProperty("items") List<ViewNode> items) {
        if (items == null) {
            this.items = List.of();
            return;
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == null) throw new IllegalArgumentException("items[" + i + "] must not be null");
        }
        this.items = List.copyOf(items);
    }

    public static ArrayNode of(List<? extends ViewNode> items) {
        return new ArrayNode(items == null ? null : new ArrayList<>(items));
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.ARRAY;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayNode)) return false;
        ArrayNode that = (ArrayNode) o;
        return Objects.equals(items, that.items);
    }

    @Override public int hashCode() {
        return Objects.hashCode(items);
    }
}
