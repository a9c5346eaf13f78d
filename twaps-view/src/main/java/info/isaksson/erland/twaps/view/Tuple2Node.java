package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Two siblings in declaration order, without a container of their own. */
@JsonPropertyOrder({"first","second"})
public final class Tuple2Node implements ViewNode {
    public final ViewNode first;
    public final ViewNode second;

    @JsonCreator
    public Tuple2Node(
            @JsonProperty("first") ViewNode first,
            @JsonProperty("second") ViewNode second
    ) {
        if (first == null) throw new IllegalArgumentException("first must not be null");
        if (second == null) throw new IllegalArgumentException("second must not be null");
        this.first = first;
        this.second = second;
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.TUPLE2;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitTuple2(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tuple2Node)) return false;
        Tuple2Node that = (Tuple2Node) o;
        return Objects.equals(first, that.first) && Objects.equals(second, that.second);
    }

    @Override public int hashCode() {
        return Objects.hash(first, second);
    }
}
