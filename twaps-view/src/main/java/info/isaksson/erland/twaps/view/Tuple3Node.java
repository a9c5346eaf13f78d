package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Three siblings in declaration order, without a container of their own. */
@JsonPropertyOrder({"first","second","third"})
public final class Tuple3Node implements ViewNode {
    public final ViewNode first;
    public final ViewNode second;
    public final ViewNode third;

    @JsonCreator
    public Tuple3Node(
            @JsonProperty("first") ViewNode first,
            @JsonProperty("second") ViewNode second,
            @JsonProperty("third") ViewNode third
    ) {
        if (first == null) throw new IllegalArgumentException("first must not be null");
        if (second == null) throw new IllegalArgumentException("second must not be null");
        if (third == null) throw new IllegalArgumentException("third must not be null");
        this.first = first;
        this.second = second;
        this.third = third;
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.TUPLE3;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitTuple3(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tuple3Node)) return false;
        Tuple3Node that = (Tuple3Node) o;
        return Objects.equals(first, that.first) &&
                Objects.equals(second, that.second) &&
                Objects.equals(third, that.third);
    }

    @Override public int hashCode() {
        return Objects.hash(first, second, third);
    }
}
