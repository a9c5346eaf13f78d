package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Content that may be absent. An absent node stands for an empty view. */
@JsonPropertyOrder({"content"})
public final class OptionalNode implements ViewNode {
    private static final OptionalNode EMPTY = new OptionalNode(null);

    /** {@code null} when absent. */
    public final ViewNode content;

    @JsonCreator
    public OptionalNode(@JsonProperty("content") ViewNode content) {
        this.content = content;
    }

    public static OptionalNode of(ViewNode content) {
        if (content == null) throw new IllegalArgumentException("content must not be null");
        return new OptionalNode(content);
    }

    public static OptionalNode ofNullable(ViewNode content) {
        return content == null ? EMPTY : new OptionalNode(content);
    }

    public static OptionalNode empty() {
        return EMPTY;
    }

    public boolean hasContent() {
        return content != null;
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.OPTIONAL;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitOptional(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionalNode)) return false;
        OptionalNode that = (OptionalNode) o;
        return Objects.equals(content, that.content);
    }

    @Override public int hashCode() {
        return Objects.hashCode(content);
    }
}
