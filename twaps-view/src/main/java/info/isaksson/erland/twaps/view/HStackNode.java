package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Lays its content out leading to trailing. */
@JsonPropertyOrder({"alignment","spacing","content"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class HStackNode implements ViewNode {
    public final VerticalAlignment alignment;

    /** Gap between children; {@code null} means the platform default. */
    public final Double spacing;

    public final ViewNode content;

    @JsonCreator
    public HStackNode(
            @JsonProperty("alignment") VerticalAlignment alignment,
            @JsonProperty("spacing") Double spacing,
            @JsonProperty("content") ViewNode content
    ) {
        if (content == null) throw new IllegalArgumentException("content must not be null");
        this.alignment = alignment == null ? VerticalAlignment.CENTER : alignment;
        this.spacing = Spacing.check(spacing);
        this.content = content;
    }

    public HStackNode(ViewNode content) {
        this(VerticalAlignment.CENTER, null, content);
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.HSTACK;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitHStack(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HStackNode)) return false;
        HStackNode that = (HStackNode) o;
        return alignment == that.alignment &&
                Objects.equals(spacing, that.spacing) &&
                Objects.equals(content, that.content);
    }

    @Override public int hashCode() {
        return Objects.hash(alignment, spacing, content);
    }
}
