package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Lays its content out top to bottom. */
@JsonPropertyOrder({"alignment","spacing","content"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class VStackNode implements ViewNode {
    public final HorizontalAlignment alignment;

    /** Gap between children; {@code null} means the platform default. */
    public final Double spacing;

    public final ViewNode content;

    @JsonCreator
    public VStackNode(
            @JsonProperty("alignment") HorizontalAlignment alignment,
            @JsonProperty("spacing") Double spacing,
            @JsonProperty("content") ViewNode content
    ) {
        if (content == null) throw new IllegalArgumentException("content must not be null");
        this.alignment = alignment == null ? HorizontalAlignment.CENTER : alignment;
        this.spacing = Spacing.check(spacing);
        this.content = content;
    }

    public VStackNode(ViewNode content) {
        this(HorizontalAlignment.CENTER, null, content);
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.VSTACK;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitVStack(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VStackNode)) return false;
        VStackNode that = (VStackNode) o;
        return alignment == that.alignment &&
                Objects.equals(spacing, that.spacing) &&
                Objects.equals(content, that.content);
    }

    @Override public int hashCode() {
        return Objects.hash(alignment, spacing, content);
    }
}
