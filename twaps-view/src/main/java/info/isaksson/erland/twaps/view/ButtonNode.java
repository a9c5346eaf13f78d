package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A tappable control wrapping a label subtree.
 *
 * <p>The action is opaque: it is neither serialized nor part of the node's value
 * ({@link #equals(Object)} compares labels only).</p>
 */
@JsonPropertyOrder({"label"})
public final class ButtonNode implements ViewNode {
    public final ViewNode label;

    @JsonIgnore
    public final Runnable action;

    @JsonCreator
    public ButtonNode(@JsonProperty("label") ViewNode label) {
        this(null, label);
    }

    public ButtonNode(Runnable action, ViewNode label) {
        if (label == null) throw new IllegalArgumentException("label must not be null");
        this.action = action;
        this.label = label;
    }

    public boolean hasAction() {
        return action != null;
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.BUTTON;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitButton(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ButtonNode)) return false;
        ButtonNode that = (ButtonNode) o;
        return Objects.equals(label, that.label);
    }

    @Override public int hashCode() {
        return Objects.hash(label);
    }
}
