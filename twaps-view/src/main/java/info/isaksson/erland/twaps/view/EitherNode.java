package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * The outcome of a conditional: which side was taken and the content built for it.
 * Only the taken side is ever constructed.
 */
@JsonPropertyOrder({"branch","content"})
public final class EitherNode implements ViewNode {

    public enum Branch {
        FIRST,
        SECOND
    }

    public final Branch branch;
    public final ViewNode content;

    @JsonCreator
    public EitherNode(
            @JsonProperty("branch") Branch branch,
            @JsonProperty("content") ViewNode content
    ) {
        if (branch == null) throw new IllegalArgumentException("branch must not be null");
        if (content == null) throw new IllegalArgumentException("content must not be null");
        this.branch = branch;
        this.content = content;
    }

    public static EitherNode first(ViewNode content) {
        return new EitherNode(Branch.FIRST, content);
    }

    public static EitherNode second(ViewNode content) {
        return new EitherNode(Branch.SECOND, content);
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.EITHER;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitEither(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EitherNode)) return false;
        EitherNode that = (EitherNode) o;
        return branch == that.branch && Objects.equals(content, that.content);
    }

    @Override public int hashCode() {
        return Objects.hash(branch, content);
    }
}
