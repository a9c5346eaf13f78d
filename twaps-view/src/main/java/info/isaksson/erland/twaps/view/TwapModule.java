package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Top-level unit: a content tree plus the {@link TwapMetadata} that identifies it.
 *
 * <p>As a node it contributes only its content; the metadata is read by the generator when
 * a full compilation unit is produced.</p>
 */
@JsonPropertyOrder({"metadata","content"})
public final class TwapModule implements ViewNode {
    public final TwapMetadata metadata;
    public final ViewNode content;

    @JsonCreator
    public TwapModule(
            @JsonProperty("metadata") TwapMetadata metadata,
            @JsonProperty("content") ViewNode content
    ) {
        if (content == null) throw new IllegalArgumentException("content must not be null");
        this.metadata = metadata == null ? new TwapMetadata(null) : metadata;
        this.content = content;
    }

    public TwapModule(String id, String version, String author, ViewNode content) {
        this(new TwapMetadata(id, version, author), content);
    }

    public static TwapModule of(String id, ViewNode content) {
        return new TwapModule(new TwapMetadata(id), content);
    }

    /** Evaluates {@code content} once, at construction. */
    public static TwapModule define(String id, String version, String author, Supplier<? extends ViewNode> content) {
        if (content == null) throw new IllegalArgumentException("content must not be null");
        return new TwapModule(id, version, author, content.get());
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.MODULE;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitModule(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TwapModule)) return false;
        TwapModule that = (TwapModule) o;
        return Objects.equals(metadata, that.metadata) && Objects.equals(content, that.content);
    }

    @Override public int hashCode() {
        return Objects.hash(metadata, content);
    }
}
