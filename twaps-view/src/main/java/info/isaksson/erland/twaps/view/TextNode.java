package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A run of text with optional style attributes.
 *
 * <p>Modifiers ({@link #font}, {@link #foregroundColor}, {@link #bold}, {@link #italic}) never
 * mutate the receiver; each returns a copy with exactly one attribute changed. Attributes are
 * flags or last-write-wins slots, so the order of modifier calls does not matter.</p>
 */
@JsonPropertyOrder({"content","font","color","bold","italic"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TextNode implements ViewNode {
    public final String content;
    public final FontStyle font;
    public final ColorSpec color;
    public final boolean bold;
    public final boolean italic;

    public TextNode(String content) {
        this(content, null, null, false, false);
    }

    @JsonCreator
    public TextNode(
            @JsonProperty("content") String content,
            @JsonProperty("font") FontStyle font,
            @JsonProperty("color") ColorSpec color,
            @JsonProperty("bold") boolean bold,
            @JsonProperty("italic") boolean italic
    ) {
        this.content = content == null ? "" : content;
        this.font = font;
        this.color = color;
        this.bold = bold;
        this.italic = italic;
    }

    public TextNode font(FontStyle font) {
        return new TextNode(content, font, color, bold, italic);
    }

    public TextNode foregroundColor(ColorSpec color) {
        return new TextNode(content, font, color, bold, italic);
    }

    public TextNode foregroundColor(NamedColor color) {
        return foregroundColor(ColorSpec.named(color));
    }

    public TextNode bold() {
        return new TextNode(content, font, color, true, italic);
    }

    public TextNode italic() {
        return new TextNode(content, font, color, bold, true);
    }

    @Override
    public ViewNodeKind kind() {
        return ViewNodeKind.TEXT;
    }

    @Override
    public <R> R accept(ViewNodeVisitor<R> visitor) {
        return visitor.visitText(this);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextNode)) return false;
        TextNode that = (TextNode) o;
        return bold == that.bold &&
                italic == that.italic &&
                Objects.equals(content, that.content) &&
                font == that.font &&
                Objects.equals(color, that.color);
    }

    @Override public int hashCode() {
        return Objects.hash(content, font, color, bold, italic);
    }

    @Override public String toString() {
        return "TextNode{" + content + "}";
    }
}
