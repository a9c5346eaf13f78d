package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One immutable element of a declarative view tree.
 *
 * <p>The set of implementations is closed (see {@link ViewNodeKind}); consumers dispatch through
 * {@link #accept(ViewNodeVisitor)} so every kind must be handled explicitly.</p>
 *
 * <p>In JSON each node carries a {@code kind} discriminator so trees can be read back.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextNode.class, name = "text"),
        @JsonSubTypes.Type(value = ButtonNode.class, name = "button"),
        @JsonSubTypes.Type(value = VStackNode.class, name = "vstack"),
        @JsonSubTypes.Type(value = HStackNode.class, name = "hstack"),
        @JsonSubTypes.Type(value = Tuple2Node.class, name = "tuple2"),
        @JsonSubTypes.Type(value = Tuple3Node.class, name = "tuple3"),
        @JsonSubTypes.Type(value = EitherNode.class, name = "either"),
        @JsonSubTypes.Type(value = OptionalNode.class, name = "optional"),
        @JsonSubTypes.Type(value = ArrayNode.class, name = "array"),
        @JsonSubTypes.Type(value = TwapModule.class, name = "module")
})
public interface ViewNode {

    ViewNodeKind kind();

    <R> R accept(ViewNodeVisitor<R> visitor);
}
