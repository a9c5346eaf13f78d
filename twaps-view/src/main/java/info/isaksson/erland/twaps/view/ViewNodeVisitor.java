package info.isaksson.erland.twaps.view;

/** Exhaustive dispatch over {@link ViewNodeKind}. */
public interface ViewNodeVisitor<R> {

    R visitText(TextNode node);

    R visitButton(ButtonNode node);

    R visitVStack(VStackNode node);

    R visitHStack(HStackNode node);

    R visitTuple2(Tuple2Node node);

    R visitTuple3(Tuple3Node node);

    R visitEither(EitherNode node);

    R visitOptional(OptionalNode node);

    R visitArray(ArrayNode node);

    R visitModule(TwapModule module);
}
