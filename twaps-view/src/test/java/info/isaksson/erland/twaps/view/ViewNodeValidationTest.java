package info.isaksson.erland.twaps.view;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ViewNodeValidationTest {

    @Test
    void stacksDefaultToCenterAndNoSpacing() {
        VStackNode v = new VStackNode(new TextNode("a"));
        HStackNode h = new HStackNode(null, null, new TextNode("a"));

        assertEquals(HorizontalAlignment.CENTER, v.alignment);
        assertNull(v.spacing);
        assertEquals(VerticalAlignment.CENTER, h.alignment);
        assertNull(h.spacing);
    }

    @Test
    void negativeOrNonFiniteSpacingIsRejected() {
        TextNode t = new TextNode("a");
        assertThrows(IllegalArgumentException.class, () -> new VStackNode(HorizontalAlignment.CENTER, -1.0, t));
        assertThrows(IllegalArgumentException.class, () -> new HStackNode(VerticalAlignment.TOP, Double.NaN, t));
        assertThrows(IllegalArgumentException.class, () -> new HStackNode(VerticalAlignment.TOP, Double.POSITIVE_INFINITY, t));
    }

    @Test
    void negativeZeroSpacingEqualsZero() {
        TextNode t = new TextNode("a");
        VStackNode negative = new VStackNode(HorizontalAlignment.CENTER, -0.0, t);
        VStackNode positive = new VStackNode(HorizontalAlignment.CENTER, 0.0, t);

        assertEquals(0, Double.compare(0.0, negative.spacing));
        assertEquals(positive, negative);
        assertEquals(positive.hashCode(), negative.hashCode());
        assertEquals(new HStackNode(VerticalAlignment.TOP, 0.0, t), new HStackNode(VerticalAlignment.TOP, -0.0, t));
    }

    @Test
    void compositesRejectMissingChildren() {
        TextNode t = new TextNode("a");
        assertThrows(IllegalArgumentException.class, () -> new Tuple2Node(t, null));
        assertThrows(IllegalArgumentException.class, () -> new Tuple3Node(t, t, null));
        assertThrows(IllegalArgumentException.class, () -> new ButtonNode(null));
        assertThrows(IllegalArgumentException.class, () -> new EitherNode(EitherNode.Branch.FIRST, null));
        assertThrows(IllegalArgumentException.class, () -> ArrayNode.of(Arrays.asList(t, null)));
    }

    @Test
    void arrayNodeKeepsOrderAndIsUnmodifiable() {
        ArrayNode arr = ArrayNode.of(List.of(new TextNode("b"), new TextNode("a")));

        assertEquals("b", ((TextNode) arr.items.get(0)).content);
        assertEquals("a", ((TextNode) arr.items.get(1)).content);
        assertThrows(UnsupportedOperationException.class, () -> arr.items.add(new TextNode("c")));
    }

    @Test
    void colorComponentsMustBeInUnitRange() {
        assertThrows(IllegalArgumentException.class, () -> ColorSpec.rgb(1.5, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> ColorSpec.rgb(0, 0, 0, -0.1));
        assertThrows(IllegalArgumentException.class, () -> new ColorSpec(NamedColor.RED, 0.5, null, null, null));
        assertEquals(1.0, ColorSpec.rgb(0.1, 0.2, 0.3).opacity.doubleValue());
    }

    @Test
    void metadataDefaults() {
        TwapMetadata m = new TwapMetadata("com.example.x");

        assertEquals("com.example.x", m.id);
        assertEquals("1.0.0", m.version);
        assertEquals("Unknown", m.author);
        assertEquals(new TwapMetadata("unknown", "1.0.0", "Unknown"), TwapMetadata.FALLBACK);
    }

    @Test
    void moduleDefinitionEvaluatesContentOnce() {
        int[] calls = {0};
        TwapModule module = TwapModule.define("id", "2.0.0", "me", () -> {
            calls[0]++;
            return new TextNode("body");
        });

        assertEquals(1, calls[0]);
        assertEquals(new TwapMetadata("id", "2.0.0", "me"), module.metadata);
        assertEquals(ViewNodeKind.MODULE, module.kind());
    }
}
