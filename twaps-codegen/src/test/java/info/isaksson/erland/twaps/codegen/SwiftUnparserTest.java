package info.isaksson.erland.twaps.codegen;

import info.isaksson.erland.twaps.view.ArrayNode;
import info.isaksson.erland.twaps.view.ColorSpec;
import info.isaksson.erland.twaps.view.EitherNode;
import info.isaksson.erland.twaps.view.FontStyle;
import info.isaksson.erland.twaps.view.HorizontalAlignment;
import info.isaksson.erland.twaps.view.NamedColor;
import info.isaksson.erland.twaps.view.OptionalNode;
import info.isaksson.erland.twaps.view.TextNode;
import info.isaksson.erland.twaps.view.TwapModule;
import info.isaksson.erland.twaps.view.VerticalAlignment;
import info.isaksson.erland.twaps.view.ViewNode;
import info.isaksson.erland.twaps.view.builder.ViewBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.twaps.view.Views.*;
import static org.junit.jupiter.api.Assertions.*;

public class SwiftUnparserTest {

    @Test
    void plainTextHasNoModifiers() {
        assertEquals("Text(\"s\")", SwiftUnparser.unparse(text("s")));
    }

    @Test
    void modifiersFollowFixedEmissionOrder() {
        TextNode t = text("Hello, World!").bold().italic().font(FontStyle.TITLE).foregroundColor(NamedColor.RED);

        assertEquals("Text(\"Hello, World!\").font(.title).foregroundColor(.red).bold().italic()", SwiftUnparser.unparse(t));
    }

    @Test
    void boldItalicCallOrderDoesNotChangeOutput() {
        assertEquals(
                SwiftUnparser.unparse(text("x").bold().italic()),
                SwiftUnparser.unparse(text("x").italic().bold()));
    }

    @Test
    void helloWorldContainsModifiersInRelativeOrder() {
        String code = SwiftUnparser.unparse(text("Hello, World!").bold().italic().font(FontStyle.TITLE));

        int text = code.indexOf("Text(\"Hello, World!\")");
        int font = code.indexOf(".font(");
        int bold = code.indexOf(".bold()");
        int italic = code.indexOf(".italic()");
        assertEquals(0, text);
        assertTrue(font > text, code);
        assertTrue(bold > font, code);
        assertTrue(italic > bold, code);
    }

    @Test
    void rgbColorUsesColorInitializer() {
        assertEquals("Text(\"c\").foregroundColor(Color(red: 1, green: 0.5, blue: 0))",
                SwiftUnparser.unparse(text("c").foregroundColor(ColorSpec.rgb(1.0, 0.5, 0.0))));
        assertEquals("Text(\"c\").foregroundColor(Color(red: 0, green: 0, blue: 0, opacity: 0.25))",
                SwiftUnparser.unparse(text("c").foregroundColor(ColorSpec.rgb(0, 0, 0, 0.25))));
        assertEquals("Text(\"c\").foregroundColor(.accentColor)",
                SwiftUnparser.unparse(text("c").foregroundColor(NamedColor.ACCENT)));
    }

    @Test
    void quotesBackslashesAndNewlinesAreEscaped() {
        assertEquals("Text(\"say \\\"hi\\\"\\n\\\\o/\")", SwiftUnparser.unparse(text("say \"hi\"\n\\o/")));
    }

    @Test
    void vstackWithoutSpacingOmitsClause() {
        String code = SwiftUnparser.unparse(vstack(text("Hello")));

        assertEquals("VStack(alignment: .center) {\n    Text(\"Hello\")\n}", code);
        assertFalse(code.contains("spacing"));
    }

    @Test
    void vstackWithSpacingIncludesClause() {
        String code = SwiftUnparser.unparse(vstack(HorizontalAlignment.TRAILING, 8.0, text("a")));

        assertTrue(code.contains(", spacing: 8"), code);
        assertTrue(code.startsWith("VStack(alignment: .trailing, spacing: 8) {"), code);
    }

    @Test
    void hstackMapsVerticalAlignment() {
        assertTrue(SwiftUnparser.unparse(hstack(VerticalAlignment.TOP, null, text("a"))).startsWith("HStack(alignment: .top) {"));
        assertTrue(SwiftUnparser.unparse(hstack(VerticalAlignment.BOTTOM, 4.5, text("a"))).startsWith("HStack(alignment: .bottom, spacing: 4.5) {"));
        assertTrue(SwiftUnparser.unparse(hstack(text("a"))).startsWith("HStack(alignment: .center) {"));
    }

    @Test
    void tuplesEmitOneChildPerLineWithoutContainer() {
        assertEquals("Text(\"a\")\nText(\"b\")", SwiftUnparser.unparse(ViewBuilder.block(text("a"), text("b"))));
        assertEquals("Text(\"a\")\nText(\"b\")\nText(\"c\")", SwiftUnparser.unparse(ViewBuilder.block(text("a"), text("b"), text("c"))));
    }

    @Test
    void longBlocksGenerateSameLinesAsFlatSequence() {
        ViewNode five = ViewBuilder.block(new ViewNode[]{text("1"), text("2"), text("3"), text("4"), text("5")});

        assertEquals("Text(\"1\")\nText(\"2\")\nText(\"3\")\nText(\"4\")\nText(\"5\")", SwiftUnparser.unparse(five));
    }

    @Test
    void eitherEmitsOnlyRecordedBranch() {
        assertEquals("Text(\"yes\")", SwiftUnparser.unparse(EitherNode.first(text("yes"))));
        assertEquals("Text(\"no\")", SwiftUnparser.unparse(EitherNode.second(text("no"))));
    }

    @Test
    void optionalEmitsContentOrEmptyView() {
        ViewNode x = text("x").italic();

        assertEquals(SwiftUnparser.EMPTY_VIEW, SwiftUnparser.unparse(OptionalNode.empty()));
        assertEquals("EmptyView()", SwiftUnparser.unparse(empty()));
        assertEquals(SwiftUnparser.unparse(x), SwiftUnparser.unparse(OptionalNode.of(x)));
    }

    @Test
    void arrayWrapsItemsInVStack() {
        assertEquals("VStack {\n}", SwiftUnparser.unparse(new ArrayNode(List.of())));

        ViewNode a = text("a");
        ViewNode b = text("b").bold();
        String code = SwiftUnparser.unparse(new ArrayNode(List.of(a, b)));

        assertEquals("VStack {\n    " + SwiftUnparser.unparse(a) + "\n    " + SwiftUnparser.unparse(b) + "\n}", code);
    }

    @Test
    void buttonEmitsPlaceholderInsteadOfAction() {
        String code = SwiftUnparser.unparse(button(() -> { }, text("Go")));

        assertEquals("Button(action: {\n    // Action code would be here\n}) {\n    Text(\"Go\")\n}", code);
    }

    @Test
    void nestedContainersIndentEveryLine() {
        String code = SwiftUnparser.unparse(vstack(hstack(text("a"), text("b"))));

        assertEquals(String.join("\n",
                "VStack(alignment: .center) {",
                "    HStack(alignment: .center) {",
                "        Text(\"a\")",
                "        Text(\"b\")",
                "    }",
                "}"), code);
    }

    @Test
    void nestedModuleContributesOnlyItsContent() {
        TwapModule inner = TwapModule.of("inner", text("inside"));

        assertEquals("Text(\"inside\")", SwiftUnparser.unparse(inner));
    }

    @Test
    void indentOptionIsHonoured() {
        String code = new SwiftUnparser(CodegenOptions.defaults().withIndent(2), null).render(vstack(text("a")));

        assertEquals("VStack(alignment: .center) {\n  Text(\"a\")\n}", code);
    }

    @Test
    void buttonActionsAreReportedWithTheirPath() {
        GeneratorWarnings warnings = new GeneratorWarnings();

        new SwiftUnparser(CodegenOptions.defaults(), warnings)
                .render(vstack(text("a"), button(() -> { }, text("b")), button("c")));

        List<GeneratorWarning> out = warnings.toDeterministicList();
        assertEquals(1, out.size());
        assertEquals(GeneratorWarning.ACTION_NOT_SERIALIZED, out.get(0).code);
        assertEquals("/content/second", out.get(0).context.get("path"));
    }

    @Test
    void unparseIsDeterministic() {
        ViewNode tree = vstack(HorizontalAlignment.LEADING, 3.0,
                text("t").font(FontStyle.CAPTION2),
                ViewBuilder.forEach(List.of("a", "b", "c"), s -> text(s).foregroundColor(NamedColor.BLUE)),
                ViewBuilder.optional(true, () -> button("ok")));

        assertEquals(SwiftUnparser.unparse(tree), SwiftUnparser.unparse(tree));
    }
}
