package info.isaksson.erland.twaps.codegen;

import info.isaksson.erland.twaps.view.ArrayNode;
import info.isaksson.erland.twaps.view.ButtonNode;
import info.isaksson.erland.twaps.view.EitherNode;
import info.isaksson.erland.twaps.view.HStackNode;
import info.isaksson.erland.twaps.view.OptionalNode;
import info.isaksson.erland.twaps.view.TextNode;
import info.isaksson.erland.twaps.view.Tuple2Node;
import info.isaksson.erland.twaps.view.Tuple3Node;
import info.isaksson.erland.twaps.view.TwapModule;
import info.isaksson.erland.twaps.view.VStackNode;
import info.isaksson.erland.twaps.view.ViewNode;
import info.isaksson.erland.twaps.view.ViewNodeVisitor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Turns a view tree into SwiftUI view-builder source.
 *
 * <p>Output is a pure function of the tree and the indent option: no locale, no hashing,
 * no iteration over unordered collections. Containers put their content on separate lines,
 * indented one level; sibling sequences (tuples, arrays) emit one child per line.</p>
 *
 * <p>Text modifiers are always emitted as font, foreground color, bold, italic, regardless of
 * the order the modifiers were applied in.</p>
 */
public final class SwiftUnparser implements ViewNodeVisitor<String> {

    /** Emitted for absent optional content. */
    public static final String EMPTY_VIEW = "EmptyView()";

    /** Stands in for a button's action closure, which has no source form. */
    public static final String ACTION_PLACEHOLDER = "// Action code would be here";

    private final String indent;
    private final GeneratorWarnings warnings;
    private final Deque<String> path = new ArrayDeque<>();

    public SwiftUnparser() {
        this(CodegenOptions.defaults(), null);
    }

    /**
     * @param warnings collector for non-fatal findings; may be {@code null}
     */
    public SwiftUnparser(CodegenOptions options, GeneratorWarnings warnings) {
        this.indent = (options == null ? CodegenOptions.defaults() : options).indent;
        this.warnings = warnings;
    }

    /** Convenience: unparse with default options and no warning collection. */
    public static String unparse(ViewNode node) {
        return new SwiftUnparser().render(node);
    }

    public String render(ViewNode node) {
        if (node == null) throw new IllegalArgumentException("node must not be null");
        return node.accept(this);
    }

    @Override
    public String visitText(TextNode node) {
        StringBuilder sb = new StringBuilder("Text(").append(SwiftLiterals.string(node.content)).append(')');
        if (node.font != null) {
            sb.append(".font(.").append(SwiftKeywords.font(node.font)).append(')');
        }
        if (node.color != null) {
            sb.append(".foregroundColor(").append(SwiftLiterals.color(node.color)).append(')');
        }
        if (node.bold) {
            sb.append(".bold()");
        }
        if (node.italic) {
            sb.append(".italic()");
        }
        return sb.toString();
    }

    @Override
    public String visitButton(ButtonNode node) {
        if (node.hasAction() && warnings != null) {
            warnings.warn(GeneratorWarning.ACTION_NOT_SERIALIZED,
                    "Button action replaced by a placeholder comment", currentPath());
        }
        String header = "Button(action: {\n" + indent + ACTION_PLACEHOLDER + "\n})";
        return block(header, child("label", node.label));
    }

    @Override
    public String visitVStack(VStackNode node) {
        String header = "VStack(alignment: ." + SwiftKeywords.alignment(node.alignment) + spacing(node.spacing) + ")";
        return block(header, child("content", node.content));
    }

    @Override
    public String visitHStack(HStackNode node) {
        String header = "HStack(alignment: ." + SwiftKeywords.alignment(node.alignment) + spacing(node.spacing) + ")";
        return block(header, child("content", node.content));
    }

    @Override
    public String visitTuple2(Tuple2Node node) {
        return child("first", node.first) + "\n" + child("second", node.second);
    }

    @Override
    public String visitTuple3(Tuple3Node node) {
        return child("first", node.first) + "\n" + child("second", node.second) + "\n" + child("third", node.third);
    }

    @Override
    public String visitEither(EitherNode node) {
        return child(node.branch == EitherNode.Branch.FIRST ? "first" : "second", node.content);
    }

    @Override
    public String visitOptional(OptionalNode node) {
        return node.hasContent() ? child("content", node.content) : EMPTY_VIEW;
    }

    @Override
    public String visitArray(ArrayNode node) {
        List<ViewNode> items = node.items;
        StringBuilder body = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) body.append('\n');
            body.append(child("items[" + i + "]", items.get(i)));
        }
        return block("VStack", body.toString());
    }

    @Override
    public String visitModule(TwapModule module) {
        return child("content", module.content);
    }

    /** Prefixes every non-empty line of {@code code} with {@code levels} indents. */
    String indent(String code, int levels) {
        String prefix = indent.repeat(levels);
        String[] lines = code.split("\n", -1);
        StringBuilder sb = new StringBuilder(code.length() + lines.length * prefix.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            if (!lines[i].isEmpty()) sb.append(prefix);
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    private String block(String header, String body) {
        StringBuilder sb = new StringBuilder(header).append(" {\n");
        if (!body.isEmpty()) {
            sb.append(indent(body, 1)).append('\n');
        }
        return sb.append('}').toString();
    }

    private String child(String slot, ViewNode node) {
        path.addLast(slot);
        try {
            return node.accept(this);
        } finally {
            path.removeLast();
        }
    }

    private String currentPath() {
        return "/" + String.join("/", path);
    }

    private static String spacing(Double spacing) {
        return spacing == null ? "" : ", spacing: " + SwiftLiterals.number(spacing);
    }
}
