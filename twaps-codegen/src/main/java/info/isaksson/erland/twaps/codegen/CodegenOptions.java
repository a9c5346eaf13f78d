package info.isaksson.erland.twaps.codegen;

import java.util.regex.Pattern;

/**
 * Options for generating Swift source.
 *
 * <p>The exported entry point ({@link TwapCodeGenerator#ENTRY_POINT_SYMBOL}) and its signature
 * are fixed and deliberately not part of these options.</p>
 */
public final class CodegenOptions {
    public static final String DEFAULT_GENERATOR_NAME = "Twaps Framework";
    public static final String DEFAULT_HOSTING_CONTROLLER = "NSHostingController";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** One level of indentation. */
    public final String indent;

    /** Shown in the first header line of every generated unit. */
    public final String generatorName;

    /** Controller type that hosts the view inside the entry point. */
    public final String hostingController;

    public CodegenOptions(String indent, String generatorName, String hostingController) {
        this.indent = (indent == null || indent.isEmpty()) ? "    " : checkIndent(indent);
        this.generatorName = (generatorName == null || generatorName.isBlank())
                ? DEFAULT_GENERATOR_NAME
                : checkSingleLine(generatorName.trim());
        this.hostingController = (hostingController == null || hostingController.isBlank())
                ? DEFAULT_HOSTING_CONTROLLER
                : checkIdentifier(hostingController.trim());
    }

    public static CodegenOptions defaults() {
        return new CodegenOptions(null, null, null);
    }

    public CodegenOptions withIndent(int spaces) {
        if (spaces < 1 || spaces > 8) throw new IllegalArgumentException("indent must be 1..8 spaces: " + spaces);
        return new CodegenOptions(" ".repeat(spaces), generatorName, hostingController);
    }

    public CodegenOptions withGeneratorName(String name) {
        return new CodegenOptions(indent, name, hostingController);
    }

    public CodegenOptions withHostingController(String type) {
        return new CodegenOptions(indent, generatorName, type);
    }

    private static String checkIndent(String indent) {
        for (int i = 0; i < indent.length(); i++) {
            char c = indent.charAt(i);
            if (c != ' ' && c != '\t') throw new IllegalArgumentException("indent must be spaces or tabs");
        }
        return indent;
    }

    private static String checkSingleLine(String value) {
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("generatorName must be a single line");
        }
        return value;
    }

    private static String checkIdentifier(String value) {
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("hostingController must be a Swift type name: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "CodegenOptions{" +
                "indent=" + indent.length() +
                ", generatorName='" + generatorName + '\'' +
                ", hostingController='" + hostingController + '\'' +
                '}';
    }
}
