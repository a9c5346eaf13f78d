package info.isaksson.erland.twaps.codegen;

import info.isaksson.erland.twaps.view.TwapMetadata;
import info.isaksson.erland.twaps.view.TwapModule;
import info.isaksson.erland.twaps.view.ViewNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Generates a complete Swift compilation unit for a view tree.
 *
 * <p>Every unit has the same shape: a header comment with the module metadata, an import of
 * SwiftUI, a {@value #WRAPPER_TYPE_NAME} struct whose body is the unparsed tree, and a C-callable
 * entry point named {@value #ENTRY_POINT_SYMBOL} taking no arguments and returning an opaque
 * retained pointer to the hosting controller. Dynamic loaders look the entry point up by
 * name, so neither the symbol nor its signature may change.</p>
 *
 * <p>Generation never fails for a well-formed tree; findings are reported as warnings.</p>
 */
public final class TwapCodeGenerator {

    public static final String ENTRY_POINT_SYMBOL = "createDynamicView";
    public static final String WRAPPER_TYPE_NAME = "TwapView";
    public static final String FRAMEWORK_MODULE = "SwiftUI";

    private static final Logger log = LoggerFactory.getLogger(TwapCodeGenerator.class);

    /** Generated source plus the warnings collected while producing it. */
    public static final class Result {
        public final String source;
        public final TwapMetadata metadata;
        public final List<GeneratorWarning> warnings;

        Result(String source, TwapMetadata metadata, List<GeneratorWarning> warnings) {
            this.source = source;
            this.metadata = metadata;
            this.warnings = warnings == null ? List.of() : warnings;
        }
    }

    private final ViewNode twap;
    private final TwapMetadata metadata;
    private final CodegenOptions options;

    public TwapCodeGenerator(TwapModule module) {
        this(module, module == null ? null : module.metadata, CodegenOptions.defaults());
    }

    public TwapCodeGenerator(ViewNode twap, TwapMetadata metadata) {
        this(twap, metadata, CodegenOptions.defaults());
    }

    public TwapCodeGenerator(ViewNode twap, TwapMetadata metadata, CodegenOptions options) {
        if (twap == null) throw new IllegalArgumentException("twap must not be null");
        this.twap = twap;
        this.metadata = metadata == null ? extractMetadata(twap) : metadata;
        this.options = options == null ? CodegenOptions.defaults() : options;
    }

    /**
     * Looks up the metadata carried by a module.
     *
     * @return the module's metadata, or {@link TwapMetadata#FALLBACK} for anything that is not
     *         a {@link TwapModule} (including {@code null})
     */
    public static TwapMetadata extractMetadata(Object value) {
        if (value instanceof TwapModule) {
            return ((TwapModule) value).metadata;
        }
        return TwapMetadata.FALLBACK;
    }

    /** Generates the Swift source for the unit. Repeated calls return identical text. */
    public String generateCode() {
        return generate().source;
    }

    public Result generate() {
        GeneratorWarnings warnings = new GeneratorWarnings();

        if (metadata.id.isBlank()) {
            warnings.warn(GeneratorWarning.BLANK_MODULE_ID, "Module id is blank");
        }
        String id = headerValue("id", metadata.id, warnings);
        String version = headerValue("version", metadata.version, warnings);
        String author = headerValue("author", metadata.author, warnings);

        SwiftUnparser unparser = new SwiftUnparser(options, warnings);
        String body = unparser.indent(unparser.render(twap), 2);
        String in = options.indent;

        StringBuilder sb = new StringBuilder();
        sb.append("// Generated by ").append(SwiftLiterals.withoutUnpairedSurrogates(options.generatorName)).append('\n');
        sb.append("// Twap ID: ").append(id).append('\n');
        sb.append("// Version: ").append(version).append('\n');
        sb.append("// Author: ").append(author).append('\n');
        sb.append('\n');
        sb.append("import ").append(FRAMEWORK_MODULE).append('\n');
        sb.append('\n');
        sb.append("// MARK: - Twap View").append('\n');
        sb.append('\n');
        sb.append("struct ").append(WRAPPER_TYPE_NAME).append(": View {").append('\n');
        sb.append(in).append("var body: some View {").append('\n');
        sb.append(body).append('\n');
        sb.append(in).append('}').append('\n');
        sb.append('}').append('\n');
        sb.append('\n');
        sb.append("// MARK: - Dynamic Loading Entry Point").append('\n');
        sb.append('\n');
        sb.append("@_cdecl(\"").append(ENTRY_POINT_SYMBOL).append("\")").append('\n');
        sb.append("public func ").append(ENTRY_POINT_SYMBOL).append("() -> UnsafeMutableRawPointer {").append('\n');
        sb.append(in).append("let view = ").append(WRAPPER_TYPE_NAME).append("()").append('\n');
        sb.append(in).append("let hostingController = ").append(options.hostingController).append("(rootView: view)").append('\n');
        sb.append(in).append("return Unmanaged.passRetained(hostingController).toOpaque()").append('\n');
        sb.append('}').append('\n');

        List<GeneratorWarning> sorted = warnings.toDeterministicList();
        log.debug("Generated unit for '{}' ({} chars, {} warnings)", metadata.id, sb.length(), sorted.size());
        return new Result(sb.toString(), metadata, sorted);
    }

    /** Writes the generated unit as UTF-8, creating parent directories as needed. */
    public void writeToFile(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String code = generateCode();
        Files.writeString(path, code, StandardCharsets.UTF_8);
        log.debug("Wrote unit for '{}' to {}", metadata.id, path);
    }

    // Header values are comments; a line break would end the comment and leak into code.
    private static String headerValue(String field, String raw, GeneratorWarnings warnings) {
        String value = SwiftLiterals.withoutUnpairedSurrogates(raw);
        if (value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        warnings.warnField(GeneratorWarning.METADATA_LINE_BREAK,
                "Line breaks in metadata replaced by spaces", field);
        return value.replace("\r\n", " ").replace('\r', ' ').replace('\n', ' ');
    }
}
