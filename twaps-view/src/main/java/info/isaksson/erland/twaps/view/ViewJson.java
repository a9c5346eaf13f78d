package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON serialization for view trees and modules.
 *
 * <p>Writing is deterministic: property order is fixed per node type, every node carries a
 * {@code kind} discriminator and output ends with a newline. Button actions are dropped.</p>
 */
public final class ViewJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final ObjectWriter WRITER = MAPPER.writerFor(ViewNode.class).with(createPrettyPrinter());

    private ViewJson() {}

    public static ViewNode read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, ViewNode.class);
        }
    }

    /** Parse a view tree from a JSON string. */
    public static ViewNode readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, ViewNode.class);
    }

    /** Parse a module document; fails if the top-level node is not a module. */
    public static TwapModule readModule(Path path) throws IOException {
        ViewNode node = read(path);
        if (!(node instanceof TwapModule)) {
            throw new IOException("expected a module document but found " + node.kind() + ": " + path);
        }
        return (TwapModule) node;
    }

    public static void write(ViewNode node, Path path) throws IOException {
        if (node == null) throw new IllegalArgumentException("node is null");
        if (path == null) throw new IllegalArgumentException("path is null");
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (var out = Files.newOutputStream(path)) {
            WRITER.writeValue(out, node);
            // Trailing newline for diff-friendliness.
            out.write('\n');
        }
    }

    public static String toJsonString(ViewNode node) throws IOException {
        if (node == null) throw new IllegalArgumentException("node is null");
        return WRITER.writeValueAsString(node) + "\n";
    }

    /** Shared mapper settings, also used for publish payloads. */
    public static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return om;
    }

    public static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
