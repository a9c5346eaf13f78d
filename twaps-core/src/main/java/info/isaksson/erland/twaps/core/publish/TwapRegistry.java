package info.isaksson.erland.twaps.core.publish;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import info.isaksson.erland.twaps.view.ViewJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Local registry of published modules: a JSON array of {@link PublishPayload} in one file.
 *
 * <p>Entries are keyed by {@code url}; saving a payload replaces any entry with the same url and
 * appends the new one at the end.</p>
 */
public final class TwapRegistry {

    private static final Logger log = LoggerFactory.getLogger(TwapRegistry.class);
    private static final TypeReference<List<PublishPayload>> LIST_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = ViewJson.createMapper();
    private static final ObjectWriter WRITER = MAPPER.writerFor(LIST_TYPE).with(ViewJson.createPrettyPrinter());

    private final Path file;

    public TwapRegistry(Path file) {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        this.file = file;
    }

    /** {@code ~/.twaps/twaps.json} */
    public static Path defaultPath() {
        return Paths.get(System.getProperty("user.home"), ".twaps", "twaps.json");
    }

    public Path file() {
        return file;
    }

    /**
     * Reads all entries. A missing file is an empty registry; an unreadable one is logged and
     * treated as empty so a corrupt file never blocks registering.
     */
    public List<PublishPayload> load() {
        if (!Files.isRegularFile(file)) return new ArrayList<>();
        try (var in = Files.newInputStream(file)) {
            List<PublishPayload> entries = MAPPER.readValue(in, LIST_TYPE);
            return entries == null ? new ArrayList<>() : new ArrayList<>(entries);
        } catch (IOException e) {
            log.warn("Could not read registry {}: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    public void save(PublishPayload payload) throws IOException {
        if (payload == null) throw new IllegalArgumentException("payload must not be null");
        Path parent = file.toAbsolutePath().normalize().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        List<PublishPayload> entries = load();
        entries.removeIf(p -> p.url != null && p.url.equals(payload.url));
        entries.add(payload);

        try (var out = Files.newOutputStream(file)) {
            WRITER.writeValue(out, entries);
            out.write('\n');
        }
        log.debug("Registered '{}' at {} ({} entries in {})", payload.id, payload.url, entries.size(), file);
    }
}
