package info.isaksson.erland.twaps.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Collects warnings while a unit is generated.
 *
 * <p>A finding about a node carries the node's slot path from the module root under
 * {@link #PATH} (for example {@code /content/second/items[2]}); a finding about the header
 * carries the metadata field under {@link #FIELD}.</p>
 *
 * <p>Final output is grouped by code. Within a code, warnings keep the order they were raised
 * in, which is header order for metadata fields and reading order for nodes.</p>
 */
public final class GeneratorWarnings {

    public static final String PATH = "path";
    public static final String FIELD = "field";

    private final List<GeneratorWarning> warnings = new ArrayList<>();

    /** A finding about the module as a whole. */
    public void warn(String code, String message) {
        warnings.add(new GeneratorWarning(code, message, Map.of()));
    }

    /** A finding about the node at {@code path}. */
    public void warn(String code, String message, String path) {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        warnings.add(new GeneratorWarning(code, message, Map.of(PATH, path)));
    }

    /** A finding about one metadata field of the header ({@code id}, {@code version}, {@code author}). */
    public void warnField(String code, String message, String field) {
        if (field == null) throw new IllegalArgumentException("field must not be null");
        warnings.add(new GeneratorWarning(code, message, Map.of(FIELD, field)));
    }

    public List<GeneratorWarning> toDeterministicList() {
        List<GeneratorWarning> out = new ArrayList<>(warnings);
        // List.sort is stable, so raise order survives within a code.
        out.sort(Comparator.comparing((GeneratorWarning w) -> w.code));
        return Collections.unmodifiableList(out);
    }
}
