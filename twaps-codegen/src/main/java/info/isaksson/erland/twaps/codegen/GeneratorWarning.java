package info.isaksson.erland.twaps.codegen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal deterministic warning produced during generation. */
public final class GeneratorWarning {

    public static final String ACTION_NOT_SERIALIZED = "ACTION_NOT_SERIALIZED";
    public static final String BLANK_MODULE_ID = "BLANK_MODULE_ID";
    public static final String METADATA_LINE_BREAK = "METADATA_LINE_BREAK";

    /** Warning code stable across versions. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Optional structured context (stable keys). */
    public final Map<String, String> context;

    public GeneratorWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeneratorWarning)) return false;
        GeneratorWarning that = (GeneratorWarning) o;
        return code.equals(that.code) && message.equals(that.message) && context.equals(that.context);
    }

    @Override public int hashCode() {
        return Objects.hash(code, message, context);
    }

    @Override public String toString() {
        return code + ": " + message + (context.isEmpty() ? "" : " " + context);
    }
}
