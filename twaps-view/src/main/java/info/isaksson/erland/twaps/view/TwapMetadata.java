package info.isaksson.erland.twaps.view;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Identity of a module: {@code id}, {@code version}, {@code author}.
 *
 * <p>The id is opaque and never validated; downstream publishing uses it as the stable key.</p>
 */
@JsonPropertyOrder({"id","version","author"})
public final class TwapMetadata {
    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_AUTHOR = "Unknown";

    /** Returned when metadata cannot be located on a value. */
    public static final TwapMetadata FALLBACK = new TwapMetadata("unknown", DEFAULT_VERSION, DEFAULT_AUTHOR);

    public final String id;
    public final String version;
    public final String author;

    @JsonCreator
    public TwapMetadata(
            @JsonProperty("id") String id,
            @JsonProperty("version") String version,
            @JsonProperty("author") String author
    ) {
        this.id = id == null ? "" : id;
        this.version = version == null ? DEFAULT_VERSION : version;
        this.author = author == null ? DEFAULT_AUTHOR : author;
    }

    public TwapMetadata(String id) {
        this(id, null, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TwapMetadata)) return false;
        TwapMetadata that = (TwapMetadata) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(version, that.version) &&
                Objects.equals(author, that.author);
    }

    @Override public int hashCode() {
        return Objects.hash(id, version, author);
    }

    @Override public String toString() {
        return "TwapMetadata{" + id + "@" + version + " by " + author + "}";
    }
}
