package info.isaksson.erland.twaps.core.publish;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.twaps.view.ViewJson;

import java.util.Objects;
import java.util.UUID;

/**
 * A module in the form a distribution server expects: {@code {source, id, url}}.
 *
 * <p>{@code source} holds the generated unit with every newline replaced by the two characters
 * {@code \n}. Nothing else is escaped, and Swift string literals in the unit already spell their
 * own line breaks as {@code \n}, so the replacement is one-way: read the unit from the generator,
 * not back out of a payload.</p>
 */
@JsonPropertyOrder({"source","id","url"})
public final class PublishPayload {

    private static final ObjectMapper MAPPER = ViewJson.createMapper();

    public final String source;
    public final String id;
    public final String url;

    @JsonCreator
    public PublishPayload(
            @JsonProperty("source") String source,
            @JsonProperty("id") String id,
            @JsonProperty("url") String url
    ) {
        this.source = source == null ? "" : source;
        this.id = id;
        this.url = url;
    }

    /**
     * @param id payload id; a random UUID is used when {@code null}
     */
    public static PublishPayload prepare(String sourceCode, String url, String id) {
        if (sourceCode == null) throw new IllegalArgumentException("sourceCode must not be null");
        if (url == null || url.isBlank()) throw new IllegalArgumentException("url must not be blank");
        String escaped = sourceCode.replace("\n", "\\n");
        return new PublishPayload(escaped, id == null ? UUID.randomUUID().toString() : id, url);
    }

    /** Compact JSON body, properties in the order source, id, url. */
    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }

    public static PublishPayload fromJson(String json) throws JsonProcessingException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, PublishPayload.class);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PublishPayload)) return false;
        PublishPayload that = (PublishPayload) o;
        return Objects.equals(source, that.source) &&
                Objects.equals(id, that.id) &&
                Objects.equals(url, that.url);
    }

    @Override public int hashCode() {
        return Objects.hash(source, id, url);
    }

    @Override public String toString() {
        return "PublishPayload{id=" + id + ", url=" + url + "}";
    }
}
