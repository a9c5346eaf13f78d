package info.isaksson.erland.twaps.core;

import info.isaksson.erland.twaps.codegen.GeneratorWarning;
import info.isaksson.erland.twaps.view.TwapMetadata;

import java.nio.charset.StandardCharsets;
import java.util.List;

/** Generation result container for programmatic usage. */
public final class TwapsResult {
    /** UTF-8 encoded Swift source. */
    public final byte[] sourceBytes;

    /** Convenience: decoded source. */
    public final String source;

    public final TwapMetadata metadata;

    /** Sorted deterministically; empty when generation found nothing to report. */
    public final List<GeneratorWarning> warnings;

    TwapsResult(String source, TwapMetadata metadata, List<GeneratorWarning> warnings) {
        this.source = source;
        this.sourceBytes = source.getBytes(StandardCharsets.UTF_8);
        this.metadata = metadata;
        this.warnings = warnings == null ? List.of() : warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
