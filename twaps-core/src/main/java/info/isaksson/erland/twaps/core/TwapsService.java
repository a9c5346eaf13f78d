package info.isaksson.erland.twaps.core;

import info.isaksson.erland.twaps.codegen.TwapCodeGenerator;
import info.isaksson.erland.twaps.core.publish.PublishPayload;
import info.isaksson.erland.twaps.core.publish.TwapRegistry;
import info.isaksson.erland.twaps.view.TwapModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Core API for turning modules into Swift source and registering them.
 *
 * <p>Wrappers (build scripts, servers) should use this class instead of wiring the generator
 * and registry themselves. Instances hold no state and may be shared between threads.</p>
 */
public final class TwapsService {

    private static final Logger log = LoggerFactory.getLogger(TwapsService.class);

    public TwapsResult generate(TwapModule module, TwapsOptions options) {
        if (module == null) throw new IllegalArgumentException("module must not be null");
        if (options == null) options = new TwapsOptions();

        TwapCodeGenerator.Result res = new TwapCodeGenerator(module, module.metadata, options.codegen).generate();
        if (!res.warnings.isEmpty()) {
            log.debug("Module '{}' generated with warnings: {}", module.metadata.id, res.warnings);
        }
        return new TwapsResult(res.source, res.metadata, res.warnings);
    }

    /** Generate and write the unit as UTF-8. */
    public TwapsResult writeSource(TwapModule module, Path out, TwapsOptions options) throws IOException {
        if (out == null) throw new IllegalArgumentException("out must not be null");
        TwapsResult result = generate(module, options);
        Path parent = out.toAbsolutePath().normalize().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(out, result.source, StandardCharsets.UTF_8);
        log.debug("Wrote '{}' to {}", result.metadata.id, out);
        return result;
    }

    /**
     * Build the publish payload for a module; the module id becomes the payload id.
     *
     * @param url target url; {@link TwapsOptions#publishUrl} is used when {@code null}
     * @throws IllegalArgumentException if neither gives a non-blank url
     */
    public PublishPayload preparePublish(TwapModule module, String url, TwapsOptions options) {
        if (options == null) options = new TwapsOptions();
        String target = url != null ? url : options.publishUrl;
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("url must be given or set in TwapsOptions.publishUrl");
        }
        TwapsResult result = generate(module, options);
        return PublishPayload.prepare(result.source, target, module.metadata.id);
    }

    /**
     * Generate, prepare and store a module in the local registry, replacing any entry already
     * registered under the same url.
     */
    public PublishPayload register(TwapModule module, String url, TwapsOptions options) throws IOException {
        if (options == null) options = new TwapsOptions();
        PublishPayload payload = preparePublish(module, url, options);
        new TwapRegistry(options.registryPath).save(payload);
        return payload;
    }
}
