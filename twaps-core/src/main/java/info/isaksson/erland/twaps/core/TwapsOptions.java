package info.isaksson.erland.twaps.core;

import info.isaksson.erland.twaps.codegen.CodegenOptions;
import info.isaksson.erland.twaps.core.publish.TwapRegistry;

import java.nio.file.Path;

/**
 * Core (server-friendly) options for generating and registering modules.
 */
public final class TwapsOptions {
    public CodegenOptions codegen = CodegenOptions.defaults();

    /**
     * Server URL used by {@link TwapsService#preparePublish} and {@link TwapsService#register}
     * when no url is passed. {@code null} means a url must be passed.
     */
    public String publishUrl = null;

    /**
     * Registry file used by {@link TwapsService#register}. Defaults to
     * {@code ~/.twaps/twaps.json}.
     */
    public Path registryPath = TwapRegistry.defaultPath();
}
