package com.pipedef.publisher;

import com.pipedef.publisher.discovery.DefinitionInstantiationException;
import com.pipedef.publisher.loader.DefinitionModuleLoader;
import com.pipedef.publisher.loader.ModuleLoadException;
import com.pipedef.publisher.loader.TypeCatalog;
import com.pipedef.publisher.publish.NoDefinitionsFoundException;
import com.pipedef.publisher.publish.PublishOrchestrator;
import com.pipedef.publisher.publish.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Publisher entry point, run as a build step after the definitions module is compiled.
 * <p>
 * Exit codes: {@code 0} success, {@code 1} run failure (load error, no definitions, or changes while
 * {@code --fail-if-changed} is set), {@code 2} invalid invocation.
 */
public final class PublishDefinitionsApplication {

    private static final Logger log = LoggerFactory.getLogger(PublishDefinitionsApplication.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private PublishDefinitionsApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        PublisherConfig config;
        try {
            config = PublisherConfig.from(args, env);
        } catch (PublisherConfigException e) {
            log.error("{}", e.getMessage());
            log.error("Usage: pipedef-publisher --module <path-to-jar> [--fail-if-changed] [--required-artifacts a,b]");
            return EXIT_USAGE;
        }
        log.info("Publishing definitions from {} (failIfChanged={})", config.getModulePath(), config.isFailIfChanged());

        DefinitionModuleLoader loader = new DefinitionModuleLoader(config.toLoaderConfig());
        try (TypeCatalog catalog = loader.load(config.getModulePath())) {
            RunResult result = new PublishOrchestrator().run(catalog, config.isFailIfChanged());
            return result.isSuccess() ? EXIT_SUCCESS : EXIT_FAILURE;
        } catch (ModuleLoadException | DefinitionInstantiationException | NoDefinitionsFoundException e) {
            log.error("Publishing definitions failed: {}", e.getMessage());
            log.debug("Publishing definitions failed", e);
            return EXIT_FAILURE;
        }
    }
}
