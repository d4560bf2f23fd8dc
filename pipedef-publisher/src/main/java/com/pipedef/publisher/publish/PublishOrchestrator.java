package com.pipedef.publisher.publish;

import com.pipedef.publisher.change.ChangeDetector;
import com.pipedef.publisher.change.ContentFingerprint;
import com.pipedef.publisher.discovery.DefinitionDescriptor;
import com.pipedef.publisher.discovery.DefinitionDiscoverer;
import com.pipedef.publisher.loader.TypeCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Publishes every definition of a module: validate, fingerprint, publish, fingerprint, classify.
 * <p>
 * Definitions are processed one at a time in discovery order. A definition that fails to resolve its
 * target path, to validate or to publish is logged and recorded; the remaining definitions are still
 * published. This includes linkage errors from classes a definition only references at run time.
 * With {@code failIfChanged} the files are still written, but any created or changed file
 * fails the run.
 */
public final class PublishOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PublishOrchestrator.class);

    private static final String VERBOSITY_HINT = "To see exception details, run with PIPEDEF_LOG_LEVEL=DEBUG";

    private final DefinitionDiscoverer discoverer;
    private final ChangeDetector changeDetector;

    public PublishOrchestrator() {
        this(new DefinitionDiscoverer(), new ChangeDetector());
    }

    public PublishOrchestrator(DefinitionDiscoverer discoverer, ChangeDetector changeDetector) {
        this.discoverer = Objects.requireNonNull(discoverer, "discoverer");
        this.changeDetector = Objects.requireNonNull(changeDetector, "changeDetector");
    }

    /**
     * Discovers and publishes every definition in {@code catalog}.
     *
     * @throws NoDefinitionsFoundException when the catalog contains no definitions
     * @throws com.pipedef.publisher.discovery.DefinitionInstantiationException when a definition cannot be instantiated
     */
    public RunResult run(TypeCatalog catalog, boolean failIfChanged) {
        List<DefinitionDescriptor> definitions = discoverer.discover(catalog);
        if (definitions.isEmpty()) {
            throw new NoDefinitionsFoundException(catalog.getSource(), discoverer.getContractTypeName());
        }
        return run(definitions, failIfChanged);
    }

    /** Publishes already discovered definitions in the given order. */
    public RunResult run(List<DefinitionDescriptor> definitions, boolean failIfChanged) {
        List<DefinitionResult> results = new ArrayList<>(definitions.size());
        for (DefinitionDescriptor definition : definitions) {
            results.add(publish(definition, failIfChanged));
        }
        RunResult result = new RunResult(results, failIfChanged);
        if (result.isSuccess()) {
            log.info("Published {} definition(s): {}", results.size(), result.countsByOutcome());
        } else if (results.isEmpty()) {
            log.error("No definitions to publish");
        } else {
            log.error("Published {} definition(s) with changes while failIfChanged is set: {}. "
                    + "Publish the definitions and commit the changed files.", results.size(), result.countsByOutcome());
        }
        return result;
    }

    DefinitionResult publish(DefinitionDescriptor definition, boolean failIfChanged) {
        String name = definition.getName();

        String targetPath;
        Path target;
        try {
            targetPath = definition.getTargetPath();
            if (targetPath == null || targetPath.isBlank()) {
                log.error("Failed to get target path for {}", name);
                return DefinitionResult.publishError(name, null, "Target path is empty");
            }
            target = Path.of(targetPath);
        } catch (InvalidPathException e) {
            log.error("Failed to get target path for {}: {}", name, e.getMessage());
            return DefinitionResult.publishError(name, null, e.getMessage());
        } catch (RuntimeException | LinkageError | AssertionError e) {
            log.error("Failed to get target path for {}: {}", name, messageOf(e));
            log.debug("Target path resolution of {} failed", name, e);
            return DefinitionResult.publishError(name, null, messageOf(e));
        }

        log.info("{}:", name);
        log.info("  Validating pipeline...");
        try {
            definition.validate();
        } catch (RuntimeException | LinkageError | AssertionError e) {
            log.error("Validation of pipeline {} failed: {}{}{}", name, messageOf(e), System.lineSeparator(), VERBOSITY_HINT);
            log.debug("Validation of pipeline {} failed", name, e);
            return DefinitionResult.validationFailed(name, targetPath, messageOf(e));
        }

        PublishOutcome outcome;
        try {
            ContentFingerprint before = changeDetector.fingerprint(target);
            definition.publish();
            ContentFingerprint after = changeDetector.fingerprint(target);
            outcome = PublishOutcome.classify(before, after);
            log.debug("{}: fingerprint {} -> {}", name, before.toHex(), after.toHex());
        } catch (Exception | LinkageError | AssertionError e) {
            log.error("Publishing of pipeline {} to {} failed: {}{}{}", name, targetPath, messageOf(e), System.lineSeparator(), VERBOSITY_HINT);
            log.debug("Publishing of pipeline {} failed", name, e);
            return DefinitionResult.publishError(name, targetPath, messageOf(e));
        }

        logOutcome(name, targetPath, outcome, failIfChanged);
        return DefinitionResult.published(name, targetPath, outcome);
    }

    private static void logOutcome(String name, String targetPath, PublishOutcome outcome, boolean failIfChanged) {
        switch (outcome) {
            case CREATED:
                if (failIfChanged) {
                    log.error("  This pipeline hasn't been published yet!");
                } else {
                    log.info("  {} created at {}", name, targetPath);
                }
                break;
            case UNCHANGED:
                log.info("  No new changes to publish");
                break;
            case CHANGED:
                if (failIfChanged) {
                    log.error("  Changes detected between {} and {}!", name, targetPath);
                } else {
                    log.info("  Published new changes to {}", targetPath);
                }
                break;
            default:
                break;
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }
}
