package com.pipedef.publisher.loader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Settings for {@link DefinitionModuleLoader}. Created once at run start and read-only afterwards.
 * <p>
 * Required artifacts are JAR file-name prefixes that must be present next to the module
 * (default: the serialization library {@code jackson-databind} and the definitions library
 * {@code pipedef-definitions}). Shared packages are loaded from the publisher's own classpath.
 */
public final class ModuleLoaderConfig {

    public static final List<String> DEFAULT_REQUIRED_ARTIFACTS = List.of("jackson-databind", "pipedef-definitions");

    public static final List<String> DEFAULT_SHARED_PACKAGES = List.of(
            "java.",
            "javax.",
            "jdk.",
            "sun.",
            "com.pipedef.definitions.",
            "com.fasterxml.jackson.",
            "org.yaml.snakeyaml.",
            "org.slf4j.");

    private final List<String> requiredArtifacts;
    private final List<String> sharedPackages;
    private final ClassLoader publisherClassLoader;

    private ModuleLoaderConfig(Builder b) {
        this.requiredArtifacts = Collections.unmodifiableList(new ArrayList<>(b.requiredArtifacts));
        this.sharedPackages = Collections.unmodifiableList(new ArrayList<>(b.sharedPackages));
        this.publisherClassLoader = b.publisherClassLoader != null
                ? b.publisherClassLoader
                : ModuleLoaderConfig.class.getClassLoader();
    }

    public static ModuleLoaderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** JAR file-name prefixes that must exist in the module's directory. */
    public List<String> getRequiredArtifacts() {
        return requiredArtifacts;
    }

    /** Package prefixes resolved from the publisher's classloader instead of the module's JARs. */
    public List<String> getSharedPackages() {
        return sharedPackages;
    }

    public ClassLoader getPublisherClassLoader() {
        return publisherClassLoader;
    }

    public static final class Builder {
        private List<String> requiredArtifacts = DEFAULT_REQUIRED_ARTIFACTS;
        private List<String> sharedPackages = DEFAULT_SHARED_PACKAGES;
        private ClassLoader publisherClassLoader;

        public Builder requiredArtifacts(List<String> requiredArtifacts) {
            this.requiredArtifacts = Objects.requireNonNull(requiredArtifacts, "requiredArtifacts");
            return this;
        }

        public Builder sharedPackages(List<String> sharedPackages) {
            this.sharedPackages = Objects.requireNonNull(sharedPackages, "sharedPackages");
            return this;
        }

        public Builder publisherClassLoader(ClassLoader publisherClassLoader) {
            this.publisherClassLoader = publisherClassLoader;
            return this;
        }

        public ModuleLoaderConfig build() {
            return new ModuleLoaderConfig(this);
        }
    }
}
