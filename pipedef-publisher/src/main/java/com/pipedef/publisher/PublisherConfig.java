package com.pipedef.publisher;

import com.pipedef.publisher.loader.ModuleLoaderConfig;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Publisher invocation settings from command-line arguments, with environment variables as fallback.
 * <p>
 * Arguments: {@code --module <jar>} (alias {@code --assembly}, or the first positional argument),
 * {@code --fail-if-changed [true|false]} (value optional, also as {@code =value}), {@code --required-artifacts a,b}.
 * Environment: {@code PIPEDEF_MODULE}, {@code PIPEDEF_FAIL_IF_CHANGED}, {@code PIPEDEF_REQUIRED_ARTIFACTS}.
 * Arguments win over environment.
 */
public final class PublisherConfig {

    static final String ENV_MODULE = "PIPEDEF_MODULE";
    static final String ENV_FAIL_IF_CHANGED = "PIPEDEF_FAIL_IF_CHANGED";
    static final String ENV_REQUIRED_ARTIFACTS = "PIPEDEF_REQUIRED_ARTIFACTS";

    private static final String ARG_MODULE = "--module";
    private static final String ARG_ASSEMBLY = "--assembly";
    private static final String ARG_FAIL_IF_CHANGED = "--fail-if-changed";
    private static final String ARG_REQUIRED_ARTIFACTS = "--required-artifacts";

    private final Path modulePath;
    private final boolean failIfChanged;
    private final List<String> requiredArtifacts;

    private PublisherConfig(Builder b) {
        this.modulePath = b.modulePath;
        this.failIfChanged = b.failIfChanged;
        this.requiredArtifacts = Collections.unmodifiableList(new ArrayList<>(b.requiredArtifacts));
    }

    /** Compiled definitions module (JAR) to scan. */
    public Path getModulePath() {
        return modulePath;
    }

    /** Whether a created or changed file fails the run. Default {@code false}. */
    public boolean isFailIfChanged() {
        return failIfChanged;
    }

    /** JAR file-name prefixes that must be present next to the module. */
    public List<String> getRequiredArtifacts() {
        return requiredArtifacts;
    }

    public ModuleLoaderConfig toLoaderConfig() {
        return ModuleLoaderConfig.builder()
                .requiredArtifacts(requiredArtifacts)
                .build();
    }

    /**
     * Parses {@code args}, falling back to {@code env}.
     *
     * @throws PublisherConfigException when the module path is missing or an argument is invalid
     */
    public static PublisherConfig from(String[] args, Map<String, String> env) {
        Objects.requireNonNull(args, "args");
        Map<String, String> environment = env != null ? env : Map.of();

        String module = null;
        Boolean failIfChanged = null;
        String requiredArtifacts = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String inlineValue = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                inlineValue = arg.substring(eq + 1);
            }
            switch (name) {
                case ARG_MODULE:
                case ARG_ASSEMBLY:
                    if (inlineValue != null) {
                        module = inlineValue;
                    } else {
                        module = requireValue(args, ++i, name);
                    }
                    break;
                case ARG_FAIL_IF_CHANGED:
                    if (inlineValue != null) {
                        failIfChanged = parseBoolean(inlineValue, name);
                    } else if (i + 1 < args.length && isBooleanLiteral(args[i + 1])) {
                        failIfChanged = parseBoolean(args[++i], name);
                    } else {
                        failIfChanged = true;
                    }
                    break;
                case ARG_REQUIRED_ARTIFACTS:
                    requiredArtifacts = inlineValue != null ? inlineValue : requireValue(args, ++i, name);
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new PublisherConfigException("Unknown option " + arg);
                    }
                    if (module != null) {
                        throw new PublisherConfigException("Unexpected argument " + arg + "; module already set to " + module);
                    }
                    module = arg;
            }
        }

        if (module == null) {
            module = getEnv(environment, ENV_MODULE, null);
        }
        if (module == null) {
            throw new PublisherConfigException("Module parameter not set. Pass --module <path-to-jar> or set " + ENV_MODULE);
        }
        if (failIfChanged == null) {
            String value = getEnv(environment, ENV_FAIL_IF_CHANGED, null);
            failIfChanged = value != null && parseBoolean(value, ENV_FAIL_IF_CHANGED);
        }
        if (requiredArtifacts == null) {
            requiredArtifacts = getEnv(environment, ENV_REQUIRED_ARTIFACTS, null);
        }

        Path modulePath;
        try {
            modulePath = Path.of(module);
        } catch (InvalidPathException e) {
            throw new PublisherConfigException("Invalid module path " + module + ": " + e.getMessage());
        }

        Builder builder = builder().modulePath(modulePath).failIfChanged(failIfChanged);
        if (requiredArtifacts != null) {
            builder.requiredArtifacts(parseCommaSeparated(requiredArtifacts));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String requireValue(String[] args, int index, String name) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new PublisherConfigException("Option " + name + " requires a value");
        }
        return args[index];
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean isBooleanLiteral(String value) {
        String v = value.trim();
        return "true".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v) || "1".equals(v) || "0".equals(v);
    }

    private static boolean parseBoolean(String value, String name) {
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) {
            return true;
        }
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) {
            return false;
        }
        throw new PublisherConfigException("Invalid boolean for " + name + ": " + value);
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private Path modulePath;
        private boolean failIfChanged;
        private List<String> requiredArtifacts = ModuleLoaderConfig.DEFAULT_REQUIRED_ARTIFACTS;

        public Builder modulePath(Path modulePath) {
            this.modulePath = modulePath;
            return this;
        }

        public Builder failIfChanged(boolean failIfChanged) {
            this.failIfChanged = failIfChanged;
            return this;
        }

        public Builder requiredArtifacts(List<String> requiredArtifacts) {
            this.requiredArtifacts = Objects.requireNonNull(requiredArtifacts, "requiredArtifacts");
            return this;
        }

        public PublisherConfig build() {
            if (modulePath == null) {
                throw new PublisherConfigException("Module parameter not set");
            }
            return new PublisherConfig(this);
        }
    }
}
