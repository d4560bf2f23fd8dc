package com.pipedef.definitions;

import com.pipedef.definitions.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Base of every pipeline definition. Concrete subclasses are discovered in a compiled module by the
 * publisher, instantiated through their public no-arg constructor, validated and published.
 * <p>
 * The publisher recognizes subclasses by the fully-qualified name of this class, so it must not be
 * renamed or moved without updating the publisher's contract type.
 * <p>
 * Publishing overwrites the target file in place. A crash mid-write can leave a partially written file.
 */
public abstract class DefinitionBase {

    private static final Logger log = LoggerFactory.getLogger(DefinitionBase.class);

    private static final String GIT_DIR = ".git";

    /**
     * Path of the file this definition renders to. Interpreted according to {@link #getTargetPathType()}.
     */
    public abstract String getTargetFile();

    /** How {@link #getTargetFile()} is resolved. Default {@link TargetPathType#RELATIVE_TO_CURRENT_DIR}. */
    public TargetPathType getTargetPathType() {
        return TargetPathType.RELATIVE_TO_CURRENT_DIR;
    }

    /**
     * Resolved path the definition is published to.
     *
     * @throws IllegalStateException when the target file is not set or cannot be resolved
     */
    public String getTargetPath() {
        String targetFile = getTargetFile();
        if (targetFile == null || targetFile.isBlank()) {
            throw new IllegalStateException("Target file of " + getClass().getSimpleName() + " is not set");
        }
        Path file = Path.of(targetFile);
        TargetPathType type = getTargetPathType();
        if (type == TargetPathType.ABSOLUTE) {
            if (!file.isAbsolute()) {
                throw new IllegalStateException("Target file " + targetFile + " of "
                        + getClass().getSimpleName() + " is not an absolute path");
            }
            return file.normalize().toString();
        }
        if (type == TargetPathType.RELATIVE_TO_GIT_ROOT) {
            return findGitRoot(workingDirectory()).resolve(file).normalize().toString();
        }
        return workingDirectory().resolve(file).normalize().toString();
    }

    /**
     * Validates the definition.
     *
     * @throws DefinitionValidationException with every error found when the definition is invalid
     */
    public void validate() {
        ValidationResult result = validateDefinition();
        if (result != null && !result.isValid()) {
            throw new DefinitionValidationException(getClass().getSimpleName(), result);
        }
    }

    /** Checks the definition's configuration. Default: always valid. */
    protected ValidationResult validateDefinition() {
        return ValidationResult.success();
    }

    /** Renders the definition's current in-memory state, without the generated-file header. */
    public abstract String serialize();

    /**
     * Banner written at the top of the published file, one comment line per entry. Return an empty list to
     * publish without a header.
     */
    public List<String> getHeader() {
        return List.of(
                "DO NOT MODIFY THIS FILE!",
                "This file was generated by pipedef from " + getClass().getName() + ".",
                "To make changes, change the definition and publish again.");
    }

    /**
     * Renders the definition and writes it to {@link #getTargetPath()}, creating parent directories and
     * overwriting any existing file.
     */
    public void publish() throws IOException {
        Path target = Path.of(getTargetPath());
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String content = render();
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.debug("Wrote {} characters to {}", content.length(), target);
    }

    /** Full published content: header comment lines followed by the serialized definition. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        List<String> header = getHeader();
        if (header != null && !header.isEmpty()) {
            for (String line : header) {
                sb.append("### ").append(line).append(" ###\n");
            }
            sb.append('\n');
        }
        sb.append(serialize());
        return sb.toString();
    }

    private static Path workingDirectory() {
        return Path.of(System.getProperty("user.dir")).toAbsolutePath();
    }

    private Path findGitRoot(Path start) {
        for (Path dir = start; dir != null; dir = dir.getParent()) {
            if (Files.exists(dir.resolve(GIT_DIR))) {
                return dir;
            }
        }
        throw new IllegalStateException("No git repository found above " + start
                + " to resolve the target file of " + getClass().getSimpleName());
    }
}
