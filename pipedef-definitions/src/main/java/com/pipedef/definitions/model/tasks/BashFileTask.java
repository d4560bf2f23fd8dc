package com.pipedef.definitions.model.tasks;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Bash step that runs a script file. The path must be absolute or relative to the default working directory.
 */
@JsonPropertyOrder({"bash", "displayName", "name", "condition", "continueOnError", "enabled", "timeoutInMinutes",
        "workingDirectory", "failOnStderr", "noProfile", "noRc", "arguments"})
public final class BashFileTask extends BashTask<BashFileTask> {

    private final String filePath;
    private String arguments;

    public BashFileTask(String filePath) {
        this.filePath = Objects.requireNonNull(filePath, "filePath");
    }

    @JsonProperty("bash")
    public String getFilePath() {
        return filePath;
    }

    /** Arguments passed to the script. */
    public String getArguments() {
        return arguments;
    }

    public BashFileTask arguments(String arguments) {
        this.arguments = arguments;
        return this;
    }
}
