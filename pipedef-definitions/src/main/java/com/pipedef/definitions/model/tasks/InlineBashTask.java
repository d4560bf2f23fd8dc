package com.pipedef.definitions.model.tasks;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Bash step whose script is given inline. Lines are joined with {@code \n} and rendered as a literal block.
 */
@JsonPropertyOrder({"bash", "displayName", "name", "condition", "continueOnError", "enabled", "timeoutInMinutes",
        "workingDirectory", "failOnStderr", "noProfile", "noRc"})
public final class InlineBashTask extends BashTask<InlineBashTask> {

    private final String contents;

    public InlineBashTask(String... scriptLines) {
        Objects.requireNonNull(scriptLines, "scriptLines");
        this.contents = String.join("\n", scriptLines);
    }

    @JsonProperty("bash")
    public String getContents() {
        return contents;
    }
}
