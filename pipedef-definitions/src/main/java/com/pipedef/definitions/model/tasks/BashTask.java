package com.pipedef.definitions.model.tasks;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pipedef.definitions.model.Step;
import com.pipedef.definitions.serialization.DefaultTrueFilter;

/**
 * Step that runs a bash script, either inline ({@link InlineBashTask}) or from a file ({@link BashFileTask}).
 * Inputs left at their defaults are not rendered.
 *
 * @param <S> concrete task type
 */
public abstract class BashTask<S extends BashTask<S>> extends Step<S> {

    private String workingDirectory;
    private boolean failOnStderr;
    private boolean noProfile;
    private boolean noRc = true;

    /**
     * Working directory the script runs in. When unset, the agent uses the sources directory.
     */
    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public S workingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
        return self();
    }

    /** Fail the task when anything is written to stderr. Default {@code false}. */
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isFailOnStderr() {
        return failOnStderr;
    }

    public S failOnStderr(boolean failOnStderr) {
        this.failOnStderr = failOnStderr;
        return self();
    }

    /** Skip {@code /etc/profile} and the personal initialization files. Default {@code false}. */
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isNoProfile() {
        return noProfile;
    }

    public S noProfile(boolean noProfile) {
        this.noProfile = noProfile;
        return self();
    }

    /** Skip {@code .bashrc} from the user's home directory. Default {@code true}. */
    @JsonInclude(value = JsonInclude.Include.CUSTOM, valueFilter = DefaultTrueFilter.class)
    public boolean isNoRc() {
        return noRc;
    }

    public S noRc(boolean noRc) {
        this.noRc = noRc;
        return self();
    }
}
