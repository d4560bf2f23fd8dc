package com.pipedef.definitions.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.pipedef.definitions.serialization.DefaultTrueFilter;

/**
 * One step of a pipeline. Properties shared by every step kind; setters are fluent and return the
 * concrete step type.
 *
 * @param <S> concrete step type
 */
@JsonPropertyOrder({"displayName", "name", "condition", "continueOnError", "enabled", "timeoutInMinutes"})
public abstract class Step<S extends Step<S>> {

    private String displayName;
    private String name;
    private String condition;
    private boolean continueOnError;
    private boolean enabled = true;
    private int timeoutInMinutes;

    /** Human-readable name shown in the run UI. */
    public String getDisplayName() {
        return displayName;
    }

    public S displayName(String displayName) {
        this.displayName = displayName;
        return self();
    }

    /** Identifier of the step, used to reference its outputs. Letters, digits and underscores only. */
    public String getName() {
        return name;
    }

    public S name(String name) {
        this.name = name;
        return self();
    }

    /** Condition expression deciding whether the step runs. */
    public String getCondition() {
        return condition;
    }

    public S condition(String condition) {
        this.condition = condition;
        return self();
    }

    /** Whether the pipeline continues when this step fails. Default {@code false}. */
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isContinueOnError() {
        return continueOnError;
    }

    public S continueOnError(boolean continueOnError) {
        this.continueOnError = continueOnError;
        return self();
    }

    /** Whether the step runs at all. Default {@code true}. */
    @JsonInclude(value = JsonInclude.Include.CUSTOM, valueFilter = DefaultTrueFilter.class)
    public boolean isEnabled() {
        return enabled;
    }

    public S enabled(boolean enabled) {
        this.enabled = enabled;
        return self();
    }

    /** Maximum run time; {@code 0} means the agent default. */
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public int getTimeoutInMinutes() {
        return timeoutInMinutes;
    }

    public S timeoutInMinutes(int timeoutInMinutes) {
        this.timeoutInMinutes = timeoutInMinutes;
        return self();
    }

    @SuppressWarnings("unchecked")
    protected final S self() {
        return (S) this;
    }
}
