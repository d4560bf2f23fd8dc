package com.pipedef.definitions.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single-job pipeline: run name, variables and an ordered list of steps.
 * Variables keep insertion order so the rendered file is stable.
 */
@JsonPropertyOrder({"name", "variables", "steps"})
public final class Pipeline {

    private String name;
    private final Map<String, String> variables = new LinkedHashMap<>();
    private final List<Step<?>> steps = new ArrayList<>();

    /** Run name format, e.g. {@code $(Date:yyyyMMdd)$(Rev:.r)}. */
    public String getName() {
        return name;
    }

    public Pipeline name(String name) {
        this.name = name;
        return this;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, String> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public Pipeline variable(String name, String value) {
        variables.put(Objects.requireNonNull(name, "name"), value);
        return this;
    }

    public List<Step<?>> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public Pipeline step(Step<?> step) {
        steps.add(Objects.requireNonNull(step, "step"));
        return this;
    }

    public Pipeline steps(Step<?>... steps) {
        for (Step<?> step : steps) {
            step(step);
        }
        return this;
    }
}
