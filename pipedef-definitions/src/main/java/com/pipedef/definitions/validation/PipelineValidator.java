package com.pipedef.definitions.validation;

import com.pipedef.definitions.model.Pipeline;
import com.pipedef.definitions.model.Step;
import com.pipedef.definitions.model.tasks.BashFileTask;
import com.pipedef.definitions.model.tasks.InlineBashTask;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks on a {@link Pipeline} before it is published. All rules run; errors are collected.
 */
public final class PipelineValidator {

    private static final Pattern STEP_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public ValidationResult validate(Pipeline pipeline) {
        List<String> errors = new ArrayList<>();
        if (pipeline == null) {
            errors.add("Pipeline is null");
            return ValidationResult.failure(errors);
        }

        List<Step<?>> steps = pipeline.getSteps();
        if (steps.isEmpty()) {
            errors.add("Pipeline has no steps");
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            Step<?> step = steps.get(i);
            String label = describe(step, i);

            String name = step.getName();
            if (name != null) {
                if (!STEP_NAME.matcher(name).matches()) {
                    errors.add(label + ": invalid name '" + name + "' (use letters, digits and underscores; must not start with a digit)");
                } else if (!names.add(name)) {
                    errors.add(label + ": duplicate step name '" + name + "'");
                }
            }
            if (step.getTimeoutInMinutes() < 0) {
                errors.add(label + ": timeoutInMinutes must not be negative");
            }
            if (step instanceof InlineBashTask && ((InlineBashTask) step).getContents().isBlank()) {
                errors.add(label + ": inline script is empty");
            }
            if (step instanceof BashFileTask && ((BashFileTask) step).getFilePath().isBlank()) {
                errors.add(label + ": script file path is empty");
            }
        }
        return ValidationResult.of(errors);
    }

    private static String describe(Step<?> step, int index) {
        String label = step.getDisplayName() != null ? step.getDisplayName() : step.getName();
        return "Step " + (index + 1) + (label != null ? " (" + label + ")" : "");
    }
}
