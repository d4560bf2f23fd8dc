package com.pipedef.publisher.publish;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of a publish run. The run fails when no definition was processed, or when {@code failIfChanged}
 * is set and any definition was created or changed. Validation and publish errors are reported per
 * definition and do not change the verdict.
 */
public final class RunResult {

    private final List<DefinitionResult> results;
    private final boolean failIfChanged;

    public RunResult(List<DefinitionResult> results, boolean failIfChanged) {
        this.results = results != null ? Collections.unmodifiableList(new ArrayList<>(results)) : List.of();
        this.failIfChanged = failIfChanged;
    }

    public List<DefinitionResult> getResults() {
        return results;
    }

    public boolean isFailIfChanged() {
        return failIfChanged;
    }

    public boolean isSuccess() {
        if (results.isEmpty()) {
            return false;
        }
        return !(failIfChanged && hasDrift());
    }

    /** Whether any definition was created or changed. */
    public boolean hasDrift() {
        return results.stream().anyMatch(r -> r.getOutcome().isDrift());
    }

    /** Whether any definition failed validation or publishing. */
    public boolean hasDefinitionErrors() {
        return results.stream().anyMatch(r -> r.getOutcome().isError());
    }

    public long count(PublishOutcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).count();
    }

    /** Outcome of the named definition, or null when it was not part of the run. */
    public PublishOutcome outcomeOf(String definitionName) {
        for (DefinitionResult r : results) {
            if (r.getDefinitionName().equals(definitionName)) {
                return r.getOutcome();
            }
        }
        return null;
    }

    public Map<PublishOutcome, Long> countsByOutcome() {
        Map<PublishOutcome, Long> counts = new EnumMap<>(PublishOutcome.class);
        for (PublishOutcome outcome : PublishOutcome.values()) {
            long n = count(outcome);
            if (n > 0) {
                counts.put(outcome, n);
            }
        }
        return counts;
    }
}
