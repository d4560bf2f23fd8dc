package com.pipedef.publisher.publish;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunResultTest {

    private static List<DefinitionResult> oneChangedRestUnchanged() {
        return List.of(
                DefinitionResult.published("A", "/out/a.yml", PublishOutcome.UNCHANGED),
                DefinitionResult.published("B", "/out/b.yml", PublishOutcome.CHANGED),
                DefinitionResult.published("C", "/out/c.yml", PublishOutcome.UNCHANGED));
    }

    @Test
    void isSuccess_failsOnChangeOnlyWhenStrict() {
        assertFalse(new RunResult(oneChangedRestUnchanged(), true).isSuccess());
        assertTrue(new RunResult(oneChangedRestUnchanged(), false).isSuccess());
    }

    @Test
    void isSuccess_ignoresPerDefinitionErrors() {
        RunResult result = new RunResult(List.of(
                DefinitionResult.published("A", "/out/a.yml", PublishOutcome.UNCHANGED),
                DefinitionResult.validationFailed("B", "/out/b.yml", "Pipeline has no steps")), true);

        assertTrue(result.isSuccess());
        assertTrue(result.hasDefinitionErrors());
        assertFalse(result.hasDrift());
    }

    @Test
    void isSuccess_failsWithoutDefinitions() {
        assertFalse(new RunResult(List.of(), false).isSuccess());
    }

    @Test
    void counts() {
        RunResult result = new RunResult(oneChangedRestUnchanged(), false);

        assertEquals(2, result.count(PublishOutcome.UNCHANGED));
        assertEquals(1, result.countsByOutcome().get(PublishOutcome.CHANGED));
        assertFalse(result.countsByOutcome().containsKey(PublishOutcome.CREATED));
        assertEquals(PublishOutcome.CHANGED, result.outcomeOf("B"));
        assertNull(result.outcomeOf("Z"));
    }
}
