package com.pipedef.publisher.publish;

import com.pipedef.publisher.discovery.DefinitionDescriptor;
import com.pipedef.publisher.discovery.DirectDefinitionDescriptor;
import com.pipedef.publisher.fixtures.AlphaPipeline;
import com.pipedef.publisher.fixtures.FixtureOutput;
import com.pipedef.publisher.fixtures.InvalidPipeline;
import com.pipedef.publisher.fixtures.NotADefinition;
import com.pipedef.publisher.loader.TypeCatalog;
import com.pipedef.publisher.support.StubDefinition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PublishOrchestratorTest {

    @TempDir
    Path tempDir;

    private final PublishOrchestrator orchestrator = new PublishOrchestrator();

    @BeforeEach
    void setUp() {
        System.setProperty(FixtureOutput.PROPERTY, tempDir.toString());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(FixtureOutput.PROPERTY);
        System.clearProperty(FixtureOutput.MESSAGE_PROPERTY);
    }

    private static DefinitionDescriptor direct(StubDefinition definition) {
        return new DirectDefinitionDescriptor(definition);
    }

    private static TypeCatalog catalog(Class<?>... types) {
        return TypeCatalog.of("test-classpath", List.of(types));
    }

    @Test
    void run_createdAndValidationFailedWithoutFailIfChangedSucceeds() {
        RunResult result = orchestrator.run(catalog(AlphaPipeline.class, InvalidPipeline.class, NotADefinition.class), false);

        assertEquals(2, result.getResults().size());
        assertEquals(PublishOutcome.CREATED, result.outcomeOf("AlphaPipeline"));
        assertEquals(PublishOutcome.VALIDATION_FAILED, result.outcomeOf("InvalidPipeline"));
        assertTrue(result.isSuccess());
        assertTrue(result.hasDefinitionErrors());
        assertTrue(Files.exists(tempDir.resolve("a.yml")));
        assertFalse(Files.exists(tempDir.resolve("b.yml")));
    }

    @Test
    void run_reportsValidationErrorMessage() {
        RunResult result = orchestrator.run(catalog(InvalidPipeline.class), false);

        DefinitionResult invalid = result.getResults().get(0);
        assertEquals(PublishOutcome.VALIDATION_FAILED, invalid.getOutcome());
        assertTrue(invalid.getMessage().contains("Pipeline has no steps"), invalid.getMessage());
        assertEquals(tempDir.resolve("b.yml").toString(), invalid.getTargetPath());
    }

    @Test
    void run_secondRunIsUnchangedAndPassesFailIfChanged() throws Exception {
        orchestrator.run(catalog(AlphaPipeline.class), false);
        String firstContent = Files.readString(tempDir.resolve("a.yml"));

        RunResult second = orchestrator.run(catalog(AlphaPipeline.class), true);

        assertEquals(PublishOutcome.UNCHANGED, second.outcomeOf("AlphaPipeline"));
        assertTrue(second.isSuccess());
        assertEquals(firstContent, Files.readString(tempDir.resolve("a.yml")));
    }

    @Test
    void run_changedDefinitionRewritesFileAndFailsWithFailIfChanged() throws Exception {
        orchestrator.run(catalog(AlphaPipeline.class), false);
        System.setProperty(FixtureOutput.MESSAGE_PROPERTY, "world");

        RunResult result = orchestrator.run(catalog(AlphaPipeline.class), true);

        assertEquals(PublishOutcome.CHANGED, result.outcomeOf("AlphaPipeline"));
        assertFalse(result.isSuccess());
        assertTrue(Files.readString(tempDir.resolve("a.yml")).contains("echo world"));
    }

    @Test
    void run_preexistingContentIsReplacedAndReportedAsChanged() throws Exception {
        Path target = Files.writeString(tempDir.resolve("x.yml"), "X");

        RunResult result = orchestrator.run(List.of(direct(new StubDefinition(target.toString()).content("Y"))), true);

        assertEquals(PublishOutcome.CHANGED, result.getResults().get(0).getOutcome());
        assertFalse(result.isSuccess());
        assertEquals("Y", Files.readString(target));
    }

    @Test
    void run_deletedFileIsCreatedAgain() throws Exception {
        Path target = tempDir.resolve("a.yml");
        orchestrator.run(catalog(AlphaPipeline.class), false);
        Files.delete(target);

        RunResult result = orchestrator.run(catalog(AlphaPipeline.class), false);

        assertEquals(PublishOutcome.CREATED, result.outcomeOf("AlphaPipeline"));
        assertTrue(Files.exists(target));
    }

    @Test
    void run_failIfChangedOnlyGatesTheVerdict() throws Exception {
        Path lenientTarget = tempDir.resolve("lenient.yml");
        Path strictTarget = tempDir.resolve("strict.yml");

        RunResult lenient = orchestrator.run(List.of(direct(new StubDefinition(lenientTarget.toString()).content("a: 1\n"))), false);
        RunResult strict = orchestrator.run(List.of(direct(new StubDefinition(strictTarget.toString()).content("a: 1\n"))), true);

        assertEquals(PublishOutcome.CREATED, lenient.getResults().get(0).getOutcome());
        assertEquals(PublishOutcome.CREATED, strict.getResults().get(0).getOutcome());
        assertTrue(lenient.isSuccess());
        assertFalse(strict.isSuccess());
        assertEquals(Files.readString(lenientTarget), Files.readString(strictTarget));
    }

    @Test
    void run_throwingValidationDoesNotStopLaterDefinitions() throws Exception {
        Path first = tempDir.resolve("first.yml");
        Path second = tempDir.resolve("second.yml");

        RunResult result = orchestrator.run(List.of(
                direct(new StubDefinition(first.toString()).validateFailure(new IllegalArgumentException("bad input"))),
                direct(new StubDefinition(second.toString()))), false);

        assertEquals(PublishOutcome.VALIDATION_FAILED, result.getResults().get(0).getOutcome());
        assertEquals("bad input", result.getResults().get(0).getMessage());
        assertEquals(PublishOutcome.CREATED, result.getResults().get(1).getOutcome());
        assertFalse(Files.exists(first));
        assertTrue(Files.exists(second));
    }

    @Test
    void run_missingClassDuringValidationDoesNotStopLaterDefinitions() throws Exception {
        Path first = tempDir.resolve("first.yml");
        Path second = tempDir.resolve("second.yml");

        RunResult result = orchestrator.run(List.of(
                direct(new StubDefinition(first.toString()).validateError(new NoClassDefFoundError("com/example/Missing"))),
                direct(new StubDefinition(second.toString()))), false);

        assertEquals(PublishOutcome.VALIDATION_FAILED, result.getResults().get(0).getOutcome());
        assertEquals("com/example/Missing", result.getResults().get(0).getMessage());
        assertEquals(PublishOutcome.CREATED, result.getResults().get(1).getOutcome());
        assertFalse(Files.exists(first));
        assertTrue(Files.exists(second));
    }

    @Test
    void run_missingClassDuringPublishIsPublishErrorAndRunContinues() throws Exception {
        Path first = tempDir.resolve("first.yml");
        Path second = tempDir.resolve("second.yml");

        RunResult result = orchestrator.run(List.of(
                direct(new StubDefinition(first.toString()).publishError(new NoClassDefFoundError("com/example/Missing"))),
                direct(new StubDefinition(second.toString()))), false);

        assertEquals(PublishOutcome.PUBLISH_ERROR, result.getResults().get(0).getOutcome());
        assertEquals(PublishOutcome.CREATED, result.getResults().get(1).getOutcome());
        assertTrue(Files.exists(second));
    }

    @Test
    void run_validationFailureLeavesExistingFileUntouched() throws Exception {
        Path target = Files.writeString(tempDir.resolve("keep.yml"), "old");

        RunResult result = orchestrator.run(List.of(
                direct(new StubDefinition(target.toString()).content("new").validationError("name is invalid"))), true);

        assertEquals(PublishOutcome.VALIDATION_FAILED, result.getResults().get(0).getOutcome());
        assertEquals("old", Files.readString(target));
        assertTrue(result.isSuccess());
    }

    @Test
    void run_blankTargetPathIsPublishError() {
        RunResult result = orchestrator.run(List.of(direct(new StubDefinition("  "))), false);

        DefinitionResult blank = result.getResults().get(0);
        assertEquals(PublishOutcome.PUBLISH_ERROR, blank.getOutcome());
        assertNull(blank.getTargetPath());
    }

    @Test
    void run_relativeTargetForAbsolutePathTypeIsPublishError() {
        RunResult result = orchestrator.run(List.of(direct(new StubDefinition("relative/out.yml"))), false);

        assertEquals(PublishOutcome.PUBLISH_ERROR, result.getResults().get(0).getOutcome());
    }

    @Test
    void run_publishFailureIsRecordedAndRunContinues() throws Exception {
        Path broken = tempDir.resolve("broken.yml");
        Path fine = tempDir.resolve("fine.yml");

        RunResult result = orchestrator.run(List.of(
                direct(new StubDefinition(broken.toString()).publishFailure(new IOException("disk full"))),
                direct(new StubDefinition(fine.toString()))), false);

        assertEquals(PublishOutcome.PUBLISH_ERROR, result.getResults().get(0).getOutcome());
        assertEquals("disk full", result.getResults().get(0).getMessage());
        assertEquals(broken.toString(), result.getResults().get(0).getTargetPath());
        assertEquals(PublishOutcome.CREATED, result.getResults().get(1).getOutcome());
        assertTrue(result.isSuccess());
    }

    @Test
    void run_publishIntoDirectoryPathIsPublishError() throws Exception {
        Path directory = Files.createDirectories(tempDir.resolve("taken"));

        RunResult result = orchestrator.run(List.of(direct(new StubDefinition(directory.toString()))), false);

        assertEquals(PublishOutcome.PUBLISH_ERROR, result.getResults().get(0).getOutcome());
    }

    @Test
    void run_withoutDefinitionsFails() {
        NoDefinitionsFoundException e = assertThrows(NoDefinitionsFoundException.class,
                () -> orchestrator.run(catalog(NotADefinition.class), false));

        assertTrue(e.getMessage().contains("test-classpath"), e.getMessage());
        assertFalse(orchestrator.run(List.of(), false).isSuccess());
    }

    @Test
    void run_keepsDiscoveryOrder() {
        RunResult result = orchestrator.run(catalog(InvalidPipeline.class, AlphaPipeline.class), false);

        assertEquals("InvalidPipeline", result.getResults().get(0).getDefinitionName());
        assertEquals("AlphaPipeline", result.getResults().get(1).getDefinitionName());
    }
}
