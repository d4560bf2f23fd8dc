package com.pipedef.definitions;

import com.pipedef.definitions.model.Pipeline;
import com.pipedef.definitions.model.tasks.InlineBashTask;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefinitionBaseTest {

    @TempDir
    Path tempDir;

    private static class TestPipeline extends PipelineDefinition {
        private final String targetFile;
        private final TargetPathType pathType;
        private final Pipeline pipeline;

        TestPipeline(String targetFile, TargetPathType pathType, Pipeline pipeline) {
            this.targetFile = targetFile;
            this.pathType = pathType;
            this.pipeline = pipeline;
        }

        @Override
        public String getTargetFile() {
            return targetFile;
        }

        @Override
        public TargetPathType getTargetPathType() {
            return pathType;
        }

        @Override
        public Pipeline getPipeline() {
            return pipeline;
        }
    }

    private static Pipeline validPipeline() {
        return new Pipeline().steps(new InlineBashTask("make").displayName("Build"));
    }

    @Test
    void publish_writesHeaderAndYamlCreatingParentDirectories() throws Exception {
        Path target = tempDir.resolve("eng/pipelines/build.yml");
        TestPipeline definition = new TestPipeline(target.toString(), TargetPathType.ABSOLUTE, validPipeline());

        definition.publish();

        String content = Files.readString(target);
        assertTrue(content.startsWith("### DO NOT MODIFY THIS FILE! ###\n"), content);
        assertTrue(content.contains(TestPipeline.class.getName()), content);
        assertTrue(content.endsWith(definition.serialize()), content);
    }

    @Test
    void publish_withoutHeaderWritesOnlySerializedContent() throws Exception {
        Path target = tempDir.resolve("plain.yml");
        TestPipeline definition = new TestPipeline(target.toString(), TargetPathType.ABSOLUTE, validPipeline()) {
            @Override
            public List<String> getHeader() {
                return List.of();
            }
        };

        definition.publish();

        assertEquals(definition.serialize(), Files.readString(target));
    }

    @Test
    void getTargetPath_resolvesRelativeFileAgainstWorkingDirectory() {
        TestPipeline definition = new TestPipeline("out/a.yml", TargetPathType.RELATIVE_TO_CURRENT_DIR, validPipeline());

        Path expected = Path.of(System.getProperty("user.dir")).toAbsolutePath().resolve("out/a.yml").normalize();
        assertEquals(expected.toString(), definition.getTargetPath());
    }

    @Test
    void getTargetPath_rejectsRelativeFileWhenAbsoluteRequired() {
        TestPipeline definition = new TestPipeline("out/a.yml", TargetPathType.ABSOLUTE, validPipeline());

        assertThrows(IllegalStateException.class, definition::getTargetPath);
    }

    @Test
    void getTargetPath_rejectsBlankTargetFile() {
        TestPipeline definition = new TestPipeline(" ", TargetPathType.RELATIVE_TO_CURRENT_DIR, validPipeline());

        assertThrows(IllegalStateException.class, definition::getTargetPath);
    }

    @Test
    void validate_throwsWithEveryError() {
        TestPipeline definition = new TestPipeline("a.yml", TargetPathType.RELATIVE_TO_CURRENT_DIR, new Pipeline());

        DefinitionValidationException e = assertThrows(DefinitionValidationException.class, definition::validate);

        assertEquals("TestPipeline", e.getDefinitionName());
        assertFalse(e.getValidationResult().isValid());
        assertEquals("Pipeline has no steps", e.getMessage());
    }
}
