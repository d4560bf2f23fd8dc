package com.pipedef.publisher.publish;

import com.pipedef.publisher.change.ContentFingerprint;

/**
 * Result of publishing one definition.
 */
public enum PublishOutcome {

    /** Validation failed; nothing was written. */
    VALIDATION_FAILED,
    /** Target file did not exist before the publish. */
    CREATED,
    /** Target file content is byte-identical to what was there before. */
    UNCHANGED,
    /** Target file existed and its content changed. */
    CHANGED,
    /** Target path could not be resolved or the publish itself failed. */
    PUBLISH_ERROR;

    /** Whether the published file differs from what was there before the run. */
    public boolean isDrift() {
        return this == CREATED || this == CHANGED;
    }

    public boolean isError() {
        return this == VALIDATION_FAILED || this == PUBLISH_ERROR;
    }

    /**
     * Classifies a successful publish from the fingerprints taken before and after it.
     */
    public static PublishOutcome classify(ContentFingerprint before, ContentFingerprint after) {
        if (before == null || before.isAbsent()) {
            return CREATED;
        }
        return before.equals(after) ? UNCHANGED : CHANGED;
    }
}
