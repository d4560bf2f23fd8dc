package com.pipedef.definitions;

/**
 * How {@link DefinitionBase#getTargetFile()} is resolved into the path the definition is published to.
 */
public enum TargetPathType {

    /** Target file is resolved against the working directory of the publishing process. */
    RELATIVE_TO_CURRENT_DIR,

    /** Target file is resolved against the nearest ancestor of the working directory that contains {@code .git}. */
    RELATIVE_TO_GIT_ROOT,

    /** Target file must already be an absolute path. */
    ABSOLUTE
}
