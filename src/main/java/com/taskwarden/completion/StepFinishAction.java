package com.taskwarden.completion;

/**
 * What the task driver should do at a turn boundary.
 */
public enum StepFinishAction {
    /** Turn still in progress, nothing to do. */
    CONTINUE,
    /** A continuation prompt is owed once the process exits. */
    PENDING,
    /** Finalize the task. */
    COMPLETE
}
