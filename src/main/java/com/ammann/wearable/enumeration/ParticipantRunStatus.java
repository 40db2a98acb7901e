package com.ammann.wearable.enumeration;

/**
 * Outcome of one participant's analysis unit within a run.
 */
public enum ParticipantRunStatus
{
    /** Analysis finished and produced at least one computable finding. */
    COMPLETED,
    /** Analysis finished but no baseline was valid and no correlation was computable. */
    INSUFFICIENT_DATA,
    /** Analysis raised an error; other participants were unaffected. */
    FAILED,
    /** The run was aborted before this participant was started. */
    SKIPPED
}
