package com.shipyard.orchestrator.recovery;

/** What an operator forces on an episode. */
public enum OverrideAction {
    /** Stop the work and fail the pipeline. */
    TERMINATE,
    /** Close the episode and restart the step, optionally under another agent. */
    REASSIGN,
    /** Close the episode, resume the pipeline and restart the step with the operator's guidance. */
    PROVIDE_GUIDANCE
}
