package net.spookly.stateprox.filter;

/**
 * Per-request progress of the session filter.
 */
public enum SessionPhase {
    INIT,
    POLICY_RESOLVED,
    /**
     * Route disabled session logic; terminal, nothing is decoded or emitted.
     */
    INACTIVE,
    HINT_EXTRACTED,
    BACKEND_SELECTED,
    RESPONSE_EMITTED,
    DONE
}
