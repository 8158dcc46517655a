package net.spookly.stateprox.filter;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.stateprox.balancer.Endpoint;
import net.spookly.stateprox.balancer.OverrideHint;
import net.spookly.stateprox.route.EffectiveSessionPolicy;

/**
 * Session filter bookkeeping for one exchange. Confined to the thread processing the exchange.
 */
@Getter
@Accessors(fluent = true)
public final class SessionFilterState {
    private SessionPhase phase = SessionPhase.INIT;
    private EffectiveSessionPolicy policy;
    private OverrideHint hint;
    private Endpoint selected;
    private boolean cookieEmitted;

    void policyResolved(EffectiveSessionPolicy resolved) {
        require(SessionPhase.INIT);
        this.policy = resolved;
        this.phase = SessionPhase.POLICY_RESOLVED;
    }

    void inactive() {
        require(SessionPhase.POLICY_RESOLVED);
        this.phase = SessionPhase.INACTIVE;
    }

    void hintExtracted(OverrideHint extracted) {
        require(SessionPhase.POLICY_RESOLVED);
        this.hint = extracted;
        this.phase = SessionPhase.HINT_EXTRACTED;
    }

    void backendSelected(Endpoint endpoint) {
        require(SessionPhase.HINT_EXTRACTED);
        this.selected = endpoint;
        this.phase = SessionPhase.BACKEND_SELECTED;
    }

    void responseEmitted(boolean emitted) {
        require(SessionPhase.BACKEND_SELECTED);
        this.cookieEmitted = emitted;
        this.phase = SessionPhase.RESPONSE_EMITTED;
    }

    void done() {
        this.phase = SessionPhase.DONE;
    }

    private void require(SessionPhase expected) {
        if (phase != expected) {
            throw new IllegalStateException("Session filter expected phase " + expected + " but was " + phase);
        }
    }
}
