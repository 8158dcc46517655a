package net.spookly.stateprox.filter;

/**
 * Listener for session filter outcomes.
 */
@FunctionalInterface
public interface SessionEventListener {
    SessionEventListener NOOP = event -> {
    };

    void onEvent(SessionEvent event);
}
