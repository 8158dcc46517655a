package net.spookly.stateprox.filter;

public enum SessionEventType {
    /**
     * Client token matched the backend that served the request.
     */
    HONORED,
    /**
     * No usable token arrived; a new one was issued.
     */
    ISSUED,
    /**
     * Token pointed at a backend that was not used; a replacement was issued.
     */
    REISSUED,
    /**
     * Session logic disabled for the route.
     */
    SKIPPED
}
