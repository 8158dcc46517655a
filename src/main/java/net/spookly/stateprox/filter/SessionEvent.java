package net.spookly.stateprox.filter;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Outcome of the session filter for one exchange, for audit logging.
 */
@Value
@Accessors(fluent = true)
public class SessionEvent {
    SessionEventType type;
    Instant timestamp;
    String route;
    String cluster;
    String codec;
    String hinted;
    String selected;
    String policy;
}
