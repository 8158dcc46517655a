package net.spookly.stateprox.filter;

/**
 * Session event listener that emits one line per event. The token itself is not logged;
 * {@code selected} already names the backend it encodes.
 */
public final class SessionAuditLogger implements SessionEventListener {
    public static final SessionAuditLogger INSTANCE = new SessionAuditLogger();

    private SessionAuditLogger() {
    }

    @Override
    public void onEvent(SessionEvent event) {
        System.out.println(format(event));
    }

    String format(SessionEvent event) {
        StringBuilder builder = new StringBuilder("session_event");
        append(builder, "type", event.type());
        append(builder, "route", event.route());
        append(builder, "cluster", event.cluster());
        append(builder, "policy", event.policy());
        append(builder, "codec", event.codec());
        append(builder, "hinted", event.hinted());
        append(builder, "selected", event.selected());
        append(builder, "timestamp", event.timestamp());
        return builder.toString();
    }

    private void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
