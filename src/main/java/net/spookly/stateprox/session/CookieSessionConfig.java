package net.spookly.stateprox.session;

import java.time.Duration;
import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Cookie name and {@code Set-Cookie} attributes for cookie based session state.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
public final class CookieSessionConfig {
    private final String name;
    private final String path;
    private final Duration ttl;
    private final boolean secure;

    public CookieSessionConfig(String name, String path, Duration ttl, boolean secure) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("cookie name is required");
        }
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("cookie ttl must not be negative");
        }
        this.name = name;
        this.path = path == null || path.isBlank() ? null : path;
        this.ttl = ttl;
        this.secure = secure;
    }
}
