package net.spookly.stateprox.session;

import java.time.Duration;

import net.spookly.stateprox.config.ConfigDurations;
import net.spookly.stateprox.config.ConfigException;
import net.spookly.stateprox.config.StateproxConfig;

/**
 * Builds the session state codec selected by the {@code codec} type tag.
 */
public final class SessionStateCodecs {
    private SessionStateCodecs() {
    }

    /**
     * Create a codec for a validated {@code session_state} block.
     *
     * @throws ConfigException for an unknown tag or a missing variant block
     */
    public static SessionStateCodec create(StateproxConfig.SessionStateConfig config, String field) {
        if (config == null) {
            throw new ConfigException(field + " is required");
        }
        String codec = config.codec == null ? "" : config.codec.trim().toLowerCase();
        switch (codec) {
            case CookieSessionStateCodec.TYPE:
                return cookie(config.cookie, field + ".cookie");
            case HeaderSessionStateCodec.TYPE:
                if (config.header == null || config.header.name == null || config.header.name.isBlank()) {
                    throw new ConfigException(field + ".header.name is required");
                }
                return new HeaderSessionStateCodec(config.header.name);
            default:
                throw new ConfigException(field + ".codec must be cookie or header: " + config.codec);
        }
    }

    private static SessionStateCodec cookie(StateproxConfig.CookieConfig cookie, String field) {
        if (cookie == null) {
            throw new ConfigException(field + " is required");
        }
        Duration ttl = ConfigDurations.parse(cookie.ttl, field + ".ttl");
        boolean secure = cookie.secure == null || cookie.secure;
        try {
            return new CookieSessionStateCodec(new CookieSessionConfig(cookie.name, cookie.path, ttl, secure));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(field + ": " + e.getMessage(), e);
        }
    }
}
