package net.spookly.stateprox.session;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.cookie.Cookie;
import io.netty.handler.codec.http.cookie.ServerCookieDecoder;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Session state kept in a client cookie holding the base64 backend address.
 */
public final class CookieSessionStateCodec implements SessionStateCodec {
    public static final String TYPE = "cookie";

    @Getter
    @Accessors(fluent = true)
    private final CookieSessionConfig config;

    public CookieSessionStateCodec(CookieSessionConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String type() {
        return TYPE;
    }

    /**
     * Looks through every {@code Cookie} header in arrival order; the first cookie with the
     * configured name wins, later duplicates are ignored.
     */
    @Override
    public Optional<BackendAddress> decode(HttpHeaders requestHeaders) {
        String token = findCookieValue(requestHeaders, config.name());
        if (token == null) {
            return Optional.empty();
        }
        return SessionTokenCodec.decode(token);
    }

    @Override
    public void encode(BackendAddress selected, HttpHeaders responseHeaders) {
        Objects.requireNonNull(selected, "selected");
        responseHeaders.add(HttpHeaderNames.SET_COOKIE, setCookieValue(SessionTokenCodec.encode(selected)));
    }

    /**
     * Render {@code name="token"; Path=..; Max-Age=..; HttpOnly; Secure}.
     */
    String setCookieValue(String token) {
        StringBuilder builder = new StringBuilder(config.name().length() + token.length() + 48);
        builder.append(config.name()).append("=\"").append(token).append('"');
        if (config.path() != null) {
            builder.append("; Path=").append(config.path());
        }
        long maxAge = config.ttl().getSeconds();
        if (maxAge > 0) {
            builder.append("; Max-Age=").append(maxAge);
        }
        builder.append("; HttpOnly");
        if (config.secure()) {
            builder.append("; Secure");
        }
        return builder.toString();
    }

    static String findCookieValue(HttpHeaders headers, String name) {
        if (headers == null) {
            return null;
        }
        List<String> cookieHeaders = headers.getAll(HttpHeaderNames.COOKIE);
        for (String header : cookieHeaders) {
            if (header == null || header.isEmpty()) {
                continue;
            }
            for (Cookie cookie : ServerCookieDecoder.LAX.decodeAll(header)) {
                if (name.equals(cookie.name())) {
                    return cookie.value();
                }
            }
        }
        return null;
    }
}
