package net.spookly.stateprox.session;

import java.util.Objects;
import java.util.Optional;

import io.netty.handler.codec.http.HttpHeaders;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Session state carried in a plain request/response header instead of a cookie.
 */
public final class HeaderSessionStateCodec implements SessionStateCodec {
    public static final String TYPE = "header";

    @Getter
    @Accessors(fluent = true)
    private final String headerName;

    public HeaderSessionStateCodec(String headerName) {
        if (headerName == null || headerName.isBlank()) {
            throw new IllegalArgumentException("session header name is required");
        }
        this.headerName = headerName.trim();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Optional<BackendAddress> decode(HttpHeaders requestHeaders) {
        if (requestHeaders == null) {
            return Optional.empty();
        }
        String token = requestHeaders.get(headerName);
        if (token == null) {
            return Optional.empty();
        }
        return SessionTokenCodec.decode(token.trim());
    }

    @Override
    public void encode(BackendAddress selected, HttpHeaders responseHeaders) {
        Objects.requireNonNull(selected, "selected");
        responseHeaders.set(headerName, SessionTokenCodec.encode(selected));
    }
}
