package net.spookly.stateprox.session;

import java.util.Optional;

import io.netty.handler.codec.http.HttpHeaders;

/**
 * Carries the session token between client and proxy. Implementations are immutable and
 * shared by every request that resolves to them.
 */
public interface SessionStateCodec {
    /**
     * Configured type tag, for example {@code cookie}.
     */
    String type();

    /**
     * Extract and decode the backend address the client is pinned to, if any.
     * Malformed or absent state yields empty; this method never throws on client input.
     */
    Optional<BackendAddress> decode(HttpHeaders requestHeaders);

    /**
     * Write the token for the backend that served this request onto the response.
     */
    void encode(BackendAddress selected, HttpHeaders responseHeaders);
}
