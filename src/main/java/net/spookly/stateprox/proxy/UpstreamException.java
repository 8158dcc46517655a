package net.spookly.stateprox.proxy;

import java.io.IOException;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Failure while exchanging a request with an upstream backend.
 */
public final class UpstreamException extends IOException {
    public enum Failure {
        /**
         * TCP connection to the backend could not be established.
         */
        CONNECT,
        /**
         * Backend did not answer within the request timeout.
         */
        TIMEOUT,
        /**
         * Connection broke or the response could not be decoded.
         */
        PROTOCOL
    }

    @Getter
    @Accessors(fluent = true)
    private final Failure failure;

    public UpstreamException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public UpstreamException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
