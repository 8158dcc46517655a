package net.spookly.stateprox.session;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts a backend address to the opaque token held by the client and back.
 * The token is standard base64 over the canonical {@code host:port} ASCII text.
 */
public final class SessionTokenCodec {
    /**
     * Longest canonical address text, an IPv4 mapped IPv6 literal with a five digit port.
     */
    static final int MAX_ADDRESS_BYTES = 64;
    static final int MAX_TOKEN_LENGTH = 4 * ((MAX_ADDRESS_BYTES + 2) / 3);

    private SessionTokenCodec() {
    }

    /**
     * Encode an address as a cookie-safe token. Same address, same token.
     */
    public static String encode(BackendAddress address) {
        Objects.requireNonNull(address, "address");
        byte[] text = address.toString().getBytes(StandardCharsets.US_ASCII);
        return Base64.getEncoder().encodeToString(text);
    }

    /**
     * Decode a client supplied token. Any malformed input yields empty.
     */
    public static Optional<BackendAddress> decode(String token) {
        if (token == null || token.isEmpty() || token.length() > MAX_TOKEN_LENGTH) {
            return Optional.empty();
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(token);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (decoded.length == 0 || decoded.length > MAX_ADDRESS_BYTES) {
            return Optional.empty();
        }
        for (byte value : decoded) {
            // printable ASCII only, no whitespace
            if (value < 0x21 || value > 0x7e) {
                return Optional.empty();
            }
        }
        return BackendAddress.parse(new String(decoded, StandardCharsets.US_ASCII));
    }
}
