package net.spookly.stateprox.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.Test;

class SessionTokenCodecTest {
    @Test
    void encodesCanonicalAddressAsBase64() {
        BackendAddress address = BackendAddress.of("127.0.0.1", 50001);

        assertEquals("MTI3LjAuMC4xOjUwMDAx", SessionTokenCodec.encode(address));
        assertEquals(address, SessionTokenCodec.decode("MTI3LjAuMC4xOjUwMDAx").orElseThrow());
    }

    @Test
    void roundTripsAcrossFamiliesAndPortWidths() {
        int[] ports = {1, 80, 443, 8080, 65535};
        String[] hosts = {"0.0.0.0", "192.168.100.200", "::1", "fe80::1:2:3:4", "2001:db8:85a3::8a2e:370:7334"};
        for (String host : hosts) {
            for (int port : ports) {
                BackendAddress address = BackendAddress.of(host, port);
                assertEquals(Optional.of(address), SessionTokenCodec.decode(SessionTokenCodec.encode(address)),
                        host + ":" + port);
            }
        }
    }

    @Test
    void sameAddressAlwaysProducesSameToken() {
        assertEquals(
                SessionTokenCodec.encode(BackendAddress.of("::1", 8080)),
                SessionTokenCodec.encode(BackendAddress.parse("[0::1]:8080").orElseThrow())
        );
    }

    @Test
    void malformedTokensDecodeToEmpty() {
        assertTrue(SessionTokenCodec.decode(null).isEmpty());
        assertTrue(SessionTokenCodec.decode("").isEmpty());
        assertTrue(SessionTokenCodec.decode("not base64!").isEmpty());
        assertTrue(SessionTokenCodec.decode("MTI3LjAuMC4xOjUwMDAx===").isEmpty());
        assertTrue(SessionTokenCodec.decode(b64("127.0.0.1")).isEmpty());
        assertTrue(SessionTokenCodec.decode(b64("localhost:80")).isEmpty());
        assertTrue(SessionTokenCodec.decode(b64("127.0.0.1: 80")).isEmpty());
        assertTrue(SessionTokenCodec.decode(b64("127.0.0.1:80\n")).isEmpty());
        assertTrue(SessionTokenCodec.decode(b64("1.2.3.4:99999")).isEmpty());
        assertTrue(SessionTokenCodec.decode(b64("1.2.3.4:00080")).isEmpty());
        assertTrue(SessionTokenCodec.decode(b64("1.2.3.4:080")).isEmpty());
        assertTrue(SessionTokenCodec.decode("A".repeat(4096)).isEmpty());
    }

    @Test
    void decodeNeverThrowsOnArbitraryInput() {
        Random random = new Random(42);
        for (int i = 0; i < 2000; i++) {
            byte[] raw = new byte[random.nextInt(80)];
            random.nextBytes(raw);
            SessionTokenCodec.decode(Base64.getEncoder().encodeToString(raw));
            SessionTokenCodec.decode(new String(raw, StandardCharsets.ISO_8859_1));
        }
    }

    private static String b64(String text) {
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.US_ASCII));
    }
}
