package net.spookly.stateprox.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import org.junit.jupiter.api.Test;

class CookieSessionStateCodecTest {
    private static final BackendAddress FIRST = BackendAddress.of("127.0.0.1", 50001);
    private static final BackendAddress SECOND = BackendAddress.of("127.0.0.1", 50002);

    @Test
    void writesSetCookieWithAllAttributes() {
        CookieSessionStateCodec codec = codec("global-session-cookie", "/path", Duration.ofSeconds(120), true);
        HttpHeaders response = new DefaultHttpHeaders();

        codec.encode(FIRST, response);

        assertEquals(
                List.of("global-session-cookie=\"MTI3LjAuMC4xOjUwMDAx\"; Path=/path; Max-Age=120; HttpOnly; Secure"),
                response.getAll(HttpHeaderNames.SET_COOKIE)
        );
    }

    @Test
    void omitsPathAndMaxAgeWhenUnset() {
        CookieSessionStateCodec codec = codec("sid", null, Duration.ZERO, true);
        HttpHeaders response = new DefaultHttpHeaders();

        codec.encode(FIRST, response);

        assertEquals("sid=\"MTI3LjAuMC4xOjUwMDAx\"; HttpOnly; Secure", response.get(HttpHeaderNames.SET_COOKIE));
    }

    @Test
    void omitsSecureWhenDisabled() {
        CookieSessionStateCodec codec = codec("sid", "/", Duration.ofMinutes(1), false);

        assertEquals("sid=\"tok\"; Path=/; Max-Age=60; HttpOnly", codec.setCookieValue("tok"));
    }

    @Test
    void keepsExistingSetCookieHeaders() {
        CookieSessionStateCodec codec = codec("sid", null, Duration.ZERO, true);
        HttpHeaders response = new DefaultHttpHeaders();
        response.add(HttpHeaderNames.SET_COOKIE, "app=1");

        codec.encode(FIRST, response);

        assertEquals(2, response.getAll(HttpHeaderNames.SET_COOKIE).size());
    }

    @Test
    void decodesQuotedAndUnquotedValues() {
        CookieSessionStateCodec codec = codec("sid", null, Duration.ZERO, true);

        assertEquals(FIRST, codec.decode(cookies("sid=\"MTI3LjAuMC4xOjUwMDAx\"")).orElseThrow());
        assertEquals(FIRST, codec.decode(cookies("a=b; sid=MTI3LjAuMC4xOjUwMDAx; c=d")).orElseThrow());
    }

    @Test
    void firstMatchingCookieWinsAcrossHeaders() {
        CookieSessionStateCodec codec = codec("sid", null, Duration.ZERO, true);

        assertEquals(SECOND, codec.decode(cookies(
                "other=1",
                "sid=MTI3LjAuMC4xOjUwMDAy; sid=MTI3LjAuMC4xOjUwMDAx",
                "sid=MTI3LjAuMC4xOjUwMDAx"
        )).orElseThrow());
    }

    @Test
    void cookieNameMatchIsExact() {
        CookieSessionStateCodec codec = codec("sid", null, Duration.ZERO, true);

        assertTrue(codec.decode(cookies("SID=MTI3LjAuMC4xOjUwMDAx; sid2=MTI3LjAuMC4xOjUwMDAx")).isEmpty());
    }

    @Test
    void absentOrMalformedCookieYieldsNoAddress() {
        CookieSessionStateCodec codec = codec("sid", null, Duration.ZERO, true);

        assertTrue(codec.decode(new DefaultHttpHeaders()).isEmpty());
        assertTrue(codec.decode(cookies("sid=")).isEmpty());
        assertTrue(codec.decode(cookies("sid=%%%")).isEmpty());
        assertTrue(codec.decode(cookies(";;;=")).isEmpty());
    }

    private static CookieSessionStateCodec codec(String name, String path, Duration ttl, boolean secure) {
        return new CookieSessionStateCodec(new CookieSessionConfig(name, path, ttl, secure));
    }

    private static HttpHeaders cookies(String... values) {
        HttpHeaders headers = new DefaultHttpHeaders();
        for (String value : values) {
            headers.add(HttpHeaderNames.COOKIE, value);
        }
        return headers;
    }
}
