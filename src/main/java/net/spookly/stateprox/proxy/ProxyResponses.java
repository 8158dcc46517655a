package net.spookly.stateprox.proxy;

import java.util.ArrayList;
import java.util.List;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.AsciiString;
import io.netty.util.CharsetUtil;

/**
 * Message helpers for the proxy data path.
 */
final class ProxyResponses {
    private static final AsciiString[] HOP_BY_HOP = {
            HttpHeaderNames.CONNECTION,
            HttpHeaderNames.KEEP_ALIVE,
            HttpHeaderNames.PROXY_AUTHENTICATE,
            HttpHeaderNames.PROXY_AUTHORIZATION,
            HttpHeaderNames.TE,
            HttpHeaderNames.TRAILER,
            HttpHeaderNames.TRANSFER_ENCODING,
            HttpHeaderNames.UPGRADE,
            AsciiString.cached("proxy-connection")
    };

    private ProxyResponses() {
    }

    /**
     * Plain text response generated by the proxy itself.
     */
    static FullHttpResponse local(HttpResponseStatus status, String body) {
        ByteBuf content = Unpooled.copiedBuffer(body, CharsetUtil.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, content);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
        return response;
    }

    /**
     * Copy of the downstream request suitable for the upstream connection. The content is
     * shared with {@code request} and retained once.
     */
    static FullHttpRequest toUpstream(FullHttpRequest request, String clientAddress) {
        FullHttpRequest upstream = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1,
                request.method(),
                request.uri(),
                request.content().retainedDuplicate()
        );
        upstream.headers().set(request.headers());
        stripHopByHop(upstream.headers());
        upstream.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, upstream.content().readableBytes());
        upstream.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        if (clientAddress != null) {
            String prior = upstream.headers().get("x-forwarded-for");
            upstream.headers().set("x-forwarded-for", prior == null ? clientAddress : prior + ", " + clientAddress);
        }
        return upstream;
    }

    /**
     * Remove connection scoped headers, including any the {@code Connection} header names.
     */
    static void stripHopByHop(HttpHeaders headers) {
        List<String> nominated = new ArrayList<>();
        for (String value : headers.getAll(HttpHeaderNames.CONNECTION)) {
            for (String token : value.split(",")) {
                String name = token.trim();
                if (!name.isEmpty()) {
                    nominated.add(name);
                }
            }
        }
        for (String name : nominated) {
            headers.remove(name);
        }
        for (AsciiString name : HOP_BY_HOP) {
            headers.remove(name);
        }
    }
}
