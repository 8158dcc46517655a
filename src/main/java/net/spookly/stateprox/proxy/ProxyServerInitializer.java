package net.spookly.stateprox.proxy;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerExpectContinueHandler;

/**
 * Builds the downstream HTTP/1.1 pipeline.
 */
final class ProxyServerInitializer extends ChannelInitializer<SocketChannel> {
    private final ProxyRouting routing;
    private final UpstreamClient upstreamClient;
    private final int maxRequestBytes;

    ProxyServerInitializer(ProxyRouting routing, UpstreamClient upstreamClient, int maxRequestBytes) {
        this.routing = routing;
        this.upstreamClient = upstreamClient;
        this.maxRequestBytes = maxRequestBytes;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        ch.pipeline()
                .addLast(new HttpServerCodec())
                .addLast(new HttpServerExpectContinueHandler())
                // answers 413 itself when the body exceeds the limit
                .addLast(new HttpObjectAggregator(maxRequestBytes))
                .addLast(new ProxyRequestHandler(routing, upstreamClient));
    }
}
