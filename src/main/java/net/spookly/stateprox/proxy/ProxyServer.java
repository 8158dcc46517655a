package net.spookly.stateprox.proxy;

import java.net.InetSocketAddress;
import java.util.Objects;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import net.spookly.stateprox.config.StateproxConfig;
import net.spookly.stateprox.util.ListenAddress;

/**
 * HTTP/1.1 proxy listener that routes client requests to cluster backends.
 */
public final class ProxyServer {
    static final int DEFAULT_CONNECT_TIMEOUT_MS = 5000;
    static final int DEFAULT_REQUEST_TIMEOUT_MS = 30000;
    static final int DEFAULT_MAX_REQUEST_BYTES = 1024 * 1024;

    private final StateproxConfig config;
    private final ProxyRouting routing;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel channel;

    public ProxyServer(StateproxConfig config, ProxyRouting routing) {
        this.config = Objects.requireNonNull(config, "config");
        this.routing = Objects.requireNonNull(routing, "routing");
    }

    /**
     * Bind the listener.
     *
     * @return the bound address, useful when the configured port is 0
     */
    public InetSocketAddress start() {
        if (channel != null) {
            return (InetSocketAddress) channel.localAddress();
        }
        StateproxConfig.ProxyConfig proxy = config.proxy;
        StateproxConfig.TimeoutsConfig timeouts = proxy.timeouts;
        UpstreamClient upstreamClient = new UpstreamClient(
                valueOrDefault(timeouts == null ? null : timeouts.connectMs, DEFAULT_CONNECT_TIMEOUT_MS),
                valueOrDefault(timeouts == null ? null : timeouts.requestMs, DEFAULT_REQUEST_TIMEOUT_MS)
        );
        int maxRequestBytes = valueOrDefault(proxy.maxRequestBytes, DEFAULT_MAX_REQUEST_BYTES);

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ProxyServerInitializer(routing, upstreamClient, maxRequestBytes));

        InetSocketAddress address = ListenAddress.parse(proxy.listen).toSocketAddress();
        try {
            channel = bootstrap.bind(address).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new IllegalStateException("Proxy bind interrupted", e);
        }
        InetSocketAddress bound = (InetSocketAddress) channel.localAddress();
        System.out.println("Proxy listening on " + bound.getHostString() + ":" + bound.getPort());
        return bound;
    }

    /**
     * Stop the listener and event loops.
     */
    public void stop() {
        if (channel != null) {
            channel.close();
            channel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
    }

    private static int valueOrDefault(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
