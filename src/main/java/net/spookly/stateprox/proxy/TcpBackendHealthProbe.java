package net.spookly.stateprox.proxy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import net.spookly.stateprox.balancer.BackendHealthProbe;
import net.spookly.stateprox.balancer.Endpoint;

/**
 * Health probe that opens and immediately closes a TCP connection to the backend.
 */
public final class TcpBackendHealthProbe implements BackendHealthProbe {
    private final EventLoopGroup workerGroup;
    private final boolean ownsGroup;

    /**
     * Create a probe with a dedicated single-thread event loop.
     */
    public TcpBackendHealthProbe() {
        this(new NioEventLoopGroup(1), true);
    }

    /**
     * Create a probe on a provided event loop group.
     */
    public TcpBackendHealthProbe(EventLoopGroup workerGroup) {
        this(workerGroup, false);
    }

    private TcpBackendHealthProbe(EventLoopGroup workerGroup, boolean ownsGroup) {
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
        this.ownsGroup = ownsGroup;
    }

    @Override
    public CompletableFuture<Boolean> probe(Endpoint endpoint, int timeoutMs) {
        Objects.requireNonNull(endpoint, "endpoint");
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(workerGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(1, timeoutMs))
                .handler(new ChannelInboundHandlerAdapter());
        ChannelFuture connectFuture = bootstrap.connect(endpoint.address().toSocketAddress());
        connectFuture.addListener(future -> {
            if (!future.isSuccess()) {
                result.complete(false);
                return;
            }
            connectFuture.channel().close();
            result.complete(true);
        });
        return result;
    }

    @Override
    public void close() {
        if (!ownsGroup) {
            return;
        }
        workerGroup.shutdownGracefully();
    }
}
