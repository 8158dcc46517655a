package net.spookly.stateprox.proxy;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoop;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;
import net.spookly.stateprox.session.BackendAddress;

/**
 * Sends one request per connection to a backend and completes with the aggregated response.
 *
 * <p>Connections are opened on the caller's event loop so that completion callbacks run on the
 * same thread as the downstream exchange.</p>
 */
public final class UpstreamClient {
    static final int MAX_RESPONSE_BYTES = 16 * 1024 * 1024;

    private final int connectTimeoutMs;
    private final int requestTimeoutMs;

    public UpstreamClient(int connectTimeoutMs, int requestTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    /**
     * Forward {@code request} to {@code backend}. The request is released once written.
     * A successful future hands ownership of the response to the caller.
     */
    public Future<FullHttpResponse> send(EventLoop eventLoop, BackendAddress backend, FullHttpRequest request) {
        Objects.requireNonNull(backend, "backend");
        Promise<FullHttpResponse> promise = eventLoop.newPromise();
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(eventLoop)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new HttpClientCodec())
                                .addLast(new HttpObjectAggregator(MAX_RESPONSE_BYTES))
                                .addLast(new ResponseHandler(promise));
                    }
                });

        ChannelFuture connectFuture = bootstrap.connect(backend.toSocketAddress());
        connectFuture.addListener(future -> {
            if (!future.isSuccess()) {
                request.release();
                promise.tryFailure(new UpstreamException(
                        UpstreamException.Failure.CONNECT,
                        "Failed to connect to " + backend,
                        future.cause()
                ));
                return;
            }
            Channel channel = connectFuture.channel();
            ScheduledFuture<?> timeout = eventLoop.schedule(() -> {
                if (promise.tryFailure(new UpstreamException(
                        UpstreamException.Failure.TIMEOUT,
                        "No response from " + backend + " within " + requestTimeoutMs + "ms"))) {
                    channel.close();
                }
            }, requestTimeoutMs, TimeUnit.MILLISECONDS);
            promise.addListener(ignored -> {
                timeout.cancel(false);
                channel.close();
            });
            channel.writeAndFlush(request).addListener(writeFuture -> {
                if (!writeFuture.isSuccess()) {
                    promise.tryFailure(new UpstreamException(
                            UpstreamException.Failure.PROTOCOL,
                            "Failed to write request to " + backend,
                            writeFuture.cause()
                    ));
                }
            });
        });
        return promise;
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
        private final Promise<FullHttpResponse> promise;

        private ResponseHandler(Promise<FullHttpResponse> promise) {
            super(false);
            this.promise = promise;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response) {
            if (!response.decoderResult().isSuccess()) {
                response.release();
                promise.tryFailure(new UpstreamException(
                        UpstreamException.Failure.PROTOCOL,
                        "Malformed upstream response",
                        response.decoderResult().cause()
                ));
                return;
            }
            if (!promise.trySuccess(response)) {
                response.release();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            promise.tryFailure(new UpstreamException(
                    UpstreamException.Failure.PROTOCOL,
                    "Upstream closed connection before responding"
            ));
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            promise.tryFailure(new UpstreamException(
                    UpstreamException.Failure.PROTOCOL,
                    "Upstream exchange failed",
                    cause
            ));
            ctx.close();
        }
    }
}
